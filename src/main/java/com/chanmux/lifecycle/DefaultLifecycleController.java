package com.chanmux.lifecycle;

import com.chanmux.auth.CredentialSaver;
import com.chanmux.auth.CredentialStore;
import com.chanmux.auth.PairingCoordinator;
import com.chanmux.auth.PairingWait;
import com.chanmux.auth.QrEncoder;
import com.chanmux.auth.QrEncodingException;
import com.chanmux.channels.ChannelRegistry;
import com.chanmux.observability.ChannelMetrics;
import com.chanmux.protocol.ClientOptions;
import com.chanmux.protocol.ConnectionEvent;
import com.chanmux.protocol.ConnectionHandle;
import com.chanmux.protocol.DisconnectReason;
import com.chanmux.protocol.ProtocolClient;
import com.chanmux.protocol.ReconnectPolicy;
import com.chanmux.protocol.TransportState;
import com.chanmux.sessions.Session;
import com.chanmux.sessions.SessionStore;
import com.chanmux.shared.config.LifecycleConfig;
import com.chanmux.shared.error.ChanMuxException;
import com.chanmux.shared.error.ChannelAlreadyExistsException;
import com.chanmux.shared.error.ChannelNotFoundException;
import com.chanmux.shared.model.Channel;
import com.chanmux.shared.model.ChannelStatus;
import com.chanmux.shared.model.ChannelUpdate;
import com.chanmux.shared.model.HealthCheck;
import com.chanmux.shared.model.PairingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the session store and drives channel records from protocol events.
 *
 * <p>Every mutation of one channel runs under that channel's lock: explicit calls, event
 * handling and scheduled reconnects. Each connection attempt gets a new generation number;
 * events and reconnect timers that belong to an older generation are dropped, so a retired
 * connection can neither change the status nor bring a closed channel back.
 *
 * <p>Listener callbacks are queued per channel and run on a worker after the lock is released,
 * so a slow listener delays only that channel's notifications.
 */
public class DefaultLifecycleController implements LifecycleController {

    private static final Logger log = LoggerFactory.getLogger(DefaultLifecycleController.class);

    private final ChannelRegistry registry;
    private final SessionStore sessions;
    private final PairingCoordinator pairing;
    private final CredentialStore credentials;
    private final ProtocolClient client;
    private final QrEncoder qrEncoder;
    private final LifecycleConfig config;
    private final ClientOptions options;
    private final ChannelMetrics metrics;
    private final ChannelStateMachine stateMachine;
    private final Clock clock;

    private final Map<String, ChannelContext> contexts = new ConcurrentHashMap<>();
    private final List<ChannelListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    public DefaultLifecycleController(ChannelRegistry registry, SessionStore sessions, PairingCoordinator pairing,
                                      CredentialStore credentials, ProtocolClient client, QrEncoder qrEncoder,
                                      LifecycleConfig config, ClientOptions options, ChannelMetrics metrics) {
        this(registry, sessions, pairing, credentials, client, qrEncoder, config, options, metrics,
                Clock.systemUTC());
    }

    public DefaultLifecycleController(ChannelRegistry registry, SessionStore sessions, PairingCoordinator pairing,
                                      CredentialStore credentials, ProtocolClient client, QrEncoder qrEncoder,
                                      LifecycleConfig config, ClientOptions options, ChannelMetrics metrics,
                                      Clock clock) {
        this.registry = registry;
        this.sessions = sessions;
        this.pairing = pairing;
        this.credentials = credentials;
        this.client = client;
        this.qrEncoder = qrEncoder;
        this.config = config;
        this.options = options;
        this.metrics = metrics;
        this.clock = clock;
        this.stateMachine = new ChannelStateMachine(ReconnectPolicy.from(config), clock);
        this.workers = Executors.newCachedThreadPool(daemonThreads("chanmux-worker"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("chanmux-reconnect"));
        metrics.trackConnected(registry);
    }

    // --- explicit operations ---

    @Override
    public PairingResult create(String channelId) {
        PairingWait pairingWait;
        var ctx = lockContext(channelId);
        try {
            if (!registry.register(Channel.created(channelId, clock.instant()))) {
                throw new ChannelAlreadyExistsException(channelId);
            }
            log.info("[{}] Channel created", channelId);
            registry.get(channelId).ifPresent(channel -> fireUpdated(ctx, channel));
            pairingWait = pairing.beginWait(channelId);
            try {
                cancelReconnect(ctx);
                startAttempt(ctx, true);
            } catch (RuntimeException e) {
                pairingWait.close();
                throw e;
            }
        } finally {
            ctx.lock.unlock();
        }
        return awaitPairing(channelId, pairingWait);
    }

    @Override
    public PairingResult regenerate(String channelId) {
        log.info("[{}] Regenerating QR code", channelId);
        PairingWait pairingWait;
        var ctx = lockExistingContext(channelId);
        try {
            pairingWait = pairing.beginWait(channelId);
            try {
                cancelReconnect(ctx);
                if (retire(ctx)) {
                    sleep(config.settleDelay());
                }
                // leaves LOGGED_OUT and FAILED, which ignore provider events
                registry.set(channelId, new ChannelUpdate(ChannelStatus.CONNECTING, null, true, clock.instant(), 0))
                        .ifPresent(channel -> fireUpdated(ctx, channel));
                startAttempt(ctx, true);
            } catch (RuntimeException e) {
                pairingWait.close();
                throw e;
            }
        } finally {
            ctx.lock.unlock();
        }
        return awaitPairing(channelId, pairingWait);
    }

    @Override
    public PairingResult restore(String channelId) {
        if (!credentials.exists(channelId)) {
            throw new ChannelNotFoundException(channelId);
        }
        var ctx = lockContext(channelId);
        try {
            var existing = registry.get(channelId);
            if (existing.isPresent() && existing.get().isConnected()) {
                log.info("[{}] Already connected, nothing to restore", channelId);
                return PairingResult.of(existing.get());
            }
            cancelReconnect(ctx);
            var restoring = Channel.restoring(channelId, clock.instant());
            registry.put(restoring);
            fireUpdated(ctx, restoring);
            startAttempt(ctx, false);
            return snapshot(channelId);
        } finally {
            ctx.lock.unlock();
        }
    }

    @Override
    public void close(String channelId) {
        var ctx = lockExistingContext(channelId);
        try {
            ctx.closed = true;
            cancelReconnect(ctx);
            ctx.generation.incrementAndGet();
            sessions.remove(channelId).ifPresent(session -> {
                try {
                    session.handle().logout();
                } catch (Exception e) {
                    log.warn("[{}] Logout failed, dropping the connection anyway: {}", channelId, e.getMessage());
                }
            });
            registry.remove(channelId);
            try {
                credentials.discard(channelId);
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to discard stored credentials: {}", channelId, e.getMessage());
            }
            contexts.remove(channelId, ctx);
            fireRemoved(ctx, channelId);
            log.info("[{}] Channel closed", channelId);
        } finally {
            ctx.lock.unlock();
        }
    }

    // --- queries ---

    @Override
    public HealthCheck testConnection(String channelId) {
        var session = sessions.get(channelId);
        if (session.isEmpty()) {
            return HealthCheck.unhealthy("Session not found");
        }
        try {
            var state = session.get().handle().transportState();
            if (state != TransportState.OPEN) {
                return HealthCheck.unhealthy("Transport is not open (" + state + ")");
            }
            return HealthCheck.ok();
        } catch (RuntimeException e) {
            return HealthCheck.unhealthy(e.getMessage());
        }
    }

    @Override
    public Optional<Channel> getStatus(String channelId) {
        return registry.get(channelId);
    }

    @Override
    public List<Channel> listAll() {
        return registry.list();
    }

    @Override
    public boolean isConnected(String channelId) {
        return registry.get(channelId).map(Channel::isConnected).orElse(false);
    }

    @Override
    public Optional<ConnectionHandle> connection(String channelId) {
        return sessions.get(channelId).map(Session::handle);
    }

    @Override
    public void addListener(ChannelListener listener) {
        listeners.add(listener);
    }

    /**
     * Stops timers and ends every live connection without logging out, so stored credentials
     * remain usable for the next start.
     */
    public void shutdown() {
        log.info("Shutting down {} live session(s)", sessions.size());
        for (var ctx : contexts.values()) {
            ctx.closed = true;
            cancelReconnect(ctx);
        }
        scheduler.shutdownNow();
        for (var session : sessions.all()) {
            sessions.remove(session);
            endQuietly(session);
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    // --- connection attempts ---

    /** Caller holds {@code ctx.lock}. */
    private void startAttempt(ChannelContext ctx, boolean forceNew) {
        var channelId = ctx.channelId;
        if (!ctx.starting.compareAndSet(false, true)) {
            log.info("[{}] Connection attempt already in progress", channelId);
            return;
        }
        try {
            long generation = ctx.generation.incrementAndGet();
            if (retire(ctx)) {
                sleep(config.settleDelay());
            }
            if (forceNew) {
                credentials.discard(channelId);
            }
            var state = credentials.load(channelId);
            log.info("[{}] Starting connection attempt #{} (stored credentials: {})",
                    channelId, generation, state.isRegistered() ? "yes" : "no");

            CredentialSaver saver = updated -> credentials.save(channelId, updated);
            ConnectionHandle handle;
            try {
                handle = client.open(channelId, state, saver, options);
            } catch (IOException e) {
                throw new ChanMuxException("CONNECTION_FAILED", "Failed to open connection for channel " + channelId, e);
            }
            handle.subscribe(event -> ctx.events.execute(() -> onEvent(ctx, generation, event)));
            sessions.install(new Session(channelId, handle, saver, generation, clock.instant()))
                    .ifPresent(this::endQuietly);
            log.info("[{}] Session installed", channelId);
        } finally {
            ctx.starting.set(false);
        }
    }

    /** Forgets the live session, asking it to end first. Returns true if there was one. */
    private boolean retire(ChannelContext ctx) {
        var previous = sessions.remove(ctx.channelId);
        previous.ifPresent(this::endQuietly);
        return previous.isPresent();
    }

    private void endQuietly(Session session) {
        try {
            session.handle().end();
        } catch (Exception e) {
            log.debug("[{}] Error while ending previous connection: {}", session.channelId(), e.getMessage());
        }
    }

    private PairingResult awaitPairing(String channelId, PairingWait pairingWait) {
        try (pairingWait) {
            if (!pairingWait.await(config.pairingTimeout())) {
                log.warn("[{}] Timed out waiting for QR code after {} ms",
                        channelId, config.pairingTimeout().toMillis());
                metrics.pairingTimeouts().increment();
            }
        }
        return snapshot(channelId);
    }

    private PairingResult snapshot(String channelId) {
        return registry.get(channelId)
                .map(PairingResult::of)
                .orElseThrow(() -> new ChannelNotFoundException(channelId));
    }

    // --- event handling ---

    private void onEvent(ChannelContext ctx, long generation, ConnectionEvent event) {
        ctx.lock.lock();
        try {
            if (ctx.closed || ctx.generation.get() != generation) {
                log.debug("[{}] Ignoring event from retired connection: {}", ctx.channelId, event);
                return;
            }
            handle(ctx, generation, event);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to handle connection event {}", ctx.channelId, event, e);
        } finally {
            ctx.lock.unlock();
        }
    }

    private void handle(ChannelContext ctx, long generation, ConnectionEvent event) {
        var channelId = ctx.channelId;
        if (event instanceof ConnectionEvent.PairingCodeIssued issued) {
            log.info("[{}] QR code issued", channelId);
            String image;
            try {
                image = qrEncoder.encode(issued.code());
            } catch (QrEncodingException e) {
                log.error("[{}] Failed to render QR code", channelId, e);
                pairing.reject(channelId, e);
                return;
            }
            apply(ctx, generation, new LifecycleEvent.QrReady(image));
        } else if (event instanceof ConnectionEvent.ConnectionUpdate update) {
            switch (update.state()) {
                case CONNECTING -> apply(ctx, generation, new LifecycleEvent.Connecting());
                case OPEN -> {
                    log.info("[{}] Connected", channelId);
                    apply(ctx, generation, new LifecycleEvent.Opened());
                }
                case CLOSE -> {
                    var cause = update.cause() != null ? update.cause() : DisconnectReason.UNKNOWN;
                    log.info("[{}] Connection closed: {} ({}) {}", channelId, cause, cause.code(),
                            update.detail() != null ? update.detail() : "");
                    apply(ctx, generation, new LifecycleEvent.Closed(cause));
                }
            }
        } else if (event instanceof ConnectionEvent.CredentialsUpdated) {
            log.debug("[{}] Credentials updated", channelId);
        } else if (event instanceof ConnectionEvent.MessageReceived received) {
            var message = received.message();
            if (!message.fromMe()) {
                log.debug("[{}] Message received from {}", channelId, message.from());
            }
        }
    }

    private void apply(ChannelContext ctx, long generation, LifecycleEvent event) {
        var channelId = ctx.channelId;
        var current = registry.get(channelId);
        if (current.isEmpty()) return;

        var transition = stateMachine.apply(current.get(), event);
        if (transition.isNone()) {
            log.debug("[{}] Ignoring {} in terminal status {}", channelId, event, current.get().status());
            return;
        }
        var updated = registry.set(channelId, transition.update());
        if (updated.isEmpty()) return;

        for (var effect : transition.effects()) {
            if (effect instanceof Effect.ResolvePairing) {
                pairing.resolve(channelId);
            } else if (effect instanceof Effect.DropSession) {
                // retire the generation so late events from the dropped handle are ignored
                ctx.generation.incrementAndGet();
                sessions.get(channelId)
                        .filter(s -> s.generation() == generation)
                        .ifPresent(session -> {
                            sessions.remove(session);
                            endQuietly(session);
                        });
            } else if (effect instanceof Effect.ScheduleReconnect reconnect) {
                scheduleReconnect(ctx, generation, reconnect);
            }
        }

        var status = updated.get().status();
        if (status == ChannelStatus.LOGGED_OUT) {
            log.warn("[{}] Logged out, a new pairing is required", channelId);
            metrics.channelsLoggedOut().increment();
        } else if (status == ChannelStatus.FAILED) {
            log.error("[{}] Reconnect limit of {} attempts reached", channelId, stateMachine.policy().maxAttempts());
            metrics.channelsFailed().increment();
        }
        fireUpdated(ctx, updated.get());
    }

    private void scheduleReconnect(ChannelContext ctx, long generation, Effect.ScheduleReconnect reconnect) {
        cancelReconnect(ctx);
        log.info("[{}] Reconnecting in {} ms (attempt {}/{})", ctx.channelId, reconnect.delayMs(),
                reconnect.attempt(), stateMachine.policy().maxAttempts());
        ctx.pendingReconnect = scheduler.schedule(
                () -> workers.execute(() -> runReconnect(ctx, generation)),
                reconnect.delayMs(), TimeUnit.MILLISECONDS);
        metrics.reconnectsScheduled().increment();
    }

    private void runReconnect(ChannelContext ctx, long generation) {
        ctx.lock.lock();
        try {
            if (ctx.closed || ctx.generation.get() != generation || !registry.contains(ctx.channelId)) {
                log.debug("[{}] Skipping stale reconnect", ctx.channelId);
                return;
            }
            ctx.pendingReconnect = null;
            try {
                startAttempt(ctx, false);
            } catch (RuntimeException e) {
                log.warn("[{}] Reconnect attempt failed: {}", ctx.channelId, e.getMessage());
                apply(ctx, ctx.generation.get(), new LifecycleEvent.Closed(DisconnectReason.CONNECTION_LOST));
            }
        } finally {
            ctx.lock.unlock();
        }
    }

    private void cancelReconnect(ChannelContext ctx) {
        var pending = ctx.pendingReconnect;
        if (pending != null) {
            pending.cancel(false);
            ctx.pendingReconnect = null;
        }
    }

    // --- contexts and listeners ---

    private ChannelContext lockContext(String channelId) {
        while (true) {
            var ctx = contexts.computeIfAbsent(channelId, id -> new ChannelContext(id, workers));
            ctx.lock.lock();
            if (!ctx.closed) return ctx;
            ctx.lock.unlock();
            contexts.remove(channelId, ctx);
        }
    }

    private ChannelContext lockExistingContext(String channelId) {
        var ctx = contexts.get(channelId);
        if (ctx == null) {
            throw new ChannelNotFoundException(channelId);
        }
        ctx.lock.lock();
        if (ctx.closed || !registry.contains(channelId)) {
            ctx.lock.unlock();
            throw new ChannelNotFoundException(channelId);
        }
        return ctx;
    }

    private void fireUpdated(ChannelContext ctx, Channel channel) {
        ctx.notices.execute(() -> notifyUpdated(channel));
    }

    private void fireRemoved(ChannelContext ctx, String channelId) {
        ctx.notices.execute(() -> notifyRemoved(channelId));
    }

    private void notifyUpdated(Channel channel) {
        for (var listener : listeners) {
            try {
                listener.onChannelUpdated(channel);
            } catch (RuntimeException e) {
                log.warn("Channel listener failed for {}: {}", channel.channelId(), e.getMessage());
            }
        }
    }

    private void notifyRemoved(String channelId) {
        for (var listener : listeners) {
            try {
                listener.onChannelRemoved(channelId);
            } catch (RuntimeException e) {
                log.warn("Channel listener failed for {}: {}", channelId, e.getMessage());
            }
        }
    }

    private static void sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the previous connection to settle", e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var seq = new AtomicInteger();
        return r -> {
            var t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class ChannelContext {
        final String channelId;
        final ReentrantLock lock = new ReentrantLock();
        final AtomicBoolean starting = new AtomicBoolean();
        final AtomicLong generation = new AtomicLong();
        final SerialExecutor events;
        final SerialExecutor notices;
        volatile ScheduledFuture<?> pendingReconnect;
        volatile boolean closed;

        ChannelContext(String channelId, ExecutorService workers) {
            this.channelId = channelId;
            this.events = new SerialExecutor(workers);
            this.notices = new SerialExecutor(workers);
        }
    }
}
