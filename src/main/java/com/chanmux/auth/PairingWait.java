package com.chanmux.auth;

import com.chanmux.shared.error.PairingEncodeException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class PairingWait implements AutoCloseable {

    private final String channelId;
    private final PairingCoordinator owner;
    private final CompletableFuture<Void> future = new CompletableFuture<>();

    PairingWait(String channelId, PairingCoordinator owner) {
        this.channelId = channelId;
        this.owner = owner;
    }

    public String channelId() {
        return channelId;
    }

    /**
     * Blocks until the first QR code arrives or the timeout elapses.
     *
     * @return true if a QR code arrived, false on timeout
     * @throws PairingEncodeException if the QR code could not be encoded
     */
    public boolean await(Duration timeout) {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new PairingEncodeException(channelId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for pairing code: " + channelId, e);
        }
    }

    boolean complete() {
        return future.complete(null);
    }

    boolean fail(Throwable cause) {
        return future.completeExceptionally(cause);
    }

    @Override
    public void close() {
        owner.release(this);
    }
}
