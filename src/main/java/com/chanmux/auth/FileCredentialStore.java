package com.chanmux.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Keeps credentials as JSON under {@code <root>/<channelId>/auth_info/creds.json}.
 */
public class FileCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(FileCredentialStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String AUTH_DIR = "auth_info";
    private static final String CREDS_FILE = "creds.json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path root;

    public FileCredentialStore(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(String channelId) {
        return Files.isDirectory(channelDir(channelId));
    }

    @Override
    public CredentialState load(String channelId) {
        var file = authDir(channelId).resolve(CREDS_FILE);
        try {
            Files.createDirectories(authDir(channelId));
            if (!Files.exists(file)) {
                return CredentialState.fresh();
            }
            var node = MAPPER.readTree(file.toFile());
            if (node instanceof ObjectNode obj) {
                return new CredentialState(obj);
            }
            log.warn("[{}] Ignoring malformed credentials file {}", channelId, file);
            return CredentialState.fresh();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load credentials for channel " + channelId, e);
        }
    }

    @Override
    public void save(String channelId, CredentialState state) {
        var dir = authDir(channelId);
        try {
            Files.createDirectories(dir);
            var tmp = dir.resolve(CREDS_FILE + ".tmp");
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state.creds());
            Files.move(tmp, dir.resolve(CREDS_FILE), StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save credentials for channel " + channelId, e);
        }
    }

    @Override
    public void discard(String channelId) {
        var dir = authDir(channelId);
        if (!Files.exists(dir)) return;
        log.info("[{}] Discarding stored credentials", channelId);
        try (var paths = Files.walk(dir)) {
            for (var p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to discard credentials for channel " + channelId, e);
        }
    }

    @Override
    public List<String> listStored() {
        if (!Files.isDirectory(root)) return List.of();
        var ids = new ArrayList<String>();
        try (var dirs = Files.list(root)) {
            for (var dir : dirs.filter(Files::isDirectory).toList()) {
                var auth = dir.resolve(AUTH_DIR);
                if (Files.isDirectory(auth) && !isEmpty(auth)) {
                    ids.add(dir.getFileName().toString());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list stored channels in " + root, e);
        }
        ids.sort(null);
        return ids;
    }

    private Path channelDir(String channelId) {
        if (channelId == null || !SAFE_ID.matcher(channelId).matches() || channelId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid channel id: " + channelId);
        }
        return root.resolve(channelId);
    }

    private Path authDir(String channelId) {
        return channelDir(channelId).resolve(AUTH_DIR);
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (var entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }
}
