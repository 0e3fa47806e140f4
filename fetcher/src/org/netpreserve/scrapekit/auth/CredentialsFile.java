package org.netpreserve.scrapekit.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

/**
 * A JSON file mapping credential keys to entries. An entry is normally an encrypted blob string; a plain
 * {@code {"username": .., "password": ..}} object is also accepted when reading.
 */
public class CredentialsFile {
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;

    public CredentialsFile(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public synchronized Optional<JsonNode> entry(String key) throws IOException {
        JsonNode entry = read().get(key);
        return entry == null || entry.isNull() ? Optional.empty() : Optional.of(entry);
    }

    public synchronized void put(String key, String blob) throws IOException {
        ObjectNode all = read();
        all.put(key, blob);
        write(all);
    }

    public synchronized void remove(String key) throws IOException {
        ObjectNode all = read();
        if (all.remove(key) != null) write(all);
    }

    private ObjectNode read() throws IOException {
        if (!Files.exists(path)) return JSON.createObjectNode();
        JsonNode tree = JSON.readTree(path.toFile());
        if (tree == null || tree.isMissingNode()) return JSON.createObjectNode();
        if (!tree.isObject()) throw new IOException(path + " is not a JSON object");
        return (ObjectNode) tree;
    }

    private void write(ObjectNode all) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, ".credentials", ".tmp");
        try {
            restrictToOwner(tmp);
            JSON.writeValue(tmp.toFile(), all);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (Files.getFileStore(file).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
