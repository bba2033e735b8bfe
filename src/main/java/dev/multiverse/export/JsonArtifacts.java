package dev.multiverse.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * The single serialization path shared by every exporter, so that writing to a file and
 * rendering the in-memory tree produce the same bytes.
 */
public final class JsonArtifacts {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonArtifacts() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Compact UTF-8 JSON for {@code node}. */
    public static byte[] render(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render JSON", e);
        }
    }

    public static String renderString(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render JSON", e);
        }
    }

    /**
     * Write {@code node} to {@code destination} all-or-nothing: a sibling temp file is written
     * first and moved into place.
     */
    public static void write(JsonNode node, Path destination) throws IOException {
        byte[] bytes = render(node);
        Path target = destination.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
