package complaint.router.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.model.SyncCursor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps all mailbox cursors in one JSON file:
 * <pre>{"mailbox@example.com": {"token": "...", "syncedAt": "2024-01-01T00:00:00Z"}}</pre>
 * Files holding a bare token string per mailbox are read as well. Writes go to a temporary file
 * that is then moved over the target, so a crash leaves either the old or the new content.
 */
@Slf4j
@Service
public class FileSyncCursorStore implements SyncCursorStore {
    private final Path file;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public FileSyncCursorStore(ComplaintRouterProperties properties) {
        this(Paths.get(properties.getDeltaTokenPath()).resolve(properties.getDeltaTokenFile()));
    }

    public FileSyncCursorStore(Path file) {
        this.file = file;
    }

    @Override
    public synchronized SyncCursor load(String mailboxId) {
        SyncCursor cursor = readAll().get(mailboxId);
        return cursor != null ? cursor : SyncCursor.empty(mailboxId);
    }

    @Override
    public synchronized void save(SyncCursor cursor) {
        Map<String, SyncCursor> cursors = readAll();
        cursors.put(cursor.getMailboxId(), cursor);
        write(cursors);
        log.debug("Cursor for {} saved to {}", cursor.getMailboxId(), file);
    }

    synchronized Map<String, SyncCursor> readAll() {
        Map<String, SyncCursor> cursors = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            log.warn("Delta token file not found: {}. Starting with empty tokens.", file);
            return cursors;
        }
        try {
            if (Files.size(file) == 0) {
                return cursors;
            }
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.error("Delta token file {} is not a JSON object, ignoring its content", file);
                return cursors;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                SyncCursor cursor = toCursor(entry.getKey(), entry.getValue());
                if (cursor != null) {
                    cursors.put(entry.getKey(), cursor);
                }
            }
        } catch (IOException e) {
            // an unreadable file must not silently restart every mailbox from scratch
            throw new UncheckedIOException("Could not read delta token file " + file, e);
        }
        return cursors;
    }

    private SyncCursor toCursor(String mailboxId, JsonNode value) {
        if (value.isTextual()) {
            return new SyncCursor(mailboxId, value.asText(), null);
        }
        if (value.isObject() && value.hasNonNull("token")) {
            Instant syncedAt = null;
            if (value.hasNonNull("syncedAt")) {
                try {
                    syncedAt = Instant.parse(value.get("syncedAt").asText());
                } catch (DateTimeParseException e) {
                    log.warn("Ignoring unreadable syncedAt for {}: {}", mailboxId, value.get("syncedAt").asText());
                }
            }
            return new SyncCursor(mailboxId, value.get("token").asText(), syncedAt);
        }
        log.warn("Skipping malformed cursor entry for {}", mailboxId);
        return null;
    }

    private void write(Map<String, SyncCursor> cursors) {
        ObjectNode root = objectMapper.createObjectNode();
        cursors.forEach((mailboxId, cursor) -> {
            ObjectNode entry = root.putObject(mailboxId);
            entry.put("token", cursor.getToken());
            if (cursor.getSyncedAt() != null) {
                entry.put("syncedAt", cursor.getSyncedAt().toString());
            }
        });

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
                try {
                    Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write delta token file " + file, e);
        }
    }
}
