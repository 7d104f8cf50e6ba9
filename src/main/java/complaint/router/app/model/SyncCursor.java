package complaint.router.app.model;

import lombok.Value;

import java.time.Instant;

/**
 * Opaque per-mailbox delta position. A null token means no prior state.
 */
@Value
public class SyncCursor {
    String mailboxId;
    String token;
    Instant syncedAt;

    public static SyncCursor empty(String mailboxId) {
        return new SyncCursor(mailboxId, null, null);
    }

    public boolean isPresent() {
        return token != null && !token.isEmpty();
    }
}
