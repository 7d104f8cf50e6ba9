package complaint.router.app.service;

import complaint.router.app.model.SyncCursor;

/**
 * Durable storage for per-mailbox delta cursors.
 */
public interface SyncCursorStore {

    /**
     * @return the stored cursor, or {@link SyncCursor#empty(String)} when the mailbox has none
     */
    SyncCursor load(String mailboxId);

    /**
     * Replaces the mailbox's cursor. Either the new cursor is fully stored or the old one stays.
     */
    void save(SyncCursor cursor);
}
