package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.model.MessagePage;
import complaint.router.app.model.SyncCursor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Reads and advances the per-mailbox delta cursor.
 *
 * <p>{@link #nextBatch(String)} lists what arrived since the persisted cursor, falling back to a
 * filtered full listing when there is no cursor or the provider rejects it. The cursor only moves in
 * {@link #commit(SyncBatch)}, which callers invoke after the whole batch was processed, so a crash in
 * between reprocesses the batch instead of losing it.
 */
@Slf4j
@Service
public class SyncCursorManager {
    private final MailboxProvider provider;
    private final SyncCursorStore store;
    private final MailboxLockService lockService;
    private final ComplaintRouterProperties.EmailFilter emailFilter;
    private final int topEmails;
    private final Clock clock;

    @Autowired
    public SyncCursorManager(MailboxProvider provider, SyncCursorStore store, MailboxLockService lockService,
                             ComplaintRouterProperties properties) {
        this(provider, store, lockService, properties.getEmailFilter(), properties.getTopEmails(), Clock.systemUTC());
    }

    public SyncCursorManager(MailboxProvider provider, SyncCursorStore store, MailboxLockService lockService,
                             ComplaintRouterProperties.EmailFilter emailFilter, int topEmails, Clock clock) {
        this.provider = provider;
        this.store = store;
        this.lockService = lockService;
        this.emailFilter = emailFilter;
        this.topEmails = topEmails;
        this.clock = clock;
    }

    /**
     * @throws complaint.router.app.exception.TransientProviderException if the provider stays unreachable
     */
    public SyncBatch nextBatch(String mailboxId) {
        SyncCursor cursor = store.load(mailboxId);
        if (cursor.isPresent()) {
            try {
                MessagePage page = provider.listMessagesSince(mailboxId, cursor.getToken());
                log.info("Delta listing for {}: {} new messages", mailboxId, page.getMessageIds().size());
                return new SyncBatch(mailboxId, cursor, page.getNextCursor(), false, page.getMessageIds(), provider);
            } catch (MailboxProvider.CursorExpiredException e) {
                log.warn("Cursor for {} rejected ({}), falling back to full sync", mailboxId, e.getMessage());
            }
        } else {
            log.info("No cursor stored for {}, starting with a full sync", mailboxId);
        }
        MessagePage page = provider.listMessages(mailboxId, emailFilter, topEmails);
        log.info("Full listing for {}: {} messages (cap {})", mailboxId, page.getMessageIds().size(), topEmails);
        return new SyncBatch(mailboxId, cursor, page.getNextCursor(), true, page.getMessageIds(), provider);
    }

    /**
     * Persists the cursor that follows the batch. A delta batch is only committed if the stored cursor
     * is still the one it started from; otherwise another pass already moved on and this commit would
     * move the cursor backwards.
     *
     * @return true if the cursor was written
     */
    public boolean commit(SyncBatch batch) {
        String mailboxId = batch.getMailboxId();
        if (batch.getNextToken() == null || batch.getNextToken().isEmpty()) {
            log.warn("Provider returned no cursor for {}, keeping the stored one", mailboxId);
            return false;
        }
        boolean locked;
        try {
            locked = lockService.tryLock(mailboxId, 5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to commit cursor for {}", mailboxId);
            return false;
        }
        if (!locked) {
            log.warn("Could not lock {} to commit its cursor, batch will be reprocessed", mailboxId);
            return false;
        }
        try {
            SyncCursor stored = store.load(mailboxId);
            if (!batch.isBaseline() && !Objects.equals(stored.getToken(), batch.getStartCursor().getToken())) {
                log.warn("Cursor for {} moved during the pass ({} -> {}), not committing", mailboxId,
                    batch.getStartCursor().getToken(), stored.getToken());
                return false;
            }
            Instant now = clock.instant();
            Instant syncedAt = stored.getSyncedAt() != null && stored.getSyncedAt().isAfter(now) ? stored.getSyncedAt() : now;
            store.save(new SyncCursor(mailboxId, batch.getNextToken(), syncedAt));
            log.info("Cursor for {} advanced to {}{}", mailboxId, batch.getNextToken(), batch.isBaseline() ? " (new baseline)" : "");
            return true;
        } finally {
            lockService.releaseLock(mailboxId);
        }
    }
}
