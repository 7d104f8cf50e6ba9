package complaint.router.app.service;

import complaint.router.app.model.InboundMessage;
import complaint.router.app.model.SyncCursor;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * New messages of one mailbox since its persisted cursor. Messages are fetched one at a time while
 * iterating; the batch is committed through {@link SyncCursorManager#commit(SyncBatch)} once all of
 * them were handled.
 */
public class SyncBatch implements Iterable<InboundMessage> {
    private final String mailboxId;
    private final SyncCursor startCursor;
    private final String nextToken;
    private final boolean baseline;
    private final List<String> messageIds;
    private final MailboxProvider provider;

    SyncBatch(String mailboxId, SyncCursor startCursor, String nextToken, boolean baseline,
              List<String> messageIds, MailboxProvider provider) {
        this.mailboxId = mailboxId;
        this.startCursor = startCursor;
        this.nextToken = nextToken;
        this.baseline = baseline;
        this.messageIds = List.copyOf(messageIds);
        this.provider = provider;
    }

    public String getMailboxId() {
        return mailboxId;
    }

    public SyncCursor getStartCursor() {
        return startCursor;
    }

    public String getNextToken() {
        return nextToken;
    }

    /**
     * True when the batch came from a full listing after the cursor was missing or expired.
     */
    public boolean isBaseline() {
        return baseline;
    }

    public List<String> getMessageIds() {
        return messageIds;
    }

    public int size() {
        return messageIds.size();
    }

    @Override
    public Iterator<InboundMessage> iterator() {
        Iterator<String> ids = messageIds.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return ids.hasNext();
            }

            @Override
            public InboundMessage next() {
                if (!ids.hasNext()) {
                    throw new NoSuchElementException();
                }
                return provider.getMessage(mailboxId, ids.next());
            }
        };
    }
}
