package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.model.InboundMessage;
import complaint.router.app.model.MessagePage;

import java.time.Instant;
import java.util.List;

/**
 * Interface for mailbox operations.
 * Failures that may succeed later surface as {@link complaint.router.app.exception.TransientProviderException};
 * an unusable delta cursor surfaces as {@link CursorExpiredException}.
 */
public interface MailboxProvider {

    /**
     * The provider no longer accepts a delta cursor. Callers fall back to a full listing.
     */
    class CursorExpiredException extends RuntimeException {
        public CursorExpiredException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * List ids of messages that arrived after the cursor.
     * @param mailboxId mailbox address
     * @param cursor cursor returned by an earlier listing
     * @return new message ids in arrival order and the cursor that follows them
     * @throws CursorExpiredException if the cursor is expired or invalid
     */
    MessagePage listMessagesSince(String mailboxId, String cursor);

    /**
     * Full listing bounded by the date/sender/subject filter and a result cap. The returned cursor is
     * captured before listing, so nothing arriving during the call is skipped.
     */
    MessagePage listMessages(String mailboxId, ComplaintRouterProperties.EmailFilter filter, int top);

    /**
     * Fetch one message with headers and body.
     */
    InboundMessage getMessage(String mailboxId, String messageId);

    /**
     * Inbox messages received since the given instant, newest first, used by the feedback loops.
     */
    List<InboundMessage> listRecentMessages(String mailboxId, Instant since, int top);

    /**
     * Send a copy of the message to the distribution address, prefixed with the processing marker.
     */
    void forwardMessage(String mailboxId, InboundMessage message, String distributionAddress);

    /**
     * Move a message to the trash.
     */
    void deleteMessage(String mailboxId, String messageId);
}
