package complaint.router.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one processing pass over a mailbox.
 */
@Value
@Builder
public class PassResult {
    String mailboxId;
    int processed;
    int forwarded;
    int skipped;
    int failed;
    boolean cursorAdvanced;
    // set when the pass did not run or stopped before listing
    String abortReason;

    public static PassResult aborted(String mailboxId, String reason) {
        return PassResult.builder().mailboxId(mailboxId).abortReason(reason).build();
    }
}
