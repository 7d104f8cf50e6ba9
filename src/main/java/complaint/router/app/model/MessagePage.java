package complaint.router.app.model;

import lombok.Value;

import java.util.List;

/**
 * Message ids returned by one listing call together with the cursor that follows them.
 */
@Value
public class MessagePage {
    List<String> messageIds;
    String nextCursor;
}
