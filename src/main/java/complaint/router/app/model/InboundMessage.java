package complaint.router.app.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A message as fetched from a monitored mailbox. Immutable once built.
 */
@Value
@Builder
public class InboundMessage {
    String id;
    String mailboxId;
    String sender;
    String subject;
    String body;
    Instant receivedAt;

    @Builder.Default
    List<String> recipients = List.of();

    // Provider-specific headers and ids (thread id, label ids, raw date header...)
    @Builder.Default
    Map<String, String> metadata = Map.of();
}
