package complaint.router.app.service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line stamped on every forwarded complaint. A message carrying it that comes back into a
 * monitored mailbox is a rejected complaint.
 */
public final class ForwardingMarker {
    public static final String HEADER_NAME = "X-Complaint-Processor";
    private static final String VERSION = "Processed-v1.0";
    private static final Pattern MARKER = Pattern.compile(HEADER_NAME + ": " + VERSION + "; ID=(.*?);");

    private ForwardingMarker() {
    }

    public static String headerValue(String messageId) {
        return VERSION + "; ID=" + messageId + ";";
    }

    public static String line(String messageId) {
        return HEADER_NAME + ": " + headerValue(messageId);
    }

    /**
     * @return the id of the original message, if the text carries a marker
     */
    public static Optional<String> extractMessageId(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = MARKER.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
