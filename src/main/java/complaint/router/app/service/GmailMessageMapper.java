package complaint.router.app.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import complaint.router.app.model.InboundMessage;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a Gmail {@link Message} fetched with {@code format=full} into an {@link InboundMessage}.
 */
@Slf4j
public final class GmailMessageMapper {
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^>]+)>");

    private GmailMessageMapper() {
    }

    public static InboundMessage toInboundMessage(String mailboxId, Message message) {
        String subject = "";
        String from = "";
        List<String> recipients = new ArrayList<>();
        Map<String, String> metadata = new HashMap<>();

        MessagePart payload = message.getPayload();
        if (payload != null && payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                String name = header.getName().toLowerCase(Locale.ROOT);
                String value = header.getValue() == null ? "" : header.getValue();
                switch (name) {
                    case "subject":
                        subject = value;
                        break;
                    case "from":
                        from = value;
                        break;
                    case "to":
                    case "cc":
                        recipients.addAll(parseAddresses(value));
                        break;
                    case "date":
                        metadata.put("date", value);
                        break;
                    default:
                        if (name.equalsIgnoreCase(ForwardingMarker.HEADER_NAME)) {
                            metadata.put(ForwardingMarker.HEADER_NAME, value);
                        }
                }
            }
        }
        if (message.getThreadId() != null) {
            metadata.put("threadId", message.getThreadId());
        }
        if (message.getLabelIds() != null) {
            metadata.put("labels", String.join(",", message.getLabelIds()));
        }

        BodyExtractionResult body = payload == null ? new BodyExtractionResult() : extractBodyFromParts(payload);
        // plain text scores better than markup; HTML is cleaned by the tokenizer when it is all we have
        String text = body.plainTextContent != null && !body.plainTextContent.isEmpty()
            ? body.plainTextContent
            : (body.htmlContent != null ? body.htmlContent : "");

        Instant receivedAt = message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : null;

        return InboundMessage.builder()
            .id(message.getId())
            .mailboxId(mailboxId)
            .sender(parseAddress(from))
            .subject(subject)
            .body(text)
            .receivedAt(receivedAt)
            .recipients(List.copyOf(recipients))
            .metadata(Map.copyOf(metadata))
            .build();
    }

    static String parseAddress(String headerValue) {
        if (headerValue == null) {
            return "";
        }
        Matcher matcher = ANGLE_ADDRESS.matcher(headerValue);
        String address = matcher.find() ? matcher.group(1) : headerValue;
        return address.trim().toLowerCase(Locale.ROOT);
    }

    static List<String> parseAddresses(String headerValue) {
        List<String> addresses = new ArrayList<>();
        for (String part : headerValue.split(",")) {
            String address = parseAddress(part);
            if (!address.isEmpty()) {
                addresses.add(address);
            }
        }
        return addresses;
    }

    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    private static BodyExtractionResult extractBodyFromParts(MessagePart part) {
        BodyExtractionResult result = new BodyExtractionResult();

        if (part.getBody() != null && part.getBody().getData() != null) {
            String mimeType = part.getMimeType();
            if ("text/plain".equals(mimeType) || "text/html".equals(mimeType)) {
                String decoded = decode(part.getBody().getData(), mimeType);
                if ("text/html".equals(mimeType)) {
                    result.htmlContent = decoded;
                } else {
                    result.plainTextContent = decoded;
                }
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                BodyExtractionResult subResult = extractBodyFromParts(subPart);
                if (subResult.htmlContent != null && !subResult.htmlContent.isEmpty()) {
                    result.htmlContent = (result.htmlContent != null ? result.htmlContent + "\n" : "") + subResult.htmlContent;
                }
                if (subResult.plainTextContent != null && !subResult.plainTextContent.isEmpty()) {
                    result.plainTextContent = (result.plainTextContent != null ? result.plainTextContent + "\n" : "") + subResult.plainTextContent;
                }
            }
        }
        return result;
    }

    private static String decode(String data, String mimeType) {
        try {
            // Gmail uses URL-safe Base64
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                String padded = data;
                int remainder = padded.length() % 4;
                if (remainder > 0) {
                    padded += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return "";
            }
        }
    }
}
