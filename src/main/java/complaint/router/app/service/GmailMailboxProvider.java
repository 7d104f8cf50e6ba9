package complaint.router.app.service;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.History;
import com.google.api.services.gmail.model.HistoryMessageAdded;
import com.google.api.services.gmail.model.ListHistoryResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import complaint.router.app.common.RetryPolicy;
import complaint.router.app.common.ShutdownSignal;
import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.exception.TransientProviderException;
import complaint.router.app.model.InboundMessage;
import complaint.router.app.model.MessagePage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Gmail implementation of {@link MailboxProvider}. The delta cursor is the mailbox history id.
 */
@Slf4j
@Service
public class GmailMailboxProvider implements MailboxProvider {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final DateTimeFormatter GMAIL_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final long PAGE_SIZE = 100L;

    private final NetHttpTransport httpTransport;
    private final GmailTokenService tokenService;
    private final RetryPolicy retryPolicy;
    private final ShutdownSignal shutdownSignal;
    private final String applicationName;
    private final int timeoutMs;

    @FunctionalInterface
    interface GmailCall<T> {
        T execute(Gmail gmail) throws IOException;
    }

    public GmailMailboxProvider(GmailTokenService tokenService, ComplaintRouterProperties properties,
                                ShutdownSignal shutdownSignal) throws GeneralSecurityException, IOException {
        this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        this.tokenService = tokenService;
        this.shutdownSignal = shutdownSignal;
        this.retryPolicy = new RetryPolicy(properties.getMaxRetries(), properties.getRetryDelay(),
            RetryPolicy.Backoff.parse(properties.getRetryBackoff()));
        this.applicationName = properties.getGmail().getApplicationName();
        this.timeoutMs = (int) properties.getGmail().getTimeout().toMillis();
    }

    private Gmail gmail(String mailboxId) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(tokenService.accessToken(mailboxId));

        HttpRequestInitializer initializer = request -> {
            credential.initialize(request);
            request.setConnectTimeout(timeoutMs);
            request.setReadTimeout(timeoutMs);
        };
        return new Gmail.Builder(httpTransport, JSON_FACTORY, initializer)
            .setApplicationName(applicationName)
            .build();
    }

    @Override
    public MessagePage listMessagesSince(String mailboxId, String cursor) {
        BigInteger startHistoryId;
        try {
            startHistoryId = new BigInteger(cursor);
        } catch (NumberFormatException e) {
            throw new CursorExpiredException("Cursor for " + mailboxId + " is not a Gmail history id: " + cursor, e);
        }

        return call(mailboxId, "history.list", gmail -> {
            Set<String> ids = new LinkedHashSet<>();
            String pageToken = null;
            BigInteger latest = startHistoryId;
            try {
                do {
                    ListHistoryResponse response = gmail.users().history().list(mailboxId)
                        .setStartHistoryId(startHistoryId)
                        .setHistoryTypes(List.of("messageAdded"))
                        .setLabelId("INBOX")
                        .setMaxResults(PAGE_SIZE)
                        .setPageToken(pageToken)
                        .execute();
                    if (response.getHistory() != null) {
                        for (History history : response.getHistory()) {
                            if (history.getMessagesAdded() == null) {
                                continue;
                            }
                            for (HistoryMessageAdded added : history.getMessagesAdded()) {
                                ids.add(added.getMessage().getId());
                            }
                        }
                    }
                    if (response.getHistoryId() != null) {
                        latest = response.getHistoryId();
                    }
                    pageToken = response.getNextPageToken();
                } while (pageToken != null);
            } catch (GoogleJsonResponseException e) {
                if (e.getStatusCode() == 404) {
                    throw new CursorExpiredException("History id " + cursor + " expired for " + mailboxId, e);
                }
                throw e;
            }
            return new MessagePage(new ArrayList<>(ids), latest.toString());
        });
    }

    @Override
    public MessagePage listMessages(String mailboxId, ComplaintRouterProperties.EmailFilter filter, int top) {
        return call(mailboxId, "messages.list", gmail -> {
            // capture the position first so messages arriving during the listing are picked up next time
            BigInteger historyId = gmail.users().getProfile(mailboxId).execute().getHistoryId();
            ListMessagesResponse response = gmail.users().messages().list(mailboxId)
                .setQ(buildQuery(filter))
                .setMaxResults((long) top)
                .execute();
            List<String> ids = new ArrayList<>();
            if (response.getMessages() != null) {
                for (Message ref : response.getMessages()) {
                    ids.add(ref.getId());
                }
            }
            // Gmail lists newest first; process in arrival order
            Collections.reverse(ids);
            return new MessagePage(ids, historyId != null ? historyId.toString() : null);
        });
    }

    @Override
    public InboundMessage getMessage(String mailboxId, String messageId) {
        Message message = call(mailboxId, "messages.get", gmail -> gmail.users().messages().get(mailboxId, messageId)
            .setFormat("full")
            .execute());
        return GmailMessageMapper.toInboundMessage(mailboxId, message);
    }

    @Override
    public List<InboundMessage> listRecentMessages(String mailboxId, Instant since, int top) {
        ListMessagesResponse response = call(mailboxId, "messages.list", gmail -> gmail.users().messages().list(mailboxId)
            .setQ("in:inbox after:" + since.getEpochSecond())
            .setMaxResults((long) top)
            .execute());
        List<InboundMessage> messages = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message ref : response.getMessages()) {
                messages.add(getMessage(mailboxId, ref.getId()));
            }
        }
        return messages;
    }

    @Override
    public void forwardMessage(String mailboxId, InboundMessage message, String distributionAddress) {
        byte[] raw = buildForward(mailboxId, message, distributionAddress).getBytes(StandardCharsets.UTF_8);
        Message outgoing = new Message().encodeRaw(raw);
        call(mailboxId, "messages.send", gmail -> gmail.users().messages().send(mailboxId, outgoing).execute());
        log.info("Message {} forwarded from {} to {}", message.getId(), mailboxId, distributionAddress);
    }

    @Override
    public void deleteMessage(String mailboxId, String messageId) {
        call(mailboxId, "messages.trash", gmail -> gmail.users().messages().trash(mailboxId, messageId).execute());
        log.info("Original message {} moved to trash in {}", messageId, mailboxId);
    }

    /**
     * Runs one Gmail call under the retry policy. 401 drops the cached token so the next attempt
     * refreshes it; 429 and 5xx are retried; other HTTP errors are not.
     */
    private <T> T call(String mailboxId, String operation, GmailCall<T> gmailCall) {
        return retryPolicy.execute(
            "Gmail " + operation + " for " + mailboxId,
            () -> {
                try {
                    return gmailCall.execute(gmail(mailboxId));
                } catch (GoogleJsonResponseException e) {
                    int status = e.getStatusCode();
                    if (status == 401) {
                        tokenService.invalidate(mailboxId);
                        throw new TransientProviderException("Unauthorized for " + mailboxId + ", token refreshed", e);
                    }
                    if (status == 429 || status >= 500) {
                        throw new TransientProviderException("Gmail " + operation + " returned " + status, e);
                    }
                    throw new IllegalStateException("Gmail " + operation + " failed: " + status + " - " + e.getMessage(), e);
                } catch (IOException e) {
                    throw new TransientProviderException("Gmail " + operation + " I/O error: " + e.getMessage(), e);
                }
            },
            e -> e instanceof TransientProviderException,
            shutdownSignal::isShuttingDown);
    }

    static String buildQuery(ComplaintRouterProperties.EmailFilter filter) {
        StringBuilder query = new StringBuilder("in:inbox");
        if (filter == null) {
            return query.toString();
        }
        if (filter.getFromDomain() != null && !filter.getFromDomain().isBlank()) {
            query.append(" from:").append(filter.getFromDomain().trim());
        }
        if (filter.getStartDate() != null && !filter.getStartDate().isBlank()) {
            LocalDate start = parseStartDate(filter.getStartDate().trim());
            if (start != null) {
                query.append(" after:").append(GMAIL_DATE.format(start));
            }
        }
        if (filter.getSubjectContains() != null && !filter.getSubjectContains().isBlank()) {
            query.append(" subject:(").append(filter.getSubjectContains().trim()).append(')');
        }
        return query.toString();
    }

    private static LocalDate parseStartDate(String value) {
        try {
            if (value.length() <= 10) {
                return LocalDate.parse(value);
            }
            return OffsetDateTime.parse(value.replace("Z", "+00:00")).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException e) {
            log.error("Invalid email-filter.start-date '{}'. Use ISO 8601 (YYYY-MM-DD or YYYY-MM-DDTHH:mm:ssZ).", value);
            return null;
        }
    }

    static String buildForward(String mailboxId, InboundMessage message, String distributionAddress) {
        String subject = message.getSubject() == null ? "" : message.getSubject();
        StringBuilder mime = new StringBuilder();
        mime.append("From: ").append(mailboxId).append("\r\n");
        mime.append("To: ").append(distributionAddress).append("\r\n");
        mime.append("Subject: ").append(encodeHeader("FW: " + subject)).append("\r\n");
        mime.append(ForwardingMarker.HEADER_NAME).append(": ").append(ForwardingMarker.headerValue(message.getId())).append("\r\n");
        mime.append("MIME-Version: 1.0\r\n");
        mime.append("Content-Type: text/plain; charset=UTF-8\r\n");
        mime.append("Content-Transfer-Encoding: 8bit\r\n");
        mime.append("\r\n");
        mime.append(ForwardingMarker.line(message.getId())).append("\r\n\r\n");
        mime.append("---------- Forwarded message ---------\r\n");
        mime.append("From: ").append(message.getSender()).append("\r\n");
        if (message.getReceivedAt() != null) {
            mime.append("Date: ").append(message.getReceivedAt()).append("\r\n");
        }
        mime.append("Subject: ").append(subject).append("\r\n\r\n");
        mime.append(message.getBody() == null ? "" : message.getBody());
        return mime.toString();
    }

    private static String encodeHeader(String value) {
        boolean ascii = value.chars().allMatch(c -> c < 128);
        if (ascii) {
            return value;
        }
        return "=?UTF-8?B?" + Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8)) + "?=";
    }
}
