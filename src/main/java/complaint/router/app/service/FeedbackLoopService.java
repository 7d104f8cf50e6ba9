package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.entity.ClassificationRecord;
import complaint.router.app.model.FeedbackStatus;
import complaint.router.app.model.InboundMessage;
import complaint.router.app.model.KeywordSet;
import complaint.router.app.repository.ClassificationRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Feeds operator signals back into keyword weighting.
 *
 * <p>False positives (forwarded complaints the complaint team sent back, recognisable by the
 * processing marker) lower the multipliers of the keywords that fired. False negatives (messages
 * an operator forwarded to the distribution list by hand) raise the multipliers of keywords that
 * matched but were dampened, or propose subject terms as new keyword candidates when nothing matched.
 * Signals also arrive through the REST API.
 */
@Slf4j
@Service
public class FeedbackLoopService {
    private static final Pattern REPLY_PREFIX = Pattern.compile("^\\s*((fw|fwd|re)\\s*:\\s*)+", Pattern.CASE_INSENSITIVE);
    private static final int MIN_CANDIDATE_LENGTH = 4;

    private final MailboxProvider mailboxProvider;
    private final ClassificationRecordRepository recordRepository;
    private final ScoringWeightsService weightsService;
    private final KeywordStore keywordStore;
    private final ComplaintRouterProperties properties;
    private final Clock clock;

    private final Map<String, Instant> lastFalsePositiveCheck = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastFalseNegativeCheck = new ConcurrentHashMap<>();
    // ids listed by the previous scan per "fp:"/"fn:" + mailbox; windows overlap at most by one scan
    private final Map<String, Set<String>> previousScanIds = new ConcurrentHashMap<>();

    @Autowired
    public FeedbackLoopService(MailboxProvider mailboxProvider, ClassificationRecordRepository recordRepository,
                               ScoringWeightsService weightsService, KeywordStore keywordStore,
                               ComplaintRouterProperties properties) {
        this(mailboxProvider, recordRepository, weightsService, keywordStore, properties, Clock.systemUTC());
    }

    FeedbackLoopService(MailboxProvider mailboxProvider, ClassificationRecordRepository recordRepository,
                        ScoringWeightsService weightsService, KeywordStore keywordStore,
                        ComplaintRouterProperties properties, Clock clock) {
        this.mailboxProvider = mailboxProvider;
        this.recordRepository = recordRepository;
        this.weightsService = weightsService;
        this.keywordStore = keywordStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * One false-positive pass: scan the mailboxes for bounced complaints, then demote the keywords of
     * every unapplied false-positive record.
     *
     * @return number of records whose feedback was applied
     */
    public int runFalsePositiveLoop() {
        keywordStore.refreshIfModified();
        if (properties.getFeedback().isScanMailboxes()) {
            for (String mailboxId : properties.getMonitoredMailboxes()) {
                try {
                    scanForFalsePositives(mailboxId);
                } catch (RuntimeException e) {
                    log.error("Error checking for fp feedback for {}: {}", mailboxId, e.getMessage(), e);
                }
            }
        }
        return applyPending(FeedbackStatus.FALSE_POSITIVE);
    }

    /**
     * One false-negative pass: scan the mailboxes for hand-forwarded complaints, then promote weak
     * keywords or propose candidates for every unapplied false-negative record.
     *
     * @return number of records whose feedback was applied
     */
    public int runFalseNegativeLoop() {
        keywordStore.refreshIfModified();
        if (properties.getFeedback().isScanMailboxes()) {
            for (String mailboxId : properties.getMonitoredMailboxes()) {
                try {
                    scanForFalseNegatives(mailboxId);
                } catch (RuntimeException e) {
                    log.error("Error checking for fn feedback for {}: {}", mailboxId, e.getMessage(), e);
                }
            }
        }
        return applyPending(FeedbackStatus.FALSE_NEGATIVE);
    }

    /**
     * Operator rejects a forwarded complaint.
     *
     * @return the updated record, empty if the message was never classified
     * @throws IllegalStateException if the message was not forwarded as a complaint
     */
    public Optional<ClassificationRecord> reportFalsePositive(String mailboxId, String messageId) {
        Optional<ClassificationRecord> found = recordRepository.findByMailboxIdAndMessageId(mailboxId, messageId);
        found.ifPresent(record -> {
            if (!record.isComplaint()) {
                throw new IllegalStateException("Message " + messageId + " was not classified as a complaint");
            }
            mark(record, FeedbackStatus.FALSE_POSITIVE);
        });
        return found;
    }

    /**
     * Operator flags a message that should have been forwarded.
     *
     * @throws IllegalStateException if the message was forwarded or excluded by a pattern
     */
    public Optional<ClassificationRecord> reportMissedComplaint(String mailboxId, String messageId) {
        Optional<ClassificationRecord> found = recordRepository.findByMailboxIdAndMessageId(mailboxId, messageId);
        found.ifPresent(record -> {
            if (record.isComplaint()) {
                throw new IllegalStateException("Message " + messageId + " was already classified as a complaint");
            }
            if (record.getExclusionReason() != null) {
                throw new IllegalStateException("Message " + messageId + " was excluded: " + record.getExclusionReason());
            }
            mark(record, FeedbackStatus.FALSE_NEGATIVE);
        });
        return found;
    }

    void scanForFalsePositives(String mailboxId) {
        Instant now = clock.instant();
        Instant since = lastFalsePositiveCheck.getOrDefault(mailboxId, now.minus(interval(FeedbackStatus.FALSE_POSITIVE)));
        List<InboundMessage> messages = mailboxProvider.listRecentMessages(mailboxId, since, properties.getTopEmails());
        Set<String> previous = previousScanIds.getOrDefault("fp:" + mailboxId, Set.of());
        Set<String> current = new HashSet<>();

        for (InboundMessage message : messages) {
            current.add(message.getId());
            if (isOwnMessage(mailboxId, message) || previous.contains(message.getId())) {
                continue;
            }
            Optional<String> originalId = markerId(message);
            if (originalId.isEmpty()) {
                continue;
            }
            log.info("False Positive detected for {}: Email ID: {}, Subject: {}, Original Message ID: {}",
                mailboxId, originalId.get(), message.getSubject(), message.getId());
            Optional<ClassificationRecord> record = recordRepository.findByMailboxIdAndMessageId(mailboxId, originalId.get())
                .or(() -> recordRepository.findFirstByMessageId(originalId.get()));
            if (record.isPresent() && record.get().isForwarded()) {
                mark(record.get(), FeedbackStatus.FALSE_POSITIVE);
            } else {
                log.warn("No forwarded record for bounced complaint {}", originalId.get());
            }
        }
        previousScanIds.put("fp:" + mailboxId, current);
        lastFalsePositiveCheck.put(mailboxId, now);
    }

    void scanForFalseNegatives(String mailboxId) {
        Instant now = clock.instant();
        Instant since = lastFalseNegativeCheck.getOrDefault(mailboxId, now.minus(interval(FeedbackStatus.FALSE_NEGATIVE)));
        List<InboundMessage> messages = mailboxProvider.listRecentMessages(mailboxId, since, properties.getTopEmails());
        String distributionList = properties.getDistributionListEmail().toLowerCase(Locale.ROOT);
        Set<String> previous = previousScanIds.getOrDefault("fn:" + mailboxId, Set.of());
        Set<String> current = new HashSet<>();

        for (InboundMessage message : messages) {
            current.add(message.getId());
            if (isOwnMessage(mailboxId, message) || markerId(message).isPresent()
                    || !message.getRecipients().contains(distributionList)
                    || previous.contains(message.getId())) {
                continue;
            }
            log.info("Potential False Negative Detected for {}: Subject: {}, From: {}, Original Message ID: {}",
                mailboxId, message.getSubject(), message.getSender(), message.getId());
            String subject = normalizeSubject(message.getSubject());
            Optional<ClassificationRecord> record = recordRepository
                .findByMailboxIdAndComplaintFalseAndExclusionReasonIsNullOrderByClassifiedAtDesc(mailboxId).stream()
                .filter(r -> r.getFeedbackStatus() == FeedbackStatus.NONE)
                .filter(r -> normalizeSubject(r.getSubject()).equals(subject))
                .findFirst();
            if (record.isPresent()) {
                mark(record.get(), FeedbackStatus.FALSE_NEGATIVE);
            } else {
                log.info("No unforwarded record matches subject '{}' in {}", subject, mailboxId);
            }
        }
        previousScanIds.put("fn:" + mailboxId, current);
        lastFalseNegativeCheck.put(mailboxId, now);
    }

    int applyPending(FeedbackStatus status) {
        List<ClassificationRecord> pending = recordRepository.findByFeedbackStatusAndFeedbackAppliedFalse(status);
        double step = properties.getFeedback().getStep();
        int applied = 0;
        for (ClassificationRecord record : pending) {
            try {
                if (status == FeedbackStatus.FALSE_POSITIVE) {
                    int changed = weightsService.adjust(record.getFiredKeywords(), -step);
                    log.info("False positive {} applied: {} of {} keywords demoted", record.getMessageId(),
                        changed, record.getFiredKeywords().size());
                } else {
                    promote(record, step);
                }
                record.setFeedbackApplied(true);
                recordRepository.save(record);
                applied++;
            } catch (RuntimeException e) {
                log.error("Failed to apply feedback for {}: {}", record.getMessageId(), e.getMessage(), e);
            }
        }
        return applied;
    }

    private void promote(ClassificationRecord record, double step) {
        Set<String> promoted = new LinkedHashSet<>(record.getWeakKeywords());
        promoted.addAll(record.getFiredKeywords());
        if (!promoted.isEmpty()) {
            int changed = weightsService.adjust(promoted, step);
            log.info("False negative {} applied: {} of {} keywords promoted", record.getMessageId(), changed, promoted.size());
            return;
        }
        List<String> candidates = candidateTerms(record.getSubject(), keywordStore.current(),
            properties.getFeedback().getMaxCandidatesPerMessage());
        candidates.forEach(weightsService::proposeCandidate);
        log.info("False negative {} matched no keywords, proposed candidates {}", record.getMessageId(), candidates);
    }

    static List<String> candidateTerms(String subject, KeywordSet keywords, int max) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : TextTokenizer.tokenize(subject)) {
            if (terms.size() >= max) {
                break;
            }
            if (token.length() >= MIN_CANDIDATE_LENGTH && token.chars().allMatch(Character::isLetter)
                    && !keywords.containsAnywhere(token)) {
                terms.add(token);
            }
        }
        return List.copyOf(terms);
    }

    static String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        return REPLY_PREFIX.matcher(subject).replaceFirst("").trim().toLowerCase(Locale.ROOT);
    }

    private void mark(ClassificationRecord record, FeedbackStatus status) {
        if (record.getFeedbackStatus() != FeedbackStatus.NONE) {
            log.debug("Record {} already carries feedback {}", record.getMessageId(), record.getFeedbackStatus());
            return;
        }
        record.setFeedbackStatus(status);
        record.setFeedbackApplied(false);
        record.setFeedbackAt(clock.instant());
        recordRepository.save(record);
    }

    private Optional<String> markerId(InboundMessage message) {
        Optional<String> fromBody = ForwardingMarker.extractMessageId(message.getBody());
        if (fromBody.isPresent()) {
            return fromBody;
        }
        String header = message.getMetadata().get(ForwardingMarker.HEADER_NAME);
        return header == null ? Optional.empty()
            : ForwardingMarker.extractMessageId(ForwardingMarker.HEADER_NAME + ": " + header);
    }

    private static boolean isOwnMessage(String mailboxId, InboundMessage message) {
        return mailboxId.equalsIgnoreCase(message.getSender());
    }

    private Duration interval(FeedbackStatus status) {
        ComplaintRouterProperties.SchedulingIntervals intervals = properties.getSchedulingIntervals();
        return status == FeedbackStatus.FALSE_POSITIVE ? intervals.getFpFeedbackLoop() : intervals.getFnFeedbackLoop();
    }
}
