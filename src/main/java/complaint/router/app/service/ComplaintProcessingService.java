package complaint.router.app.service;

import complaint.router.app.common.ShutdownSignal;
import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.entity.ClassificationRecord;
import complaint.router.app.exception.TransientProviderException;
import complaint.router.app.model.ClassificationResult;
import complaint.router.app.model.InboundMessage;
import complaint.router.app.model.PassResult;
import complaint.router.app.repository.ClassificationRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Main classification loop. Each monitored mailbox is processed on its own worker: list the batch
 * since the cursor, classify and forward message by message, then advance the cursor if every
 * message of the batch was handled.
 */
@Slf4j
@Service
public class ComplaintProcessingService {
    private enum Outcome { PROCESSED, FORWARDED, SKIPPED }

    private final SyncCursorManager cursorManager;
    private final MailboxProvider mailboxProvider;
    private final ComplaintScoringService scoringService;
    private final KeywordStore keywordStore;
    private final ScoringWeightsService weightsService;
    private final ClassificationRecordRepository recordRepository;
    private final MailboxLockService lockService;
    private final ShutdownSignal shutdownSignal;
    private final ComplaintRouterProperties properties;
    private final Executor executor;
    private final Clock clock;

    @Autowired
    public ComplaintProcessingService(
            SyncCursorManager cursorManager,
            MailboxProvider mailboxProvider,
            ComplaintScoringService scoringService,
            KeywordStore keywordStore,
            ScoringWeightsService weightsService,
            ClassificationRecordRepository recordRepository,
            MailboxLockService lockService,
            ShutdownSignal shutdownSignal,
            ComplaintRouterProperties properties,
            @Qualifier("mailboxProcessingExecutor") Executor executor) {
        this(cursorManager, mailboxProvider, scoringService, keywordStore, weightsService, recordRepository,
            lockService, shutdownSignal, properties, executor, Clock.systemUTC());
    }

    ComplaintProcessingService(
            SyncCursorManager cursorManager,
            MailboxProvider mailboxProvider,
            ComplaintScoringService scoringService,
            KeywordStore keywordStore,
            ScoringWeightsService weightsService,
            ClassificationRecordRepository recordRepository,
            MailboxLockService lockService,
            ShutdownSignal shutdownSignal,
            ComplaintRouterProperties properties,
            Executor executor,
            Clock clock) {
        this.cursorManager = cursorManager;
        this.mailboxProvider = mailboxProvider;
        this.scoringService = scoringService;
        this.keywordStore = keywordStore;
        this.weightsService = weightsService;
        this.recordRepository = recordRepository;
        this.lockService = lockService;
        this.shutdownSignal = shutdownSignal;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Runs one pass over every monitored mailbox in parallel and waits for all of them.
     */
    public List<PassResult> processMonitoredMailboxes() {
        log.info("Processing monitored mailboxes started");
        List<CompletableFuture<PassResult>> futures = new ArrayList<>();
        for (String mailboxId : properties.getMonitoredMailboxes()) {
            futures.add(CompletableFuture.supplyAsync(() -> processMailbox(mailboxId), executor)
                .exceptionally(ex -> {
                    log.error("Error in async processing of {}: {}", mailboxId, ex.getMessage(), ex);
                    return PassResult.aborted(mailboxId, ex.getMessage());
                }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<PassResult> results = new ArrayList<>();
        for (CompletableFuture<PassResult> future : futures) {
            results.add(future.join());
        }
        log.info("Processing monitored mailboxes ended");
        return results;
    }

    /**
     * Processes one mailbox. Does nothing if another pass holds the mailbox.
     */
    public PassResult processMailbox(String mailboxId) {
        if (shutdownSignal.isShuttingDown()) {
            return PassResult.aborted(mailboxId, "shutting down");
        }
        if (!lockService.tryLock(mailboxId)) {
            return PassResult.aborted(mailboxId, "already being processed");
        }
        try {
            return processBatch(mailboxId);
        } catch (CancellationException e) {
            log.warn("Processing of {} cancelled: {}", mailboxId, e.getMessage());
            return PassResult.aborted(mailboxId, "cancelled");
        } catch (RuntimeException e) {
            // provider-level failure: the whole pass is deferred to the next run
            log.error("Error processing mailbox {}, deferring to next run: {}", mailboxId, e.getMessage(), e);
            return PassResult.aborted(mailboxId, e.getMessage());
        } finally {
            lockService.releaseLock(mailboxId);
        }
    }

    private PassResult processBatch(String mailboxId) {
        SyncBatch batch = cursorManager.nextBatch(mailboxId);
        Instant deadline = clock.instant().plus(deadlineFor());
        log.info("Messages to process count {} for {}", batch.size(), mailboxId);

        int processed = 0;
        int forwarded = 0;
        int skipped = 0;
        int failed = 0;
        boolean complete = true;

        Iterator<InboundMessage> messages = batch.iterator();
        int position = 0;
        while (messages.hasNext()) {
            String messageId = batch.getMessageIds().get(position++);
            if (shutdownSignal.isShuttingDown()) {
                log.warn("Shutdown requested, leaving {} messages of {} for the next run", batch.size() - position + 1, mailboxId);
                complete = false;
                break;
            }
            if (clock.instant().isAfter(deadline)) {
                log.warn("Batch deadline reached for {}, leaving {} messages for the next run", mailboxId, batch.size() - position + 1);
                complete = false;
                break;
            }
            try {
                InboundMessage message = messages.next();
                switch (processMessage(mailboxId, message)) {
                    case FORWARDED:
                        forwarded++;
                        processed++;
                        break;
                    case SKIPPED:
                        skipped++;
                        break;
                    default:
                        processed++;
                }
            } catch (CancellationException e) {
                log.warn("Processing of message {} in {} cancelled", messageId, mailboxId);
                complete = false;
                break;
            } catch (TransientProviderException | SentimentAdapter.SentimentUnavailableException e) {
                log.error("Failed to process message {} for mailbox {}: {}", messageId, mailboxId, e.getMessage(), e);
                failed++;
                // retryable, the cursor stays put so this one is picked up again
                complete = false;
            } catch (RuntimeException e) {
                // permanent (message gone, rejected request): retrying cannot help, so it must not hold the cursor
                log.error("Giving up on message {} for mailbox {}: {}", messageId, mailboxId, e.getMessage(), e);
                failed++;
            }
        }

        boolean advanced = false;
        if (complete) {
            advanced = cursorManager.commit(batch);
        } else {
            log.warn("Batch for {} incomplete ({} failed), cursor not advanced", mailboxId, failed);
        }
        log.info("Mailbox {} done: processed={}, forwarded={}, skipped={}, failed={}", mailboxId, processed, forwarded, skipped, failed);
        return PassResult.builder()
            .mailboxId(mailboxId)
            .processed(processed)
            .forwarded(forwarded)
            .skipped(skipped)
            .failed(failed)
            .cursorAdvanced(advanced)
            .build();
    }

    private Outcome processMessage(String mailboxId, InboundMessage message) {
        Optional<ClassificationRecord> existing = recordRepository.findByMailboxIdAndMessageId(mailboxId, message.getId());
        if (existing.isPresent()) {
            ClassificationRecord record = existing.get();
            if (!record.isComplaint() || record.isForwarded()) {
                log.debug("Message {} in {} already processed", message.getId(), mailboxId);
                return Outcome.SKIPPED;
            }
            log.info("Retrying forward of complaint {} from {}", message.getId(), mailboxId);
            forward(mailboxId, message, record);
            return Outcome.FORWARDED;
        }

        ClassificationResult result = scoringService.classify(message, keywordStore.current(), weightsService.current());
        ClassificationRecord record = recordRepository.save(toRecord(mailboxId, message, result));

        if (!result.isComplaint()) {
            log.info("Message {} from {} is not a complaint (confidence {})", message.getId(), message.getSender(),
                String.format("%.3f", result.getConfidence()));
            return Outcome.PROCESSED;
        }
        log.info("Complaint detected: message {} from {} (confidence {}, keywords {})", message.getId(),
            message.getSender(), String.format("%.3f", result.getConfidence()), result.firedKeywords());
        forward(mailboxId, message, record);
        return Outcome.FORWARDED;
    }

    private void forward(String mailboxId, InboundMessage message, ClassificationRecord record) {
        mailboxProvider.forwardMessage(mailboxId, message, properties.getDistributionListEmail());
        record.setForwarded(true);
        recordRepository.save(record);

        if (properties.isDeleteOriginal()) {
            try {
                mailboxProvider.deleteMessage(mailboxId, message.getId());
            } catch (RuntimeException e) {
                // the complaint is already delivered; a leftover original is harmless
                log.error("Failed to delete original {} in {}: {}", message.getId(), mailboxId, e.getMessage());
            }
        }
    }

    private ClassificationRecord toRecord(String mailboxId, InboundMessage message, ClassificationResult result) {
        ClassificationRecord record = new ClassificationRecord();
        record.setMailboxId(mailboxId);
        record.setMessageId(message.getId());
        record.setSender(message.getSender());
        record.setSubject(message.getSubject());
        record.setConfidence(result.getConfidence());
        record.setComplaint(result.isComplaint());
        record.setExclusionReason(result.getExclusionReason());
        if (result.getSentiment() != null) {
            record.setSentimentScore(result.getSentiment().getScore());
            record.setSentimentLabel(result.getSentiment().getRawLabel());
        }
        record.getFiredKeywords().addAll(result.firedKeywords());
        record.getWeakKeywords().addAll(result.weakKeywords());
        record.setReceivedAt(message.getReceivedAt());
        record.setClassifiedAt(clock.instant());
        return record;
    }

    private Duration deadlineFor() {
        Duration deadline = properties.getBatchDeadline();
        return deadline == null || deadline.isZero() || deadline.isNegative() ? Duration.ofDays(1) : deadline;
    }
}
