package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.entity.ClassificationRecord;
import complaint.router.app.model.FeedbackStatus;
import complaint.router.app.model.InboundMessage;
import complaint.router.app.model.KeywordCategory;
import complaint.router.app.model.KeywordSet;
import complaint.router.app.repository.ClassificationRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedbackLoopServiceTest {
    private static final String MAILBOX = "support@example.com";
    private static final String DL = "complaints@example.com";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private MailboxProvider mailboxProvider;
    @Mock
    private ClassificationRecordRepository recordRepository;
    @Mock
    private ScoringWeightsService weightsService;
    @Mock
    private KeywordStore keywordStore;

    private ComplaintRouterProperties properties;
    private FeedbackLoopService feedbackLoopService;

    @BeforeEach
    void setUp() {
        properties = new ComplaintRouterProperties();
        properties.setMonitoredMailboxes(List.of(MAILBOX));
        properties.setDistributionListEmail(DL);
        feedbackLoopService = new FeedbackLoopService(mailboxProvider, recordRepository, weightsService, keywordStore,
            properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ClassificationRecord record(String messageId, boolean complaint, boolean forwarded) {
        ClassificationRecord record = new ClassificationRecord();
        record.setMailboxId(MAILBOX);
        record.setMessageId(messageId);
        record.setComplaint(complaint);
        record.setForwarded(forwarded);
        return record;
    }

    @Test
    void bouncedComplaintIsMarkedFalsePositive() {
        // given: the complaint team sent a forwarded complaint back
        ClassificationRecord forwarded = record("orig-1", true, true);
        InboundMessage bounced = InboundMessage.builder().id("bounce-1").mailboxId(MAILBOX)
            .sender("team@example.com").subject("FW: Outage")
            .body("Not a complaint.\n" + ForwardingMarker.line("orig-1") + "\nI am unhappy").build();
        when(mailboxProvider.listRecentMessages(eq(MAILBOX), any(), anyInt())).thenReturn(List.of(bounced));
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "orig-1")).thenReturn(Optional.of(forwarded));

        // when
        feedbackLoopService.scanForFalsePositives(MAILBOX);

        // then
        assertEquals(FeedbackStatus.FALSE_POSITIVE, forwarded.getFeedbackStatus());
        assertFalse(forwarded.isFeedbackApplied());
        assertEquals(NOW, forwarded.getFeedbackAt());
        verify(recordRepository).save(forwarded);
    }

    @Test
    void sameBouncedMessageIsCountedOnce() {
        ClassificationRecord forwarded = record("orig-1", true, true);
        InboundMessage bounced = InboundMessage.builder().id("bounce-1").mailboxId(MAILBOX)
            .sender("team@example.com").body(ForwardingMarker.line("orig-1")).build();
        when(mailboxProvider.listRecentMessages(eq(MAILBOX), any(), anyInt())).thenReturn(List.of(bounced));
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "orig-1")).thenReturn(Optional.of(forwarded));

        feedbackLoopService.scanForFalsePositives(MAILBOX);
        feedbackLoopService.scanForFalsePositives(MAILBOX);

        verify(recordRepository, times(1)).findByMailboxIdAndMessageId(MAILBOX, "orig-1");
        verify(recordRepository, times(1)).save(forwarded);
    }

    @Test
    void bouncedMessageIsOnlyRememberedForOneScan() {
        // given: the bounce drops out of one scan and shows up again in the next
        ClassificationRecord forwarded = record("orig-1", true, true);
        InboundMessage bounced = InboundMessage.builder().id("bounce-1").mailboxId(MAILBOX)
            .sender("team@example.com").body(ForwardingMarker.line("orig-1")).build();
        when(mailboxProvider.listRecentMessages(eq(MAILBOX), any(), anyInt()))
            .thenReturn(List.of(bounced))
            .thenReturn(List.of())
            .thenReturn(List.of(bounced));
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "orig-1")).thenReturn(Optional.of(forwarded));

        // when
        feedbackLoopService.scanForFalsePositives(MAILBOX);
        feedbackLoopService.scanForFalsePositives(MAILBOX);
        feedbackLoopService.scanForFalsePositives(MAILBOX);

        // then: looked up again, but the record already carries feedback so it is not counted twice
        verify(recordRepository, times(2)).findByMailboxIdAndMessageId(MAILBOX, "orig-1");
        verify(recordRepository, times(1)).save(forwarded);
        assertEquals(FeedbackStatus.FALSE_POSITIVE, forwarded.getFeedbackStatus());
    }

    @Test
    void ownForwardedCopyIsNotAFalsePositive() {
        InboundMessage sentCopy = InboundMessage.builder().id("sent-1").mailboxId(MAILBOX)
            .sender(MAILBOX).body(ForwardingMarker.line("orig-1")).build();
        when(mailboxProvider.listRecentMessages(eq(MAILBOX), any(), anyInt())).thenReturn(List.of(sentCopy));

        feedbackLoopService.scanForFalsePositives(MAILBOX);

        verifyNoInteractions(recordRepository);
    }

    @Test
    void markerInHeaderIsRecognised() {
        ClassificationRecord forwarded = record("orig-2", true, true);
        InboundMessage bounced = InboundMessage.builder().id("bounce-2").mailboxId(MAILBOX)
            .sender("team@example.com").body("see below")
            .metadata(Map.of(ForwardingMarker.HEADER_NAME, ForwardingMarker.headerValue("orig-2"))).build();
        when(mailboxProvider.listRecentMessages(eq(MAILBOX), any(), anyInt())).thenReturn(List.of(bounced));
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "orig-2")).thenReturn(Optional.of(forwarded));

        feedbackLoopService.scanForFalsePositives(MAILBOX);

        assertEquals(FeedbackStatus.FALSE_POSITIVE, forwarded.getFeedbackStatus());
    }

    @Test
    void handForwardedMessageIsMarkedFalseNegative() {
        // given: an operator forwarded a message the classifier let through
        ClassificationRecord missed = record("orig-3", false, false);
        missed.setSubject("Billing outage");
        ClassificationRecord other = record("orig-4", false, false);
        other.setSubject("Lunch plans");
        InboundMessage handForward = InboundMessage.builder().id("fwd-3").mailboxId(MAILBOX)
            .sender("operator@example.com").subject("Fwd: Billing outage").body("please handle")
            .recipients(List.of(DL)).build();
        when(mailboxProvider.listRecentMessages(eq(MAILBOX), any(), anyInt())).thenReturn(List.of(handForward));
        when(recordRepository.findByMailboxIdAndComplaintFalseAndExclusionReasonIsNullOrderByClassifiedAtDesc(MAILBOX))
            .thenReturn(List.of(other, missed));

        // when
        feedbackLoopService.scanForFalseNegatives(MAILBOX);

        // then
        assertEquals(FeedbackStatus.FALSE_NEGATIVE, missed.getFeedbackStatus());
        assertEquals(FeedbackStatus.NONE, other.getFeedbackStatus());
    }

    @Test
    void messageNotAddressedToDistributionListIsIgnored() {
        InboundMessage regular = InboundMessage.builder().id("m-5").mailboxId(MAILBOX)
            .sender("jane@example.com").subject("Billing outage").recipients(List.of(MAILBOX)).build();
        when(mailboxProvider.listRecentMessages(eq(MAILBOX), any(), anyInt())).thenReturn(List.of(regular));

        feedbackLoopService.scanForFalseNegatives(MAILBOX);

        verifyNoInteractions(recordRepository);
    }

    @Test
    void falsePositiveLoopDemotesFiredKeywords() {
        properties.getFeedback().setScanMailboxes(false);
        ClassificationRecord pending = record("orig-1", true, true);
        pending.setFeedbackStatus(FeedbackStatus.FALSE_POSITIVE);
        pending.getFiredKeywords().addAll(Set.of("unhappy", "refund"));
        when(recordRepository.findByFeedbackStatusAndFeedbackAppliedFalse(FeedbackStatus.FALSE_POSITIVE))
            .thenReturn(List.of(pending));
        when(weightsService.adjust(Set.of("unhappy", "refund"), -0.1)).thenReturn(2);

        int applied = feedbackLoopService.runFalsePositiveLoop();

        assertEquals(1, applied);
        assertTrue(pending.isFeedbackApplied());
        verify(keywordStore).refreshIfModified();
        verify(recordRepository).save(pending);
        verifyNoInteractions(mailboxProvider);
    }

    @Test
    void falseNegativeLoopPromotesWeakKeywords() {
        properties.getFeedback().setScanMailboxes(false);
        ClassificationRecord pending = record("orig-3", false, false);
        pending.setFeedbackStatus(FeedbackStatus.FALSE_NEGATIVE);
        pending.getWeakKeywords().add("broken");
        when(recordRepository.findByFeedbackStatusAndFeedbackAppliedFalse(FeedbackStatus.FALSE_NEGATIVE))
            .thenReturn(List.of(pending));
        when(weightsService.adjust(Set.of("broken"), 0.1)).thenReturn(1);

        int applied = feedbackLoopService.runFalseNegativeLoop();

        assertEquals(1, applied);
        verify(weightsService, never()).proposeCandidate(any());
    }

    @Test
    void falseNegativeWithoutKeywordsProposesCandidates() {
        properties.getFeedback().setScanMailboxes(false);
        ClassificationRecord pending = record("orig-3", false, false);
        pending.setSubject("Fwd: Invoice overcharged again");
        pending.setFeedbackStatus(FeedbackStatus.FALSE_NEGATIVE);
        when(recordRepository.findByFeedbackStatusAndFeedbackAppliedFalse(FeedbackStatus.FALSE_NEGATIVE))
            .thenReturn(List.of(pending));
        when(keywordStore.current()).thenReturn(new KeywordSet(Map.of(KeywordCategory.URGENCY, Set.of("again")), 1));

        feedbackLoopService.runFalseNegativeLoop();

        verify(weightsService).proposeCandidate("invoice");
        verify(weightsService).proposeCandidate("overcharged");
        verify(weightsService, never()).proposeCandidate("again");
        verify(weightsService, never()).adjust(any(), anyDouble());
        assertTrue(pending.isFeedbackApplied());
    }

    @Test
    void reportFalsePositiveRejectsNonComplaint() {
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "m-9"))
            .thenReturn(Optional.of(record("m-9", false, false)));

        assertThrows(IllegalStateException.class, () -> feedbackLoopService.reportFalsePositive(MAILBOX, "m-9"));
        verify(recordRepository, never()).save(any());
    }

    @Test
    void reportMissedComplaintRejectsExcludedMessage() {
        ClassificationRecord excluded = record("m-10", false, false);
        excluded.setExclusionReason("from matched *@*.gov");
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "m-10")).thenReturn(Optional.of(excluded));

        assertThrows(IllegalStateException.class, () -> feedbackLoopService.reportMissedComplaint(MAILBOX, "m-10"));
    }

    @Test
    void reportOnUnknownMessageIsEmpty() {
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "nope")).thenReturn(Optional.empty());

        assertTrue(feedbackLoopService.reportMissedComplaint(MAILBOX, "nope").isEmpty());
    }

    @Test
    void feedbackIsRecordedOnlyOnce() {
        ClassificationRecord record = record("m-11", true, true);
        record.setFeedbackStatus(FeedbackStatus.FALSE_POSITIVE);
        record.setFeedbackApplied(true);
        when(recordRepository.findByMailboxIdAndMessageId(MAILBOX, "m-11")).thenReturn(Optional.of(record));

        feedbackLoopService.reportFalsePositive(MAILBOX, "m-11");

        assertTrue(record.isFeedbackApplied());
        verify(recordRepository, never()).save(any());
    }

    @Test
    void normalizeSubjectStripsForwardAndReplyPrefixes() {
        assertEquals("billing outage", FeedbackLoopService.normalizeSubject("FW: RE: Billing outage "));
        assertEquals("billing outage", FeedbackLoopService.normalizeSubject("fwd:Billing Outage"));
        assertEquals("", FeedbackLoopService.normalizeSubject(null));
    }

    @Test
    void candidateTermsAreCapped() {
        KeywordSet keywords = new KeywordSet(Map.of(), 1);

        List<String> candidates = FeedbackLoopService.candidateTerms("Terrible service delays everywhere", keywords, 2);

        assertEquals(List.of("terrible", "service"), candidates);
    }
}
