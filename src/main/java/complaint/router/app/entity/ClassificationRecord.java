package complaint.router.app.entity;

import complaint.router.app.model.FeedbackStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of classifying one message. Also the idempotence record: a message with a record is
 * not classified again, and a forwarded one is never forwarded twice.
 */
@Entity
@Table(name = "classification_records",
       uniqueConstraints = @UniqueConstraint(columnNames = {"mailbox_id", "message_id"}))
@Data
public class ClassificationRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "mailbox_id", nullable = false)
    private String mailboxId;

    @Column(name = "message_id", nullable = false)
    private String messageId;

    private String sender;

    @Column(columnDefinition = "TEXT")
    private String subject;

    private double confidence;
    private boolean complaint;
    private boolean forwarded;

    @Column(columnDefinition = "TEXT")
    private String exclusionReason;

    private Double sentimentScore;
    private String sentimentLabel;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "classification_fired_keywords", joinColumns = @JoinColumn(name = "record_id"))
    @Column(name = "keyword")
    private Set<String> firedKeywords = new LinkedHashSet<>();

    // matched but dampened by a nearby negation
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "classification_weak_keywords", joinColumns = @JoinColumn(name = "record_id"))
    @Column(name = "keyword")
    private Set<String> weakKeywords = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    private FeedbackStatus feedbackStatus = FeedbackStatus.NONE;

    private boolean feedbackApplied;

    private Instant receivedAt;
    private Instant classifiedAt;
    private Instant feedbackAt;
}
