package complaint.router.app.repository;

import complaint.router.app.entity.ClassificationRecord;
import complaint.router.app.model.FeedbackStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ClassificationRecordRepository extends JpaRepository<ClassificationRecord, String> {
    Optional<ClassificationRecord> findByMailboxIdAndMessageId(String mailboxId, String messageId);
    Optional<ClassificationRecord> findFirstByMessageId(String messageId);
    List<ClassificationRecord> findByFeedbackStatusAndFeedbackAppliedFalse(FeedbackStatus feedbackStatus);
    List<ClassificationRecord> findByMailboxIdAndComplaintFalseAndExclusionReasonIsNullOrderByClassifiedAtDesc(String mailboxId);
}
