package complaint.router.app.controller;

import complaint.router.app.entity.ClassificationRecord;
import complaint.router.app.entity.KeywordAdjustment;
import complaint.router.app.service.FeedbackLoopService;
import complaint.router.app.service.ScoringWeightsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Operator signals for the feedback loops. Signals are recorded here and applied by the next
 * false-positive or false-negative pass.
 */
@Slf4j
@RestController
@RequestMapping("/api/feedback")
public class FeedbackController {
    private final FeedbackLoopService feedbackLoopService;
    private final ScoringWeightsService weightsService;

    public FeedbackController(FeedbackLoopService feedbackLoopService, ScoringWeightsService weightsService) {
        this.feedbackLoopService = feedbackLoopService;
        this.weightsService = weightsService;
    }

    @PostMapping("/{mailbox}/{messageId}/false-positive")
    public ResponseEntity<ClassificationRecord> reportFalsePositive(@PathVariable String mailbox,
                                                                    @PathVariable String messageId) {
        return respond(() -> feedbackLoopService.reportFalsePositive(mailbox, messageId), mailbox, messageId);
    }

    @PostMapping("/{mailbox}/{messageId}/missed-complaint")
    public ResponseEntity<ClassificationRecord> reportMissedComplaint(@PathVariable String mailbox,
                                                                      @PathVariable String messageId) {
        return respond(() -> feedbackLoopService.reportMissedComplaint(mailbox, messageId), mailbox, messageId);
    }

    /**
     * Proposed keywords, most frequently signalled first.
     */
    @GetMapping("/candidates")
    public List<KeywordAdjustment> candidates() {
        return weightsService.candidates();
    }

    private ResponseEntity<ClassificationRecord> respond(Supplier<Optional<ClassificationRecord>> action,
                                                         String mailbox, String messageId) {
        try {
            return action.get()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (IllegalStateException e) {
            log.info("Feedback for {} in {} rejected: {}", messageId, mailbox, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }
}
