package complaint.router.app.controller;

import complaint.router.app.entity.ClassificationRecord;
import complaint.router.app.model.PassResult;
import complaint.router.app.repository.ClassificationRecordRepository;
import complaint.router.app.service.ComplaintProcessingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Manual trigger for a processing pass and lookup of stored classifications.
 */
@RestController
@RequestMapping("/api")
public class ProcessingController {
    private final ComplaintProcessingService processingService;
    private final ClassificationRecordRepository recordRepository;

    public ProcessingController(ComplaintProcessingService processingService,
                                ClassificationRecordRepository recordRepository) {
        this.processingService = processingService;
        this.recordRepository = recordRepository;
    }

    /**
     * Runs one pass over all monitored mailboxes right away and reports per-mailbox results.
     */
    @PostMapping("/processing/run")
    public ResponseEntity<List<PassResult>> triggerProcessing() {
        return ResponseEntity.ok(processingService.processMonitoredMailboxes());
    }

    @GetMapping("/classifications/{mailbox}/{messageId}")
    public ResponseEntity<ClassificationRecord> classification(@PathVariable String mailbox,
                                                               @PathVariable String messageId) {
        return recordRepository.findByMailboxIdAndMessageId(mailbox, messageId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
