package complaint.router.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Learned weight multiplier for one keyword, or a proposed new keyword when {@code candidate} is set.
 */
@Entity
@Table(name = "keyword_adjustments")
@Data
public class KeywordAdjustment {
    @Id
    private String keyword;

    private double multiplier = 1.0;

    private boolean candidate;

    // how many operator signals touched this keyword
    private int signalCount;

    private Instant updatedAt;
}
