package complaint.router.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Immutable scoring configuration for one pass. Feedback adjustments produce a new
 * instance with updated keyword multipliers.
 */
@Value
@Builder(toBuilder = true)
public class ScoringWeights {
    double bodyKeyword;
    double subjectKeyword;
    double urgency;
    double negation;
    double sentiment;

    double keywordThreshold;
    double sentimentThreshold;

    // hit count at which a keyword signal saturates to 1.0
    double normalizationCap;

    SentimentCombination combination;
    double gateBand;

    ContextualCheck contextualCheck;

    @Builder.Default
    Map<String, Double> keywordMultipliers = Map.of();

    public double multiplierFor(String keyword) {
        return keywordMultipliers.getOrDefault(keyword, 1.0);
    }

    @Value
    @Builder
    public static class ContextualCheck {
        boolean enabled;
        int proximity;
        double scoreThreshold;

        @Builder.Default
        Set<String> negativeWords = Set.of();
    }
}
