package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.entity.KeywordAdjustment;
import complaint.router.app.model.ScoringWeights;
import complaint.router.app.repository.KeywordAdjustmentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Publishes the active {@link ScoringWeights}: the validated configuration plus the per-keyword
 * multipliers learned by the feedback loops. Updates are serialized and swap in a new snapshot.
 */
@Slf4j
@Service
public class ScoringWeightsService {
    private final KeywordAdjustmentRepository adjustmentRepository;
    private final ScoringWeights base;
    private final double floor;
    private final double ceiling;
    private final AtomicReference<ScoringWeights> snapshot = new AtomicReference<>();

    public ScoringWeightsService(ComplaintRouterProperties properties, KeywordAdjustmentRepository adjustmentRepository) {
        properties.validate();
        this.adjustmentRepository = adjustmentRepository;
        this.base = fromProperties(properties);
        this.floor = properties.getFeedback().getWeightFloor();
        this.ceiling = properties.getFeedback().getWeightCeiling();

        Map<String, Double> learned = adjustmentRepository.findByCandidateFalse().stream()
            .collect(Collectors.toMap(KeywordAdjustment::getKeyword, a -> clamp(a.getMultiplier())));
        snapshot.set(base.toBuilder().keywordMultipliers(Map.copyOf(learned)).build());
        log.info("Scoring weights ready: threshold={}, combination={}, {} learned keyword multipliers",
            base.getKeywordThreshold(), base.getCombination(), learned.size());
    }

    public ScoringWeights current() {
        return snapshot.get();
    }

    /**
     * Adds {@code delta} to the multiplier of each keyword, clamped to the configured floor and ceiling,
     * persists the result and publishes a new snapshot.
     *
     * @return number of keywords whose multiplier changed
     */
    public synchronized int adjust(Set<String> keywords, double delta) {
        if (keywords.isEmpty()) {
            return 0;
        }
        Map<String, Double> multipliers = new HashMap<>(snapshot.get().getKeywordMultipliers());
        int changed = 0;
        for (String keyword : keywords) {
            KeywordAdjustment adjustment = adjustmentRepository.findById(keyword).orElseGet(() -> {
                KeywordAdjustment created = new KeywordAdjustment();
                created.setKeyword(keyword);
                return created;
            });
            double oldMultiplier = adjustment.getMultiplier();
            double newMultiplier = Math.round(clamp(oldMultiplier + delta) * 1000.0) / 1000.0;

            adjustment.setSignalCount(adjustment.getSignalCount() + 1);
            adjustment.setCandidate(false);
            adjustment.setUpdatedAt(Instant.now());
            adjustment.setMultiplier(newMultiplier);
            adjustmentRepository.save(adjustment);
            multipliers.put(keyword, newMultiplier);

            if (Math.abs(newMultiplier - oldMultiplier) >= 0.001) {
                log.info("Keyword '{}' multiplier adjusted: {} -> {}", keyword, oldMultiplier, newMultiplier);
                changed++;
            } else {
                log.debug("Keyword '{}' multiplier held at bound {}", keyword, newMultiplier);
            }
        }
        snapshot.set(snapshot.get().toBuilder().keywordMultipliers(Map.copyOf(multipliers)).build());
        return changed;
    }

    /**
     * Records a term as a proposed complaint keyword. Candidates do not affect scoring.
     */
    public synchronized void proposeCandidate(String term) {
        KeywordAdjustment adjustment = adjustmentRepository.findById(term).orElseGet(() -> {
            KeywordAdjustment created = new KeywordAdjustment();
            created.setKeyword(term);
            created.setCandidate(true);
            return created;
        });
        if (!adjustment.isCandidate()) {
            return;
        }
        adjustment.setSignalCount(adjustment.getSignalCount() + 1);
        adjustment.setUpdatedAt(Instant.now());
        adjustmentRepository.save(adjustment);
        log.info("Proposed keyword candidate '{}' (seen {} times)", term, adjustment.getSignalCount());
    }

    public List<KeywordAdjustment> candidates() {
        return adjustmentRepository.findByCandidateTrueOrderBySignalCountDesc();
    }

    private double clamp(double multiplier) {
        return Math.max(floor, Math.min(ceiling, multiplier));
    }

    static ScoringWeights fromProperties(ComplaintRouterProperties properties) {
        ComplaintRouterProperties.Weights weights = properties.getWeights();
        ComplaintRouterProperties.ContextualCheck contextual = properties.getContextualCheck();
        return ScoringWeights.builder()
            .bodyKeyword(weights.getBodyKeyword())
            .subjectKeyword(weights.getSubjectKeyword())
            .urgency(weights.getUrgency())
            .negation(weights.getNegation())
            .sentiment(weights.getSentiment())
            .keywordThreshold(properties.getKeywordThreshold())
            .sentimentThreshold(properties.getSentimentThreshold())
            .normalizationCap(properties.getNormalizationCap())
            .combination(properties.getSentimentCombination())
            .gateBand(properties.getGateBand())
            .contextualCheck(ScoringWeights.ContextualCheck.builder()
                .enabled(contextual.isUseContextualCheck())
                .proximity(contextual.getNegationProximity())
                .scoreThreshold(contextual.getContextualScoreThreshold())
                .negativeWords(Set.copyOf(contextual.getNegativeWords()))
                .build())
            .build();
    }
}
