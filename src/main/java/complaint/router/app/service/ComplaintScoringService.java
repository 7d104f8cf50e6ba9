package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.model.ClassificationResult;
import complaint.router.app.model.InboundMessage;
import complaint.router.app.model.KeywordCategory;
import complaint.router.app.model.KeywordHit;
import complaint.router.app.model.KeywordSet;
import complaint.router.app.model.ScoringWeights;
import complaint.router.app.model.SentimentCombination;
import complaint.router.app.model.SentimentScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Combines keyword, urgency, negation and sentiment signals into one confidence value and a
 * complaint decision.
 *
 * <p>Keyword confidence is
 * {@code body * n(bodyHits) + subject * n(subjectHits) + urgency * n(urgencyHits) + negation * negatedHits},
 * floored at 0, where {@code n} saturates a weighted hit count at the normalization cap.
 * With {@link SentimentCombination#GATE} the keyword score decides on its own outside
 * {@code threshold +/- gateBand} and sentiment decides inside it. With {@link SentimentCombination#ADDITIVE}
 * a sentiment score at or above the sentiment threshold adds {@code sentimentWeight * score}.
 */
@Slf4j
@Service
public class ComplaintScoringService {
    private final ExclusionFilter exclusionFilter;
    private final SentimentAdapter sentimentAdapter;
    private final boolean sentimentEnabled;

    @Autowired
    public ComplaintScoringService(ExclusionFilter exclusionFilter, SentimentAdapter sentimentAdapter,
                                   ComplaintRouterProperties properties) {
        this(exclusionFilter, sentimentAdapter, properties.getSentiment().isEnabled());
    }

    public ComplaintScoringService(ExclusionFilter exclusionFilter, SentimentAdapter sentimentAdapter,
                                   boolean sentimentEnabled) {
        this.exclusionFilter = exclusionFilter;
        this.sentimentAdapter = sentimentAdapter;
        this.sentimentEnabled = sentimentEnabled && sentimentAdapter != null;
    }

    /**
     * @throws SentimentAdapter.SentimentUnavailableException if sentiment is enabled, the backend is down
     *         and fallback is disabled
     */
    public ClassificationResult classify(InboundMessage message, KeywordSet keywords, ScoringWeights weights) {
        Optional<String> exclusion = exclusionFilter.match(message);
        if (exclusion.isPresent()) {
            log.info("Excluded message {}: {}", message.getId(), exclusion.get());
            return ClassificationResult.excluded(message.getId(), exclusion.get());
        }

        List<String> bodyTokens = TextTokenizer.tokenize(message.getBody());
        List<String> subjectTokens = TextTokenizer.tokenize(message.getSubject());

        ScoringWeights.ContextualCheck contextual = weights.getContextualCheck();
        Set<String> suppressing = suppressingWords(keywords, contextual);

        List<KeywordHit> bodyHits = new ArrayList<>();
        int negationHitCount = 0;
        for (List<String> phrase : keywords.phrases(KeywordCategory.COMPLAINT)) {
            String keyword = String.join(" ", phrase);
            for (int index : occurrences(bodyTokens, phrase)) {
                double factor = ContextualNegationChecker.check(
                    bodyTokens, index, phrase.size(), contextual.getProximity(), suppressing);
                if (factor < 1.0) {
                    negationHitCount++;
                }
                double applied = 1.0;
                if (contextual.isEnabled()) {
                    applied = factor < contextual.getScoreThreshold() ? 0.0 : factor;
                }
                bodyHits.add(new KeywordHit(keyword, index, applied, weights.multiplierFor(keyword)));
            }
        }

        List<KeywordHit> subjectHits = collectHits(subjectTokens, keywords.phrases(KeywordCategory.SUBJECT), weights);
        // urgency amplifies and is never dampened
        List<KeywordHit> urgencyHits = collectHits(bodyTokens, keywords.phrases(KeywordCategory.URGENCY), weights);
        urgencyHits.addAll(collectHits(subjectTokens, keywords.phrases(KeywordCategory.URGENCY), weights));

        double keywordConfidence = 0.0;
        if (bodyTokens.isEmpty()) {
            // keywords contribute nothing without a body; the subject only feeds sentiment
            subjectHits.clear();
            urgencyHits.clear();
        } else {
            double cap = weights.getNormalizationCap();
            keywordConfidence = weights.getBodyKeyword() * normalize(bodyHits, cap)
                + weights.getSubjectKeyword() * normalize(subjectHits, cap)
                + weights.getUrgency() * normalize(urgencyHits, cap)
                + weights.getNegation() * negationHitCount;
            keywordConfidence = Math.max(0.0, keywordConfidence);
        }

        SentimentScore sentiment = null;
        if (sentimentEnabled) {
            String text = bodyTokens.isEmpty() ? TextTokenizer.clean(message.getSubject()) : TextTokenizer.clean(message.getBody());
            if (!text.isEmpty()) {
                sentiment = sentimentAdapter.score(text);
            }
        }
        boolean sentimentAvailable = sentiment != null && !sentiment.isFallback();
        boolean sentimentQualifies = sentimentAvailable && sentiment.getScore() >= weights.getSentimentThreshold();

        double sentimentContribution = 0.0;
        if (weights.getCombination() == SentimentCombination.ADDITIVE && sentimentQualifies) {
            sentimentContribution = weights.getSentiment() * sentiment.getScore();
        }
        double confidence = keywordConfidence + sentimentContribution;

        boolean complaint;
        if (bodyTokens.isEmpty()) {
            complaint = sentimentQualifies || confidence >= weights.getKeywordThreshold();
        } else if (weights.getCombination() == SentimentCombination.ADDITIVE || !sentimentAvailable) {
            complaint = confidence >= weights.getKeywordThreshold();
        } else {
            complaint = gate(keywordConfidence, sentimentQualifies, weights);
        }

        ClassificationResult result = ClassificationResult.builder()
            .messageId(message.getId())
            .confidence(confidence)
            .keywordConfidence(keywordConfidence)
            .complaint(complaint)
            .bodyHits(List.copyOf(bodyHits))
            .subjectHits(List.copyOf(subjectHits))
            .urgencyHits(List.copyOf(urgencyHits))
            .negationHitCount(negationHitCount)
            .sentiment(sentiment)
            .sentimentContribution(sentimentContribution)
            .build();
        log.debug("Scored message {}: confidence={} keywords={} negated={} sentiment={} complaint={}",
            message.getId(), confidence, result.firedKeywords(), negationHitCount,
            sentiment == null ? "n/a" : sentiment.getScore(), complaint);
        return result;
    }

    private boolean gate(double keywordConfidence, boolean sentimentQualifies, ScoringWeights weights) {
        double threshold = weights.getKeywordThreshold();
        double band = weights.getGateBand();
        if (keywordConfidence >= threshold + band) {
            return true;
        }
        if (keywordConfidence < threshold - band) {
            return false;
        }
        return sentimentQualifies;
    }

    private List<KeywordHit> collectHits(List<String> tokens, List<List<String>> phrases, ScoringWeights weights) {
        List<KeywordHit> hits = new ArrayList<>();
        for (List<String> phrase : phrases) {
            String keyword = String.join(" ", phrase);
            for (int index : occurrences(tokens, phrase)) {
                hits.add(new KeywordHit(keyword, index, 1.0, weights.multiplierFor(keyword)));
            }
        }
        return hits;
    }

    static List<Integer> occurrences(List<String> tokens, List<String> phrase) {
        List<Integer> found = new ArrayList<>();
        int last = tokens.size() - phrase.size();
        for (int i = 0; i <= last; i++) {
            boolean match = true;
            for (int j = 0; j < phrase.size(); j++) {
                if (!tokens.get(i + j).equals(phrase.get(j))) {
                    match = false;
                    break;
                }
            }
            if (match) {
                found.add(i);
            }
        }
        return found;
    }

    static double normalize(List<KeywordHit> hits, double cap) {
        double total = 0.0;
        for (KeywordHit hit : hits) {
            total += hit.contribution();
        }
        return Math.min(total, cap) / cap;
    }

    private static Set<String> suppressingWords(KeywordSet keywords, ScoringWeights.ContextualCheck contextual) {
        Set<String> words = new HashSet<>(keywords.terms(KeywordCategory.NEGATION));
        for (String word : contextual.getNegativeWords()) {
            String normalized = TextTokenizer.normalizeTerm(word);
            if (!normalized.isEmpty()) {
                words.add(normalized);
            }
        }
        return words;
    }
}
