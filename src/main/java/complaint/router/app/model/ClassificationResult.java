package complaint.router.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

@Value
@Builder
public class ClassificationResult {
    String messageId;
    double confidence;
    double keywordConfidence;
    boolean complaint;

    // set when an exclusion pattern matched; scoring was skipped
    String exclusionReason;

    @Builder.Default
    List<KeywordHit> bodyHits = List.of();
    @Builder.Default
    List<KeywordHit> subjectHits = List.of();
    @Builder.Default
    List<KeywordHit> urgencyHits = List.of();

    int negationHitCount;

    SentimentScore sentiment;
    double sentimentContribution;

    public static ClassificationResult excluded(String messageId, String reason) {
        return ClassificationResult.builder()
                .messageId(messageId)
                .complaint(false)
                .exclusionReason(reason)
                .build();
    }

    public boolean isExcluded() {
        return exclusionReason != null;
    }

    /**
     * Body and subject keywords that contributed to the score.
     */
    public Set<String> firedKeywords() {
        Set<String> fired = new LinkedHashSet<>();
        Stream.concat(bodyHits.stream(), subjectHits.stream())
                .filter(hit -> hit.contribution() > 0)
                .forEach(hit -> fired.add(hit.getKeyword()));
        return fired;
    }

    /**
     * Body keywords that matched but were dampened by a nearby negation.
     */
    public Set<String> weakKeywords() {
        Set<String> weak = new LinkedHashSet<>();
        bodyHits.stream()
                .filter(KeywordHit::isSuppressed)
                .forEach(hit -> weak.add(hit.getKeyword()));
        return weak;
    }
}
