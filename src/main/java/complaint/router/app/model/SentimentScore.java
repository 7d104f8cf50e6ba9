package complaint.router.app.model;

import lombok.Value;

/**
 * Normalized sentiment result. {@code score} is the probability that the text is negative, in [0,1].
 */
@Value
public class SentimentScore {
    public static final String UNAVAILABLE_LABEL = "UNAVAILABLE";

    double score;
    String rawLabel;
    boolean fallback;

    public static SentimentScore of(double score, String rawLabel) {
        return new SentimentScore(score, rawLabel, false);
    }

    public static SentimentScore fallback(double neutralScore) {
        return new SentimentScore(neutralScore, UNAVAILABLE_LABEL, true);
    }
}
