package complaint.router.app.model;

/**
 * How the sentiment score takes part in the final decision.
 */
public enum SentimentCombination {
    /** Keyword confidence decides outside the gate band; sentiment decides inside it. */
    GATE,
    /** A qualifying sentiment score is added to keyword confidence, scaled by the sentiment weight. */
    ADDITIVE
}
