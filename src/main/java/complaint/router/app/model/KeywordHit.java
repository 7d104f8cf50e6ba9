package complaint.router.app.model;

import lombok.Value;

@Value
public class KeywordHit {
    String keyword;
    int tokenIndex;
    // 0 = suppressed by a nearby negation, 1 = unaffected
    double suppressionFactor;
    double multiplier;

    public double contribution() {
        return suppressionFactor * multiplier;
    }

    public boolean isSuppressed() {
        return suppressionFactor < 1.0;
    }
}
