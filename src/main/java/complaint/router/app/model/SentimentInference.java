package complaint.router.app.model;

import lombok.Value;

/**
 * Raw answer of a sentiment backend: the top label and its probability.
 */
@Value
public class SentimentInference {
    String label;
    double score;
}
