package complaint.router.app.service;

import complaint.router.app.model.SentimentInference;

/**
 * Remote sentiment model. Implementations make a single call and never retry; retries belong to
 * {@link SentimentAdapter}.
 */
public interface SentimentBackend {
    /**
     * @param text cleaned message text
     * @return the top label with its probability
     * @throws complaint.router.app.exception.TransientProviderException if the backend is unreachable,
     *         rate limited or still loading the model
     */
    SentimentInference infer(String text);

    String name();
}
