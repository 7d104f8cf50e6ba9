package complaint.router.app.service;

import complaint.router.app.common.RetryPolicy;
import complaint.router.app.common.ShutdownSignal;
import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.exception.TransientProviderException;
import complaint.router.app.model.SentimentInference;
import complaint.router.app.model.SentimentScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * Wraps the sentiment backend with bounded retry and normalizes its answer to a negativity score.
 * When retries run out, either fails with {@link SentimentUnavailableException} or returns a neutral
 * fallback score, depending on {@code complaint.sentiment.fallback}.
 */
@Slf4j
@Service
public class SentimentAdapter {

    /**
     * The backend could not produce a score and fallback is disabled.
     */
    public static class SentimentUnavailableException extends RuntimeException {
        public SentimentUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final SentimentBackend backend;
    private final RetryPolicy retryPolicy;
    private final ShutdownSignal shutdownSignal;
    private final boolean fallback;
    private final double neutralScore;
    private final int maxInputChars;

    @Autowired
    public SentimentAdapter(SentimentBackend backend, ComplaintRouterProperties properties, ShutdownSignal shutdownSignal) {
        this(backend,
            new RetryPolicy(properties.getSentimentPipelineMaxRetries(),
                properties.getSentimentPipelineRetryDelay(),
                RetryPolicy.Backoff.parse(properties.getRetryBackoff())),
            shutdownSignal,
            properties.getSentiment().isFallback(),
            properties.getSentiment().getNeutralScore(),
            properties.getSentiment().getMaxInputChars());
    }

    public SentimentAdapter(SentimentBackend backend, RetryPolicy retryPolicy, ShutdownSignal shutdownSignal,
                            boolean fallback, double neutralScore, int maxInputChars) {
        this.backend = backend;
        this.retryPolicy = retryPolicy;
        this.shutdownSignal = shutdownSignal;
        this.fallback = fallback;
        this.neutralScore = neutralScore;
        this.maxInputChars = maxInputChars;
    }

    public SentimentScore score(String text) {
        String input = text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
        try {
            SentimentInference inference = retryPolicy.execute(
                "Sentiment inference (" + backend.name() + ")",
                () -> backend.infer(input),
                e -> e instanceof TransientProviderException,
                shutdownSignal::isShuttingDown);
            SentimentScore score = normalize(inference);
            log.debug("Sentiment {} -> {} ({})", inference.getLabel(), score.getScore(), backend.name());
            return score;
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (fallback) {
                log.warn("Sentiment unavailable, continuing on keyword signals alone: {}", e.getMessage());
                return SentimentScore.fallback(neutralScore);
            }
            throw new SentimentUnavailableException("Sentiment backend unavailable: " + e.getMessage(), e);
        }
    }

    /**
     * Maps the backend's top label to the probability that the text is negative.
     * The cardiffnlp labels LABEL_0/1/2 stand for negative/neutral/positive.
     */
    static SentimentScore normalize(SentimentInference inference) {
        String label = inference.getLabel() == null ? "" : inference.getLabel().trim().toUpperCase(Locale.ROOT);
        double probability = Math.max(0.0, Math.min(1.0, inference.getScore()));
        switch (label) {
            case "NEGATIVE":
            case "LABEL_0":
                return SentimentScore.of(probability, inference.getLabel());
            case "POSITIVE":
            case "LABEL_2":
                return SentimentScore.of(1.0 - probability, inference.getLabel());
            case "NEUTRAL":
            case "LABEL_1":
                return SentimentScore.of((1.0 - probability) / 2.0, inference.getLabel());
            default:
                throw new IllegalStateException("Unknown sentiment label: " + inference.getLabel());
        }
    }
}
