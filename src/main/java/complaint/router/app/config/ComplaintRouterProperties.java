package complaint.router.app.config;

import complaint.router.app.exception.ConfigurationException;
import complaint.router.app.model.SentimentCombination;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "complaint")
public class ComplaintRouterProperties {

    private List<String> monitoredMailboxes = new ArrayList<>();
    private String distributionListEmail;

    private double keywordThreshold = 0.6;
    private double sentimentThreshold = 0.7;

    // Raw hit count that maps to a fully saturated keyword signal
    private double normalizationCap = 3.0;

    private SentimentCombination sentimentCombination = SentimentCombination.GATE;
    // Half-width of the band around keyword-threshold in which sentiment decides (GATE only)
    private double gateBand = 0.1;

    private Weights weights = new Weights();
    private Exclusions exclusions = new Exclusions();
    private ContextualCheck contextualCheck = new ContextualCheck();
    private SchedulingIntervals schedulingIntervals = new SchedulingIntervals();
    private EmailFilter emailFilter = new EmailFilter();
    private KeywordFiles keywordFiles = new KeywordFiles();
    private Feedback feedback = new Feedback();
    private Sentiment sentiment = new Sentiment();
    private Gmail gmail = new Gmail();

    // Mail provider calls
    private int maxRetries = 3;
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration retryDelay = Duration.ofSeconds(5);

    // Sentiment backend calls
    private int sentimentPipelineMaxRetries = 3;
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration sentimentPipelineRetryDelay = Duration.ofSeconds(5);

    private String retryBackoff = "FIXED";

    // Overall time allowed for one mailbox pass before the remaining messages are deferred
    private Duration batchDeadline = Duration.ofMinutes(2);

    private int topEmails = 50;
    private boolean deleteOriginal = false;

    private String deltaTokenPath = ".";
    private String deltaTokenFile = "delta_tokens.json";

    @Data
    public static class Weights {
        private double bodyKeyword = 0.3;
        private double subjectKeyword = 0.2;
        private double urgency = 0.1;
        private double negation = -0.5;
        private double sentiment = 0.4;
    }

    @Data
    public static class Exclusions {
        private List<String> from = new ArrayList<>();
        private List<String> subject = new ArrayList<>();
    }

    @Data
    public static class ContextualCheck {
        private boolean useContextualCheck = true;
        private double contextualScoreThreshold = 0.0;
        private int negationProximity = 3;
        private List<String> negativeWords = new ArrayList<>();
    }

    @Data
    public static class SchedulingIntervals {
        private Duration mainLoop = Duration.ofSeconds(30);
        private Duration fpFeedbackLoop = Duration.ofMinutes(2);
        private Duration fnFeedbackLoop = Duration.ofMinutes(2);
        private Duration keywordReload = Duration.ofSeconds(30);
    }

    @Data
    public static class EmailFilter {
        private String fromDomain = "";
        // ISO date (2024-01-01) or instant (2024-01-01T00:00:00Z)
        private String startDate = "";
        private String subjectContains = "";
    }

    @Data
    public static class KeywordFiles {
        private String complaint = "classpath:keywords/complaint_keywords.txt";
        private String subject = "classpath:keywords/subject_keywords.txt";
        private String urgency = "classpath:keywords/urgency_keywords.txt";
        private String negation = "classpath:keywords/negation_keywords.txt";
    }

    @Data
    public static class Feedback {
        private double step = 0.1;
        private double weightFloor = 0.2;
        private double weightCeiling = 2.0;
        private boolean scanMailboxes = true;
        private int maxCandidatesPerMessage = 3;
    }

    @Data
    public static class Sentiment {
        private boolean enabled = true;
        private boolean fallback = true;
        // score reported when the backend is unavailable and fallback is on
        private double neutralScore = 0.0;
        private String provider = "huggingface";
        private String model = "cardiffnlp/twitter-roberta-base-sentiment";
        private String apiUrl = "https://api-inference.huggingface.co/models/";
        private Duration timeout = Duration.ofSeconds(20);
        private int maxInputChars = 2000;
    }

    @Data
    public static class Gmail {
        private String applicationName = "Complaint Router";
        private Map<String, String> refreshTokens = new HashMap<>();
        private Duration timeout = Duration.ofSeconds(30);
    }

    /**
     * Fails fast on configuration the classifier cannot run with.
     */
    public void validate() {
        if (monitoredMailboxes == null || monitoredMailboxes.isEmpty()) {
            throw new ConfigurationException("complaint.monitored-mailboxes must list at least one mailbox");
        }
        if (distributionListEmail == null || distributionListEmail.isBlank()) {
            throw new ConfigurationException("complaint.distribution-list-email is not configured");
        }
        requireFinite("complaint.keyword-threshold", keywordThreshold);
        requireFinite("complaint.sentiment-threshold", sentimentThreshold);
        requireFinite("complaint.gate-band", gateBand);
        requireFinite("complaint.weights.body-keyword", weights.getBodyKeyword());
        requireFinite("complaint.weights.subject-keyword", weights.getSubjectKeyword());
        requireFinite("complaint.weights.urgency", weights.getUrgency());
        requireFinite("complaint.weights.negation", weights.getNegation());
        requireFinite("complaint.weights.sentiment", weights.getSentiment());
        requireFinite("complaint.contextual-check.contextual-score-threshold",
                contextualCheck.getContextualScoreThreshold());

        if (weights.getNegation() > 0) {
            throw new ConfigurationException("complaint.weights.negation must not be positive, was " + weights.getNegation());
        }
        if (weights.getUrgency() < 0) {
            throw new ConfigurationException("complaint.weights.urgency must not be negative, was " + weights.getUrgency());
        }
        if (!(normalizationCap > 0) || Double.isInfinite(normalizationCap)) {
            throw new ConfigurationException("complaint.normalization-cap must be a positive number, was " + normalizationCap);
        }
        if (gateBand < 0) {
            throw new ConfigurationException("complaint.gate-band must not be negative, was " + gateBand);
        }
        if (contextualCheck.getNegationProximity() < 0) {
            throw new ConfigurationException("complaint.contextual-check.negation-proximity must not be negative");
        }
        if (maxRetries < 1 || sentimentPipelineMaxRetries < 1) {
            throw new ConfigurationException("retry attempt counts must be at least 1");
        }
        if (feedback.getWeightFloor() > feedback.getWeightCeiling()) {
            throw new ConfigurationException("complaint.feedback.weight-floor exceeds weight-ceiling");
        }
        if (topEmails < 1) {
            throw new ConfigurationException("complaint.top-emails must be at least 1");
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new ConfigurationException(name + " must be a finite number, was " + value);
        }
    }
}
