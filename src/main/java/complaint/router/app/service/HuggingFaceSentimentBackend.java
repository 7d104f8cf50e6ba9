package complaint.router.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import complaint.router.app.exception.TransientProviderException;
import complaint.router.app.model.SentimentInference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.Map;

/**
 * Sentiment through a Hugging Face style inference endpoint ({@code POST <api-url><model>}).
 */
@Slf4j
public class HuggingFaceSentimentBackend implements SentimentBackend {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String apiKey;

    public HuggingFaceSentimentBackend(RestTemplate restTemplate, String apiUrl, String model, String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
        this.endpoint = apiUrl.endsWith("/") ? apiUrl + model : apiUrl + "/" + model;
        this.apiKey = apiKey;

        if (apiKey == null || apiKey.isEmpty() || apiKey.startsWith("${")) {
            log.warn("Sentiment API key not configured. Set complaint.sentiment.api-key or SENTIMENT_API_KEY.");
        }
    }

    @Override
    public SentimentInference infer(String text) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isEmpty()) {
            headers.setBearerAuth(apiKey);
        }
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(Map.of("inputs", text), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(endpoint, request, String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            // 503 is returned while the model is loading
            if (status == 429 || status >= 500) {
                throw new TransientProviderException("Sentiment backend returned " + status, e);
            }
            throw new IllegalStateException("Sentiment backend rejected the request: " + status + " - "
                    + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransientProviderException("Sentiment backend unreachable: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new TransientProviderException("Sentiment backend error: " + response.getStatusCode());
        }
        return parse(response.getBody());
    }

    @Override
    public String name() {
        return "huggingface";
    }

    /**
     * Accepts both {@code [{label,score},...]} and the nested {@code [[{label,score},...]]} form and
     * returns the highest scoring label.
     */
    SentimentInference parse(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode candidates = root.isArray() && root.size() > 0 && root.get(0).isArray() ? root.get(0) : root;
            if (!candidates.isArray() || candidates.size() == 0) {
                throw new IllegalStateException("Unexpected sentiment response format: " + body);
            }
            JsonNode best = null;
            for (JsonNode candidate : candidates) {
                if (best == null || candidate.path("score").asDouble() > best.path("score").asDouble()) {
                    best = candidate;
                }
            }
            return new SentimentInference(best.path("label").asText(), best.path("score").asDouble());
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable sentiment response: " + body, e);
        }
    }
}
