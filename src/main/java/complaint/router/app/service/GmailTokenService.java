package complaint.router.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.exception.ConfigurationException;
import complaint.router.app.exception.TransientProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exchanges each monitored mailbox's refresh token for an access token and caches it until
 * shortly before expiry.
 */
@Slf4j
@Service
public class GmailTokenService {
    private static final String TOKEN_URL = "https://oauth2.googleapis.com/token";
    private static final long EXPIRY_MARGIN_SECONDS = 300;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Map<String, String> refreshTokens;
    private final Map<String, CachedToken> cache = new ConcurrentHashMap<>();

    @Value("${complaint.gmail.client-id:}")
    private String clientId;

    @Value("${complaint.gmail.client-secret:}")
    private String clientSecret;

    @Autowired
    public GmailTokenService(ComplaintRouterProperties properties) {
        this(new RestTemplate(), properties.getGmail().getRefreshTokens());
    }

    GmailTokenService(RestTemplate restTemplate, Map<String, String> refreshTokens) {
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
        this.refreshTokens = refreshTokens;
    }

    /**
     * Returns a valid access token for the mailbox, refreshing it when expired or about to expire.
     */
    public String accessToken(String mailboxId) {
        CachedToken cached = cache.get(mailboxId);
        if (cached != null && cached.expiry.isAfter(Instant.now().plusSeconds(EXPIRY_MARGIN_SECONDS))) {
            return cached.accessToken;
        }
        CachedToken refreshed = refresh(mailboxId);
        cache.put(mailboxId, refreshed);
        return refreshed.accessToken;
    }

    /**
     * Drops the cached token after the provider answered 401.
     */
    public void invalidate(String mailboxId) {
        if (cache.remove(mailboxId) != null) {
            log.info("Access token for {} invalidated", mailboxId);
        }
    }

    private void validateClientCredentials() {
        if (clientId == null || clientId.isEmpty() || clientId.startsWith("${")) {
            throw new ConfigurationException("Gmail OAuth client-id is not configured. Please set complaint.gmail.client-id");
        }
        if (clientSecret == null || clientSecret.isEmpty() || clientSecret.startsWith("${")) {
            throw new ConfigurationException("Gmail OAuth client-secret is not configured. Please set complaint.gmail.client-secret");
        }
    }

    private CachedToken refresh(String mailboxId) {
        validateClientCredentials();
        String refreshToken = refreshTokens.get(mailboxId);
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw new ConfigurationException("No refresh token configured for mailbox " + mailboxId
                + ". Set complaint.gmail.refresh-tokens." + mailboxId);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(TOKEN_URL, new HttpEntity<>(body, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new TransientProviderException("Token refresh failed for " + mailboxId + ". Status: " + response.getStatusCode());
            }
            JsonNode json = objectMapper.readTree(response.getBody());
            if (!json.has("access_token")) {
                throw new IllegalStateException("Token refresh response missing access_token for " + mailboxId);
            }
            long expiresIn = json.has("expires_in") ? json.get("expires_in").asLong() : 3600;
            Instant expiry = Instant.now().plusSeconds(expiresIn);
            log.info("Access token refreshed for {}, expires at {}", mailboxId, expiry);
            return new CachedToken(json.get("access_token").asText(), expiry);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 429 || e.getStatusCode().is5xxServerError()) {
                throw new TransientProviderException("Token endpoint returned " + e.getStatusCode() + " for " + mailboxId, e);
            }
            throw new IllegalStateException("Token refresh rejected for " + mailboxId + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransientProviderException("Token endpoint unreachable: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable token response for " + mailboxId, e);
        }
    }

    private static final class CachedToken {
        private final String accessToken;
        private final Instant expiry;

        private CachedToken(String accessToken, Instant expiry) {
            this.accessToken = accessToken;
            this.expiry = expiry;
        }
    }
}
