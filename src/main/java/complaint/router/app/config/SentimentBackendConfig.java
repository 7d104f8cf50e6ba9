package complaint.router.app.config;

import com.theokanning.openai.service.OpenAiService;
import complaint.router.app.service.HuggingFaceSentimentBackend;
import complaint.router.app.service.OpenAiSentimentBackend;
import complaint.router.app.service.SentimentBackend;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Configuration to switch between sentiment providers.
 * Set complaint.sentiment.provider=huggingface or complaint.sentiment.provider=openai in application.properties
 */
@Configuration
public class SentimentBackendConfig {

    @Bean
    @ConditionalOnProperty(name = "complaint.sentiment.provider", havingValue = "huggingface", matchIfMissing = true)
    public SentimentBackend huggingFaceSentimentBackend(ComplaintRouterProperties properties,
                                                        @Value("${complaint.sentiment.api-key:}") String apiKey) {
        ComplaintRouterProperties.Sentiment sentiment = properties.getSentiment();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) sentiment.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) sentiment.getTimeout().toMillis());
        return new HuggingFaceSentimentBackend(new RestTemplate(requestFactory), sentiment.getApiUrl(), sentiment.getModel(), apiKey);
    }

    @Bean
    @ConditionalOnProperty(name = "complaint.sentiment.provider", havingValue = "openai")
    public SentimentBackend openAiSentimentBackend(ComplaintRouterProperties properties,
                                                   @Value("${openai.api.key:}") String apiKey) {
        OpenAiService openAiService = new OpenAiService(apiKey, properties.getSentiment().getTimeout());
        return new OpenAiSentimentBackend(openAiService, properties.getSentiment().getModel());
    }
}
