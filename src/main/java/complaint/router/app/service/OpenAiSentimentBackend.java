package complaint.router.app.service;

import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import complaint.router.app.exception.TransientProviderException;
import complaint.router.app.model.SentimentInference;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentiment through an OpenAI chat model asked for a label and a probability.
 */
@Slf4j
public class OpenAiSentimentBackend implements SentimentBackend {
    private static final Pattern ANSWER = Pattern.compile("(NEGATIVE|NEUTRAL|POSITIVE)\\s*[,;:]?\\s*([01](?:\\.\\d+)?)");

    private final OpenAiService openAiService;
    private final String model;

    public OpenAiSentimentBackend(OpenAiService openAiService, String model) {
        this.openAiService = openAiService;
        this.model = model;
    }

    @Override
    public SentimentInference infer(String text) {
        String prompt = String.format(
            "Classify the sentiment of the following customer email as NEGATIVE, NEUTRAL or POSITIVE. " +
            "Respond with ONLY the label followed by your confidence between 0 and 1, for example: NEGATIVE 0.87\n\n%s",
            text
        );
        ChatCompletionRequest request = ChatCompletionRequest.builder()
            .model(model)
            .messages(List.of(new ChatMessage("user", prompt)))
            .maxTokens(10)
            .temperature(0.0)
            .build();

        String answer;
        try {
            answer = openAiService.createChatCompletion(request)
                .getChoices().get(0).getMessage().getContent().trim();
        } catch (OpenAiHttpException e) {
            if (e.statusCode == 429 || e.statusCode >= 500) {
                throw new TransientProviderException("OpenAI returned " + e.statusCode + ": " + e.getMessage(), e);
            }
            throw new IllegalStateException("OpenAI rejected the sentiment request: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // retrofit surfaces timeouts and connection resets as plain runtime exceptions
            throw new TransientProviderException("OpenAI call failed: " + e.getMessage(), e);
        }
        return parse(answer);
    }

    @Override
    public String name() {
        return "openai";
    }

    static SentimentInference parse(String answer) {
        Matcher matcher = ANSWER.matcher(answer.toUpperCase(Locale.ROOT));
        if (!matcher.find()) {
            throw new IllegalStateException("Unexpected sentiment answer: " + answer);
        }
        return new SentimentInference(matcher.group(1), Double.parseDouble(matcher.group(2)));
    }
}
