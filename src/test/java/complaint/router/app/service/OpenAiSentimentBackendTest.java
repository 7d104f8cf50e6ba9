package complaint.router.app.service;

import com.theokanning.openai.completion.chat.ChatCompletionChoice;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import complaint.router.app.exception.TransientProviderException;
import complaint.router.app.model.SentimentInference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiSentimentBackendTest {

    @Mock
    private OpenAiService openAiService;

    private static ChatCompletionResult answer(String content) {
        ChatCompletionChoice choice = new ChatCompletionChoice();
        choice.setMessage(new ChatMessage("assistant", content));
        ChatCompletionResult result = new ChatCompletionResult();
        result.setChoices(List.of(choice));
        return result;
    }

    @Test
    void infer_ParsesLabelAndConfidence() {
        // given
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class))).thenReturn(answer(" NEGATIVE 0.87\n"));
        OpenAiSentimentBackend backend = new OpenAiSentimentBackend(openAiService, "gpt-3.5-turbo");

        // when
        SentimentInference inference = backend.infer("The service was awful");

        // then
        assertEquals("NEGATIVE", inference.getLabel());
        assertEquals(0.87, inference.getScore(), 1e-9);
        ArgumentCaptor<ChatCompletionRequest> request = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(openAiService).createChatCompletion(request.capture());
        assertEquals("gpt-3.5-turbo", request.getValue().getModel());
        assertTrue(request.getValue().getMessages().get(0).getContent().contains("The service was awful"));
    }

    @Test
    void infer_NetworkFailureIsTransient() {
        when(openAiService.createChatCompletion(any(ChatCompletionRequest.class)))
            .thenThrow(new RuntimeException("timeout"));
        OpenAiSentimentBackend backend = new OpenAiSentimentBackend(openAiService, "gpt-3.5-turbo");

        assertThrows(TransientProviderException.class, () -> backend.infer("text"));
    }

    @Test
    void parse_ToleratesPunctuationAndCase() {
        SentimentInference inference = OpenAiSentimentBackend.parse("negative, 1");

        assertEquals("NEGATIVE", inference.getLabel());
        assertEquals(1.0, inference.getScore(), 1e-9);
        assertEquals("POSITIVE", OpenAiSentimentBackend.parse("Positive: 0.6").getLabel());
    }

    @Test
    void parse_RejectsFreeText() {
        assertThrows(IllegalStateException.class, () -> OpenAiSentimentBackend.parse("I think it is angry"));
    }
}
