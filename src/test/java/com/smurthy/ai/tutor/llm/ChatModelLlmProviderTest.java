package com.smurthy.ai.tutor.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatModelLlmProviderTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final ChatModelLlmProvider provider = new ChatModelLlmProvider("openai", chatModel);

    @Test
    @DisplayName("Should return the completion with the prompt and completion token counts")
    void readsTokenUsage() {
        // Given
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(
                List.of(new Generation(new AssistantMessage("A half is one of two equal parts"))),
                ChatResponseMetadata.builder().usage(new DefaultUsage(42, 17)).build()));

        // When
        ProviderReply reply = provider.complete(LlmPrompt.of("system", "What is a half?"), CompletionOptions.CONTENT_GENERATION);

        // Then
        assertThat(reply.text()).isEqualTo("A half is one of two equal parts");
        assertThat(reply.usage()).isEqualTo(new TokenUsage(42, 17));
    }

    @Test
    @DisplayName("Should report an empty completion as an invalid response")
    void emptyCompletionIsInvalid() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(
                List.of(new Generation(new AssistantMessage("")))));

        assertThatThrownBy(() -> provider.complete(LlmPrompt.of("system", "What is a half?"), CompletionOptions.SOLVING))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).kind())
                .isEqualTo(ProviderErrorKind.INVALID_RESPONSE);
    }
}
