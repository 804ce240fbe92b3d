package com.smurthy.ai.tutor.agents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.tutor.llm.Completion;
import com.smurthy.ai.tutor.llm.CompletionOptions;
import com.smurthy.ai.tutor.llm.LlmClient;
import com.smurthy.ai.tutor.llm.LlmPrompt;
import com.smurthy.ai.tutor.llm.ProviderErrorKind;
import com.smurthy.ai.tutor.llm.ProviderException;
import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.ClassificationResult;
import com.smurthy.ai.tutor.model.Intent;
import com.smurthy.ai.tutor.model.Provenance;
import com.smurthy.ai.tutor.model.QuizQuestion;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.model.TutorQuery;
import com.smurthy.ai.tutor.retrieval.RetrievedContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the practice quiz the content agent writes on request.
 */
@ExtendWith(MockitoExtension.class)
class ContentAgentTest {

    private static final String LESSON = "A fraction names a part of a whole [frac-1].";

    @Mock
    private LlmClient llmClient;

    private ContentAgent agent;

    @BeforeEach
    void setUp() {
        agent = new ContentAgent(llmClient, new ObjectMapper());
    }

    @Test
    @DisplayName("Should attach a structured quiz when the student asks for practice questions")
    void generatesQuizOnRequest() {
        // Given
        ArgumentCaptor<LlmPrompt> quizPrompt = ArgumentCaptor.forClass(LlmPrompt.class);
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.CONTENT_GENERATION)))
                .thenReturn(new Completion(LESSON, "lapa", 0, 1, 20));
        when(llmClient.complete(quizPrompt.capture(), eq(CompletionOptions.QUIZ_GENERATION)))
                .thenReturn(new Completion("""
                        ```json
                        [
                          {"question": "What is 1/2 + 1/4?", "type": "multiple_choice",
                           "options": ["3/4", "2/6", "1/8"], "correct_answer": "3/4", "difficulty": "easy"},
                          {"question": "Simplify 6/8", "type": "short_answer", "correct_answer": "3/4",
                           "topic_id": "fractions"}
                        ]
                        ```
                        """, "lapa", 0, 1, 15));

        // When
        AgentResponse response = agent.execute(request("Explain fractions and give me a quiz"));

        // Then
        assertThat(response.provenance()).isEqualTo(Provenance.GENERATED);
        assertThat(response.payload().text()).isEqualTo(LESSON);
        assertThat(response.payload().quiz()).hasSize(2);
        QuizQuestion first = response.payload().quiz().get(0);
        assertThat(first.options()).containsExactly("3/4", "2/6", "1/8");
        assertThat(first.correctAnswer()).isEqualTo("3/4");
        assertThat(first.difficulty()).isEqualTo("easy");
        assertThat(response.payload().quiz().get(1).options()).isEmpty();
        assertThat(quizPrompt.getValue().user()).contains(LESSON).contains("grade 7");
        assertThat(quizPrompt.getValue().tenantId()).isEqualTo("school-7");
    }

    @Test
    @DisplayName("Should keep a quiz that is not JSON as one text question")
    void keepsUnparseableQuizAsText() {
        // Given
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.CONTENT_GENERATION)))
                .thenReturn(new Completion(LESSON, "lapa", 0, 1, 20));
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.QUIZ_GENERATION)))
                .thenReturn(new Completion("1. What is 1/2 of 10?\n2. Name the numerator in 3/5.", "lapa", 0, 1, 15));

        // When
        AgentResponse response = agent.execute(request("Дай мені вправи на дроби"));

        // Then
        assertThat(response.payload().quiz()).containsExactly(
                QuizQuestion.rawText("1. What is 1/2 of 10?\n2. Name the numerator in 3/5."));
        assertThat(response.payload().quiz().get(0).type()).isEqualTo(QuizQuestion.TEXT_TYPE);
    }

    @Test
    @DisplayName("Should return the lesson without a quiz, degraded, when the quiz completion fails")
    void failedQuizKeepsLesson() {
        // Given
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.CONTENT_GENERATION)))
                .thenReturn(new Completion(LESSON, "lapa", 0, 1, 20));
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.QUIZ_GENERATION)))
                .thenThrow(new ProviderException(ProviderErrorKind.UNAVAILABLE, "anthropic", "All providers failed"));

        // When
        AgentResponse response = agent.execute(request("Practice questions on fractions please"));

        // Then
        assertThat(response.payload().text()).isEqualTo(LESSON);
        assertThat(response.payload().quiz()).isEmpty();
        assertThat(response.provenance()).isEqualTo(Provenance.FALLBACK_DEGRADED);
    }

    @Test
    @DisplayName("Should mark the response degraded when only the quiz came from a fallback provider")
    void fallbackQuizDegrades() {
        // Given
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.CONTENT_GENERATION)))
                .thenReturn(new Completion(LESSON, "lapa", 0, 1, 20));
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.QUIZ_GENERATION)))
                .thenReturn(new Completion("[{\"question\": \"What is 2/4 simplified?\"}]", "openai", 1, 3, 40));

        // When
        AgentResponse response = agent.execute(request("Quiz me on fractions"));

        // Then
        assertThat(response.payload().quiz()).extracting(QuizQuestion::question)
                .containsExactly("What is 2/4 simplified?");
        assertThat(response.provenance()).isEqualTo(Provenance.FALLBACK_DEGRADED);
    }

    @Test
    @DisplayName("Should make a single completion when no practice questions were asked for")
    void noQuizWithoutRequest() {
        // Given
        when(llmClient.complete(any(LlmPrompt.class), eq(CompletionOptions.CONTENT_GENERATION)))
                .thenReturn(new Completion(LESSON, "lapa", 0, 1, 20));

        // When
        AgentResponse response = agent.execute(request("What is a fraction?"));

        // Then
        assertThat(response.payload().quiz()).isEmpty();
        verify(llmClient, never()).complete(any(LlmPrompt.class), eq(CompletionOptions.QUIZ_GENERATION));
    }

    @Test
    @DisplayName("Should read a single question object as a one-question quiz")
    void parsesSingleQuestionObject() {
        List<QuizQuestion> quiz = agent.parseQuiz("{\"question\": \"Is 3/3 equal to 1?\", \"correct_answer\": \"yes\"}");

        assertThat(quiz).hasSize(1);
        assertThat(quiz.get(0).correctAnswer()).isEqualTo("yes");
    }

    private static SpecialistRequest request(String text) {
        return new SpecialistRequest(TutorQuery.of("school-7", text), StudentProfile.of(7, "mathematics"),
                ClassificationResult.of(Intent.EXPLAIN, 1.0, "test"), RetrievedContext.empty(), List.of());
    }
}
