package com.smurthy.ai.tutor.controllers;

import com.smurthy.ai.tutor.model.AgentResponse;
import com.smurthy.ai.tutor.model.Provenance;
import com.smurthy.ai.tutor.model.QuizQuestion;
import com.smurthy.ai.tutor.model.ResponsePayload;
import com.smurthy.ai.tutor.model.SpecialistKind;
import com.smurthy.ai.tutor.model.StudentProfile;
import com.smurthy.ai.tutor.model.TutorQuery;
import com.smurthy.ai.tutor.orchestration.OrchestrationError;
import com.smurthy.ai.tutor.orchestration.OrchestrationException;
import com.smurthy.ai.tutor.orchestration.Supervisor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TutorController.class)
class TutorControllerTest {

    private static final String EXPLAIN_REQUEST = """
            {
              "tenant_id": "t1",
              "user_query": "Explain quadratic equations",
              "student_profile": {"grade": 8, "subject": "algebra", "weak_topics": ["factoring"]}
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private Supervisor supervisor;

    @Test
    @DisplayName("Should answer with a snake_case response carrying provenance")
    void answersQuery() throws Exception {
        // Given
        when(supervisor.handle(any(TutorQuery.class), any(StudentProfile.class))).thenReturn(new AgentResponse(
                SpecialistKind.CONTENT, ResponsePayload.text("A quadratic equation is ..."), 120,
                Provenance.GENERATED, List.of(SpecialistKind.CONTENT), List.of("alg-8-12")));

        // When / Then
        mockMvc.perform(post("/api/tutor/ask").contentType(MediaType.APPLICATION_JSON).content(EXPLAIN_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.specialist").value("content"))
                .andExpect(jsonPath("$.provenance").value("generated"))
                .andExpect(jsonPath("$.latency_ms").value(120))
                .andExpect(jsonPath("$.specialists_run[0]").value("content"))
                .andExpect(jsonPath("$.sources[0]").value("alg-8-12"))
                .andExpect(jsonPath("$.payload.text").value("A quadratic equation is ..."));

        ArgumentCaptor<TutorQuery> query = ArgumentCaptor.forClass(TutorQuery.class);
        ArgumentCaptor<StudentProfile> profile = ArgumentCaptor.forClass(StudentProfile.class);
        verify(supervisor).handle(query.capture(), profile.capture());
        assertThat(query.getValue().tenantId()).isEqualTo("t1");
        assertThat(query.getValue().hasSubmittedAnswer()).isFalse();
        assertThat(profile.getValue().grade()).isEqualTo(8);
        assertThat(profile.getValue().weakTopics()).containsExactly("factoring");
    }

    @Test
    @DisplayName("Should render graded payloads with score fields")
    void rendersGrade() throws Exception {
        // Given
        when(supervisor.handle(any(TutorQuery.class), any(StudentProfile.class))).thenReturn(new AgentResponse(
                SpecialistKind.GRADER,
                new ResponsePayload("Sign error", 6.0, 10.0, false, List.of(), List.of("Practise factoring")),
                300, Provenance.CACHE_HIT, List.of(SpecialistKind.GRADER, SpecialistKind.ANALYST), List.of()));

        // When / Then
        mockMvc.perform(post("/api/tutor/ask").contentType(MediaType.APPLICATION_JSON).content("""
                        {
                          "tenant_id": "t1",
                          "user_query": "Solve x^2 - 5x + 6 = 0",
                          "submitted_answer": "x = 1",
                          "student_profile": {"grade": 8, "subject": "algebra"}
                        }
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.provenance").value("cache-hit"))
                .andExpect(jsonPath("$.payload.score").value(6.0))
                .andExpect(jsonPath("$.payload.max_score").value(10.0))
                .andExpect(jsonPath("$.payload.correct").value(false))
                .andExpect(jsonPath("$.payload.recommendations[0]").value("Practise factoring"))
                .andExpect(jsonPath("$.specialists_run[1]").value("analyst"));
    }

    @Test
    @DisplayName("Should render a practice quiz in snake_case and omit it when absent")
    void rendersQuiz() throws Exception {
        // Given
        ResponsePayload lesson = ResponsePayload.text("A fraction names a part of a whole").withQuiz(List.of(
                new QuizQuestion("What is 1/2 + 1/4?", "multiple_choice", List.of("3/4", "2/6"), "3/4", "easy")));
        when(supervisor.handle(any(TutorQuery.class), any(StudentProfile.class)))
                .thenReturn(new AgentResponse(SpecialistKind.CONTENT, lesson, 90, Provenance.GENERATED,
                        List.of(SpecialistKind.CONTENT), List.of()))
                .thenReturn(new AgentResponse(SpecialistKind.CONTENT, ResponsePayload.text("No quiz"), 90,
                        Provenance.GENERATED, List.of(SpecialistKind.CONTENT), List.of()));

        // When / Then
        mockMvc.perform(post("/api/tutor/ask").contentType(MediaType.APPLICATION_JSON).content(EXPLAIN_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.quiz[0].question").value("What is 1/2 + 1/4?"))
                .andExpect(jsonPath("$.payload.quiz[0].options[1]").value("2/6"))
                .andExpect(jsonPath("$.payload.quiz[0].correct_answer").value("3/4"));
        mockMvc.perform(post("/api/tutor/ask").contentType(MediaType.APPLICATION_JSON).content(EXPLAIN_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.quiz").doesNotExist());
    }

    @Test
    @DisplayName("Should reject a request without tenant")
    void rejectsInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/tutor/ask").contentType(MediaType.APPLICATION_JSON).content("""
                        {"user_query": "Explain fractions", "student_profile": {"grade": 5, "subject": "math"}}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));

        verifyNoInteractions(supervisor);
    }

    @Test
    @DisplayName("Should return provider exhaustion as a structured 503")
    void rendersOrchestrationError() throws Exception {
        // Given
        when(supervisor.handle(any(TutorQuery.class), any(StudentProfile.class))).thenThrow(new OrchestrationException(
                new OrchestrationError("content", "explain", List.of("lapa", "openai"), 6,
                        "No specialist could produce a response"), null));

        // When / Then
        mockMvc.perform(post("/api/tutor/ask").contentType(MediaType.APPLICATION_JSON).content(EXPLAIN_REQUEST))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("orchestration_failed"))
                .andExpect(jsonPath("$.specialist").value("content"))
                .andExpect(jsonPath("$.providers_attempted[1]").value("openai"))
                .andExpect(jsonPath("$.attempts").value(6));
    }
}
