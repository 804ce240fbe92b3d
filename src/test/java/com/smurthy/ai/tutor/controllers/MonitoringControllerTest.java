package com.smurthy.ai.tutor.controllers;

import com.smurthy.ai.tutor.cache.CacheStats;
import com.smurthy.ai.tutor.cache.SemanticCache;
import com.smurthy.ai.tutor.llm.ProviderUsageTracker;
import com.smurthy.ai.tutor.observability.RetrievalMetrics;
import com.smurthy.ai.tutor.retrieval.CurriculumIngestionService;
import com.smurthy.ai.tutor.retrieval.CurriculumPassage;
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
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {MonitoringController.class, CurriculumController.class})
class MonitoringControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SemanticCache semanticCache;

    @MockBean
    private ProviderUsageTracker usageTracker;

    @MockBean
    private RetrievalMetrics retrievalMetrics;

    @MockBean
    private CurriculumIngestionService ingestionService;

    @Test
    @DisplayName("Should expose cache statistics")
    void exposesCacheStats() throws Exception {
        when(semanticCache.stats()).thenReturn(new CacheStats(3, 6, 2, 3, 0, 1));

        mockMvc.perform(get("/monitoring/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries").value(3))
                .andExpect(jsonPath("$.hits").value(6))
                .andExpect(jsonPath("$.hitRate").value(0.75));
    }

    @Test
    @DisplayName("Should invalidate a tenant's cache entries")
    void invalidatesTenant() throws Exception {
        when(semanticCache.invalidateTenant("t1")).thenReturn(4);

        mockMvc.perform(delete("/monitoring/cache/tenants/t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4));
    }

    @Test
    @DisplayName("Should expose a tenant's token usage and cost by provider")
    void exposesTenantUsage() throws Exception {
        when(usageTracker.tenantUsage("t1")).thenReturn(new ProviderUsageTracker.TenantUsageSnapshot(
                "t1", 2, 300, 120, 420, 0.03,
                List.of(new ProviderUsageTracker.ProviderTokenUsage("openai", 2, 300, 120, 420, 0.03))));

        mockMvc.perform(get("/monitoring/usage/tenants/t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value("t1"))
                .andExpect(jsonPath("$.totalTokens").value(420))
                .andExpect(jsonPath("$.costUsd").value(0.03))
                .andExpect(jsonPath("$.byProvider[0].provider").value("openai"));
    }

    @Test
    @DisplayName("Should ingest curriculum passages")
    @SuppressWarnings("unchecked")
    void ingestsPassages() throws Exception {
        // Given
        when(ingestionService.ingest(anyList())).thenReturn(1);
        ArgumentCaptor<List<CurriculumPassage>> captor = ArgumentCaptor.forClass(List.class);

        // When
        mockMvc.perform(post("/api/curriculum/passages").contentType(MediaType.APPLICATION_JSON).content("""
                        {"passages": [{"source_id": "alg-8-12", "text": "ax^2 + bx + c = 0", "tenant_id": "t1",
                                       "subject": "algebra", "grade": 8, "topic": "quadratics"}]}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ingested").value(1));

        // Then
        verify(ingestionService).ingest(captor.capture());
        assertThat(captor.getValue()).containsExactly(
                new CurriculumPassage("alg-8-12", "ax^2 + bx + c = 0", "t1", "algebra", 8, "quadratics"));
    }

    @Test
    @DisplayName("Should reject passages without tenant")
    void rejectsPassageWithoutTenant() throws Exception {
        mockMvc.perform(post("/api/curriculum/passages").contentType(MediaType.APPLICATION_JSON).content("""
                        {"passages": [{"source_id": "x", "text": "some text"}]}
                        """))
                .andExpect(status().isBadRequest());
    }
}
