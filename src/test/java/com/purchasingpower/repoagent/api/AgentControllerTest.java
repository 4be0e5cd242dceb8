package com.purchasingpower.repoagent.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.repoagent.exception.AuthenticationException;
import com.purchasingpower.repoagent.exception.ConnectivityException;
import com.purchasingpower.repoagent.exception.RateLimitedException;
import com.purchasingpower.repoagent.exception.RepositoryNotLoadedException;
import com.purchasingpower.repoagent.exception.TransientUpstreamException;
import com.purchasingpower.repoagent.model.AgentResponse;
import com.purchasingpower.repoagent.model.FileModification;
import com.purchasingpower.repoagent.model.TaskType;
import com.purchasingpower.repoagent.service.RepositoryAgentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP mapping of the agent workflows and provider endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RepositoryAgentService agentService;

    @Test
    void generate_shouldReturnContent() throws Exception {
        // Given
        when(agentService.generate("Write fizzbuzz", "python", null)).thenReturn(Mono.just("for i in range(100): ..."));

        // When / Then
        mockMvc.perform(post("/api/v1/agent/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new GenerateRequest("Write fizzbuzz", "python", null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("for i in range(100): ..."));
    }

    @Test
    @DisplayName("Should validate request bodies")
    void analyze_shouldRejectMissingPrompt() throws Exception {
        mockMvc.perform(post("/api/v1/agent/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filePath\":\"src/app.py\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.prompt").exists());

        mockMvc.perform(post("/api/v1/agent/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"));
    }

    @Test
    void analyze_shouldReturnConflictWithoutRepository() throws Exception {
        when(agentService.analyze("Explain", null, null)).thenReturn(Mono.error(new RepositoryNotLoadedException()));

        mockMvc.perform(post("/api/v1/agent/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"Explain\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Should translate provider failures to distinct statuses")
    void workflows_shouldMapProviderFailures() throws Exception {
        when(agentService.search(eq("auth"), isNull())).thenReturn(Mono.error(new AuthenticationException(401, "bad key")));
        when(agentService.search(eq("busy"), isNull())).thenReturn(Mono.error(new RateLimitedException("slow down")));
        when(agentService.search(eq("offline"), isNull())).thenReturn(Mono.error(new ConnectivityException("offline")));
        when(agentService.search(eq("flaky"), isNull())).thenReturn(Mono.error(new TransientUpstreamException("reset")));

        expectSearchStatus("auth", 401, "PROVIDER_AUTHENTICATION_FAILED");
        expectSearchStatus("busy", 429, "RATE_LIMITED");
        expectSearchStatus("offline", 503, "PROVIDER_UNREACHABLE");
        expectSearchStatus("flaky", 502, "UPSTREAM_UNAVAILABLE");
    }

    @Test
    void edit_shouldReturnProposal() throws Exception {
        when(agentService.edit("src/app.py", "Rename", null))
                .thenReturn(Mono.just(new FileModification("src/app.py", "old", "new")));

        mockMvc.perform(post("/api/v1/agent/edit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new EditRequest("src/app.py", "Rename", null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("src/app.py"))
                .andExpect(jsonPath("$.originalContent").value("old"))
                .andExpect(jsonPath("$.newContent").value("new"));
    }

    @Test
    void solve_shouldReturnExplanationAndFiles() throws Exception {
        when(agentService.solve("Fix it", null)).thenReturn(Mono.just(new AgentResponse("Because.",
                List.of(FileModification.proposed("src/new.py", "x = 1")))));

        mockMvc.perform(post("/api/v1/agent/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"Fix it\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.explanation").value("Because."))
                .andExpect(jsonPath("$.files[0].path").value("src/new.py"))
                .andExpect(jsonPath("$.files[0].originalContent").doesNotExist());
    }

    @Test
    @SuppressWarnings("unchecked")
    void generateStream_shouldEmitChunkAndCompleteEvents() throws Exception {
        // Given
        when(agentService.generateStream(eq("Stream it"), isNull(), isNull(), any(), any())).thenAnswer(inv -> {
            Consumer<String> onChunk = inv.getArgument(3);
            Consumer<String> onComplete = inv.getArgument(4);
            onChunk.accept("Hel");
            onChunk.accept("lo");
            onComplete.accept("Hello");
            return Mono.just("Hello");
        });

        // When
        MvcResult result = mockMvc.perform(post("/api/v1/agent/generate/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"Stream it\"}"))
                .andExpect(request().asyncStarted())
                .andDo(MvcResult::getAsyncResult)
                .andReturn();

        // Then
        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("event:chunk", "\"content\":\"Hel\"", "\"content\":\"lo\"");
        assertThat(body).contains("event:complete", "\"length\":5");
        assertThat(body.indexOf("Hel")).isLessThan(body.indexOf("\"lo\""));
    }

    @Test
    void bestModel_shouldPassTaskType() throws Exception {
        when(agentService.bestAvailableModel("google/gemini-pro", TaskType.CODE)).thenReturn(Mono.just("google/gemini-pro"));
        when(agentService.recommendModel("data_analysis")).thenReturn("mistralai/mixtral-8x7b-instruct");

        mockMvc.perform(get("/api/v1/models/best").param("preferred", "google/gemini-pro").param("task", "CODE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model").value("google/gemini-pro"));
        mockMvc.perform(get("/api/v1/models/recommendation").param("category", "data_analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model").value("mistralai/mixtral-8x7b-instruct"));
    }

    private void expectSearchStatus(String description, int status, String code) throws Exception {
        mockMvc.perform(post("/api/v1/agent/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"" + description + "\"}"))
                .andExpect(status().is(status))
                .andExpect(jsonPath("$.code").value(code));
    }
}
