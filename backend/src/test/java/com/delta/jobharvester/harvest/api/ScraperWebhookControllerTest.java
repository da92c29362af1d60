package com.delta.jobharvester.harvest.api;

import com.delta.jobharvester.harvest.model.WebhookAck;
import com.delta.jobharvester.harvest.service.TaskOrchestratorService;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ScraperWebhookControllerTest {
    private static final String SECRET = "test-webhook-secret";

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private TaskOrchestratorService orchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void wrongSecretIsRejectedWithoutTouchingTasks() throws Exception {
        mockMvc.perform(post("/api/webhooks/scraper")
                .header("X-Webhook-Secret", "nope")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"req-1\",\"status\":\"Success\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.status").value("unauthorized"));

        verify(orchestrator, never()).handleWebhook(anyString(), any(), any());
    }

    @Test
    void missingSecretIsRejected() throws Exception {
        mockMvc.perform(post("/api/webhooks/scraper")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"req-1\",\"status\":\"Success\"}"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void payloadWithoutRequestIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/webhooks/scraper")
                .header("X-Webhook-Secret", SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"Success\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("invalid"));
    }

    @Test
    void validWebhookIsForwardedWithItsData() throws Exception {
        when(orchestrator.handleWebhook(eq("req-7"), eq("Success"), any()))
            .thenReturn(new WebhookAck("processed", "processed", "req-7", 7L));

        mockMvc.perform(post("/api/webhooks/scraper")
                .header("X-Webhook-Secret", SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"req-7\",\"status\":\"Success\",\"data\":[[{\"title\":\"CDL-A Driver\"}]]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("processed"))
            .andExpect(jsonPath("$.taskId").value(7));

        ArgumentCaptor<JsonNode> data = ArgumentCaptor.forClass(JsonNode.class);
        verify(orchestrator).handleWebhook(eq("req-7"), eq("Success"), data.capture());
        assertThat(data.getValue().isArray()).isTrue();
        assertThat(data.getValue().get(0).get(0).get("title").asText()).isEqualTo("CDL-A Driver");
    }

    @Test
    void secretMayArriveAsQueryParameterAndRequestIdAsAlias() throws Exception {
        when(orchestrator.handleWebhook(eq("req-8"), eq("Pending"), any()))
            .thenReturn(new WebhookAck("acknowledged", "task still running", "req-8", 8L));

        mockMvc.perform(post("/api/webhooks/scraper")
                .param("secret", SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"request_id\":\"req-8\",\"status\":\"Pending\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("acknowledged"));
    }
}
