package dev.candor;

import dev.candor.mcp.McpToolService;
import dev.candor.provider.ProviderGateway;
import dev.candor.report.InterviewEvaluationService;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class SmokeIT extends BaseIntegrationTest {

    @Autowired
    private InterviewEvaluationService service;

    @Autowired
    private ProviderGateway gateway;

    @Autowired
    private McpToolService mcpToolService;

    @Autowired
    private ToolCallbackProvider candorTools;

    @Test
    void contextLoads() {
        // If we get here, Spring context loaded successfully with:
        // - Flyway migrations applied and JPA entities validated against schema
        // - EmbeddingModel bean created (ONNX model loaded)
        // - provider gateway built from the configured entries
        assertThat(service).isNotNull();
        assertThat(gateway).isNotNull();
        assertThat(mcpToolService).isNotNull();
    }

    @Test
    void mcpToolsAreRegistered() {
        assertThat(Arrays.stream(candorTools.getToolCallbacks())
                .map(callback -> callback.getToolDefinition().name()))
                .containsExactlyInAnyOrder(
                        "generate_framework", "generate_questions", "evaluate_answer");
    }
}
