package org.carball.futureyou.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.futureyou.TestFixtures;
import org.carball.futureyou.config.OutputFormat;
import org.carball.futureyou.model.SimulationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

public class SimulationReportTest {

    private static final Instant NOW = Instant.parse("2026-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private SimulationReport report(String decision) {
        SimulationResult result = new SimulationResult(
                TestFixtures.dna(),
                TestFixtures.scenarios("1yr"),
                TestFixtures.analysis("1yr_1"),
                TestFixtures.ADVICE,
                "session_42");
        return new SimulationReport(result, TestFixtures.profile(), decision, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRenderFullJsonResult() throws Exception {
        JsonNode json = mapper.readTree(report(TestFixtures.DECISION).toJson());

        assertThat(json.path("metadata").path("user_id").asText()).isEqualTo("u1");
        assertThat(json.path("metadata").path("timestamp").asLong()).isEqualTo(NOW.getEpochSecond());
        assertThat(json.path("metadata").path("datetime").asText()).startsWith("2026-05-01T10:00");
        assertThat(json.path("metadata").path("decision").asText()).isEqualTo(TestFixtures.DECISION);
        assertThat(json.path("user_profile").path("current_role").asText()).isEqualTo("Eng");
        assertThat(json.path("decision_dna").path("risk_tolerance").asDouble()).isEqualTo(0.65);
        assertThat(json.path("scenarios")).hasSize(3);
        assertThat(json.path("analysis").path("best_scenario").asText()).isEqualTo("1yr_1");
        assertThat(json.path("advice").asText()).isEqualTo(TestFixtures.ADVICE);
        assertThat(json.path("session_id").asText()).isEqualTo("session_42");
    }

    @Test
    void shouldTruncateLongDecisionInSummary() throws Exception {
        String decision = "D".repeat(150);

        JsonNode summary = mapper.readTree(report(decision).toSummaryJson());

        assertThat(summary.path("decision").asText()).isEqualTo("D".repeat(100) + "...");
        assertThat(summary.path("user").asText()).isEqualTo("u1");
        assertThat(summary.path("top_values")).hasSize(3);
        assertThat(summary.path("scenarios_count").asInt()).isEqualTo(3);
        assertThat(summary.path("best_scenario").asText()).isEqualTo("1yr_1");
    }

    @Test
    void shouldKeepShortDecisionInSummary() throws Exception {
        JsonNode summary = mapper.readTree(report(TestFixtures.DECISION).toSummaryJson());

        assertThat(summary.path("decision").asText()).isEqualTo(TestFixtures.DECISION);
    }

    @Test
    void shouldRenderMarkdownSections() {
        String markdown = report(TestFixtures.DECISION).toMarkdown();

        assertThat(markdown).startsWith("# FutureYou Simulation Report");
        assertThat(markdown).contains(
                "## Decision DNA",
                "| Risk Tolerance | 0.65 (Medium) |",
                "## Future Scenarios",
                "| 1yr_1 ⭐ | 1yr |",
                "## Analysis",
                "## Personalized Advice");
    }

    @Test
    void shouldWriteRequestedFormats() throws Exception {
        Path output = tempDir.resolve("outputs");

        SavedFiles both = report(TestFixtures.DECISION).writeTo(output, OutputFormat.BOTH);

        String suffix = "u1_" + NOW.getEpochSecond();
        assertThat(both.jsonResult()).isEqualTo(output.resolve("result_" + suffix + ".json"));
        assertThat(both.jsonSummary()).isEqualTo(output.resolve("summary_" + suffix + ".json"));
        assertThat(both.markdownReport()).isEqualTo(output.resolve("report_" + suffix + ".md"));
        assertThat(Files.readString(both.markdownReport())).contains("## Personalized Advice");

        SavedFiles markdownOnly = report(TestFixtures.DECISION).writeTo(tempDir.resolve("md"), OutputFormat.MARKDOWN);
        assertThat(markdownOnly.jsonResult()).isNull();
        assertThat(markdownOnly.markdownReport()).exists();
    }
}
