package org.carball.futureyou.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.OutputFormat;
import org.carball.futureyou.model.AnalysisResult;
import org.carball.futureyou.model.DecisionDNA;
import org.carball.futureyou.model.FutureScenario;
import org.carball.futureyou.model.SimulationResult;
import org.carball.futureyou.model.UserProfile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

@Slf4j
public class SimulationReport {

    static final int SUMMARY_DECISION_LENGTH = 100;

    private final SimulationResult result;
    private final UserProfile userProfile;
    private final String decision;
    private final LocalDateTime timestamp;
    private final long epochSeconds;
    private final ObjectMapper objectMapper;

    public SimulationReport(SimulationResult result, UserProfile userProfile, String decision) {
        this(result, userProfile, decision, Clock.systemDefaultZone());
    }

    public SimulationReport(SimulationResult result, UserProfile userProfile, String decision, Clock clock) {
        this.result = result;
        this.userProfile = userProfile;
        this.decision = decision;
        this.timestamp = LocalDateTime.now(clock);
        this.epochSeconds = clock.instant().getEpochSecond();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        ReportData report = new ReportData();
        report.setMetadata(new Metadata(userProfile.getUserId(), epochSeconds, timestamp, decision));
        report.setUserProfile(userProfile);
        report.setDecisionDna(result.decisionDna());
        report.setScenarios(result.scenarios());
        report.setAnalysis(result.analysis());
        report.setAdvice(result.advice());
        report.setSessionId(result.sessionId());
        return write(report, "JSON report");
    }

    public String toSummaryJson() {
        DecisionDNA dna = result.decisionDna();

        Summary summary = new Summary();
        summary.setUser(userProfile.getUserId());
        summary.setDecision(decision.length() > SUMMARY_DECISION_LENGTH
                ? decision.substring(0, SUMMARY_DECISION_LENGTH) + "..."
                : decision);
        summary.setRiskTolerance(dna.riskTolerance());
        summary.setTopValues(dna.getTopValues(3));
        summary.setScenariosCount(result.scenarios().size());
        summary.setBestScenario(result.analysis() == null ? "N/A" : result.analysis().bestScenario());
        summary.setTimestamp(timestamp);
        return write(summary, "JSON summary");
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        DecisionDNA dna = result.decisionDna();

        // Header
        md.append("# FutureYou Simulation Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**User:** ").append(userProfile.getUserId()).append("  \n");
        md.append("**Session:** ").append(result.sessionId()).append("  \n\n");

        md.append("## Decision\n\n");
        md.append(decision).append("\n\n");

        // Decision DNA
        md.append("## Decision DNA\n\n");
        md.append("| Trait | Value |\n");
        md.append("|-------|-------|\n");
        md.append("| Risk Tolerance | ").append(String.format("%.2f", dna.riskTolerance()))
                .append(" (").append(dna.getRiskLabel()).append(") |\n");
        md.append("| Time Horizon | ").append(dna.timeHorizonPreference()).append(" |\n");
        md.append("| Top Values | ").append(String.join(", ", dna.getTopValues(3))).append(" |\n");
        md.append("| Emotional Drivers | ").append(String.join(", ", dna.emotionalDrivers())).append(" |\n\n");

        if (!dna.decisionPatterns().isEmpty()) {
            md.append("**Decision Patterns:**\n");
            for (Map.Entry<String, Object> pattern : dna.decisionPatterns().entrySet()) {
                md.append("- ").append(pattern.getKey()).append(": ").append(pattern.getValue()).append("\n");
            }
            md.append("\n");
        }

        // Scenarios
        md.append("## Future Scenarios\n\n");
        md.append("| Scenario | Timeline | Probability | Alignment | Path |\n");
        md.append("|----------|----------|-------------|-----------|------|\n");
        AnalysisResult analysis = result.analysis();
        for (FutureScenario scenario : result.scenarios()) {
            Double alignment = analysis == null ? null : analysis.alignmentScore().get(scenario.scenarioId());
            md.append("| ").append(scenario.scenarioId())
                    .append(scenario.scenarioId().equals(analysis == null ? null : analysis.bestScenario()) ? " ⭐" : "")
                    .append(" | ").append(scenario.timeline())
                    .append(" | ").append(String.format("%.0f%%", scenario.probability() * 100))
                    .append(" | ").append(alignment == null ? "-" : String.format("%.2f", alignment))
                    .append(" | ").append(escapeCell(scenario.decisionPath()))
                    .append(" |\n");
        }
        md.append("\n");

        for (FutureScenario scenario : result.scenarios()) {
            md.append("### ").append(scenario.scenarioId()).append("\n\n");
            md.append("**Path:** ").append(scenario.decisionPath()).append("\n\n");
            appendList(md, "Key Events", scenario.keyEvents());
            appendList(md, "Risks", scenario.risks());
            appendList(md, "Opportunities", scenario.opportunities());
            if (!scenario.outcomes().isEmpty()) {
                md.append("**Outcomes:**\n");
                scenario.outcomes().forEach((dimension, outcome) ->
                        md.append("- ").append(dimension).append(": ").append(outcome).append("\n"));
                md.append("\n");
            }
        }

        // Analysis
        if (analysis != null) {
            md.append("## Analysis\n\n");
            md.append("**Best Scenario:** ").append(analysis.bestScenario()).append("\n\n");
            md.append("### Risk Analysis\n\n").append(analysis.riskAnalysis()).append("\n\n");
            md.append("### Opportunity Analysis\n\n").append(analysis.opportunityAnalysis()).append("\n\n");
            md.append("### Trade-offs\n\n").append(analysis.tradeOffs()).append("\n\n");
        }

        // Advice
        md.append("## Personalized Advice\n\n");
        md.append(result.advice()).append("\n");

        return md.toString();
    }

    /**
     * Writes the requested formats into {@code outputDirectory}, creating it if needed.
     */
    public SavedFiles writeTo(Path outputDirectory, OutputFormat format) throws IOException {
        Files.createDirectories(outputDirectory);
        String suffix = userProfile.getUserId() + "_" + epochSeconds;

        Path jsonResult = null;
        Path jsonSummary = null;
        Path markdownReport = null;

        if (format.includesJson()) {
            jsonResult = Files.writeString(outputDirectory.resolve("result_" + suffix + ".json"), toJson());
            jsonSummary = Files.writeString(outputDirectory.resolve("summary_" + suffix + ".json"), toSummaryJson());
        }
        if (format.includesMarkdown()) {
            markdownReport = Files.writeString(outputDirectory.resolve("report_" + suffix + ".md"), toMarkdown());
        }

        log.info("Results for session {} written to {}", result.sessionId(), outputDirectory);
        return new SavedFiles(jsonResult, jsonSummary, markdownReport);
    }

    private String write(Object value, String description) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Error generating {}", description, e);
            throw new IllegalStateException("Failed to generate " + description, e);
        }
    }

    private static void appendList(StringBuilder md, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        md.append("**").append(title).append(":**\n");
        items.forEach(item -> md.append("- ").append(item).append("\n"));
        md.append("\n");
    }

    private static String escapeCell(String text) {
        return text == null ? "" : text.replace("|", "\\|").replace("\n", " ");
    }

    @lombok.Data
    private static class ReportData {
        @JsonProperty("metadata")
        private Metadata metadata;
        @JsonProperty("user_profile")
        private UserProfile userProfile;
        @JsonProperty("decision_dna")
        private DecisionDNA decisionDna;
        @JsonProperty("scenarios")
        private List<FutureScenario> scenarios;
        @JsonProperty("analysis")
        private AnalysisResult analysis;
        @JsonProperty("advice")
        private String advice;
        @JsonProperty("session_id")
        private String sessionId;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class Metadata {
        @JsonProperty("user_id")
        private String userId;
        @JsonProperty("timestamp")
        private long timestamp;
        @JsonProperty("datetime")
        private LocalDateTime datetime;
        @JsonProperty("decision")
        private String decision;
    }

    @lombok.Data
    private static class Summary {
        @JsonProperty("user")
        private String user;
        @JsonProperty("decision")
        private String decision;
        @JsonProperty("risk_tolerance")
        private double riskTolerance;
        @JsonProperty("top_values")
        private List<String> topValues;
        @JsonProperty("scenarios_count")
        private int scenariosCount;
        @JsonProperty("best_scenario")
        private String bestScenario;
        @JsonProperty("timestamp")
        private LocalDateTime timestamp;
    }
}
