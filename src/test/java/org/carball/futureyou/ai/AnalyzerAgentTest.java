package org.carball.futureyou.ai;

import org.carball.futureyou.TestFixtures;
import org.carball.futureyou.model.AnalysisResult;
import org.carball.futureyou.model.FutureScenario;
import org.carball.futureyou.validation.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AnalyzerAgentTest {

    private static final List<String> IDS = List.of("1yr_0", "1yr_1", "1yr_2");

    @Test
    void shouldParseAnalysis() {
        // Given
        StubModelClient client = StubModelClient.sequence(TestFixtures.analysisJson("1yr_1", IDS));
        AnalyzerAgent agent = new AnalyzerAgent(client, TestFixtures.fastSettings());

        // When
        AnalysisResult analysis = agent.analyzeScenarios(TestFixtures.scenarios("1yr"), TestFixtures.dna());

        // Then
        assertThat(analysis.bestScenario()).isEqualTo("1yr_1");
        assertThat(analysis.riskAnalysis()).contains("skill gap");
        assertThat(analysis.opportunityAnalysis()).isNotBlank();
        assertThat(analysis.tradeOffs()).isNotBlank();
        assertThat(analysis.alignmentScore()).containsEntry("1yr_0", 0.8).containsEntry("1yr_2", 0.6);
    }

    @Test
    void shouldListValidScenarioIdsInPrompt() {
        StubModelClient client = StubModelClient.sequence(TestFixtures.analysisJson("1yr_0", IDS));
        AnalyzerAgent agent = new AnalyzerAgent(client, TestFixtures.fastSettings());

        agent.analyzeScenarios(TestFixtures.scenarios("1yr"), TestFixtures.dna());

        assertThat(client.lastPrompt())
                .startsWith("Analyze these future scenarios")
                .contains("Valid scenario ids: 1yr_0, 1yr_1, 1yr_2")
                .contains("\"scenario_id\" : \"1yr_2\"");
    }

    @Test
    void shouldRejectEmptyScenarioSetWithoutCallingModel() {
        StubModelClient client = StubModelClient.sequence();
        AnalyzerAgent agent = new AnalyzerAgent(client, TestFixtures.fastSettings());

        assertThatThrownBy(() -> agent.analyzeScenarios(List.of(), TestFixtures.dna()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No scenarios provided for analysis");
        assertThat(client.callCount()).isZero();
    }

    @Test
    void shouldRejectBestScenarioOutsideInputSet() {
        String unknown = TestFixtures.analysisJson("5yr_0", IDS);
        StubModelClient client = StubModelClient.sequence(unknown, unknown, unknown);
        AnalyzerAgent agent = new AnalyzerAgent(client, TestFixtures.fastSettings());

        assertThatThrownBy(() -> agent.analyzeScenarios(TestFixtures.scenarios("1yr"), TestFixtures.dna()))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("5yr_0")
                .extracting("field").isEqualTo("best_scenario");
    }

    @Test
    void shouldRejectNonNumericAlignmentScore() {
        String bad = TestFixtures.analysisJson("1yr_0", IDS).replace("0.8", "\"high\"");
        StubModelClient client = StubModelClient.sequence(bad, TestFixtures.analysisJson("1yr_0", IDS));
        AnalyzerAgent agent = new AnalyzerAgent(client, TestFixtures.fastSettings());

        AnalysisResult analysis = agent.analyzeScenarios(TestFixtures.scenarios("1yr"), TestFixtures.dna());

        assertThat(analysis.bestScenario()).isEqualTo("1yr_0");
        assertThat(client.callCount()).isEqualTo(2);
    }

    @Test
    void shouldRequireAllFiveKeys() {
        String missing = "{\"best_scenario\": \"1yr_0\", \"risk_analysis\": \"r\", \"alignment_score\": {}, "
                + "\"trade_offs\": \"t\"}";
        StubModelClient client = StubModelClient.sequence(missing, missing, missing);
        AnalyzerAgent agent = new AnalyzerAgent(client, TestFixtures.fastSettings());

        List<FutureScenario> scenarios = TestFixtures.scenarios("1yr");
        assertThatThrownBy(() -> agent.analyzeScenarios(scenarios, TestFixtures.dna()))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessage("Missing key in analysis: opportunity_analysis");
    }
}
