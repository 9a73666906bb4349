package org.carball.futureyou.ai;

import org.carball.futureyou.TestFixtures;
import org.carball.futureyou.validation.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AdvisorAgentTest {

    @Test
    void shouldReturnTrimmedAdvice() {
        StubModelClient client = StubModelClient.sequence("\n\n  " + TestFixtures.ADVICE + "  \n");
        AdvisorAgent agent = new AdvisorAgent(client, TestFixtures.fastSettings());

        String advice = agent.generateAdvice(TestFixtures.analysis("1yr_0"), TestFixtures.dna());

        assertThat(advice).isEqualTo(TestFixtures.ADVICE);
        assertThat(client.lastPrompt())
                .startsWith("Based on this analysis")
                .contains("\"best_scenario\" : \"1yr_0\"")
                .contains("Action steps for next 30/60/90 days");
    }

    @Test
    void shouldTreatShortAdviceAsIncomplete() {
        StubModelClient client = StubModelClient.sequence("Do it.", "Just go for it!", "Yes.");
        AdvisorAgent agent = new AdvisorAgent(client, TestFixtures.fastSettings());

        assertThatThrownBy(() -> agent.generateAdvice(TestFixtures.analysis("1yr_0"), TestFixtures.dna()))
                .isInstanceOf(IncompleteResponseException.class)
                .hasMessageContaining("too short");
        assertThat(client.callCount()).isEqualTo(3);
    }

    @Test
    void shouldAcceptExactlyFiftyCharacters() {
        String fifty = "x".repeat(50);
        StubModelClient client = StubModelClient.sequence(fifty);
        AdvisorAgent agent = new AdvisorAgent(client, TestFixtures.fastSettings());

        assertThat(agent.generateAdvice(TestFixtures.analysis("1yr_0"), TestFixtures.dna())).hasSize(50);
    }

    @Test
    void shouldRejectMissingAnalysis() {
        StubModelClient client = StubModelClient.sequence();
        AdvisorAgent agent = new AdvisorAgent(client, TestFixtures.fastSettings());

        assertThatThrownBy(() -> agent.generateAdvice(null, TestFixtures.dna()))
                .isInstanceOf(ValidationException.class);
        assertThat(client.callCount()).isZero();
    }
}
