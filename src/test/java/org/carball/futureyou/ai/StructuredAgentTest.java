package org.carball.futureyou.ai;

import org.carball.futureyou.TestFixtures;
import org.carball.futureyou.config.ModelSettings;
import org.carball.futureyou.validation.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class StructuredAgentTest {

    /**
     * Minimal agent: the input is a prefix, the result is the parsed "value" key.
     */
    private static class EchoAgent extends StructuredAgent<String, String> {

        private final ResponseSchema schema = ResponseSchema.object("echo").text("value").build();

        EchoAgent(ModelClient client, ModelSettings settings) {
            super("EchoAgent", client, settings);
        }

        String run(String input) {
            return execute(input);
        }

        @Override
        protected String validateInput(String input) {
            if (input == null) {
                throw new ValidationException("input required");
            }
            return input.trim();
        }

        @Override
        protected String buildPrompt(String input) {
            return "Echo " + input;
        }

        @Override
        protected String parseResponse(String input, String rawText) {
            return readJson(rawText, schema).get("value").asText();
        }
    }

    @Test
    void testStripCodeFences() {
        assertEquals("{\"a\": 1}", StructuredAgent.stripCodeFences("```json\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", StructuredAgent.stripCodeFences("```\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", StructuredAgent.stripCodeFences("```JSON{\"a\": 1}```"));
        assertEquals("[1]", StructuredAgent.stripCodeFences("  [1]  "));
        assertEquals("{\"a\": 1}", StructuredAgent.stripCodeFences("Here you go:\n```json\n{\"a\": 1}\n```\nEnjoy"));
        assertEquals("not json", StructuredAgent.stripCodeFences("not json"));
    }

    @Test
    void shouldSendValidatedPromptWithConfiguredModel() {
        StubModelClient client = StubModelClient.sequence("{\"value\": \"ok\"}");
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings());

        assertThat(agent.run("  hello ")).isEqualTo("ok");
        assertThat(client.getPrompts()).containsExactly("Echo hello");
        assertThat(client.getModelNames()).containsExactly("test-model");
    }

    @Test
    void shouldFailValidationWithoutCallingModel() {
        StubModelClient client = StubModelClient.sequence();
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings());

        assertThatThrownBy(() -> agent.run(null)).isInstanceOf(ValidationException.class);
        assertThat(client.callCount()).isZero();
    }

    @Test
    void shouldRetryMalformedResponseThenSucceed() {
        StubModelClient client = StubModelClient.sequence("not json", "{\"value\": \"second\"}");
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings());

        assertThat(agent.run("x")).isEqualTo("second");
        assertThat(client.callCount()).isEqualTo(2);
    }

    @Test
    void shouldSurfaceMalformedResponseAfterThreeAttempts() {
        StubModelClient client = StubModelClient.sequence("not json", "not json", "not json");
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings());

        assertThatThrownBy(() -> agent.run("x"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("EchoAgent")
                .extracting("rawText").isEqualTo("not json");
        assertThat(client.callCount()).isEqualTo(3);
    }

    @Test
    void shouldTreatBlankResponseAsEmpty() {
        StubModelClient client = StubModelClient.sequence("", "   ", "");
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings());

        assertThatThrownBy(() -> agent.run("x")).isInstanceOf(EmptyResponseException.class);
        assertThat(client.callCount()).isEqualTo(3);
    }

    @Test
    void shouldRejectTrailingContentAfterJson() {
        StubModelClient client = StubModelClient.sequence("{\"value\": \"a\"} trailing");
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings().toBuilder().maxAttempts(1).build());

        assertThatThrownBy(() -> agent.run("x")).isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void shouldWrapTransportFailuresAsModelInvocationErrors() {
        StubModelClient client = StubModelClient.sequence(
                new RuntimeException("connection reset"), "{\"value\": \"recovered\"}");
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings());

        assertThat(agent.run("x")).isEqualTo("recovered");
        assertThat(client.callCount()).isEqualTo(2);
    }

    @Test
    void shouldHonourConfiguredAttempts() {
        StubModelClient client = StubModelClient.sequence(
                new ModelInvocationException("down", null),
                new ModelInvocationException("down", null));
        EchoAgent agent = new EchoAgent(client, TestFixtures.fastSettings().toBuilder().maxAttempts(2).build());

        assertThatThrownBy(() -> agent.run("x"))
                .isInstanceOf(ModelInvocationException.class)
                .hasMessage("down");
        assertThat(client.callCount()).isEqualTo(2);
    }

    @Test
    void shouldNotRetryNonAgentFailures() {
        assertThat(AgentRetryPolicy.isRetryable(new SchemaViolationException("k", "missing"))).isTrue();
        assertThat(AgentRetryPolicy.isRetryable(new IncompleteResponseException("short"))).isTrue();
        assertThat(AgentRetryPolicy.isRetryable(new ValidationException("bad input"))).isFalse();
        assertThat(AgentRetryPolicy.isRetryable(new IllegalStateException("bug"))).isFalse();
    }
}
