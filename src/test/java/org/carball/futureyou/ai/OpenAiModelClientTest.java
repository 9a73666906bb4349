package org.carball.futureyou.ai;

import org.carball.futureyou.config.ModelSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OpenAiModelClientTest {

    @Test
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> new OpenAiModelClient(ModelSettings.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("API key required");
    }

    @Test
    void shouldBuildClientWithoutNetworkAccess() {
        ModelSettings settings = ModelSettings.builder()
                .apiKey("test-key")
                .baseUrl("http://localhost:9/v1/")
                .build();

        assertThatCode(() -> new OpenAiModelClient(settings)).doesNotThrowAnyException();
    }
}
