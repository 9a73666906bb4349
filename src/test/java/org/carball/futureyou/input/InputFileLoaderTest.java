package org.carball.futureyou.input;

import org.carball.futureyou.model.SimulationRequest;
import org.carball.futureyou.model.UserProfile;
import org.carball.futureyou.validation.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InputFileLoaderTest {

    @TempDir
    Path tempDir;

    private final InputFileLoader loader = new InputFileLoader();

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("futureyou_input.json");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void shouldLoadAndValidateRequest() throws Exception {
        // Given
        Path file = write("""
            {
              "user_profile": {
                "user_id": "alex_001",
                "age": 29,
                "current_role": "Software Engineer",
                "experience_years": 6,
                "location": "Toronto",
                "skills": ["Java", "Kubernetes"]
              },
              "decision": "  Should I accept a senior role at a big tech company?  ",
              "timelines": ["1yr", "5yr"],
              "generate_visuals": true
            }
            """);

        // When
        SimulationRequest request = loader.load(file);

        // Then
        assertThat(request.getDecision()).isEqualTo("Should I accept a senior role at a big tech company?");
        assertThat(request.getTimelines()).containsExactly("1yr", "5yr");
        assertThat(request.isGenerateVisuals()).isTrue();
        assertThat(request.getUserProfile()).containsEntry("interests", List.of());

        UserProfile profile = loader.toUserProfile(request.getUserProfile());
        assertThat(profile.getUserId()).isEqualTo("alex_001");
        assertThat(profile.getAge()).isEqualTo(29);
        assertThat(profile.getSkills()).containsExactly("Java", "Kubernetes");
        assertThat(profile.getAttributes()).containsEntry("location", "Toronto").containsEntry("experience_years", 6);
    }

    @Test
    void shouldDefaultTimelinesAndVisuals() throws Exception {
        Path file = write("""
            {"user_profile": {"user_id": "u1", "age": 30, "current_role": "Eng"},
             "decision": "Should I switch careers to product management?"}
            """);

        SimulationRequest request = loader.load(file);

        assertThat(request.getTimelines()).containsExactly("1yr", "3yr", "5yr");
        assertThat(request.isGenerateVisuals()).isFalse();
    }

    @Test
    void shouldTreatNonBooleanVisualsFlagAsFalse() throws Exception {
        Path file = write("""
            {"user_profile": {"user_id": "u1", "age": 30, "current_role": "Eng"},
             "decision": "Should I switch careers to product management?",
             "generate_visuals": "yes"}
            """);

        assertThat(loader.load(file).isGenerateVisuals()).isFalse();
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Input file not found");
    }

    @Test
    void shouldFailForUnparsableFile() throws Exception {
        Path file = write("{\"user_profile\": ");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    void shouldRejectMissingSections() throws Exception {
        Path noProfile = write("{\"decision\": \"Should I switch careers to product management?\"}");
        assertThatThrownBy(() -> loader.load(noProfile))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Missing required key: user_profile");

        Path noDecision = write("{\"user_profile\": {\"user_id\": \"u1\", \"age\": 30, \"current_role\": \"Eng\"}}");
        assertThatThrownBy(() -> loader.load(noDecision))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Decision");
    }

    @Test
    void shouldRejectInvalidTimeline() throws Exception {
        Path file = write("""
            {"user_profile": {"user_id": "u1", "age": 30, "current_role": "Eng"},
             "decision": "Should I switch careers to product management?",
             "timelines": ["1yr", "10yr"]}
            """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("10yr");
    }
}
