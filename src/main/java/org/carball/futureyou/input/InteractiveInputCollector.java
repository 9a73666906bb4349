package org.carball.futureyou.input;

import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.model.FutureScenario;
import org.carball.futureyou.model.SimulationRequest;
import org.carball.futureyou.model.SimulationResult;
import org.carball.futureyou.orchestrator.FutureYouOrchestrator;
import org.carball.futureyou.tracker.DecisionRecord;
import org.carball.futureyou.validation.InputValidator;
import org.carball.futureyou.validation.ValidationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Collects a simulation request by prompting on the console.
 */
@Slf4j
public class InteractiveInputCollector {

    private static final Map<String, List<String>> TIMELINE_CHOICES = Map.of(
            "1", List.of("1yr"),
            "2", List.of("1yr", "3yr"),
            "3", List.of("1yr", "3yr", "5yr"));

    private final BufferedReader in;
    private final PrintStream out;

    public InteractiveInputCollector(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public SimulationRequest collect() throws IOException {
        Map<String, Object> profile = collectProfile();
        String decision = collectDecision();

        out.println("\n" + "=".repeat(60));
        out.println("⚙️  SIMULATION SETTINGS");
        out.println("=".repeat(60));
        out.println("📅 Select timelines to simulate:");
        out.println("1. 1 year only (quick)");
        out.println("2. 1yr + 3yr (medium)");
        out.println("3. 1yr + 3yr + 5yr (comprehensive)");
        List<String> timelines = TIMELINE_CHOICES.getOrDefault(ask("\nChoice (1-3): "), List.of("1yr"));

        boolean generateVisuals = ask("\n🎨 Generate visualizations? (y/n): ").toLowerCase().startsWith("y");

        return SimulationRequest.builder()
                .userProfile(InputValidator.validateProfile(profile))
                .decision(InputValidator.validateDecision(decision))
                .timelines(new ArrayList<>(timelines))
                .generateVisuals(generateVisuals)
                .build();
    }

    public boolean confirm(SimulationRequest request) throws IOException {
        out.println("\n" + "=".repeat(60));
        out.println("🚀 READY TO SIMULATE");
        out.println("=".repeat(60));
        out.println("User: " + request.getUserProfile().get("user_id"));
        out.println("Decision: " + request.getDecision());
        out.println("Timelines: " + String.join(", ", request.getTimelines()));
        out.println("Visuals: " + (request.isGenerateVisuals() ? "Yes" : "No"));

        return ask("\nProceed with simulation? (y/n): ").toLowerCase().startsWith("y");
    }

    /**
     * Asks which scenario the user intends to pursue and logs a non-blank answer with the tracker.
     */
    public Optional<DecisionRecord> askForChosenPath(SimulationResult result, String decision,
                                                      FutureYouOrchestrator orchestrator) throws IOException {
        out.println("\n📌 Which scenario will you pursue? (scenario id, or press Enter to skip)");
        out.println("   Options: " + result.scenarios().stream()
                .map(FutureScenario::scenarioId)
                .collect(Collectors.joining(", ")));
        String chosenPath = ask("   Chosen scenario: ");
        if (chosenPath.isEmpty()) {
            return Optional.empty();
        }
        String reasoning = ask("   Why? ");

        DecisionRecord entry = orchestrator.trackDecision(decision, chosenPath, reasoning);
        out.println("   ✓ Decision logged");
        return Optional.of(entry);
    }

    private Map<String, Object> collectProfile() throws IOException {
        out.println("\n" + "=".repeat(60));
        out.println("👤 USER PROFILE COLLECTION");
        out.println("=".repeat(60));
        out.println("Please provide your information for Decision DNA analysis:");

        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("user_id", ask("\n🆔 User ID (e.g., john_doe_001): "));
        profile.put("age", parseInteger(ask("🎂 Age: "), "Age must be an integer between "
                + InputValidator.MIN_AGE + " and " + InputValidator.MAX_AGE));
        profile.put("current_role", ask("💼 Current Role/Job: "));
        profile.put("experience_years", parseInteger(ask("📅 Years of Experience: "),
                "Years of experience must be an integer"));

        String salary = ask("💰 Current Annual Salary in USD (optional, press Enter to skip): ");
        try {
            profile.put("current_salary", salary.isEmpty() ? 0 : Integer.parseInt(salary));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric salary: {}", salary);
            profile.put("current_salary", 0);
        }

        profile.put("location", ask("📍 Current Location: "));
        profile.put("education", ask("🎓 Education Background: "));

        out.println("\n📋 Skills (comma-separated):");
        profile.put("skills", splitList(ask("   Example: Java, Leadership, Marketing: ")));
        out.println("\n🎯 Interests (comma-separated):");
        profile.put("interests", splitList(ask("   Example: AI, Travel, Entrepreneurship: ")));
        out.println("\n🌟 Life Goals (comma-separated):");
        profile.put("life_goals", splitList(ask("   Example: Financial independence, Work-life balance: ")));

        out.println("\n📚 Past Major Decisions (help the AI understand your patterns):");
        out.println("   Enter one decision per line, press Enter on an empty line when done:");
        List<String> pastDecisions = new ArrayList<>();
        String line;
        while (!(line = ask("   Decision: ")).isEmpty()) {
            pastDecisions.add(line);
        }
        profile.put("past_decisions", pastDecisions);

        return profile;
    }

    private String collectDecision() throws IOException {
        out.println("\n" + "=".repeat(60));
        out.println("🤔 DECISION SCENARIO");
        out.println("=".repeat(60));
        out.println("Describe the decision you're facing.");
        out.println("Be specific about the options and context.");
        return ask("\n📝 Your Decision: ");
    }

    private String ask(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        String line = in.readLine();
        return line == null ? "" : line.trim();
    }

    private static int parseInteger(String value, String message) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(message);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
