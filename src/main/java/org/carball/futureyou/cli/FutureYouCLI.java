package org.carball.futureyou.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.ai.AgentException;
import org.carball.futureyou.ai.ModelClient;
import org.carball.futureyou.ai.OpenAiModelClient;
import org.carball.futureyou.config.ConfigurationLoader;
import org.carball.futureyou.config.EnvironmentValidator;
import org.carball.futureyou.config.FutureYouConfig;
import org.carball.futureyou.config.ModelSettings;
import org.carball.futureyou.config.OutputFormat;
import org.carball.futureyou.config.ValidationReport;
import org.carball.futureyou.input.InputFileLoader;
import org.carball.futureyou.input.InteractiveInputCollector;
import org.carball.futureyou.model.DecisionDNA;
import org.carball.futureyou.model.FutureScenario;
import org.carball.futureyou.model.Session;
import org.carball.futureyou.model.SimulationRequest;
import org.carball.futureyou.model.SimulationResult;
import org.carball.futureyou.model.UserProfile;
import org.carball.futureyou.orchestrator.FutureYouOrchestrator;
import org.carball.futureyou.orchestrator.PipelineStage;
import org.carball.futureyou.output.SavedFiles;
import org.carball.futureyou.output.SimulationReport;
import org.carball.futureyou.validation.ValidationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

@Slf4j
public class FutureYouCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║           🔮 FutureYou Decision Simulator v%s               ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    // Options whose value is consumed by ConfigurationLoader
    private static final Set<String> MODEL_OPTIONS = Set.of(
            "--api-key", "--base-url", "--model", "--temperature", "--max-attempts");

    private static final int ADVICE_PREVIEW_LINES = 10;

    private final Map<String, String> environment;
    private final Function<ModelSettings, ModelClient> clientFactory;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public FutureYouCLI(Map<String, String> environment, Function<ModelSettings, ModelClient> clientFactory,
                        BufferedReader in, PrintStream out, PrintStream err) {
        this.environment = environment;
        this.clientFactory = clientFactory;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        FutureYouCLI cli = new FutureYouCLI(System.getenv(), OpenAiModelClient::new,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, System.err);
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            return 0;
        }

        try {
            FutureYouConfig config = parseArgs(args, environment);

            ValidationReport report = new EnvironmentValidator()
                    .validateEnvironment(config.getModelSettings(), config.getOutputDirectory());
            if (!config.isInteractive()) {
                report.merge(new EnvironmentValidator().validateInputFile(config.getInputFile()));
            }

            if (config.isCheckOnly()) {
                out.println("\n🔍 Running FutureYou system validation...");
                out.println(report.format());
                return report.isValid() ? 0 : 1;
            }
            if (!report.isValid()) {
                err.println("\n❌ Validation failed:");
                report.getErrors().forEach(error -> err.println("   - " + error));
                err.println("\nRun with --check for the full report.");
                return 1;
            }
            if (config.isVerbose()) {
                report.getWarnings().forEach(warning -> out.println("   ⚠️  " + warning));
            }

            SimulationRequest request;
            InteractiveInputCollector collector = null;
            if (config.isInteractive()) {
                collector = new InteractiveInputCollector(in, out);
                request = collector.collect();
                if (!collector.confirm(request)) {
                    out.println("❌ Simulation cancelled");
                    return 0;
                }
            } else {
                request = new InputFileLoader().load(config.getInputFile());
            }

            UserProfile profile = new InputFileLoader().toUserProfile(request.getUserProfile());

            out.println("\n🔍 Starting simulation...");
            out.println("   User: " + profile.getUserId());
            out.println("   Timelines: " + String.join(", ", request.getTimelines()));
            out.println("   Model: " + config.getModelSettings().getModelName());
            out.println("   Output: " + config.getOutputDirectory() + " (" + config.getOutputFormat().name().toLowerCase() + ")");
            if (request.isGenerateVisuals()) {
                log.warn("generate_visuals requested; visual generation is not available, continuing without it");
                out.println("   Visuals: requested, not generated");
            }
            out.println();

            FutureYouOrchestrator orchestrator =
                    new FutureYouOrchestrator(clientFactory.apply(config.getModelSettings()), config.getModelSettings());
            orchestrator.setPipelineListener((sessionId, stage, detail) -> printStage(stage, detail, config));

            Session session = orchestrator.createSession(profile);
            SimulationResult result = orchestrator.simulateDecision(session, request.getDecision(), request.getTimelines());

            printSummary(result);

            out.print("\n📝 Writing results... ");
            SavedFiles saved = new SimulationReport(result, profile, request.getDecision())
                    .writeTo(config.getOutputDirectory(), config.getOutputFormat());
            out.println("✓");

            out.println("\n✅ Simulation complete!");
            out.println("   Output files:");
            if (saved.jsonResult() != null) {
                out.println("     - " + saved.jsonResult());
                out.println("     - " + saved.jsonSummary());
            }
            if (saved.markdownReport() != null) {
                out.println("     - " + saved.markdownReport());
            }

            if (collector != null) {
                collector.askForChosenPath(result, request.getDecision(), orchestrator);
            }
            return 0;

        } catch (ValidationException e) {
            err.println("\n❌ Input error: " + e.getMessage());
            log.debug("Input error details", e);
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (AgentException e) {
            err.println("\n❌ Simulation failed: " + e.getMessage());
            log.debug("Simulation error details", e);
            return 1;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("\nUsage: java -jar futureyou.jar [input-file] [options]");
        out.println();
        out.println("Arguments:");
        out.println("  input-file          JSON file with user_profile, decision, timelines (default: "
                + FutureYouConfig.DEFAULT_INPUT_FILE + ")");
        out.println();
        out.println("Options:");
        out.println("  --interactive, -i   Collect profile and decision on the console");
        out.println("  --output, -o        Output directory (default: " + FutureYouConfig.DEFAULT_OUTPUT_DIRECTORY + ")");
        out.println("  --format, -f        Output format: json|markdown|both (default: both)");
        out.println("  --check             Validate environment and input, then exit");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Examples:");
        out.println("  # Simulate the decision in futureyou_input.json");
        out.println("  java -jar futureyou.jar");
        out.println();
        out.println("  # Answer questions interactively and write a markdown report");
        out.println("  java -jar futureyou.jar --interactive --format markdown");
    }

    static FutureYouConfig parseArgs(String[] args, Map<String, String> environment) {
        FutureYouConfig config = new FutureYouConfig();
        boolean inputFileSeen = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output directory not specified");
                    }
                    config.setOutputDirectory(Paths.get(args[++i]));
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(args[++i].toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--config":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Config file not specified");
                    }
                    config.setConfigFile(Paths.get(args[++i]));
                    break;

                case "--interactive":
                case "-i":
                    config.setInteractive(true);
                    break;

                case "--check":
                    config.setCheckOnly(true);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    if (MODEL_OPTIONS.contains(args[i])) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Value not specified for " + args[i]);
                        }
                        // value is read by ConfigurationLoader
                        i++;
                    } else if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    } else if (!inputFileSeen) {
                        config.setInputFile(Paths.get(args[i]));
                        inputFileSeen = true;
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                    }
            }
        }

        config.setModelSettings(new ConfigurationLoader(environment).loadConfiguration(config.getConfigFile(), args));
        return config;
    }

    private void printStage(PipelineStage stage, String detail, FutureYouConfig config) {
        switch (stage) {
            case DNA_PENDING -> out.print("🧬 Extracting Decision DNA... ");
            case DNA_READY -> out.println("cached".equals(detail) ? "🧬 Using cached Decision DNA ✓" : "✓");
            case SCENARIOS_PENDING -> out.println("🌐 Simulating " + detail + " futures...");
            case SCENARIOS_READY -> out.println("   ✓ " + detail);
            case ANALYZED -> out.println("🔍 Analyzing scenarios... ✓");
            case ADVISED -> out.println("💡 Generating personalized advice... ✓");
            case PERSISTED -> {
                if (config.isVerbose()) {
                    out.println("💾 Session saved: " + detail);
                }
            }
            default -> {
                if (config.isVerbose()) {
                    out.println("   " + stage.getDescription() + " " + detail);
                }
            }
        }
    }

    private void printSummary(SimulationResult result) {
        DecisionDNA dna = result.decisionDna();

        out.println("\n" + "=".repeat(60));
        out.println("📊 FUTUREYOU SIMULATION RESULTS");
        out.println("=".repeat(60));

        out.println("\n🧬 YOUR DECISION DNA:");
        out.printf("   Risk Tolerance: %.2f (%s)%n", dna.riskTolerance(), dna.getRiskLabel());
        out.println("   Time Preference: " + dna.timeHorizonPreference());
        out.println("   Top Values: " + String.join(", ", dna.getTopValues(3)));

        out.println("\n🌐 FUTURE SCENARIOS (" + result.scenarios().size() + " generated):");
        for (FutureScenario scenario : result.scenarios()) {
            out.printf("   %-8s %4.0f%%  %s%n",
                    scenario.scenarioId(), scenario.probability() * 100, scenario.decisionPath());
        }

        out.println("\n🔍 ANALYSIS INSIGHTS:");
        out.println("   Best Match: " + result.analysis().bestScenario());
        out.println("   Risk Assessment: " + result.analysis().riskAnalysis());

        out.println("\n💡 PERSONALIZED ADVICE:");
        List<String> adviceLines = Arrays.asList(result.advice().split("\n"));
        adviceLines.stream()
                .limit(ADVICE_PREVIEW_LINES)
                .filter(line -> !line.isBlank())
                .forEach(line -> out.println("   " + line.strip()));
        if (adviceLines.size() > ADVICE_PREVIEW_LINES) {
            out.println("   ... (showing first " + ADVICE_PREVIEW_LINES + " lines of " + adviceLines.size()
                    + " total, see the report for the rest)");
        }
    }
}
