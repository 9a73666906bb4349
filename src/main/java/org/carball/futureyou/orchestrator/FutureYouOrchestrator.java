package org.carball.futureyou.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.ai.AdvisorAgent;
import org.carball.futureyou.ai.AnalyzerAgent;
import org.carball.futureyou.ai.ModelClient;
import org.carball.futureyou.ai.ProfilerAgent;
import org.carball.futureyou.ai.SimulatorAgent;
import org.carball.futureyou.config.ModelSettings;
import org.carball.futureyou.memory.MemoryBank;
import org.carball.futureyou.model.AnalysisResult;
import org.carball.futureyou.model.DecisionDNA;
import org.carball.futureyou.model.FutureScenario;
import org.carball.futureyou.model.Session;
import org.carball.futureyou.model.SimulationResult;
import org.carball.futureyou.model.UserProfile;
import org.carball.futureyou.tracker.DecisionRecord;
import org.carball.futureyou.tracker.DecisionTracker;
import org.carball.futureyou.validation.InputValidator;
import org.carball.futureyou.validation.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Drives one decision run end to end: DNA extraction (once per session), one simulation per
 * timeline, analysis, advice, then a snapshot into the memory bank.
 *
 * <p>The first stage failure ends the run and propagates unchanged. Scenarios from a failed run
 * never reach the session or the memory bank; only a freshly extracted DNA stays cached on the
 * session. Repeated timelines are simulated once, at their first position.</p>
 */
@Slf4j
public class FutureYouOrchestrator {

    private final ProfilerAgent profiler;
    private final SimulatorAgent simulator;
    private final AnalyzerAgent analyzer;
    private final AdvisorAgent advisor;
    private final MemoryBank memoryBank;
    private final DecisionTracker tracker;
    private final Clock clock;

    private PipelineListener listener = PipelineListener.NONE;
    private long lastSessionMillis;

    public FutureYouOrchestrator(ModelClient modelClient, ModelSettings settings) {
        this(new ProfilerAgent(modelClient, settings),
                new SimulatorAgent(modelClient, settings),
                new AnalyzerAgent(modelClient, settings),
                new AdvisorAgent(modelClient, settings),
                new MemoryBank(),
                new DecisionTracker(),
                Clock.systemDefaultZone());
    }

    public FutureYouOrchestrator(ProfilerAgent profiler, SimulatorAgent simulator, AnalyzerAgent analyzer,
                                 AdvisorAgent advisor, MemoryBank memoryBank, DecisionTracker tracker,
                                 Clock clock) {
        this.profiler = profiler;
        this.simulator = simulator;
        this.analyzer = analyzer;
        this.advisor = advisor;
        this.memoryBank = memoryBank;
        this.tracker = tracker;
        this.clock = clock;
        log.info("FutureYou orchestrator initialized");
    }

    public void setPipelineListener(PipelineListener listener) {
        this.listener = listener == null ? PipelineListener.NONE : listener;
    }

    /**
     * Creates a session for a validated profile. Ids are {@code session_<epochMillis>} and
     * strictly increasing within this orchestrator even when two sessions share a millisecond.
     */
    public synchronized Session createSession(UserProfile profile) {
        InputValidator.validateProfile(profile);

        long millis = Math.max(clock.millis(), lastSessionMillis + 1);
        lastSessionMillis = millis;

        Session session = Session.builder()
                .sessionId("session_" + millis)
                .userProfile(profile)
                .createdAt(LocalDateTime.now(clock))
                .build();

        log.info("Created session {} for user {}", session.getSessionId(), profile.getUserId());
        stage(session, PipelineStage.CREATED, profile.getUserId());
        return session;
    }

    /**
     * Returns the session's DNA, calling the profiler only when none is attached yet.
     */
    public DecisionDNA ensureDecisionDna(Session session) {
        if (session.hasDecisionDna()) {
            log.info("Using cached Decision DNA for session {}", session.getSessionId());
            stage(session, PipelineStage.DNA_READY, "cached");
            return session.getDecisionDna();
        }

        stage(session, PipelineStage.DNA_PENDING, session.getUserProfile().getUserId());
        DecisionDNA dna = profiler.analyzeProfile(session.getUserProfile());
        session.attachDecisionDna(dna);
        stage(session, PipelineStage.DNA_READY, dna.getRiskLabel() + " risk");
        return dna;
    }

    public SimulationResult simulateDecision(Session session, String decision, List<String> timelines) {
        if (session == null) {
            throw new ValidationException("Session is required");
        }
        String validDecision = InputValidator.validateDecision(decision);
        List<String> requested = InputValidator.validateTimelines(timelines);
        List<String> validTimelines = List.copyOf(new LinkedHashSet<>(requested));
        if (validTimelines.size() < requested.size()) {
            log.warn("Ignoring repeated timelines in {}, simulating {}", requested, validTimelines);
        }

        log.info("Starting decision simulation for session {} over {}", session.getSessionId(), validTimelines);

        DecisionDNA dna = ensureDecisionDna(session);

        List<FutureScenario> allScenarios = new ArrayList<>();
        for (String timeline : validTimelines) {
            stage(session, PipelineStage.SCENARIOS_PENDING, timeline);
            allScenarios.addAll(simulator.simulateFutures(validDecision, dna, timeline));
        }
        stage(session, PipelineStage.SCENARIOS_READY, allScenarios.size() + " scenarios");

        AnalysisResult analysis = analyzer.analyzeScenarios(allScenarios, dna);
        stage(session, PipelineStage.ANALYZED, analysis.bestScenario());

        String advice = advisor.generateAdvice(analysis, dna);
        stage(session, PipelineStage.ADVISED, "");

        session.setScenarios(new ArrayList<>(allScenarios));
        memoryBank.save(session);
        stage(session, PipelineStage.PERSISTED, session.getSessionId());

        log.info("Decision simulation completed for session {}", session.getSessionId());
        return new SimulationResult(dna, allScenarios, analysis, advice, session.getSessionId());
    }

    public DecisionRecord trackDecision(String decision, String chosenPath, String reasoning) {
        return tracker.logDecision(decision, chosenPath, reasoning);
    }

    public List<DecisionRecord> getDecisionHistory() {
        return tracker.getDecisionHistory();
    }

    public Optional<Session> getSession(String sessionId) {
        return memoryBank.get(sessionId);
    }

    public List<Session> getUserHistory(String userId) {
        return memoryBank.history(userId);
    }

    private void stage(Session session, PipelineStage stage, String detail) {
        log.debug("Session {} -> {} {}", session.getSessionId(), stage, detail);
        listener.onStage(session.getSessionId(), stage, detail);
    }
}
