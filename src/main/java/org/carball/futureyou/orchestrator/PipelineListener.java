package org.carball.futureyou.orchestrator;

/**
 * Receives every stage transition of a run. {@code detail} is stage specific
 * (the timeline being simulated, the scenario count...) and may be empty.
 */
@FunctionalInterface
public interface PipelineListener {

    PipelineListener NONE = (sessionId, stage, detail) -> { };

    void onStage(String sessionId, PipelineStage stage, String detail);
}
