package org.carball.futureyou.orchestrator;

/**
 * States a session passes through during one decision run.
 */
public enum PipelineStage {
    CREATED("Session created"),
    DNA_PENDING("Extracting Decision DNA"),
    DNA_READY("Decision DNA ready"),
    SCENARIOS_PENDING("Simulating future scenarios"),
    SCENARIOS_READY("Scenarios ready"),
    ANALYZED("Scenarios analyzed"),
    ADVISED("Advice generated"),
    PERSISTED("Session saved");

    private final String description;

    PipelineStage(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
