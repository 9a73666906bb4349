package org.carball.futureyou.tracker;

import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.validation.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only log of the decisions users went on to make. Independent of the simulation pipeline.
 */
@Slf4j
public class DecisionTracker {

    private final List<DecisionRecord> decisionsLog = new ArrayList<>();
    private final Clock clock;

    public DecisionTracker() {
        this(Clock.systemDefaultZone());
    }

    public DecisionTracker(Clock clock) {
        this.clock = clock;
    }

    public synchronized DecisionRecord logDecision(String decision, String chosenPath, String reasoning) {
        if (decision == null || decision.isBlank()) {
            throw new ValidationException("Decision must not be empty");
        }
        if (chosenPath == null || chosenPath.isBlank()) {
            throw new ValidationException("Chosen path must not be empty");
        }

        DecisionRecord entry = new DecisionRecord(LocalDateTime.now(clock), decision, chosenPath,
                reasoning == null ? "" : reasoning);
        decisionsLog.add(entry);
        log.info("Decision logged: {} -> {}", decision, chosenPath);
        return entry;
    }

    public synchronized List<DecisionRecord> getDecisionHistory() {
        return Collections.unmodifiableList(new ArrayList<>(decisionsLog));
    }
}
