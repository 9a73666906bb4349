package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One user's run: profile, extracted DNA, accumulated scenarios and conversation log.
 * A session is the unit stored in the memory bank.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Session {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("user_profile")
    private UserProfile userProfile;

    @Setter(AccessLevel.NONE)
    @JsonProperty("decision_dna")
    private DecisionDNA decisionDna;

    @Builder.Default
    @JsonProperty("scenarios")
    private List<FutureScenario> scenarios = new ArrayList<>();

    @Builder.Default
    @JsonProperty("conversation_history")
    private List<ConversationTurn> conversationHistory = new ArrayList<>();

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public boolean hasDecisionDna() {
        return decisionDna != null;
    }

    /**
     * Attaches the profiled DNA. A session is profiled at most once.
     */
    public void attachDecisionDna(DecisionDNA dna) {
        if (decisionDna != null) {
            throw new IllegalStateException("Decision DNA already attached to session " + sessionId);
        }
        this.decisionDna = dna;
    }

    public void addConversationTurn(String role, String text) {
        conversationHistory.add(new ConversationTurn(role, text));
    }
}
