package org.carball.futureyou.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.model.Session;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local store of session snapshots keyed by session id.
 *
 * <p>Snapshots are deep copies taken through Jackson, so mutating a live {@link Session}
 * after {@link #save(Session)} does not change what is stored until it is saved again.</p>
 */
@Slf4j
public class MemoryBank {

    private final Map<String, byte[]> sessions = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;

    public MemoryBank() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }

    /**
     * Stores a snapshot under the session id, replacing any earlier one.
     */
    public synchronized void save(Session session) {
        if (session == null || session.getSessionId() == null) {
            throw new IllegalArgumentException("Session and session id are required");
        }
        try {
            sessions.put(session.getSessionId(), objectMapper.writeValueAsBytes(session));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to snapshot session " + session.getSessionId(), e);
        }
        log.info("Session {} saved", session.getSessionId());
    }

    public synchronized Optional<Session> get(String sessionId) {
        byte[] snapshot = sessions.get(sessionId);
        return snapshot == null ? Optional.empty() : Optional.of(restore(sessionId, snapshot));
    }

    /**
     * All stored sessions whose profile belongs to {@code userId}, in save order.
     */
    public synchronized List<Session> history(String userId) {
        List<Session> result = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : sessions.entrySet()) {
            Session session = restore(entry.getKey(), entry.getValue());
            if (session.getUserProfile() != null && userId != null
                    && userId.equals(session.getUserProfile().getUserId())) {
                result.add(session);
            }
        }
        return result;
    }

    public synchronized int size() {
        return sessions.size();
    }

    private Session restore(String sessionId, byte[] snapshot) {
        try {
            return objectMapper.readValue(snapshot, Session.class);
        } catch (IOException e) {
            throw new PersistenceException("Failed to restore session " + sessionId, e);
        }
    }
}
