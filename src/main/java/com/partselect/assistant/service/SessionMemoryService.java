package com.partselect.assistant.service;

import com.partselect.assistant.model.IntentType;
import com.partselect.assistant.model.SessionField;
import com.partselect.assistant.model.SessionSnapshot;
import com.partselect.assistant.model.SessionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session structured memory. Records are created lazily and live for the
 * lifetime of the process. Each record carries its own lock, so different
 * sessions never contend.
 */
@Service
public class SessionMemoryService {

    private static final Logger logger = LoggerFactory.getLogger(SessionMemoryService.class);

    private final ConcurrentHashMap<String, SessionState> sessions = new ConcurrentHashMap<>();

    /**
     * Never fails; an unseen id yields a snapshot with every field null.
     */
    public SessionSnapshot get(String sessionId) {
        return state(sessionId).snapshot();
    }

    /**
     * Overwrites only the fields present in the update and returns the resulting snapshot.
     */
    public SessionSnapshot update(String sessionId, SessionUpdate update) {
        SessionState state = state(sessionId);
        if (update == null || update.isEmpty()) {
            return state.snapshot();
        }
        SessionSnapshot result = state.apply(update);
        update.values().forEach((field, value) ->
                logger.info("Memory [{}]: set {} = {}", sessionId, field.key(), value));
        return result;
    }

    /**
     * Wire-name variant; names that are not session fields are ignored.
     */
    public SessionSnapshot update(String sessionId, Map<String, ?> fields) {
        return update(sessionId, SessionUpdate.fromMap(fields));
    }

    int sessionCount() {
        return sessions.size();
    }

    private SessionState state(String sessionId) {
        return sessions.computeIfAbsent(sessionId == null ? "" : sessionId, id -> new SessionState());
    }

    private static final class SessionState {
        private IntentType lastIntent;
        private String lastPart;
        private String lastModel;
        private String lastSwitchRefusedFor;

        synchronized SessionSnapshot snapshot() {
            return new SessionSnapshot(lastIntent, lastPart, lastModel, lastSwitchRefusedFor);
        }

        synchronized SessionSnapshot apply(SessionUpdate update) {
            for (Map.Entry<SessionField, Object> entry : update.values().entrySet()) {
                Object value = entry.getValue();
                switch (entry.getKey()) {
                    case LAST_INTENT:
                        lastIntent = (IntentType) value;
                        break;
                    case LAST_PART:
                        lastPart = canonical((String) value);
                        break;
                    case LAST_MODEL:
                        lastModel = canonical((String) value);
                        break;
                    case LAST_SWITCH_REFUSED_FOR:
                        lastSwitchRefusedFor = (String) value;
                        break;
                    default:
                        break;
                }
            }
            return snapshot();
        }

        private static String canonical(String code) {
            return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
        }
    }
}
