package com.partselect.assistant.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Partial update of a session record. Only fields that were set are applied;
 * setting a field to null clears it.
 */
public final class SessionUpdate {

    private final EnumMap<SessionField, Object> values = new EnumMap<>(SessionField.class);

    public static SessionUpdate create() {
        return new SessionUpdate();
    }

    /**
     * Builds an update from wire field names. Names that are not session fields are ignored.
     */
    public static SessionUpdate fromMap(Map<String, ?> fields) {
        SessionUpdate update = new SessionUpdate();
        if (fields == null) {
            return update;
        }
        fields.forEach((key, value) -> {
            SessionField field = SessionField.fromKey(key);
            if (field == null) {
                return;
            }
            if (field == SessionField.LAST_INTENT) {
                update.values.put(field, value instanceof IntentType type
                        ? type
                        : value == null ? null : IntentType.fromLabel(String.valueOf(value)));
            } else {
                update.values.put(field, value == null ? null : String.valueOf(value));
            }
        });
        return update;
    }

    public SessionUpdate lastIntent(IntentType intent) {
        values.put(SessionField.LAST_INTENT, intent);
        return this;
    }

    public SessionUpdate lastPart(String part) {
        values.put(SessionField.LAST_PART, part);
        return this;
    }

    public SessionUpdate lastModel(String model) {
        values.put(SessionField.LAST_MODEL, model);
        return this;
    }

    public SessionUpdate lastSwitchRefusedFor(String appliance) {
        values.put(SessionField.LAST_SWITCH_REFUSED_FOR, appliance);
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<SessionField, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "SessionUpdate" + values;
    }
}
