package com.partselect.assistant.model;

/**
 * Named fields of a session record, keyed by their wire names.
 */
public enum SessionField {
    LAST_INTENT("last_intent"),
    LAST_PART("last_part"),
    LAST_MODEL("last_model"),
    LAST_SWITCH_REFUSED_FOR("last_switch_refused_for");

    private final String key;

    SessionField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @return the field for a wire name, or null when the name is not a session field
     */
    public static SessionField fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (SessionField field : values()) {
            if (field.key.equals(key)) {
                return field;
            }
        }
        return null;
    }
}
