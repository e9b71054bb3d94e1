package com.partselect.assistant.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Intent labels produced by classification and by the turn router.
 * The wire label is what clients see in {@code intent} and {@code memory.last_intent}.
 */
public enum IntentType {
    COMPATIBILITY("compatibility"),
    INSTALLATION("installation"),
    SYMPTOM("symptom"),
    PART_LOOKUP("part_lookup"),
    GENERAL_HELP("general_help"),
    PART_SEARCH("part_search"),
    // turn-only labels, never produced by the classifier
    ACK_REFUSE("ack_refuse"),
    SWITCH_SUGGESTION("switch_suggestion");

    private final String label;

    IntentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static IntentType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (IntentType type : values()) {
            if (type.label.equalsIgnoreCase(label.trim())) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
