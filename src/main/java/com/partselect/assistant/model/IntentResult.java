package com.partselect.assistant.model;

/**
 * Coarse intent label with the confidence of the rule that produced it.
 */
public record IntentResult(IntentType type, double confidence) {

    public IntentResult {
        if (type == null) {
            type = IntentType.GENERAL_HELP;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
