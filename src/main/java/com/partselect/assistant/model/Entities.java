package com.partselect.assistant.model;

import java.util.Locale;

/**
 * Part and model identifiers pulled out of a message. Either may be null.
 */
public record Entities(String part, String model) {

    private static final Entities EMPTY = new Entities(null, null);

    public static Entities empty() {
        return EMPTY;
    }

    public boolean hasPart() {
        return part != null && !part.isBlank();
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    /**
     * Fills the missing fields from the given fallbacks, keeping values already present.
     */
    public Entities orElse(String fallbackPart, String fallbackModel) {
        return new Entities(
                hasPart() ? part : blankToNull(fallbackPart),
                hasModel() ? model : blankToNull(fallbackModel));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim().toUpperCase(Locale.ROOT);
    }
}
