package com.partselect.assistant.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One arm of the intent cascade: a set of substring cues and, optionally, a
 * vocabulary matched against whole whitespace tokens.
 */
public record IntentRule(IntentType type, double confidence, List<String> cues, Set<String> tokenVocabulary) {

    public IntentRule {
        cues = cues == null ? List.of() : List.copyOf(cues);
        tokenVocabulary = tokenVocabulary == null ? Set.of() : Set.copyOf(tokenVocabulary);
    }

    public static IntentRule of(IntentType type, double confidence, String... cues) {
        return new IntentRule(type, confidence, List.of(cues), Set.of());
    }

    /**
     * @param lowered message already lower-cased
     */
    public boolean matches(String lowered) {
        if (lowered == null) {
            return false;
        }
        for (String cue : cues) {
            if (lowered.contains(cue)) {
                return true;
            }
        }
        if (!tokenVocabulary.isEmpty()) {
            for (String token : lowered.split("\\s+")) {
                if (tokenVocabulary.contains(token.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    public IntentResult toResult() {
        return new IntentResult(type, confidence);
    }
}
