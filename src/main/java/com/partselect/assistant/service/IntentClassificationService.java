package com.partselect.assistant.service;

import com.partselect.assistant.model.IntentResult;
import com.partselect.assistant.model.IntentRule;
import com.partselect.assistant.model.IntentType;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword cascade assigning one coarse intent per message. The first matching rule wins.
 */
@Service
public class IntentClassificationService {

    public static final Set<String> PART_NAME_VOCABULARY = Set.of(
            "rack", "basket", "wheel", "roller", "gasket", "seal", "pump", "motor",
            "hose", "tube", "inlet", "valve", "filter", "water", "drain", "panel",
            "handle", "latch", "door", "shelf", "bin", "drawer", "crisper", "light",
            "bulb", "heating", "element", "thermostat", "sensor", "board", "control"
    );

    /** Evaluated top to bottom; reordering changes classification. */
    public static final List<IntentRule> RULE_CASCADE = List.of(
            IntentRule.of(IntentType.COMPATIBILITY, 0.95, "compatible", "fit", "work with"),
            IntentRule.of(IntentType.INSTALLATION, 0.9, "how to", "install", "replace", "remove"),
            IntentRule.of(IntentType.SYMPTOM, 0.9, "leaking", "not cooling", "not draining", "loud noise",
                    "won't start", "ice maker not working"),
            new IntentRule(IntentType.PART_LOOKUP, 0.8,
                    List.of("find", "need", "buy", "part for", "looking for"), PART_NAME_VOCABULARY)
    );

    public static final IntentResult DEFAULT_RESULT = new IntentResult(IntentType.GENERAL_HELP, 0.7);

    public IntentResult classify(String message) {
        String lowered = message == null ? "" : message.toLowerCase(Locale.ROOT);
        for (IntentRule rule : RULE_CASCADE) {
            if (rule.matches(lowered)) {
                return rule.toResult();
            }
        }
        return DEFAULT_RESULT;
    }
}
