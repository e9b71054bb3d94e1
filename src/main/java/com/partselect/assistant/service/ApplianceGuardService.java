package com.partselect.assistant.service;

import com.partselect.assistant.model.GuardDecision;
import com.partselect.assistant.model.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Detects messages about an appliance kind other than the declared context and
 * decides between suggesting a switch and staying quiet because the user declined.
 */
@Service
public class ApplianceGuardService {

    private static final Logger logger = LoggerFactory.getLogger(ApplianceGuardService.class);

    public static final String REFUSAL_MARKER = "user refused switch";

    /** Checked in insertion order; the first kind with a hit is the one reported. */
    static final Map<String, List<String>> APPLIANCE_VOCABULARY;

    static {
        Map<String, List<String>> vocabulary = new LinkedHashMap<>();
        vocabulary.put(CatalogVocabulary.REFRIGERATOR, List.of("fridge", "refrigerator", "freezer"));
        vocabulary.put(CatalogVocabulary.DISHWASHER, List.of("dishwasher", "dish washer"));
        APPLIANCE_VOCABULARY = vocabulary;
    }

    public GuardDecision evaluate(String message, String currentAppliance, SessionSnapshot memory) {
        String q = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (q.contains(REFUSAL_MARKER)) {
            return new GuardDecision(GuardDecision.Outcome.REFUSAL_ACK, currentAppliance, null);
        }

        String other = otherAppliance(q, currentAppliance);
        if (other == null) {
            return new GuardDecision(GuardDecision.Outcome.NONE, currentAppliance, null);
        }
        String refusedFor = memory == null ? null : memory.lastSwitchRefusedFor();
        if (!Objects.equals(refusedFor, other)) {
            logger.info("Cross-appliance query detected ('{}'); suggesting a switch.", other);
            return new GuardDecision(GuardDecision.Outcome.SWITCH_SUGGESTION, currentAppliance, other);
        }
        logger.info("User previously refused switching to {}; proceeding in the {} context.", other, currentAppliance);
        return new GuardDecision(GuardDecision.Outcome.PROCEED_SILENTLY, currentAppliance, other);
    }

    /**
     * @return the first appliance kind named in the text, or null when it is the current one or none is named
     */
    static String otherAppliance(String lowered, String currentAppliance) {
        for (Map.Entry<String, List<String>> kind : APPLIANCE_VOCABULARY.entrySet()) {
            if (kind.getValue().stream().anyMatch(lowered::contains)) {
                return kind.getKey().equals(currentAppliance) ? null : kind.getKey();
            }
        }
        return null;
    }

    public String acknowledgement(String currentAppliance) {
        return "Got it, staying with your current " + currentAppliance + " context.";
    }

    public String switchSuggestion(String otherAppliance) {
        return "It sounds like you’re asking about a <strong>" + otherAppliance + "</strong>. "
                + "You can say “switch to " + otherAppliance + "” or click the switch button to change context.";
    }

    public String stayNote(String otherAppliance) {
        return "\n\n(You mentioned <strong>" + otherAppliance + "</strong> but chose to stay. "
                + "You can switch anytime with the floating toggle.)";
    }
}
