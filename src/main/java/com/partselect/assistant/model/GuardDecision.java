package com.partselect.assistant.model;

/**
 * Result of the appliance-context guard for one turn.
 *
 * @param outcome          what the router should do
 * @param currentAppliance the declared context of the turn
 * @param otherAppliance   appliance kind named in the message when it differs from the context, else null
 */
public record GuardDecision(Outcome outcome, String currentAppliance, String otherAppliance) {

    public enum Outcome {
        /** Message names no other appliance kind. */
        NONE,
        /** Refusal marker seen; acknowledge and stop. */
        REFUSAL_ACK,
        /** Other appliance named and not yet refused; suggest a switch and stop. */
        SWITCH_SUGGESTION,
        /** Other appliance named but already refused; continue in the current context. */
        PROCEED_SILENTLY
    }

    public boolean isTerminal() {
        return outcome == Outcome.REFUSAL_ACK || outcome == Outcome.SWITCH_SUGGESTION;
    }

    public boolean proceedsSilently() {
        return outcome == Outcome.PROCEED_SILENTLY;
    }

    /**
     * Appliance kind catalog lookups should lean towards for this turn.
     */
    public String applianceHint() {
        return proceedsSilently() && otherAppliance != null ? otherAppliance : currentAppliance;
    }
}
