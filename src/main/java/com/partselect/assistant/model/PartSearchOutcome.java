package com.partselect.assistant.model;

/**
 * Explicit result of the keyword-triggered part search step.
 * {@link Status#FAILED} tells the router to continue with the next stage.
 */
public record PartSearchOutcome(Status status, String response) {

    public enum Status { FOUND, NO_MATCH, FAILED }

    public static PartSearchOutcome found(String response) {
        return new PartSearchOutcome(Status.FOUND, response);
    }

    public static PartSearchOutcome noMatch(String response) {
        return new PartSearchOutcome(Status.NO_MATCH, response);
    }

    public static PartSearchOutcome failed() {
        return new PartSearchOutcome(Status.FAILED, null);
    }

    public boolean isTerminal() {
        return status != Status.FAILED;
    }
}
