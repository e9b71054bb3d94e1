package com.partselect.assistant.model;

public record CompatibilityResult(boolean compatible, String message) {
}
