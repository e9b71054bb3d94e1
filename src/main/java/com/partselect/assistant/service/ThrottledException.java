package com.partselect.assistant.service;

/**
 * Raised when the language model keeps throttling after every retry.
 */
public class ThrottledException extends RuntimeException {
    public ThrottledException(String m) { super(m); }

    public ThrottledException(String m, Throwable c) { super(m, c); }
}
