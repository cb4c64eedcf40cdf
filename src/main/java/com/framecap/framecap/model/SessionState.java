package com.framecap.framecap.model;

/**
 * Externally visible session state, reported as closed | opened | capturing
 */
public enum SessionState {
    CLOSED("closed"),
    OPEN("opened"),
    CAPTURING("capturing");

    private final String label;

    SessionState(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
