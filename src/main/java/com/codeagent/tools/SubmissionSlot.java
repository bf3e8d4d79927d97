package com.codeagent.tools;

/** Holds the artifact handed to the terminal tool. One slot per task. */
public final class SubmissionSlot {

    private String artifact;
    private boolean submitted;

    public void submit(String value) {
        this.artifact = value != null ? value : "";
        this.submitted = true;
    }

    public boolean isSubmitted() { return submitted; }

    public String artifact() { return artifact; }
}
