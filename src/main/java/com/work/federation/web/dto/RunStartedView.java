package com.work.federation.web.dto;

public class RunStartedView {

    private String runId;
    private String role;

    public RunStartedView() {
    }

    public RunStartedView(String runId, String role) {
        this.runId = runId;
        this.role = role;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }
}
