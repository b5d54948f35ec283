package com.contextgraph.models;

public final class PolicyStep extends ChainStep {

    private final String policyId;
    private final String version;
    private final PolicyResult result;
    private final String message;

    public PolicyStep(int step, String policyId, String version, PolicyResult result, String message) {
        super(step, "policy_check", "Policy " + policyId + " " + result);
        this.policyId = policyId;
        this.version = version;
        this.result = result;
        this.message = message;
    }

    public String getPolicyId() {
        return policyId;
    }

    public String getVersion() {
        return version;
    }

    public PolicyResult getResult() {
        return result;
    }

    public String getMessage() {
        return message;
    }
}
