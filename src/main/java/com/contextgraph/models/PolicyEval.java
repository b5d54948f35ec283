package com.contextgraph.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One policy evaluation outcome. Re-evaluation is a legitimate event, so a run
 * may carry several evaluations of the same policy in evaluation order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyEval {

    private String policyId;
    private String version;
    private PolicyResult result;
    private String inputsHash;
    private String message;

    public PolicyEval() {
    }

    public PolicyEval(String policyId, String version, PolicyResult result, String message) {
        this.policyId = policyId;
        this.version = version;
        this.result = result;
        this.message = message;
    }

    public String getPolicyId() {
        return policyId;
    }

    public void setPolicyId(String policyId) {
        this.policyId = policyId;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public PolicyResult getResult() {
        return result;
    }

    public void setResult(PolicyResult result) {
        this.result = result;
    }

    public String getInputsHash() {
        return inputsHash;
    }

    public void setInputsHash(String inputsHash) {
        this.inputsHash = inputsHash;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
