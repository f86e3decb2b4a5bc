package com.policysync.transport;

public enum JobType {
    REGISTRATION("register"),
    POLICY_FETCH("policy");

    private final String requestParameter;

    JobType(String requestParameter) {
        this.requestParameter = requestParameter;
    }

    /** Value of the {@code request} query parameter sent to the server. */
    public String getRequestParameter() {
        return requestParameter;
    }
}
