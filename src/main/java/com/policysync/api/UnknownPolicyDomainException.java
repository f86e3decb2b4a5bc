package com.policysync.api;

public class UnknownPolicyDomainException extends RuntimeException {

    public UnknownPolicyDomainException(String domain) {
        super("unknown policy domain: " + domain);
    }
}
