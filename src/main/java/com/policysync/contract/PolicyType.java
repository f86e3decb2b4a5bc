package com.policysync.contract;

import java.util.Optional;

/**
 * Policy domain managed by one controller. The wire value is sent as the
 * fetch request's policy type and also names the domain in the REST surface.
 */
public enum PolicyType {
    DEVICE("device", "policysync/device", PolicyScope.MACHINE),
    USER("user", "policysync/user", PolicyScope.USER);

    private final String domain;
    private final String wireValue;
    private final PolicyScope scope;

    PolicyType(String domain, String wireValue, PolicyScope scope) {
        this.domain = domain;
        this.wireValue = wireValue;
        this.scope = scope;
    }

    public String getDomain() {
        return domain;
    }

    public String getWireValue() {
        return wireValue;
    }

    public PolicyScope getScope() {
        return scope;
    }

    public static Optional<PolicyType> fromDomain(String domain) {
        for (PolicyType type : values()) {
            if (type.domain.equalsIgnoreCase(domain)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
