package com.policysync.contract;

import java.util.Objects;

/**
 * A single policy value together with its level and scope. The value is opaque
 * to the sync engine; it is compared with {@link Object#equals(Object)} only.
 */
public record PolicyEntry(PolicyLevel level, PolicyScope scope, Object value) {

    public PolicyEntry {
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(scope, "scope is required");
    }

    public static PolicyEntry mandatory(PolicyScope scope, Object value) {
        return new PolicyEntry(PolicyLevel.MANDATORY, scope, value);
    }

    public static PolicyEntry recommended(PolicyScope scope, Object value) {
        return new PolicyEntry(PolicyLevel.RECOMMENDED, scope, value);
    }
}
