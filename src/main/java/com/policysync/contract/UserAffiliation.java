package com.policysync.contract;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UserAffiliation {
    MANAGED("managed"),
    NONE("none");

    private final String value;

    UserAffiliation(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
