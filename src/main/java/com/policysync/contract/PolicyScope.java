package com.policysync.contract;

public enum PolicyScope {
    MACHINE,
    USER
}
