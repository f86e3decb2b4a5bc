package com.policysync.controller;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Timing and domain settings shared by the controllers of one connector.
 *
 * @param refreshRate      period between successful refreshes; also the backoff cap
 * @param errorDelay       first retry delay after an error, doubled on each further error
 * @param unmanagedDomains user domains known never to be managed; no registration is attempted
 */
public record RefreshSettings(Duration refreshRate, Duration errorDelay, List<String> unmanagedDomains) {

    public static final Duration DEFAULT_REFRESH_RATE = Duration.ofHours(3);
    public static final Duration DEFAULT_ERROR_DELAY = Duration.ofMinutes(5);
    public static final List<String> DEFAULT_UNMANAGED_DOMAINS = List.of("gmail.com", "googlemail.com");

    public RefreshSettings {
        if (refreshRate == null || refreshRate.isNegative() || refreshRate.isZero()) {
            throw new IllegalArgumentException("refreshRate must be positive");
        }
        if (errorDelay == null || errorDelay.isNegative() || errorDelay.isZero()) {
            throw new IllegalArgumentException("errorDelay must be positive");
        }
        unmanagedDomains = unmanagedDomains == null
            ? List.of()
            : unmanagedDomains.stream().map(d -> d.toLowerCase(Locale.ROOT)).toList();
    }

    public static RefreshSettings defaults() {
        return new RefreshSettings(DEFAULT_REFRESH_RATE, DEFAULT_ERROR_DELAY, DEFAULT_UNMANAGED_DOMAINS);
    }

    /** False for an empty user name or one in a domain known not to be managed. */
    public boolean canBeInManagedDomain(String userName) {
        if (userName == null || userName.isEmpty()) {
            return false;
        }
        String lower = userName.toLowerCase(Locale.ROOT);
        for (String domain : unmanagedDomains) {
            if (lower.endsWith("@" + domain)) {
                return false;
            }
        }
        return true;
    }
}
