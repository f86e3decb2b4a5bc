package com.policysync.connector;

import com.policysync.contract.UserAffiliation;
import com.policysync.controller.RefreshSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings bound from {@code policy-sync.*}. Missing values fall back to the
 * defaults of {@link RefreshSettings}; a missing cache directory keeps cached
 * policy in memory only.
 */
@ConfigurationProperties(prefix = "policy-sync")
public record PolicySyncProperties(
    String serverUrl,
    Duration refreshRate,
    Duration errorDelay,
    List<String> unmanagedDomains,
    Path cacheDirectory,
    boolean waitForPolicyFetch,
    Duration requestTimeout,
    Identity user,
    Identity device
) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public PolicySyncProperties {
        if (serverUrl == null || serverUrl.isBlank()) {
            serverUrl = "http://localhost:8090/management";
        }
        refreshRate = refreshRate != null ? refreshRate : RefreshSettings.DEFAULT_REFRESH_RATE;
        errorDelay = errorDelay != null ? errorDelay : RefreshSettings.DEFAULT_ERROR_DELAY;
        unmanagedDomains = unmanagedDomains != null ? List.copyOf(unmanagedDomains) : RefreshSettings.DEFAULT_UNMANAGED_DOMAINS;
        requestTimeout = requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        user = user != null ? user : Identity.empty();
        device = device != null ? device : Identity.empty();
    }

    public RefreshSettings refreshSettings() {
        return new RefreshSettings(refreshRate, errorDelay, unmanagedDomains);
    }

    /**
     * Credentials a subsystem starts with. Normally these arrive from a sign-in
     * flow; configuring them lets a headless client enroll on its own.
     */
    public record Identity(
        String userName,
        String authToken,
        String deviceToken,
        String machineId,
        String machineModel,
        UserAffiliation affiliation
    ) {

        public static Identity empty() {
            return new Identity(null, null, null, null, null, null);
        }
    }
}
