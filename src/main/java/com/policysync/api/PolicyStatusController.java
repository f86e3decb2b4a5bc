package com.policysync.api;

import com.policysync.connector.PolicyConnector;
import com.policysync.connector.PolicySubsystem;
import com.policysync.connector.PolicySyncProperties;
import com.policysync.connector.SubsystemStatus;
import com.policysync.contract.PolicyLevel;
import com.policysync.contract.PolicyType;
import com.policysync.provider.MultiSourcePolicyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * REST surface over the policy connector.
 *
 * GET  /v1/policies?level=mandatory        combined policy of one level
 * POST /v1/policies/refresh?level=...      fetch every source, then return the combined policy
 * GET  /v1/policies/status                 state of every domain
 * GET  /v1/policies/status/{domain}        state of one domain
 * POST /v1/policies/status/{domain}/reset  drop the domain's enrollment
 *
 * Reads hop onto the policy sequence, so every response is asynchronous.
 */
@RestController
@RequestMapping("/v1/policies")
public class PolicyStatusController {

    private static final Logger log = LoggerFactory.getLogger(PolicyStatusController.class);

    private final PolicyConnector connector;
    private final PolicySyncProperties properties;

    public PolicyStatusController(PolicyConnector connector, PolicySyncProperties properties) {
        this.connector = connector;
        this.properties = properties;
    }

    @GetMapping
    public CompletableFuture<PolicySnapshot> getPolicies(
            @RequestParam(defaultValue = "mandatory") String level) {
        PolicyLevel policyLevel = PolicyLevel.fromValue(level);
        return connector.onSequence(() -> snapshot(policyLevel));
    }

    @PostMapping("/refresh")
    public CompletableFuture<PolicySnapshot> refresh(
            @RequestParam(defaultValue = "mandatory") String level) {
        PolicyLevel policyLevel = PolicyLevel.fromValue(level);
        log.info("Policy refresh requested for level={}", policyLevel.getValue());
        return connector.refreshPolicies(policyLevel)
            .orTimeout(properties.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .thenCompose(ignored -> connector.onSequence(() -> snapshot(policyLevel)));
    }

    @GetMapping("/status")
    public CompletableFuture<List<SubsystemStatus>> getStatus() {
        return connector.onSequence(() -> connector.subsystems().stream()
            .map(PolicySubsystem::status)
            .toList());
    }

    @GetMapping("/status/{domain}")
    public CompletableFuture<SubsystemStatus> getDomainStatus(@PathVariable String domain) {
        PolicyType type = resolve(domain);
        return connector.onSequence(() -> connector.subsystem(type).status());
    }

    @PostMapping("/status/{domain}/reset")
    public CompletableFuture<SubsystemStatus> resetDomain(@PathVariable String domain) {
        PolicyType type = resolve(domain);
        log.info("Resetting {} policy enrollment", type.getDomain());
        return connector.reset(type);
    }

    private PolicySnapshot snapshot(PolicyLevel level) {
        MultiSourcePolicyProvider provider = connector.provider(level);
        return new PolicySnapshot(
            level,
            provider.isInitializationComplete(),
            provider.pendingCacheCount(),
            provider.getPolicy()
        );
    }

    private static PolicyType resolve(String domain) {
        return PolicyType.fromDomain(domain)
            .orElseThrow(() -> new UnknownPolicyDomainException(domain));
    }
}
