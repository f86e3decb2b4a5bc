package com.policysync.connector;

import com.policysync.contract.DeviceManagementResponse;
import com.policysync.contract.PolicyLevel;
import com.policysync.contract.PolicyMap;
import com.policysync.contract.PolicyScope;
import com.policysync.contract.PolicyType;
import com.policysync.controller.ControllerState;
import com.policysync.provider.MultiSourcePolicyProvider;
import com.policysync.support.FakeDeviceManagementService;
import com.policysync.support.FakeDeviceManagementService.RecordingFetchJob;
import com.policysync.support.FixedRandom;
import com.policysync.support.ManualWorkScheduler;
import com.policysync.support.MutableClock;
import com.policysync.transport.DeviceManagementStatus;
import com.policysync.transport.JobType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.policysync.support.PolicyFixtures.DIRECT;
import static com.policysync.support.PolicyFixtures.MAPPER;
import static com.policysync.support.PolicyFixtures.response;
import static org.junit.jupiter.api.Assertions.*;

class PolicyConnectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final FakeDeviceManagementService service = new FakeDeviceManagementService();
    private final List<ManualWorkScheduler> schedulers = new ArrayList<>();
    private PolicyConnector connector;

    @TempDir
    Path cacheDir;

    @AfterEach
    void tearDown() {
        if (connector != null) {
            connector.close();
        }
    }

    private PolicyConnector start(PolicySyncProperties.Identity user,
                                  PolicySyncProperties.Identity device,
                                  Path cacheDirectory) {
        PolicySyncProperties properties = new PolicySyncProperties(
            "http://dm.test/management", null, null, null, cacheDirectory, true, null, user, device);
        PolicySubsystemFactory factory = new PolicySubsystemFactory(
            service,
            MAPPER,
            properties,
            () -> {
                ManualWorkScheduler scheduler = new ManualWorkScheduler();
                schedulers.add(scheduler);
                return scheduler;
            },
            new MutableClock(NOW),
            new FixedRandom(0),
            DIRECT,
            DIRECT
        );
        connector = new PolicyConnector(factory, DIRECT);
        connector.start();
        return connector;
    }

    private static PolicySyncProperties.Identity enrolled(String token) {
        return new PolicySyncProperties.Identity("admin@example.com", "auth", token, "serial-1", "model-x", null);
    }

    private void runPendingWork() {
        for (ManualWorkScheduler scheduler : schedulers) {
            if (scheduler.hasPending()) {
                scheduler.runPending();
            }
        }
    }

    private RecordingFetchJob policyJobWithToken(String token) {
        List<RecordingFetchJob> jobs = service.jobs(JobType.POLICY_FETCH);
        for (int i = jobs.size() - 1; i >= 0; i--) {
            if (token.equals(jobs.get(i).dmToken())) {
                return jobs.get(i);
            }
        }
        throw new AssertionError("no policy job for " + token);
    }

    @Nested
    @DisplayName("Wiring")
    class Wiring {

        @Test
        void start_buildsBothDomainsAndLevels() {
            start(PolicySyncProperties.Identity.empty(), PolicySyncProperties.Identity.empty(), null);

            assertEquals(2, connector.subsystems().size());
            for (PolicyLevel level : PolicyLevel.values()) {
                MultiSourcePolicyProvider provider = connector.provider(level);
                assertEquals(List.of("user", "device"),
                    provider.caches().stream().map(c -> c.name()).toList());
            }
        }

        @Test
        void userPolicy_takesPrecedenceOverDevicePolicy() {
            start(enrolled("user-token"), enrolled("device-token"), null);
            runPendingWork();

            policyJobWithToken("device-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("Homepage", "device", "DeviceOnly", 1))));
            policyJobWithToken("user-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("Homepage", "user"))));

            PolicyMap policy = connector.provider(PolicyLevel.MANDATORY).getPolicy();
            assertEquals("user", policy.getValue("Homepage").orElseThrow());
            assertEquals(PolicyScope.USER, policy.get("Homepage").orElseThrow().scope());
            assertEquals(PolicyScope.MACHINE, policy.get("DeviceOnly").orElseThrow().scope());
        }

        @Test
        void cacheDirectory_receivesPersistedPolicy() {
            start(PolicySyncProperties.Identity.empty(), enrolled("device-token"), cacheDir);
            runPendingWork();

            policyJobWithToken("device-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("a", 1))));

            assertTrue(Files.exists(cacheDir.resolve("device-policy.json")));
        }

        @Test
        void valueStore_followsCombinedPolicy() {
            start(PolicySyncProperties.Identity.empty(), enrolled("device-token"), null);
            runPendingWork();

            policyJobWithToken("device-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("a", 1))));

            assertEquals(Optional.of(1), connector.valueStore(PolicyLevel.MANDATORY).getValue("a"));
            assertTrue(connector.valueStore(PolicyLevel.RECOMMENDED).snapshot().isEmpty());
        }
    }

    @Nested
    @DisplayName("Refresh")
    class Refresh {

        @Test
        void withoutCredentials_completesImmediately() {
            start(PolicySyncProperties.Identity.empty(), PolicySyncProperties.Identity.empty(), null);

            CompletableFuture<PolicyMap> result = connector.refreshPolicies(PolicyLevel.MANDATORY);

            assertTrue(result.isDone());
            assertTrue(result.join().isEmpty());
            assertTrue(connector.provider(PolicyLevel.MANDATORY).isInitializationComplete());
        }

        @Test
        void waitsForEnrolledDomainToFetch() {
            start(PolicySyncProperties.Identity.empty(), enrolled("device-token"), null);
            runPendingWork();
            policyJobWithToken("device-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("a", 1))));

            CompletableFuture<PolicyMap> result = connector.refreshPolicies(PolicyLevel.MANDATORY);
            assertFalse(result.isDone());

            runPendingWork();
            policyJobWithToken("device-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("a", 2))));

            assertEquals(2, result.join().getValue("a").orElseThrow());
        }

        @Test
        void close_failsOutstandingRefresh() {
            start(PolicySyncProperties.Identity.empty(), enrolled("device-token"), null);
            CompletableFuture<PolicyMap> result = connector.refreshPolicies(PolicyLevel.MANDATORY);

            connector.close();
            connector = null;

            CompletionException ex = assertThrows(CompletionException.class, result::join);
            assertInstanceOf(IllegalStateException.class, ex.getCause());
        }

        @Test
        void refreshBeforeStart_failsInsteadOfHanging() throws InterruptedException {
            ExecutorService sequence = Executors.newSingleThreadExecutor();
            try {
                PolicyConnector notStarted = new PolicyConnector(null, sequence);

                CompletableFuture<PolicyMap> result = notStarted.refreshPolicies(PolicyLevel.MANDATORY);

                ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> result.get(2, TimeUnit.SECONDS));
                assertInstanceOf(IllegalStateException.class, ex.getCause());
            } finally {
                sequence.shutdownNow();
            }
        }

        @Test
        void refreshAfterClose_fails() {
            start(PolicySyncProperties.Identity.empty(), PolicySyncProperties.Identity.empty(), null);
            connector.close();
            PolicyConnector closed = connector;
            connector = null;

            CompletableFuture<PolicyMap> result = closed.refreshPolicies(PolicyLevel.MANDATORY);

            CompletionException ex = assertThrows(CompletionException.class, result::join);
            assertInstanceOf(IllegalStateException.class, ex.getCause());
        }
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        void status_reflectsControllerAndCache() {
            start(PolicySyncProperties.Identity.empty(), enrolled("device-token"), null);
            runPendingWork();
            policyJobWithToken("device-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("a", 1, "b", 2))));

            SubsystemStatus status = connector.subsystem(PolicyType.DEVICE).status();

            assertEquals("device", status.domain());
            assertEquals(ControllerState.POLICY_VALID, status.controllerState());
            assertTrue(status.cacheReady());
            assertEquals(2, status.policyCount());
            assertEquals(NOW.toString(), status.lastRefreshTime());
        }

        @Test
        void reset_restartsEnrollment() {
            start(PolicySyncProperties.Identity.empty(), enrolled("device-token"), null);
            runPendingWork();
            policyJobWithToken("device-token").complete(DeviceManagementStatus.SUCCESS,
                DeviceManagementResponse.ofPolicies(response(NOW, Map.of("a", 1))));

            SubsystemStatus status = connector.reset(PolicyType.DEVICE).join();

            assertEquals(ControllerState.TOKEN_UNAVAILABLE, status.controllerState());
            assertNull(status.lastRefreshTime());
        }

        @Test
        void subsystemLookup_failsBeforeStart() {
            PolicyConnector notStarted = new PolicyConnector(null, DIRECT);
            assertThrows(IllegalStateException.class, () -> notStarted.subsystem(PolicyType.USER));
        }
    }
}
