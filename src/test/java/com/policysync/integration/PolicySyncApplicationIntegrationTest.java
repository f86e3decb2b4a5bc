package com.policysync.integration;

import com.policysync.connector.PolicyConnector;
import com.policysync.connector.PolicySyncProperties;
import com.policysync.contract.PolicyLevel;
import com.policysync.contract.PolicyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the whole application without credentials: no request ever reaches a
 * management server, but every surface must still answer.
 */
@SpringBootTest(properties = {
    "policy-sync.server-url=http://127.0.0.1:9/management",
    "policy-sync.refresh-rate=1h"
})
@AutoConfigureMockMvc
class PolicySyncApplicationIntegrationTest {

    @Autowired PolicyConnector connector;
    @Autowired PolicySyncProperties properties;
    @Autowired MockMvc mockMvc;

    @Test
    @DisplayName("Configuration reaches the controllers")
    void configuredRefreshRate_isApplied() throws Exception {
        assertEquals(Duration.ofHours(1), properties.refreshRate());

        Duration rate = connector.onSequence(
            () -> connector.subsystem(PolicyType.USER).controller().getRefreshRate())
            .get(5, TimeUnit.SECONDS);

        assertEquals(Duration.ofHours(1), rate);
    }

    @Test
    @DisplayName("Refresh without credentials completes with empty policy")
    void refreshWithoutCredentials_completes() throws Exception {
        assertTrue(connector.refreshPolicies(PolicyLevel.RECOMMENDED).get(5, TimeUnit.SECONDS).isEmpty());

        MvcResult pending = mockMvc.perform(post("/v1/policies/refresh").param("level", "mandatory"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.level").value("mandatory"))
            .andExpect(jsonPath("$.initialization_complete").value(true))
            .andExpect(jsonPath("$.pending_caches").value(0));
    }

    @Test
    @DisplayName("Status lists both domains")
    void status_listsDomains() throws Exception {
        MvcResult pending = mockMvc.perform(get("/v1/policies/status"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].domain").value("device"))
            .andExpect(jsonPath("$[1].domain").value("user"));
    }

    @Test
    @DisplayName("Single domain status uses snake_case fields")
    void domainStatus_isServed() throws Exception {
        MvcResult pending = mockMvc.perform(get("/v1/policies/status/user"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.domain").value("user"))
            .andExpect(jsonPath("$.controller_state").exists())
            .andExpect(jsonPath("$.cache_ready").exists());
    }

    @Test
    @DisplayName("Unknown domain is rejected with 404")
    void unknownDomain_isNotFound() throws Exception {
        mockMvc.perform(get("/v1/policies/status/printer"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("UNKNOWN_DOMAIN"));
    }

    @Test
    @DisplayName("Unknown level is rejected with 400")
    void unknownLevel_isBadRequest() throws Exception {
        mockMvc.perform(get("/v1/policies").param("level", "optional"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }
}
