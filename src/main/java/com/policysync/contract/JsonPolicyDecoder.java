package com.policysync.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the JSON {@link PolicyData} document carried in a fetch response.
 *
 * Every decoded entry gets the scope this decoder was built for. Entries without
 * an explicit mode are mandatory.
 */
public class JsonPolicyDecoder implements PolicyDecoder {

    private final ObjectMapper objectMapper;
    private final PolicyScope scope;

    public JsonPolicyDecoder(ObjectMapper objectMapper, PolicyScope scope) {
        this.objectMapper = objectMapper;
        this.scope = scope;
    }

    @Override
    public DecodedPolicy decode(PolicyFetchResponse response) {
        if (response == null || response.policyData() == null || response.policyData().isBlank()) {
            throw new PolicyDecodeException("policy_data is missing");
        }

        PolicyData data;
        try {
            data = objectMapper.readValue(response.policyData(), PolicyData.class);
        } catch (JsonProcessingException ex) {
            throw new PolicyDecodeException("policy_data is not a valid document: " + ex.getOriginalMessage(), ex);
        }
        if (data.timestamp() == null) {
            throw new PolicyDecodeException("policy_data.timestamp is required");
        }

        Map<String, PolicyEntry> entries = new LinkedHashMap<>();
        if (data.policyValue() != null) {
            data.policyValue().forEach((name, spec) -> {
                if (spec == null || spec.value() == null) {
                    throw new PolicyDecodeException("policy_value." + name + " has no value");
                }
                PolicyLevel level = spec.mode() != null ? spec.mode() : PolicyLevel.MANDATORY;
                entries.put(name, new PolicyEntry(level, scope, spec.value()));
            });
        }

        PublicKeyVersion keyVersion = data.publicKeyVersion() != null
            ? PublicKeyVersion.of(data.publicKeyVersion())
            : PublicKeyVersion.invalid();

        return new DecodedPolicy(
            PolicyMap.of(entries),
            Instant.ofEpochMilli(data.timestamp()),
            keyVersion,
            Boolean.TRUE.equals(data.machineIdMissing())
        );
    }
}
