package com.policysync.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.policysync.contract.DeviceManagementRequest;
import com.policysync.contract.DeviceManagementResponse;
import com.policysync.contract.UserAffiliation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Talks to the management server over HTTP with JSON bodies.
 *
 * Requests block on the I/O executor; completions are handed back to the
 * policy sequence. HTTP codes are translated with
 * {@link DeviceManagementStatus#fromHttpStatus(int)}.
 */
public class HttpDeviceManagementService implements DeviceManagementService {

    private static final Logger log = LoggerFactory.getLogger(HttpDeviceManagementService.class);

    static final String DM_TOKEN_AUTH_PREFIX = "DMToken token=";
    static final String AUTH_TOKEN_PREFIX = "Bearer ";

    private final RestTemplate restTemplate;
    private final String serverUrl;
    private final ObjectMapper objectMapper;
    private final Executor ioExecutor;
    private final Executor sequence;

    public HttpDeviceManagementService(RestTemplate restTemplate,
                                       String serverUrl,
                                       ObjectMapper objectMapper,
                                       Executor ioExecutor,
                                       Executor sequence) {
        this.restTemplate = restTemplate;
        this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl is required");
        this.objectMapper = objectMapper;
        this.ioExecutor = ioExecutor;
        this.sequence = sequence;
    }

    @Override
    public FetchJob createJob(JobType type) {
        return new HttpFetchJob(type);
    }

    private record Outcome(DeviceManagementStatus status, DeviceManagementResponse response) {
        static Outcome failure(DeviceManagementStatus status) {
            return new Outcome(status, DeviceManagementResponse.empty());
        }
    }

    private Outcome execute(HttpFetchJob job) {
        URI uri = UriComponentsBuilder.fromHttpUrl(serverUrl)
            .queryParam("request", job.type.getRequestParameter())
            .queryParam("deviceid", job.clientId)
            .queryParam("user_affiliation", job.affiliation.getValue())
            .build()
            .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (!job.dmToken.isEmpty()) {
            headers.set(HttpHeaders.AUTHORIZATION, DM_TOKEN_AUTH_PREFIX + job.dmToken);
        } else if (!job.authToken.isEmpty()) {
            headers.set(HttpHeaders.AUTHORIZATION, AUTH_TOKEN_PREFIX + job.authToken);
        }

        ResponseEntity<String> entity;
        try {
            entity = restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(job.request, headers), String.class);
        } catch (RestClientResponseException ex) {
            int code = ex.getStatusCode().value();
            log.warn("Management server answered {} to {} request", code, job.type);
            return Outcome.failure(DeviceManagementStatus.fromHttpStatus(code));
        } catch (RestClientException ex) {
            log.warn("{} request to management server failed: {}", job.type, ex.getMessage());
            return Outcome.failure(DeviceManagementStatus.REQUEST_FAILED);
        }

        DeviceManagementStatus status = DeviceManagementStatus.fromHttpStatus(entity.getStatusCode().value());
        if (status != DeviceManagementStatus.SUCCESS) {
            return Outcome.failure(status);
        }
        String body = entity.getBody();
        if (body == null || body.isBlank()) {
            return Outcome.failure(DeviceManagementStatus.RESPONSE_DECODING_ERROR);
        }
        try {
            return new Outcome(status, objectMapper.readValue(body, DeviceManagementResponse.class));
        } catch (JsonProcessingException ex) {
            log.warn("Could not parse {} response: {}", job.type, ex.getOriginalMessage());
            return Outcome.failure(DeviceManagementStatus.RESPONSE_DECODING_ERROR);
        }
    }

    private class HttpFetchJob implements FetchJob {

        private final JobType type;
        private String dmToken = "";
        private String authToken = "";
        private String clientId = "";
        private UserAffiliation affiliation = UserAffiliation.NONE;
        private DeviceManagementRequest request;
        private boolean started;
        private volatile boolean cancelled;

        HttpFetchJob(JobType type) {
            this.type = type;
        }

        @Override
        public JobType type() {
            return type;
        }

        @Override
        public FetchJob setDmToken(String dmToken) {
            this.dmToken = dmToken != null ? dmToken : "";
            return this;
        }

        @Override
        public FetchJob setAuthToken(String authToken) {
            this.authToken = authToken != null ? authToken : "";
            return this;
        }

        @Override
        public FetchJob setClientId(String clientId) {
            this.clientId = clientId != null ? clientId : "";
            return this;
        }

        @Override
        public FetchJob setUserAffiliation(UserAffiliation affiliation) {
            this.affiliation = affiliation != null ? affiliation : UserAffiliation.NONE;
            return this;
        }

        @Override
        public FetchJob setRequest(DeviceManagementRequest request) {
            this.request = request;
            return this;
        }

        @Override
        public DeviceManagementRequest request() {
            return request;
        }

        @Override
        public void start(Callback callback) {
            if (started) {
                throw new IllegalStateException(type + " job was already started");
            }
            if (request == null) {
                throw new IllegalStateException(type + " job has no request");
            }
            started = true;
            ioExecutor.execute(() -> {
                if (cancelled) {
                    return;
                }
                Outcome outcome = execute(this);
                sequence.execute(() -> {
                    if (!cancelled) {
                        callback.onJobCompleted(outcome.status(), outcome.response());
                    }
                });
            });
        }

        @Override
        public void cancel() {
            cancelled = true;
        }
    }
}
