package com.policysync.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policysync.scheduler.TaskSchedulerWorkScheduler;
import com.policysync.transport.DeviceManagementService;
import com.policysync.transport.HttpDeviceManagementService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.random.RandomGenerator;

@Configuration
public class PolicySyncConfiguration {

    /**
     * The policy sequence. One thread: controllers, caches and providers rely
     * on it instead of locking.
     */
    @Bean
    public ThreadPoolTaskScheduler policySequence() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("policy-sequence-");
        scheduler.setRemoveOnCancelPolicy(true);
        // The connector shuts down on this thread after the context-closed event.
        scheduler.setAcceptTasksAfterContextClose(true);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor policyIo() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("policy-io-");
        executor.setAcceptTasksAfterContextClose(true);
        return executor;
    }

    @Bean
    public Clock policyClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate policyRestTemplate(RestTemplateBuilder builder, PolicySyncProperties properties) {
        return builder
            .setConnectTimeout(properties.requestTimeout())
            .setReadTimeout(properties.requestTimeout())
            .build();
    }

    @Bean
    public DeviceManagementService deviceManagementService(RestTemplate policyRestTemplate,
                                                           PolicySyncProperties properties,
                                                           ObjectMapper objectMapper,
                                                           @Qualifier("policyIo") ThreadPoolTaskExecutor policyIo,
                                                           @Qualifier("policySequence") ThreadPoolTaskScheduler policySequence) {
        return new HttpDeviceManagementService(
            policyRestTemplate, properties.serverUrl(), objectMapper, policyIo, policySequence);
    }

    @Bean
    public PolicySubsystemFactory policySubsystemFactory(DeviceManagementService deviceManagementService,
                                                         ObjectMapper objectMapper,
                                                         PolicySyncProperties properties,
                                                         Clock policyClock,
                                                         @Qualifier("policyIo") ThreadPoolTaskExecutor policyIo,
                                                         @Qualifier("policySequence") ThreadPoolTaskScheduler policySequence) {
        return new PolicySubsystemFactory(
            deviceManagementService,
            objectMapper,
            properties,
            () -> new TaskSchedulerWorkScheduler(policySequence, policyClock),
            policyClock,
            RandomGenerator.getDefault(),
            policyIo,
            policySequence
        );
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public PolicyConnector policyConnector(PolicySubsystemFactory policySubsystemFactory,
                                           @Qualifier("policySequence") ThreadPoolTaskScheduler policySequence) {
        return new PolicyConnector(policySubsystemFactory, policySequence);
    }
}
