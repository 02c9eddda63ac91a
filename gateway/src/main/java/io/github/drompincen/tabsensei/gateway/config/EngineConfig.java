package io.github.drompincen.tabsensei.gateway.config;

import io.github.drompincen.tabsensei.runtime.config.EngineSettings;
import io.github.drompincen.tabsensei.runtime.context.ContextLoop;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class EngineConfig {

    @Bean
    EngineSettings engineSettings(
            @Value("${tabsensei.query.timeout:30s}") Duration queryTimeout,
            @Value("${tabsensei.reasoning.request-timeout:60s}") Duration reasoningTimeout,
            @Value("${tabsensei.panel.send-timeout:35s}") Duration panelSendTimeout,
            @Value("${tabsensei.reminder.min-lead:60s}") Duration minLead,
            @Value("${tabsensei.reminder.recurrence-days:30}") int recurrenceDays,
            @Value("${tabsensei.reasoning.base-url:http://localhost:8000}") String reasoningBaseUrl) {
        return new EngineSettings(queryTimeout, reasoningTimeout, panelSendTimeout, minLead, recurrenceDays,
                URI.create(reasoningBaseUrl));
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "close")
    ContextLoop coordinatorLoop() {
        return ContextLoop.create("coordinator");
    }
}
