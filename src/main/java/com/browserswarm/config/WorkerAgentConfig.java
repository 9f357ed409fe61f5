package com.browserswarm.config;

import com.browserswarm.agent.BrowserAgent;
import com.browserswarm.agent.ClaimClient;
import com.browserswarm.agent.ToolCallParser;
import com.browserswarm.automation.AutomationClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Worker role: browser agent over the automation client, plus the claim client.
 */
@Configuration
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "true")
public class WorkerAgentConfig {

    @Bean
    public AutomationClient automationClient(SwarmProperties properties, ObjectMapper objectMapper) {
        return new AutomationClient(properties.getAutomation(), objectMapper);
    }

    @Bean
    public ClaimClient claimClient(RestClient.Builder restClientBuilder, SwarmProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(5));
        requestFactory.setReadTimeout(Duration.ofSeconds(10));
        return new ClaimClient(restClientBuilder.requestFactory(requestFactory).build(),
                properties.getWorker().getCoordinatorUrl());
    }

    @Bean
    public BrowserAgent browserAgent(ChatClient chatClient,
                                     AutomationClient automationClient,
                                     ClaimClient claimClient,
                                     ObjectMapper objectMapper,
                                     SwarmProperties properties) {
        return new BrowserAgent(chatClient, automationClient, claimClient, new ToolCallParser(objectMapper),
                properties.getWorker());
    }
}
