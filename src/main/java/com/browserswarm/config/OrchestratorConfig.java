package com.browserswarm.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(SwarmProperties properties,
                                 ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider,
                                 ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        if (properties.getAiProvider() == SwarmProperties.AiProvider.OPENAI) {
            OpenAiChatModel openAiChatModel = openAiChatModelProvider.getIfAvailable();
            if (openAiChatModel != null) {
                return ChatClient.builder(openAiChatModel)
                        .defaultOptions(OpenAiChatOptions.builder().model(properties.getOpenai().getModel()).build())
                        .build();
            }
            log.warn("OpenAI provider selected but no OpenAI chat model is configured; falling back to Google GenAI.");
        }
        GoogleGenAiChatModel googleGenAiChatModel = googleGenAiChatModelProvider.getIfAvailable();
        if (googleGenAiChatModel == null) {
            throw new IllegalStateException("No chat model configured for provider " + properties.getAiProvider());
        }
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool();
    }
}
