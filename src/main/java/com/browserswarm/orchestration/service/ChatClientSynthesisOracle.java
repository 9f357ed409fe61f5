package com.browserswarm.orchestration.service;

import static com.browserswarm.orchestration.SwarmConstants.*;

import com.browserswarm.orchestration.OracleFailureException;
import com.browserswarm.orchestration.api.SynthesisOracle;
import com.browserswarm.orchestration.model.AgentRunResult;
import com.browserswarm.orchestration.model.TaskMode;
import com.browserswarm.orchestration.model.TaskPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@Slf4j
public class ChatClientSynthesisOracle implements SynthesisOracle {

    private final ChatClient chatClient;
    private final SwarmPromptService promptService;

    public ChatClientSynthesisOracle(ChatClient chatClient, SwarmPromptService promptService) {
        this.chatClient = chatClient;
        this.promptService = promptService;
    }

    @Override
    public String synthesize(TaskPlan plan, List<AgentRunResult> results) {
        String resultsText = promptService.resultsText(results);
        String response;
        try {
            ChatClient.ChatClientRequestSpec request = chatClient.prompt().system(SYNTHESIS_SYSTEM_PROMPT);
            if (plan.mode() == TaskMode.COMPARATIVE) {
                String criterion = plan.comparisonCriterion() != null ? plan.comparisonCriterion() : "";
                request = request.user(user -> user.text(COMPARATIVE_USER_TEMPLATE)
                        .param("input", plan.instruction())
                        .param("criterion", criterion)
                        .param("results", resultsText));
            } else {
                request = request.user(user -> user.text(SUMMARY_USER_TEMPLATE)
                        .param("input", plan.instruction())
                        .param("results", resultsText));
            }
            response = request.call().content();
        } catch (RuntimeException ex) {
            throw new OracleFailureException("Synthesis model unavailable: " + ex.getMessage(), ex);
        }
        if (!StringUtils.hasText(response)) {
            throw new OracleFailureException("Synthesis model returned an empty answer");
        }
        log.info("Synthesized answer from {} results.", results.size());
        return response;
    }
}
