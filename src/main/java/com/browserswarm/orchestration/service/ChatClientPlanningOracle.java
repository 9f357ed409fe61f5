package com.browserswarm.orchestration.service;

import static com.browserswarm.orchestration.SwarmConstants.*;

import com.browserswarm.config.SwarmProperties;
import com.browserswarm.orchestration.OracleFailureException;
import com.browserswarm.orchestration.api.PlanningOracle;
import com.browserswarm.orchestration.model.PlanDraft;
import com.browserswarm.orchestration.model.TaskMode;
import com.browserswarm.orchestration.model.TaskPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@Slf4j
public class ChatClientPlanningOracle implements PlanningOracle {

    private final ChatClient chatClient;
    private final SwarmPromptService promptService;
    private final PlanDraftReader planDraftReader;
    private final SwarmProperties properties;

    public ChatClientPlanningOracle(ChatClient chatClient,
                                    SwarmPromptService promptService,
                                    PlanDraftReader planDraftReader,
                                    SwarmProperties properties) {
        this.chatClient = chatClient;
        this.promptService = promptService;
        this.planDraftReader = planDraftReader;
        this.properties = properties;
    }

    @Override
    public TaskPlan plan(String instruction) {
        String response;
        try {
            response = chatClient.prompt()
                    .system(promptService.planningSystemPrompt(properties.effectiveMaxAgents()))
                    .user(user -> user.text(PLANNING_USER_TEMPLATE).param("input", instruction))
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            throw new OracleFailureException("Planning model unavailable: " + ex.getMessage(), ex);
        }
        PlanDraft draft = planDraftReader.read(response);
        if (draft == null) {
            throw new OracleFailureException("Planning model returned no parseable plan");
        }
        return toPlan(instruction, draft);
    }

    private TaskPlan toPlan(String instruction, PlanDraft draft) {
        TaskMode mode = TaskMode.fromWireName(draft.taskType());
        if (mode == null) {
            throw new OracleFailureException("Unknown task type: " + draft.taskType());
        }
        int targetCount = draft.targetCount() != null ? draft.targetCount() : 1;
        return switch (mode) {
            case PRE_ASSIGNED -> {
                List<String> subTasks = draft.subTasks() == null ? List.of()
                        : draft.subTasks().stream().filter(StringUtils::hasText).toList();
                if (subTasks.isEmpty()) {
                    throw new OracleFailureException("Pre-assigned plan without sub tasks");
                }
                yield TaskPlan.preAssigned(instruction, subTasks);
            }
            case DYNAMIC_DISCOVERY -> TaskPlan.dynamicDiscovery(instruction, targetCount, baseTask(instruction, draft));
            case COMPARATIVE -> TaskPlan.comparative(instruction, targetCount, baseTask(instruction, draft),
                    StringUtils.hasText(draft.comparisonCriteria()) ? draft.comparisonCriteria() : instruction);
        };
    }

    private String baseTask(String instruction, PlanDraft draft) {
        return StringUtils.hasText(draft.baseTask()) ? draft.baseTask() : instruction;
    }
}
