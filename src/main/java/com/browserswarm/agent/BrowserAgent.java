package com.browserswarm.agent;

import static com.browserswarm.agent.AgentPrompts.*;

import com.browserswarm.automation.AutomationClient;
import com.browserswarm.automation.ImageAttachment;
import com.browserswarm.automation.OperationResult;
import com.browserswarm.config.SwarmProperties;
import com.browserswarm.orchestration.service.ClaimExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.content.Media;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.lang.Nullable;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Worker-side reasoning loop. The model either answers or asks for one browser operation at a
 * time; operation results are fed back until it answers or the step budget runs out.
 * Claims found in the model's output are posted to the coordinator before work continues.
 */
@Slf4j
public class BrowserAgent {

    private final ChatClient chatClient;
    private final AutomationClient automationClient;
    private final ClaimClient claimClient;
    private final ToolCallParser toolCallParser;
    private final SwarmProperties.Worker config;
    private final ReentrantLock busy = new ReentrantLock();
    private volatile boolean connected;

    public BrowserAgent(ChatClient chatClient,
                        AutomationClient automationClient,
                        ClaimClient claimClient,
                        ToolCallParser toolCallParser,
                        SwarmProperties.Worker config) {
        this.chatClient = chatClient;
        this.automationClient = automationClient;
        this.claimClient = claimClient;
        this.toolCallParser = toolCallParser;
        this.config = config;
    }

    /**
     * Runs one instruction to completion.
     *
     * @throws AgentBusyException when another instruction is still running on this worker
     */
    public String execute(String instruction) {
        if (!busy.tryLock()) {
            throw new AgentBusyException(config.getId());
        }
        try {
            ensureConnected();
            return runLoop(instruction);
        } finally {
            busy.unlock();
        }
    }

    public boolean isBusy() {
        return busy.isLocked();
    }

    private String runLoop(String instruction) {
        String systemPrompt = SYSTEM_PROMPT.formatted(describeOperations());
        List<Message> messages = new ArrayList<>();
        messages.add(new UserMessage(instruction));
        String reply = ask(systemPrompt, messages);

        String acceptedClaim = null;
        int claimAttempts = 0;
        int steps = 0;
        while (true) {
            String claim = ClaimExtractor.extract(reply);
            if (claim != null && acceptedClaim == null && claimAttempts < config.getMaxClaimAttempts()) {
                claimAttempts++;
                ClaimDecision decision = claimClient.claim(config.getId(), claim);
                if (!decision.approved() && decision.reachable()) {
                    messages.add(new AssistantMessage(reply));
                    messages.add(new UserMessage(CLAIM_REJECTED.formatted(claim)));
                    reply = ask(systemPrompt, messages);
                    continue;
                }
                if (!decision.reachable()) {
                    log.warn("Proceeding with unconfirmed claim '{}'.", claim);
                }
                acceptedClaim = claim;
                if (toolCallParser.parse(reply) == null) {
                    messages.add(new AssistantMessage(reply));
                    messages.add(new UserMessage(CLAIM_CONFIRMED.formatted(claim)));
                    reply = ask(systemPrompt, messages);
                    continue;
                }
            }

            ToolCall call = toolCallParser.parse(reply);
            if (call == null) {
                break;
            }
            messages.add(new AssistantMessage(reply));
            if (steps >= config.getMaxToolSteps()) {
                log.info("Step budget of {} operations used; requesting final summary.", config.getMaxToolSteps());
                messages.add(new UserMessage(FINAL_SUMMARY));
                reply = ask(systemPrompt, messages);
                break;
            }
            steps++;
            log.info("Executing operation {} ({}/{}).", call.operation(), steps, config.getMaxToolSteps());
            OperationResult result = automationClient.callOperation(call.operation(), call.arguments());
            messages.add(toolResultMessage(call.operation(), result));
            reply = ask(systemPrompt, messages);
        }
        return withClaimLine(reply, acceptedClaim);
    }

    private String ask(String systemPrompt, List<Message> messages) {
        String content = chatClient.prompt()
                .system(systemPrompt)
                .messages(messages)
                .call()
                .content();
        return content != null ? content : "";
    }

    private Message toolResultMessage(String operation, OperationResult result) {
        StringBuilder text = new StringBuilder();
        if (result.isError()) {
            text.append(TOOL_FAILED.formatted(operation, result.error()));
        } else if (StringUtils.hasText(result.text())) {
            text.append(TOOL_RESULT.formatted(operation, result.text()));
        } else {
            text.append(TOOL_EMPTY_RESULT.formatted(operation));
        }
        text.append("\n\n").append(result.images().isEmpty() ? TEXT_FOLLOW_UP : IMAGE_FOLLOW_UP);
        if (result.images().isEmpty()) {
            return new UserMessage(text.toString());
        }
        List<Media> media = new ArrayList<>();
        for (ImageAttachment image : result.images()) {
            media.add(new Media(MimeTypeUtils.parseMimeType(image.mimeType()), new ByteArrayResource(image.data())));
        }
        log.debug("Attaching {} image(s) from {}.", media.size(), operation);
        return UserMessage.builder().text(text.toString()).media(media).build();
    }

    private String describeOperations() {
        return automationClient.operations().stream()
                .map(operation -> "- **" + operation.name() + "**: " + operation.description())
                .collect(Collectors.joining("\n"));
    }

    private static String withClaimLine(String answer, @Nullable String acceptedClaim) {
        if (acceptedClaim == null) {
            return answer;
        }
        String reported = ClaimExtractor.extract(answer);
        if (reported != null && reported.equalsIgnoreCase(acceptedClaim)) {
            return answer;
        }
        return "CLAIM: " + acceptedClaim + "\n\n" + answer;
    }

    private void ensureConnected() {
        if (!connected) {
            automationClient.connect();
            connected = true;
        }
    }
}
