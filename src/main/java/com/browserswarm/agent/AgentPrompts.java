package com.browserswarm.agent;

final class AgentPrompts {

    private AgentPrompts() {
    }

    static final String SYSTEM_PROMPT = """
            You are a helpful browser automation assistant. You can control a web browser to help users accomplish tasks.

            ## Available Tools
            %s

            ## How to Use Tools
            When you need to perform an action in the browser, respond with a JSON tool call in this exact format:
            ```json
            {"tool": "tool_name", "arguments": {"param1": "value1"}}
            ```

            ## Important Guidelines
            1. Always start by taking a snapshot (browser_snapshot) to see what's on the page
            2. Use the element references from snapshots when clicking or typing
            3. After performing an action, take another snapshot to see the result
            4. Explain what you're doing and what happened
            5. When the task asks you to claim a target, write the claim line before any tool call

            When you have the answer, reply without a tool call.
            """;

    static final String TOOL_FAILED = "Tool '%s' failed with error: %s";
    static final String TOOL_RESULT = "Tool '%s' executed. Result:\n```\n%s\n```";
    static final String TOOL_EMPTY_RESULT = "Tool '%s' executed successfully.";
    static final String IMAGE_FOLLOW_UP = "I've included a screenshot of the current page. Describe what you see and continue with the task if needed.";
    static final String TEXT_FOLLOW_UP = "Summarize what happened. If you need to perform more actions, include another tool call.";
    static final String FINAL_SUMMARY = "You have used all available browser actions. Provide a final summary of your findings.";
    static final String CLAIM_CONFIRMED = "Your claim for '%s' is confirmed. Proceed with the research.";
    static final String CLAIM_REJECTED = "Your claim for '%s' was rejected: another agent already took it. Choose a different target and claim it with a new CLAIM line.";
}
