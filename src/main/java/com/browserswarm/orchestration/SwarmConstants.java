package com.browserswarm.orchestration;

public final class SwarmConstants {

    private SwarmConstants() {
    }

    // Event types
    public static final String EVENT_STATUS = "status";
    public static final String EVENT_ERROR = "error";
    public static final String EVENT_SNAPSHOT = "snapshot";
    public static final String EVENT_RUN_STATUS = "run-status";
    public static final String EVENT_CLAIM = "claim";
    public static final String EVENT_AGENT_RESULT = "agent-result";
    public static final String EVENT_RUN_COMPLETE = "run-complete";
    public static final String EVENT_POOL_STATUS = "pool-status";

    // Synthesis fallbacks
    public static final String NO_PLAN_MESSAGE = "No task plan found.";
    public static final String NO_RESULTS_MESSAGE = "No results collected from agents.";
    public static final String RESULTS_HEADING = "## Results\n\n";
    public static final String AGENT_LABEL_PREFIX = "Agent ";
    public static final String NONE_CLAIMED = "none yet";

    public static final String PLANNING_SYSTEM_PROMPT = """
            Analyze the user request and determine how to execute it with multiple browser agents.

            Determine:
            1. task_type: One of:
               - "pre_assigned": The user specified exact items (e.g., "look up Stripe, Airbnb, Dropbox")
               - "dynamic_discovery": The user wants N items but didn't specify which (e.g., "find 5 YC companies")
               - "comparative": The user wants to compare and find the best (e.g., "which YC company has highest valuation")

            2. target_count: How many items/agents needed (1-%d)

            3. For pre_assigned: List the specific sub-tasks, one per agent
               For dynamic_discovery: Provide the base task each agent should do
               For comparative: Provide both base task and comparison criteria

            Respond only with JSON:
            {
                "task_type": "pre_assigned" | "dynamic_discovery" | "comparative",
                "target_count": <number>,
                "sub_tasks": ["task1", "task2"],
                "base_task": "...",
                "comparison_criteria": "..."
            }

            Examples:

            Input: "Look up Stripe, Airbnb, and Coinbase"
            Output: {"task_type": "pre_assigned", "target_count": 3, "sub_tasks": ["Research Stripe company - find their valuation, founders, and what they do", "Research Airbnb company - find their valuation, founders, and what they do", "Research Coinbase company - find their valuation, founders, and what they do"]}

            Input: "Find 5 YC companies"
            Output: {"task_type": "dynamic_discovery", "target_count": 5, "base_task": "Find and research one YC company. Look up their valuation, founders, and what they do. Pick a company that hasn't been claimed yet."}

            Input: "Which YC company has the highest valuation?"
            Output: {"task_type": "comparative", "target_count": 6, "base_task": "Find and research one YC company. Focus on finding their current valuation.", "comparison_criteria": "highest valuation"}
            """;

    public static final String PLANNING_USER_TEMPLATE = """
            User request: "{input}"
            """;

    public static final String SYNTHESIS_SYSTEM_PROMPT = """
            You combine research results gathered by parallel browser agents into one answer for the user.
            Only use facts present in the results. Mention when a result is missing or uncertain.
            """;

    public static final String SUMMARY_USER_TEMPLATE = """
            Summarize these research results into a cohesive response.

            Original request: "{input}"

            Results from research:
            {results}

            Provide a clear, organized summary of all findings. Use a table format if appropriate.
            """;

    public static final String COMPARATIVE_USER_TEMPLATE = """
            Based on these research results, answer the user's original question.

            Original question: "{input}"
            Comparison criteria: {criterion}

            Results from research:
            {results}

            Provide a clear answer identifying the winner based on the comparison criteria, with supporting evidence from the research. Rank the candidates.
            """;

    public static final String DYNAMIC_AGENT_TEMPLATE = """
            %s

            IMPORTANT: Before researching any target, you must claim it first to avoid duplicates.
            Already claimed by other agents: %s

            To claim a target, include in your response:
            CLAIM: <target name>

            Only proceed with research after your claim is confirmed.
            If your claim is rejected (target already taken), try a different one.

            You are Agent %d of %d.""";
}
