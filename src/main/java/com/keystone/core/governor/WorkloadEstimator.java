package com.keystone.core.governor;

import com.keystone.core.model.RiskTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword heuristics estimating how many steps and tool calls a goal needs.
 * Shared by the risk assessor (budget-breach signal) and the Plan stage.
 */
public class WorkloadEstimator {

    private static final Pattern RESEARCH = words("research", "investigate", "find", "search", "look up",
            "compare", "survey");
    private static final Pattern CODE = words("code", "script", "implement", "build", "program", "automate");
    private static final Pattern FILES = words("file", "document", "report", "spreadsheet", "dataset", "csv");
    private static final Pattern OUTBOUND = words("send", "email", "post", "publish", "upload");

    public record Projection(int steps, int toolCalls) {}

    public Projection estimate(String goal, RiskTier tier) {
        String text = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        int steps = TransitionTable.nominalPath(tier).size();
        int toolCalls = 0;
        if (RESEARCH.matcher(text).find()) {
            steps += 2;
            toolCalls++;
        }
        if (CODE.matcher(text).find()) {
            steps += 2;
            toolCalls++;
        }
        if (FILES.matcher(text).find()) {
            toolCalls++;
        }
        if (OUTBOUND.matcher(text).find()) {
            toolCalls++;
        }
        return new Projection(steps, toolCalls);
    }

    /** Deliverables implied by the goal wording; never empty. */
    public List<String> deliverables(String goal) {
        String text = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        List<String> result = new ArrayList<>();
        if (words("summary", "summarize", "summarise").matcher(text).find()) result.add("Summary");
        if (words("report").matcher(text).find()) result.add("Written report");
        if (words("plan", "schedule").matcher(text).find()) result.add("Plan document");
        if (CODE.matcher(text).find()) result.add("Code artifact");
        if (words("email", "message", "letter", "announcement").matcher(text).find()) result.add("Message draft");
        if (words("analyze", "analyse", "analysis", "compare").matcher(text).find()) result.add("Analysis");
        if (result.isEmpty()) {
            result.add("Response to: " + (goal == null ? "" : goal.trim()));
        }
        return List.copyOf(result);
    }

    private static Pattern words(String... words) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])(" + String.join("|", words) + ")(?![\\p{L}\\p{N}])");
    }
}
