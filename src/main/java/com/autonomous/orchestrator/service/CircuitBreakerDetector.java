package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.CircuitBreakerResult;
import com.autonomous.orchestrator.model.TripType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies agent output as stuck or not.
 *
 * Checks run in a fixed order and the first match wins: same issue,
 * no progress, timeout, max cycles, then any generic trip phrase. The order
 * decides which reason the requester sees when several apply.
 *
 * Has no state and no side effects, so it can be re-run over a growing log.
 * Deciding whether a trip was already acted on is the caller's job.
 */
@Service
public class CircuitBreakerDetector {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Pattern> SAME_ISSUE_PHRASES = compile(
        "circuit\\s*breaker.*same\\s*(issue|finding|error).*\\d+\\s*times?",
        "halting.*same\\s*(issue|finding|error)\\s*(\\d+|three)\\s*times?",
        "repeated\\s*failure.*circuit\\s*breaker",
        "same\\s*finding\\s*appeared\\s*\\d+\\s*times"
    );

    private static final List<Pattern> NO_PROGRESS_PHRASES = compile(
        "circuit\\s*breaker.*no\\s*progress.*\\d+\\s*cycles?",
        "halting.*no\\s*(progress|file\\s*changes?).*\\d+\\s*cycles?",
        "stalled.*no\\s*progress",
        "\\d+\\s*cycles?\\s*with(out)?\\s*no\\s*progress"
    );

    private static final List<Pattern> TIMEOUT_PHRASES = compile(
        "circuit\\s*breaker.*timeout",
        "session\\s*timeout.*exceeded",
        "maximum\\s*runtime.*exceeded",
        "\\d+\\s*hours?\\s*timeout"
    );

    private static final List<Pattern> MAX_CYCLES_PHRASES = compile(
        "circuit\\s*breaker.*max(imum)?\\s*cycles?",
        "reached\\s*max(imum)?\\s*cycles?.*\\d+",
        "\\d+\\s*cycles?\\s*limit"
    );

    private static final List<Pattern> GENERIC_PHRASES = compile(
        "circuit\\s*breaker\\s*(has\\s*)?(tripped|triggered|activated)",
        "run\\s*mode.*halted",
        "autonomous\\s*execution.*stopped"
    );

    private static final List<Pattern> SUCCESS_PHRASES = compile(
        "sprint.*completed?\\s*(successfully)?",
        "all\\s*tasks?\\s*completed?",
        "implementation\\s*complete",
        "PR\\s*created",
        "change\\s*request\\s*opened",
        "draft\\s*PR.*ready"
    );

    private static final Pattern FAILURE_COUNT =
        Pattern.compile("\\b[1-9]\\d*\\s+(?:failed|failures?|errors?|failing)\\b", FLAGS);

    // Error-shaped lines only: a typed error, "error:", FAIL, or a labelled finding.
    private static final Pattern ISSUE_LINE = Pattern.compile(
        "\\b\\w*(?:Error|Exception)\\b"
            + "|\\bFAIL(?:ED|URE)?\\b"
            + "|(?i:\\berror\\s*:)"
            + "|(?i:\\b(?:issue|finding)\\s*:)");

    private static final Pattern CLEAN_SUMMARY = Pattern.compile(
        "\\b0\\s+(?:failed|failures?|errors?|failing)\\b"
            + "|\\bno\\s+(?:issues|errors|findings|failures)\\b", FLAGS);

    private static final Pattern REPEATED_ISSUE =
        Pattern.compile("same\\s*(issue|finding|error):\\s*(.+?)(?:\\n|$)", FLAGS);

    private static final Pattern CYCLE_MARKER =
        Pattern.compile("^\\W*(?:cycle|iteration)\\s*#?\\s*(\\d+)", FLAGS);

    private static final Pattern PROGRESS_SIGNAL = Pattern.compile(
        "files?\\s+(changed|modified|created|updated)"
            + "|\\b(wrote|created|modified|updated|edited)\\s+(file\\s+)?\\S+\\.\\w+"
            + "|\\bcommit(ted)?\\b"
            + "|tests?\\s+pass(ed|ing)?"
            + "|\\b\\d+\\s+passed\\b", FLAGS);

    private static final Pattern CYCLE_COUNT =
        Pattern.compile("(?:total\\s*)?cycles?:\\s*(\\d+)", FLAGS);

    private final int sameIssueThreshold;
    private final int noProgressCycles;
    private final Duration timeout;
    private final int maxCycles;

    @Autowired
    public CircuitBreakerDetector(OrchestratorProperties properties) {
        this(properties.getCircuitBreaker().getSameIssueThreshold(),
            properties.getCircuitBreaker().getNoProgressCycles(),
            properties.getCircuitBreaker().getTimeout(),
            properties.getCircuitBreaker().getMaxCycles());
    }

    public CircuitBreakerDetector(int sameIssueThreshold, int noProgressCycles, Duration timeout, int maxCycles) {
        this.sameIssueThreshold = sameIssueThreshold;
        this.noProgressCycles = noProgressCycles;
        this.timeout = timeout;
        this.maxCycles = maxCycles;
    }

    public CircuitBreakerResult detect(String output) {
        return detect(output, Duration.ZERO);
    }

    /**
     * @param output  cumulative agent output of the current run
     * @param elapsed wall-clock time the session has spent running
     */
    public CircuitBreakerResult detect(String output, Duration elapsed) {
        String text = output == null ? "" : output;
        CycleStats cycles = countCycles(text);

        CircuitBreakerResult result = detectSameIssue(text, cycles);
        if (result == null) {
            result = detectNoProgress(text, cycles);
        }
        if (result == null) {
            result = detectTimeout(text, elapsed, cycles);
        }
        if (result == null) {
            result = detectMaxCycles(text, cycles);
        }
        if (result == null && anyMatch(GENERIC_PHRASES, text)) {
            result = CircuitBreakerResult.tripped(TripType.GENERIC, "Circuit breaker tripped",
                withCycles(new LinkedHashMap<>(), cycles.total));
        }
        return result != null ? result : CircuitBreakerResult.notTripped();
    }

    /**
     * Whether the agent reported that it finished. Independent of {@link #detect}:
     * quiet output is neither stuck nor done.
     */
    public boolean isSuccessfulCompletion(String output) {
        return output != null && anyMatch(SUCCESS_PHRASES, output);
    }

    public String formatMessage(CircuitBreakerResult result, String sessionId) {
        if (!result.isTripped()) {
            return "";
        }
        StringBuilder message = new StringBuilder();
        message.append("Circuit breaker tripped: ").append(result.getReason());

        if (result.repeatedIssue() != null) {
            message.append("\n\nRepeated issue: ").append(result.repeatedIssue());
        }
        Object totalCycles = result.getContext().get("totalCycles");
        if (totalCycles != null) {
            message.append("\n\nTotal cycles run: ").append(totalCycles);
        }

        message.append("\n\nYou can:");
        message.append("\n• `/sprint-resume ").append(sessionId).append("` to continue");
        message.append("\n• `/sprint-abort ").append(sessionId).append("` to cancel");
        message.append("\n• `/sprint-logs ").append(sessionId).append("` to review logs");
        return message.toString();
    }

    // ------------------------------------------------------------------
    // Individual checks, in priority order
    // ------------------------------------------------------------------

    private CircuitBreakerResult detectSameIssue(String text, CycleStats cycles) {
        Map<String, Object> context = new LinkedHashMap<>();

        if (anyMatch(SAME_ISSUE_PHRASES, text)) {
            Matcher issue = REPEATED_ISSUE.matcher(text);
            String repeated = issue.find() ? issue.group(2).trim() : null;
            if (repeated != null) {
                context.put("repeatedIssue", repeated);
            }
            return CircuitBreakerResult.tripped(TripType.SAME_ISSUE,
                sameIssueReason(sameIssueThreshold, repeated), withCycles(context, cycles.total));
        }

        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (String rawLine : text.split("\n")) {
            String line = rawLine.trim().replaceAll("\\s+", " ");
            if (!isIssueLine(line)) {
                continue;
            }
            int count = occurrences.merge(line, 1, Integer::sum);
            if (count >= sameIssueThreshold) {
                context.put("repeatedIssue", line);
                context.put("occurrences", count);
                return CircuitBreakerResult.tripped(TripType.SAME_ISSUE,
                    sameIssueReason(count, line), withCycles(context, cycles.total));
            }
        }
        return null;
    }

    private CircuitBreakerResult detectNoProgress(String text, CycleStats cycles) {
        boolean phrase = anyMatch(NO_PROGRESS_PHRASES, text);
        if (!phrase && cycles.withoutProgress < noProgressCycles) {
            return null;
        }
        Map<String, Object> context = new LinkedHashMap<>();
        int stalled = phrase ? Math.max(noProgressCycles, cycles.withoutProgress) : cycles.withoutProgress;
        context.put("cyclesWithoutProgress", stalled);
        return CircuitBreakerResult.tripped(TripType.NO_PROGRESS,
            "No progress for " + stalled + " cycles", withCycles(context, cycles.total));
    }

    private CircuitBreakerResult detectTimeout(String text, Duration elapsed, CycleStats cycles) {
        boolean overBudget = elapsed != null && !timeout.isZero() && elapsed.compareTo(timeout) >= 0;
        if (!overBudget && !anyMatch(TIMEOUT_PHRASES, text)) {
            return null;
        }
        Map<String, Object> context = new LinkedHashMap<>();
        if (elapsed != null && !elapsed.isZero()) {
            context.put("elapsedMinutes", elapsed.toMinutes());
        }
        return CircuitBreakerResult.tripped(TripType.TIMEOUT,
            "Session timeout exceeded (" + timeout.toHours() + "h budget)", withCycles(context, cycles.total));
    }

    private CircuitBreakerResult detectMaxCycles(String text, CycleStats cycles) {
        if (cycles.total < maxCycles && !anyMatch(MAX_CYCLES_PHRASES, text)) {
            return null;
        }
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("totalCycles", Math.max(cycles.total, maxCycles));
        return CircuitBreakerResult.tripped(TripType.MAX_CYCLES,
            "Maximum cycles (" + maxCycles + ") reached", context);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Counts cycle markers and the cycles closed since the last progress
     * signal. The cycle still in flight is not counted as stalled.
     */
    private static CycleStats countCycles(String text) {
        int markers = 0;
        int highest = 0;
        int stalled = 0;
        boolean inCycle = false;
        boolean progressed = false;

        for (String line : text.split("\n")) {
            Matcher marker = CYCLE_MARKER.matcher(line);
            if (marker.find()) {
                if (inCycle && !progressed) {
                    stalled++;
                }
                inCycle = true;
                progressed = false;
                markers++;
                highest = Math.max(highest, parseInt(marker.group(1)));
            } else if (PROGRESS_SIGNAL.matcher(line).find()) {
                progressed = true;
                stalled = 0;
            }
        }

        Matcher reported = CYCLE_COUNT.matcher(text);
        int reportedTotal = 0;
        while (reported.find()) {
            reportedTotal = Math.max(reportedTotal, parseInt(reported.group(1)));
        }
        return new CycleStats(Math.max(markers, Math.max(highest, reportedTotal)), stalled);
    }

    /**
     * A clean summary or a progress line is never an issue, unless it still
     * counts failures.
     */
    private static boolean isIssueLine(String line) {
        if (line.isEmpty() || anyMatch(SUCCESS_PHRASES, line)) {
            return false;
        }
        if (FAILURE_COUNT.matcher(line).find()) {
            return true;
        }
        return ISSUE_LINE.matcher(line).find()
            && !CLEAN_SUMMARY.matcher(line).find()
            && !PROGRESS_SIGNAL.matcher(line).find();
    }

    private static Map<String, Object> withCycles(Map<String, Object> context, int totalCycles) {
        if (totalCycles > 0) {
            context.put("totalCycles", totalCycles);
        }
        return context;
    }

    private static String sameIssueReason(int times, String issue) {
        String reason = "Same issue appeared " + times + " times";
        return issue != null ? reason + ": " + issue : reason;
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }

    private static int parseInt(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<Pattern> compile(String... regexes) {
        return java.util.Arrays.stream(regexes)
            .map(r -> Pattern.compile(r, FLAGS))
            .collect(java.util.stream.Collectors.toUnmodifiableList());
    }

    private static final class CycleStats {
        final int total;
        final int withoutProgress;

        CycleStats(int total, int withoutProgress) {
            this.total = total;
            this.withoutProgress = withoutProgress;
        }
    }
}
