package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Project;
import com.autonomous.orchestrator.model.Session;
import com.autonomous.orchestrator.model.SessionMetrics;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the draft pull request text from a finished run.
 */
@Component
public class ChangeRequestComposer {

    private static final Pattern SUMMARY_SECTION =
        Pattern.compile("## Summary\\n([\\s\\S]*?)(?=\\n##|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TESTS_PASSED =
        Pattern.compile("(\\d+)\\s+tests?\\s+(passed|passing)", Pattern.CASE_INSENSITIVE);
    private static final int FALLBACK_SUMMARY_CHARS = 500;

    public String title(Session session, Project project) {
        return String.format("[Sprint] Sprint %s - %s", session.getUnit(), project.getName());
    }

    public String description(Session session, Project project, String output) {
        long minutes = Math.round(session.getMetrics().getRuntimeMillis() / 60000.0);
        SessionMetrics metrics = session.getMetrics();

        StringBuilder body = new StringBuilder();
        body.append("## Autonomous Sprint Execution\n\n");
        body.append("**Session ID**: `").append(session.getId()).append("`\n");
        body.append("**Project**: ").append(project.getName()).append("\n");
        body.append("**Sprint**: ").append(session.getUnit()).append("\n");
        body.append("**Triggered by**: ").append(session.getTriggeredBy()).append("\n");
        body.append("**Duration**: ").append(minutes).append(" minutes\n\n");

        body.append("| Metric | Value |\n");
        body.append("|--------|-------|\n");
        body.append("| Files changed | ").append(metrics.getFilesChanged()).append(" |\n");
        body.append("| Lines added | ").append(metrics.getLinesAdded()).append(" |\n");
        body.append("| Lines removed | ").append(metrics.getLinesRemoved()).append(" |\n");
        if (metrics.getTestsRun() > 0) {
            body.append("| Tests passed | ").append(metrics.getTestsPassed()).append(" |\n");
        }

        body.append("\n### Summary\n\n").append(extractSummary(output)).append("\n\n");
        body.append("---\n");
        body.append("*Created by autonomous sprint execution. Review the changes carefully before merging.*\n");
        return body.toString();
    }

    /**
     * The agent's own {@code ## Summary} section, or the tail of its output.
     */
    public String extractSummary(String output) {
        if (output == null || output.isBlank()) {
            return "(no output)";
        }
        Matcher matcher = SUMMARY_SECTION.matcher(output);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return output.substring(Math.max(0, output.length() - FALLBACK_SUMMARY_CHARS)).trim();
    }

    /**
     * Picks up the last "N tests passed" line the agent printed, if any.
     */
    public void applyTestResults(SessionMetrics metrics, String output) {
        if (output == null) {
            return;
        }
        Matcher matcher = TESTS_PASSED.matcher(output);
        Integer passed = null;
        while (matcher.find()) {
            passed = Integer.parseInt(matcher.group(1));
        }
        if (passed != null) {
            metrics.setTestsPassed(passed);
            metrics.setTestsRun(passed);
        }
    }
}
