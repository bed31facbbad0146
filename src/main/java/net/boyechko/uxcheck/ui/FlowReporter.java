/*
 * UX-Check - UX Pattern Validation for UI Scaffolds
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.uxcheck.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.uxcheck.core.FlowListener;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.patterns.CoverageResult;
import net.boyechko.uxcheck.patterns.PatternSuggestion;
import net.boyechko.uxcheck.validation.PatternResult;
import net.boyechko.uxcheck.validation.ValidationSummary;
import org.slf4j.LoggerFactory;

/** Prints a boxed plain-text summary of a flow run. */
public class FlowReporter implements FlowListener {
    private final PrintStream output;
    private final boolean verbose;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "️✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;
    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private boolean phaseOpen = false;
    private final Logger appLogger;
    private final ListAppender<ILoggingEvent> logBuffer;

    public FlowReporter(PrintStream output) {
        this(output, false);
    }

    /**
     * @param verbose if true, issues in collapsed groups are listed one by one as well
     */
    public FlowReporter(PrintStream output, boolean verbose) {
        this.output = output;
        this.verbose = verbose;
        appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.uxcheck");
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        closePhaseBoxIfOpen();
        printBoxHeader(phaseName);
        phaseOpen = true;
    }

    @Override
    public void onAutoSelected(List<PatternSuggestion> suggestions) {
        if (suggestions.isEmpty()) {
            printLine("No pattern suggested with high confidence", INFO);
            return;
        }
        for (PatternSuggestion s : suggestions) {
            printLine(
                    "Auto-selected "
                            + s.pattern()
                            + " ("
                            + s.confidenceScore()
                            + "): "
                            + s.reason(),
                    INFO);
        }
    }

    @Override
    public void onPatternAdded(String patternName, String reason) {
        printLine("Added " + patternName + ": " + reason, INFO);
    }

    @Override
    public void onPatternResult(PatternResult result) {
        String counts =
                result.pattern()
                        + ": MUST "
                        + result.mustPassed()
                        + "/"
                        + (result.mustPassed() + result.mustFailed())
                        + ", SHOULD "
                        + result.shouldPassed()
                        + "/"
                        + (result.shouldPassed() + result.shouldFailed());
        if (result.issues().isEmpty()) {
            printLine(counts, SUCCESS);
            return;
        }
        printLine(counts, result.hasMustFailures() ? ERROR : WARNING);
        reportIssuesGrouped(result.issueList());
    }

    @Override
    public void onSummary(ValidationSummary summary) {
        closePhaseBoxIfOpen();
        printBoxHeader("Summary");
        if (summary.patterns().isEmpty()) {
            printLine("No patterns were validated", INFO);
        } else if (summary.totalIssues() == 0) {
            printLine(
                    "Checked " + summary.patterns().size() + " pattern(s) and found no issues",
                    SUCCESS);
        } else {
            IssueList all = new IssueList();
            summary.patterns().forEach(p -> all.addAll(p.issues()));
            printLine("Issues detected: " + summary.totalIssues(), INFO);
            printLine("Errors: " + all.errors().size(), all.hasErrors() ? ERROR : SUCCESS);
            printLine("Warnings: " + all.warnings().size(), INFO);
        }
        phaseOpen = true;
    }

    @Override
    public void onCoverage(CoverageResult coverage) {
        printEmptyLine();
        printLine(
                "Coverage: "
                        + coverage.activated()
                        + " of "
                        + coverage.total()
                        + " patterns ("
                        + coverage.percent()
                        + "%)",
                INFO);
        for (CoverageResult.Gap gap : coverage.gaps()) {
            printLine("Not validated: " + gap.pattern() + " (" + gap.reason() + ")", WARNING);
        }
    }

    /** Closes the open box and stops buffering engine log events. */
    @Override
    public void onFinish() {
        closePhaseBoxIfOpen();
        appLogger.detachAppender(logBuffer);
        logBuffer.stop();
    }

    private void reportIssuesGrouped(IssueList issues) {
        for (Map.Entry<String, List<Issue>> entry : issues.byRuleId().entrySet()) {
            List<Issue> group = entry.getValue();
            String icon = group.get(0).isError() ? ERROR : WARNING;
            if (group.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                String nodes =
                        group.stream()
                                .map(Issue::nodeId)
                                .filter(id -> id != null)
                                .collect(Collectors.joining(", "));
                String label = group.size() + " × " + entry.getKey();
                printLine(nodes.isEmpty() ? label : label + " (" + nodes + ")", icon);
                if (verbose) {
                    group.forEach(issue -> printLine(issue.message(), icon));
                }
            } else {
                group.forEach(issue -> printLine(issue.message(), icon));
            }
        }
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Flushes warnings logged by the engine since the last drain into the open box. */
    private void drainLogBuffer() {
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        events.removeIf(e -> !e.getLevel().isGreaterOrEqual(Level.WARN));
        if (events.isEmpty()) {
            return;
        }
        printEmptyLine();
        for (ILoggingEvent event : events) {
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            printLine(
                    "["
                            + event.getLevel()
                            + "] "
                            + event.getLoggerName()
                            + ": "
                            + event.getFormattedMessage(),
                    icon);
        }
    }

    /**
     * Prints an indented line with the given message and icon, word-wrapping long messages to stay
     * within the box width.
     */
    private void printLine(String message, String icon) {
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(INDENT.trim());
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printEmptyLine() {
        output.println(INDENT.trim());
    }

    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n")) {
            StringBuilder currentLine = new StringBuilder();
            for (String word : paragraph.split(" ")) {
                if (currentLine.isEmpty()) {
                    currentLine.append(word);
                } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                    currentLine.append(' ').append(word);
                } else {
                    lines.add(currentLine.toString());
                    currentLine.setLength(0);
                    currentLine.append(word);
                }
            }
            lines.add(currentLine.toString());
        }
        return lines;
    }
}
