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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.uxcheck.core.FlowListener;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.patterns.CoverageResult;
import net.boyechko.uxcheck.patterns.PatternSuggestion;
import net.boyechko.uxcheck.validation.PatternResult;
import net.boyechko.uxcheck.validation.ValidationSummary;
import org.slf4j.LoggerFactory;

/** A {@link FlowListener} that routes all events through SLF4J. */
public class LoggingFlowListener implements FlowListener {

    private static final String CONSOLE_APPENDER_NAME = "UXCHECK_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.uxcheck.flow");

    /** Creates a {@link LoggingFlowListener} and ensures logs are emitted to stdout. */
    public static LoggingFlowListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingFlowListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-24logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onAutoSelected(List<PatternSuggestion> suggestions) {
        logger.info(
                "AUTO {}",
                suggestions.stream()
                        .map(s -> s.pattern() + "(" + s.confidence() + ")")
                        .collect(Collectors.joining(", ")));
    }

    @Override
    public void onPatternAdded(String patternName, String reason) {
        logger.info("ADDED {}: {}", patternName, reason);
    }

    @Override
    public void onPatternResult(PatternResult result) {
        logger.info(
                "PATTERN {} must={}/{} should={}/{}",
                result.pattern(),
                result.mustPassed(),
                result.mustPassed() + result.mustFailed(),
                result.shouldPassed(),
                result.shouldPassed() + result.shouldFailed());
        for (Issue issue : result.issues()) {
            String message =
                    "ISSUE "
                            + issue.id()
                            + ": "
                            + issue.message()
                            + (issue.nodeId() != null ? " [node " + issue.nodeId() + "]" : "");
            if (issue.isError()) {
                logger.error("{}", message);
            } else {
                logger.warn("{}", message);
            }
        }
    }

    @Override
    public void onSummary(ValidationSummary summary) {
        logger.info(
                "SUMMARY patterns={} issues={} mustFailures={}",
                summary.patterns().size(),
                summary.totalIssues(),
                summary.hasMustFailures());
    }

    @Override
    public void onCoverage(CoverageResult coverage) {
        logger.info(
                "COVERAGE {}/{} ({}%) gaps={}",
                coverage.activated(),
                coverage.total(),
                coverage.percent(),
                coverage.gaps().stream()
                        .map(CoverageResult.Gap::pattern)
                        .collect(Collectors.joining(", ")));
    }
}
