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

import static net.boyechko.uxcheck.ScaffoldFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import net.boyechko.uxcheck.core.FlowRequest;
import net.boyechko.uxcheck.core.FlowService;
import net.boyechko.uxcheck.node.StackNode;
import net.boyechko.uxcheck.node.TableNode;
import net.boyechko.uxcheck.patterns.PatternDefaults;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public class FlowReporterTest {

    private static String render(StackNode root, FlowRequest request, boolean verbose)
            throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        FlowService.builder()
                .withRegistry(PatternDefaults.registry())
                .withListener(new FlowReporter(out, verbose))
                .build()
                .run(root, request);
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void reportsPatternCountsAndIssues() throws Exception {
        String rendered = render(primaryHiddenScenario(), FlowRequest.of("pd"), false);

        assertTrue(rendered.contains("┌─ Pattern selection "));
        assertTrue(rendered.contains("┌─ Pattern validation "));
        assertTrue(rendered.contains("Progressive.Disclosure: MUST 2/3, SHOULD 3/3"));
        assertTrue(
                rendered.contains(
                        "Primary action is hidden by default within collapsed section"
                                + " \"advanced\""));
        assertTrue(rendered.contains("Errors: 1"));
        assertTrue(rendered.trim().endsWith("└─╯"));
    }

    @Test
    void cleanRunSaysSo() throws Exception {
        String rendered = render(threeStepWizard(), FlowRequest.of("wizard"), false);

        assertTrue(rendered.contains("✓ Guided.Flow: MUST 7/7, SHOULD 3/3"));
        assertTrue(rendered.contains("Checked 1 pattern(s) and found no issues"));
    }

    @Test
    void repeatedRuleIssuesAreGrouped() throws Exception {
        StackNode root =
                stack(
                        "root",
                        collapsible("one", null),
                        text("gap-1", "Gap"),
                        collapsible("two", null),
                        text("gap-2", "Gap"),
                        collapsible("three", null));

        String compact = render(root, FlowRequest.of("pd").withoutAutoSelect(), false);
        String verbose = render(root, FlowRequest.of("pd").withoutAutoSelect(), true);

        assertTrue(compact.contains("3 × disclosure-no-control (one, two, three)"));
        assertFalse(compact.contains("Collapsible section \"two\" has no associated control"));
        assertTrue(verbose.contains("Collapsible section \"two\" has no associated control"));
    }

    @Test
    void coverageAndGapsAreListed() throws Exception {
        StackNode root = stack("root", TableNode.of("t", "Users", List.of(), "wrap"));

        String rendered = render(root, FlowRequest.auto().withCoverage(), false);

        assertTrue(rendered.contains("No pattern suggested with high confidence"));
        assertTrue(rendered.contains("No patterns were validated"));
        assertTrue(rendered.contains("Coverage: 0 of 4 patterns (0.0%)"));
        assertTrue(rendered.contains("Not validated: Table.Simple (Detected Table node"));
    }

    @Test
    void engineWarningsAreShownInsideTheBox() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        FlowReporter reporter =
                new FlowReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        reporter.onPhaseStart("Pattern validation");
        LoggerFactory.getLogger("net.boyechko.uxcheck.patterns").warn("catalog looks odd");
        reporter.onFinish();

        String rendered = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(rendered.contains("[WARN] net.boyechko.uxcheck.patterns: catalog looks odd"));
    }

    @Test
    void finishedReportersDetachTheirLogBuffer() throws Exception {
        int before = appenderCount();

        for (int i = 0; i < 5; i++) {
            render(threeStepWizard(), FlowRequest.of("wizard"), false);
        }

        assertEquals(before, appenderCount());
    }

    @Test
    void warningsAfterFinishAreNotBuffered() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        FlowReporter reporter =
                new FlowReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        reporter.onPhaseStart("First");
        reporter.onFinish();

        LoggerFactory.getLogger("net.boyechko.uxcheck.patterns").warn("late warning");
        reporter.onPhaseStart("Second");
        reporter.onFinish();

        assertFalse(buffer.toString(StandardCharsets.UTF_8).contains("late warning"));
    }

    private static int appenderCount() {
        Logger appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.uxcheck");
        int count = 0;
        for (Iterator<Appender<ILoggingEvent>> it = appLogger.iteratorForAppenders();
                it.hasNext(); ) {
            it.next();
            count++;
        }
        return count;
    }

    @Test
    void wordWrapKeepsLinesWithinWidth() {
        List<String> lines = FlowReporter.wordWrap("alpha beta gamma delta", 11);

        assertEquals(List.of("alpha beta", "gamma delta"), lines);
        assertEquals(List.of("first", "second"), FlowReporter.wordWrap("first\nsecond", 80));
        assertTrue(FlowReporter.wordWrap("", 10).isEmpty());
    }
}
