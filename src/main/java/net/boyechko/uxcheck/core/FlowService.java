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
package net.boyechko.uxcheck.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.uxcheck.node.Node;
import net.boyechko.uxcheck.patterns.CoverageAnalyzer;
import net.boyechko.uxcheck.patterns.CoverageResult;
import net.boyechko.uxcheck.patterns.GuidedFlow;
import net.boyechko.uxcheck.patterns.PatternDefaults;
import net.boyechko.uxcheck.patterns.PatternRegistry;
import net.boyechko.uxcheck.patterns.PatternSuggester;
import net.boyechko.uxcheck.patterns.PatternSuggestion;
import net.boyechko.uxcheck.patterns.ProgressiveDisclosure;
import net.boyechko.uxcheck.ui.LoggingFlowListener;
import net.boyechko.uxcheck.validation.Pattern;
import net.boyechko.uxcheck.validation.PatternResult;
import net.boyechko.uxcheck.validation.PatternValidator;
import net.boyechko.uxcheck.validation.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates a flow run: decides which patterns apply to a tree, validates them and optionally
 * measures coverage.
 */
public class FlowService {
    private static final Logger logger = LoggerFactory.getLogger(FlowService.class);

    private final PatternRegistry registry;
    private final PatternValidator validator;
    private final FlowListener listener;

    public static class FlowServiceBuilder {
        private PatternRegistry registry;
        private PatternValidator validator;
        private FlowListener listener;

        public FlowServiceBuilder withRegistry(PatternRegistry registry) {
            this.registry = registry;
            return this;
        }

        public FlowServiceBuilder withValidator(PatternValidator validator) {
            this.validator = validator;
            return this;
        }

        public FlowServiceBuilder withListener(FlowListener listener) {
            this.listener = listener;
            return this;
        }

        public FlowService build() {
            return new FlowService(this);
        }
    }

    public static FlowServiceBuilder builder() {
        return new FlowServiceBuilder();
    }

    private FlowService(FlowServiceBuilder builder) {
        this.registry = builder.registry != null ? builder.registry : PatternDefaults.registry();
        this.validator = builder.validator != null ? builder.validator : new PatternValidator();
        this.listener = builder.listener != null ? builder.listener : new LoggingFlowListener();
    }

    /**
     * Runs the flow.
     *
     * @throws UnknownPatternException if a requested name is not registered; nothing is validated
     */
    public FlowResult run(Node root, FlowRequest request) throws UnknownPatternException {
        List<Pattern> patterns = resolveRequested(request.patternNames());
        List<PatternSuggestion> suggestions = PatternSuggester.suggestPatterns(root);
        List<PatternSuggestion> autoSelected = new ArrayList<>();

        if (request.autoSelect()) {
            listener.onPhaseStart("Pattern selection");
            if (!request.hasExplicitPatterns()) {
                for (PatternSuggestion s : suggestions) {
                    if (s.confidence() != PatternSuggestion.Confidence.HIGH) {
                        continue;
                    }
                    Optional<Pattern> p = registry.getPattern(s.pattern());
                    if (p.isPresent() && addIfAbsent(patterns, p.get())) {
                        autoSelected.add(s);
                    }
                }
                listener.onAutoSelected(autoSelected);
            } else {
                if (PatternSuggester.hasDisclosureHints(root)) {
                    inject(patterns, ProgressiveDisclosure.NAME, "collapsible sections present");
                }
                if (PatternSuggester.hasGuidedFlowHints(root)) {
                    inject(patterns, GuidedFlow.NAME, "wizard steps present");
                }
            }
        }

        listener.onPhaseStart("Pattern validation");
        List<PatternResult> results = new ArrayList<>();
        for (Pattern pattern : patterns) {
            PatternResult result = validator.validatePattern(pattern, root);
            listener.onPatternResult(result);
            results.add(result);
        }
        ValidationSummary summary = ValidationSummary.of(results);
        listener.onSummary(summary);

        List<String> activated = patterns.stream().map(Pattern::name).toList();
        CoverageResult coverage = null;
        if (request.includeCoverage()) {
            coverage = CoverageAnalyzer.computeCoverage(suggestions, activated, registry);
            listener.onCoverage(coverage);
        }
        listener.onFinish();

        logger.debug(
                "Flow run validated {} pattern(s), {} issue(s)",
                activated.size(),
                summary.totalIssues());
        return new FlowResult(summary, activated, autoSelected, suggestions, coverage);
    }

    private List<Pattern> resolveRequested(List<String> names) throws UnknownPatternException {
        List<Pattern> patterns = new ArrayList<>();
        for (String name : names) {
            Optional<Pattern> pattern = registry.getPattern(name);
            if (pattern.isEmpty()) {
                throw new UnknownPatternException(name, registry.listPatternNames());
            }
            addIfAbsent(patterns, pattern.get());
        }
        return patterns;
    }

    private void inject(List<Pattern> patterns, String name, String reason) {
        Optional<Pattern> pattern = registry.getPattern(name);
        if (pattern.isPresent() && addIfAbsent(patterns, pattern.get())) {
            listener.onPatternAdded(name, reason);
        }
    }

    private static boolean addIfAbsent(List<Pattern> patterns, Pattern pattern) {
        boolean present = patterns.stream().anyMatch(p -> p.name().equals(pattern.name()));
        if (!present) {
            patterns.add(pattern);
        }
        return !present;
    }
}
