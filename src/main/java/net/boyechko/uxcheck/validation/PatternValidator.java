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
package net.boyechko.uxcheck.validation;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.uxcheck.issue.Issue;
import net.boyechko.uxcheck.issue.IssueList;
import net.boyechko.uxcheck.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs pattern rules against a scaffold tree and tallies the results.
 *
 * <p>The validator knows nothing about individual patterns: any {@link Pattern} built from
 * {@link Rule} values can be validated without changes here.
 */
public class PatternValidator {
    private static final Logger logger = LoggerFactory.getLogger(PatternValidator.class);

    public PatternResult validatePattern(Pattern pattern, Node root) {
        List<Issue> issues = new ArrayList<>();
        int mustPassed = 0;
        int mustFailed = 0;
        int shouldPassed = 0;
        int shouldFailed = 0;

        for (Rule rule : pattern.must()) {
            IssueList found = rule.check(root);
            if (found.isEmpty()) {
                mustPassed++;
            } else {
                mustFailed++;
                issues.addAll(found);
            }
        }

        for (Rule rule : pattern.should()) {
            IssueList found = rule.check(root);
            if (found.isEmpty()) {
                shouldPassed++;
            } else {
                shouldFailed++;
                issues.addAll(found);
            }
        }

        logger.debug(
                "Pattern {}: MUST {}/{} passed, SHOULD {}/{} passed, {} issue(s)",
                pattern.name(),
                mustPassed,
                pattern.must().size(),
                shouldPassed,
                pattern.should().size(),
                issues.size());

        return new PatternResult(
                pattern.name(),
                pattern.source(),
                mustPassed,
                mustFailed,
                shouldPassed,
                shouldFailed,
                issues);
    }

    public ValidationSummary validatePatterns(List<Pattern> patterns, Node root) {
        List<PatternResult> results = new ArrayList<>(patterns.size());
        for (Pattern pattern : patterns) {
            results.add(validatePattern(pattern, root));
        }
        return ValidationSummary.of(results);
    }
}
