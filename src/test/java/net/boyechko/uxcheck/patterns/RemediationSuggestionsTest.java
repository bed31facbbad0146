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
package net.boyechko.uxcheck.patterns;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import java.util.stream.Collectors;
import net.boyechko.uxcheck.validation.Pattern;
import net.boyechko.uxcheck.validation.Rule;
import org.junit.jupiter.api.Test;

class RemediationSuggestionsTest {

    @Test
    void everyRegisteredRuleHasSuggestion() {
        Set<String> ruleIds =
                PatternDefaults.registry().getAllPatterns().stream()
                        .map(Pattern::rules)
                        .flatMap(rules -> rules.stream().map(Rule::id))
                        .collect(Collectors.toSet());

        assertEquals(ruleIds, RemediationSuggestions.knownIssueIds());
    }

    @Test
    void templatesNameTheOffendingNode() {
        String text =
                RemediationSuggestions.getSuggestion("disclosure-no-control", "filters")
                        .orElseThrow();

        assertTrue(text.contains("\"controlsId\": \"toggle-filters\""));
        assertTrue(text.contains("{ \"id\": \"toggle-filters\", \"type\": \"Button\""));
    }

    @Test
    void missingNodeIdFallsBackToDefaults() {
        assertTrue(
                RemediationSuggestions.getSuggestion("disclosure-no-control")
                        .orElseThrow()
                        .contains("toggle-advanced"));
        assertTrue(
                RemediationSuggestions.getSuggestion("disclosure-missing-label")
                        .orElseThrow()
                        .contains("\"section-label\""));
    }

    @Test
    void suggestionsAreDeterministic() {
        for (String id : RemediationSuggestions.knownIssueIds()) {
            assertEquals(
                    RemediationSuggestions.getSuggestion(id, "node-1"),
                    RemediationSuggestions.getSuggestion(id, "node-1"));
        }
    }

    @Test
    void unknownRuleHasNoSuggestion() {
        assertTrue(RemediationSuggestions.getSuggestion("no-such-rule", "x").isEmpty());
        assertTrue(RemediationSuggestions.getSuggestion(null).isEmpty());
    }
}
