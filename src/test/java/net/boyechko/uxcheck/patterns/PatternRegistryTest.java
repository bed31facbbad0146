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

import java.util.List;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.validation.Pattern;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class PatternRegistryTest {
    private static PatternRegistry registry;

    @BeforeAll
    static void setup() {
        registry = PatternDefaults.registry();
    }

    private static Pattern emptyPattern(String name) {
        return new Pattern(
                name, new IssueSource(name, "Test", "https://example.org/"), List.of(), List.of());
    }

    @Test
    void defaultsRegisterAllFourPatternsInOrder() {
        assertEquals(4, registry.size());
        assertEquals(
                List.of(
                        FormBasic.NAME,
                        TableSimple.NAME,
                        ProgressiveDisclosure.NAME,
                        GuidedFlow.NAME),
                registry.getAllPatterns().stream().map(Pattern::name).toList());
    }

    @Test
    void namesAndAliasesResolveCaseInsensitively() {
        assertEquals(GuidedFlow.NAME, registry.getPattern("Wizard").orElseThrow().name());
        assertEquals(GuidedFlow.NAME, registry.getPattern("guided.flow").orElseThrow().name());
        assertEquals(
                ProgressiveDisclosure.NAME, registry.getPattern("PD").orElseThrow().name());
        assertEquals(TableSimple.NAME, registry.getPattern("table-simple").orElseThrow().name());
        assertTrue(registry.hasPattern("FORM"));
        assertFalse(registry.hasPattern("carousel"));
        assertTrue(registry.getPattern(null).isEmpty());
    }

    @Test
    void registeredPatternCarriesCatalogSource() {
        Pattern flow = registry.getPattern(GuidedFlow.NAME).orElseThrow();

        assertEquals(GuidedFlow.NAME, flow.source().pattern());
        assertEquals("https://www.nngroup.com/articles/wizard-design/", flow.source().url());
    }

    @Test
    void listPatternNamesIncludesAliases() {
        List<String> names = registry.listPatternNames();

        assertEquals(FormBasic.NAME, names.get(0));
        assertTrue(names.containsAll(List.of("form", "table", "pd", "wizard", "flow-wizard")));
        assertEquals(
                List.of("pd", "progressive-disclosure"),
                registry.getAliases(ProgressiveDisclosure.NAME));
        assertTrue(registry.getAliases("pd").isEmpty());
    }

    @Test
    void duplicateAliasIsRejected() {
        PatternRegistry.Builder builder =
                PatternRegistry.builder().register(emptyPattern("One.Pattern"), "one", "shared");

        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> builder.register(emptyPattern("Two.Pattern"), "SHARED"));
        assertTrue(e.getMessage().contains("already used by One.Pattern"));
    }

    @Test
    void aliasMayNotShadowAnotherName() {
        PatternRegistry.Builder builder =
                PatternRegistry.builder().register(emptyPattern("One.Pattern"));

        assertThrows(
                IllegalArgumentException.class,
                () -> builder.register(emptyPattern("Two.Pattern"), "one.pattern"));
    }

    @Test
    void builtRegistryIsUnaffectedByLaterRegistrations() {
        PatternRegistry.Builder builder =
                PatternRegistry.builder().register(emptyPattern("One.Pattern"));
        PatternRegistry built = builder.build();

        builder.register(emptyPattern("Two.Pattern"));

        assertEquals(1, built.size());
        assertFalse(built.hasPattern("Two.Pattern"));
    }
}
