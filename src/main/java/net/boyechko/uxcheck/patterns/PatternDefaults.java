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

import java.util.function.Function;
import net.boyechko.uxcheck.issue.IssueSource;
import net.boyechko.uxcheck.validation.Pattern;

/** The standard pattern set, attributed and aliased according to the bundled catalogue. */
public final class PatternDefaults {
    private PatternDefaults() {}

    public static PatternRegistry registry() {
        return registry(PatternCatalog.loadDefault());
    }

    public static PatternRegistry registry(PatternCatalog catalog) {
        PatternRegistry.Builder builder = PatternRegistry.builder();
        register(builder, catalog, FormBasic.NAME, FormBasic::pattern);
        register(builder, catalog, TableSimple.NAME, TableSimple::pattern);
        register(builder, catalog, ProgressiveDisclosure.NAME, ProgressiveDisclosure::pattern);
        register(builder, catalog, GuidedFlow.NAME, GuidedFlow::pattern);
        return builder.build();
    }

    private static void register(
            PatternRegistry.Builder builder,
            PatternCatalog catalog,
            String name,
            Function<IssueSource, Pattern> factory) {
        PatternCatalog.Entry entry = catalog.entry(name);
        if (entry == null || entry.getSourceName() == null || entry.getSourceUrl() == null) {
            throw new IllegalStateException("Pattern catalog has no attributed entry for " + name);
        }
        IssueSource source = new IssueSource(name, entry.getSourceName(), entry.getSourceUrl());
        builder.register(factory.apply(source), entry.getAliases());
    }
}
