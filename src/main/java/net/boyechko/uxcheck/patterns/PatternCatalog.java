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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Names, aliases and guideline sources of the registered patterns, as declared in
 * {@code pattern-catalog.yaml}. Rules themselves live in code; the catalogue only says how each
 * pattern is addressed and attributed.
 */
public final class PatternCatalog {
    private static final String DEFAULT_CATALOG_RESOURCE = "/pattern-catalog.yaml";
    private static final Logger logger = LoggerFactory.getLogger(PatternCatalog.class);

    /** Canonical pattern name to its entry, in declaration order. */
    public Map<String, Entry> patterns;

    public static final class Entry {
        public List<String> aliases;
        public String source_name;
        public String source_url;

        public List<String> getAliases() {
            return aliases != null ? aliases : List.of();
        }

        public String getSourceName() {
            return source_name;
        }

        public String getSourceUrl() {
            return source_url;
        }
    }

    public PatternCatalog() {
        this.patterns = new LinkedHashMap<>();
    }

    public Map<String, Entry> getPatterns() {
        return patterns;
    }

    public Entry entry(String canonicalName) {
        return patterns.get(canonicalName);
    }

    /**
     * Load the catalogue from a classpath resource.
     *
     * @param resourcePath path starting with "/" for an absolute resource path
     * @throws IllegalStateException if the resource is missing or is not a valid catalogue
     */
    public static PatternCatalog fromResource(String resourcePath) {
        try (var inputStream = PatternCatalog.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(PatternCatalog.class, new LoaderOptions()));
            PatternCatalog catalog = yaml.load(inputStream);
            if (catalog == null || catalog.patterns == null) {
                throw new IllegalArgumentException("No patterns declared");
            }

            logger.debug(
                    "Loaded pattern catalog with {} patterns from resource {}",
                    catalog.patterns.size(),
                    resourcePath);

            var warnings = catalog.validateConsistency();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Catalog loaded from {} has {} consistency warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }

            return catalog;
        } catch (Exception e) {
            logger.error(
                    "Failed to load pattern catalog from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new IllegalStateException(
                    "Failed to load pattern catalog from resource "
                            + resourcePath
                            + ": "
                            + e.getMessage(),
                    e);
        }
    }

    public static PatternCatalog loadDefault() {
        return fromResource(DEFAULT_CATALOG_RESOURCE);
    }

    /**
     * Returns problems that do not prevent loading: entries without a source, aliases that repeat
     * their own canonical name, and aliases claimed more than once within an entry. Aliases shared
     * between patterns are not reported here; the registry rejects them.
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, Entry> e : patterns.entrySet()) {
            String name = e.getKey();
            Entry entry = e.getValue();
            if (entry == null) {
                warnings.add(name + " has no catalog entry body");
                continue;
            }
            if (entry.source_name == null || entry.source_url == null) {
                warnings.add(name + " has no complete source attribution");
            }
            Set<String> seen = new HashSet<>();
            for (String alias : entry.getAliases()) {
                String key = alias.toLowerCase(Locale.ROOT);
                if (key.equals(name.toLowerCase(Locale.ROOT))) {
                    warnings.add(name + " lists its own name as an alias");
                } else if (!seen.add(key)) {
                    warnings.add(name + " lists alias '" + alias + "' more than once");
                }
            }
        }
        return warnings;
    }
}
