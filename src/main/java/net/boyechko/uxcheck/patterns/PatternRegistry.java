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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import net.boyechko.uxcheck.validation.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable set of patterns addressable by canonical name or alias, case-insensitively.
 *
 * <p>Built once with {@link #builder()} and passed to whoever needs it.
 */
public final class PatternRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PatternRegistry.class);

    private record Registration(Pattern pattern, List<String> aliases) {}

    private final Map<String, Registration> byName;
    private final Map<String, String> lookup;

    private PatternRegistry(Map<String, Registration> byName, Map<String, String> lookup) {
        this.byName = Collections.unmodifiableMap(byName);
        this.lookup = Collections.unmodifiableMap(lookup);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the pattern registered under {@code name} or one of its aliases. */
    public Optional<Pattern> getPattern(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String canonical = lookup.get(name.toLowerCase(Locale.ROOT));
        return canonical != null
                ? Optional.of(byName.get(canonical).pattern())
                : Optional.empty();
    }

    public boolean hasPattern(String name) {
        return getPattern(name).isPresent();
    }

    /** Returns all patterns in registration order. */
    public List<Pattern> getAllPatterns() {
        return byName.values().stream().map(Registration::pattern).toList();
    }

    /** Returns the aliases of a canonical name, or an empty list if it is not registered. */
    public List<String> getAliases(String canonicalName) {
        Registration registration = byName.get(canonicalName);
        return registration != null ? registration.aliases() : List.of();
    }

    /** Returns every canonical name followed by its aliases. */
    public List<String> listPatternNames() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Registration> e : byName.entrySet()) {
            names.add(e.getKey());
            names.addAll(e.getValue().aliases());
        }
        return names;
    }

    public int size() {
        return byName.size();
    }

    public static final class Builder {
        private final Map<String, Registration> byName = new LinkedHashMap<>();
        private final Map<String, String> lookup = new HashMap<>();

        private Builder() {}

        /**
         * @throws IllegalArgumentException if the name or any alias is already taken
         */
        public Builder register(Pattern pattern, List<String> aliases) {
            String name = pattern.name();
            claim(name, name);
            for (String alias : aliases) {
                claim(alias, name);
            }
            byName.put(name, new Registration(pattern, List.copyOf(aliases)));
            return this;
        }

        public Builder register(Pattern pattern, String... aliases) {
            return register(pattern, List.of(aliases));
        }

        public PatternRegistry build() {
            logger.debug("Built pattern registry: {}", byName.keySet());
            return new PatternRegistry(new LinkedHashMap<>(byName), new HashMap<>(lookup));
        }

        private void claim(String key, String canonical) {
            String normalized = key.toLowerCase(Locale.ROOT);
            String owner = lookup.putIfAbsent(normalized, canonical);
            if (owner != null) {
                throw new IllegalArgumentException(
                        "Name '"
                                + key
                                + "' of pattern "
                                + canonical
                                + " is already used by "
                                + owner);
            }
        }
    }
}
