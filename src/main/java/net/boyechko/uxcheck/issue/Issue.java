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
package net.boyechko.uxcheck.issue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A diagnostic raised by a pattern rule against one node (or one group of nodes).
 *
 * <p>Several issues may share an {@link #id()}: a rule emits one per offending node.
 *
 * @param id id of the rule that raised the issue, e.g. "disclosure-no-control"
 * @param nodeId offending node, or null for tree-wide findings
 * @param source guideline attribution; may be null
 * @param suggestion remediation text; may be null
 * @param details structured context in insertion order; never null, values may be null
 */
public record Issue(
        String id,
        IssueSev severity,
        String message,
        String nodeId,
        IssueSource source,
        String suggestion,
        Map<String, Object> details) {

    public Issue {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        details =
                details != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                        : Map.of();
    }

    public static Builder builder(String id, IssueSev severity, String message) {
        return new Builder(id, severity, message);
    }

    public Optional<String> suggestionText() {
        return Optional.ofNullable(suggestion);
    }

    public boolean isError() {
        return severity == IssueSev.ERROR;
    }

    public Object detail(String key) {
        return details.get(key);
    }

    public static final class Builder {
        private final String id;
        private final IssueSev severity;
        private final String message;
        private String nodeId;
        private IssueSource source;
        private String suggestion;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(String id, IssueSev severity, String message) {
            this.id = id;
            this.severity = severity;
            this.message = message;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder source(IssueSource source) {
            this.source = source;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder suggestion(Optional<String> suggestion) {
            this.suggestion = suggestion.orElse(null);
            return this;
        }

        public Builder detail(String key, Object value) {
            details.put(key, value);
            return this;
        }

        public Issue build() {
            return new Issue(id, severity, message, nodeId, source, suggestion, details);
        }
    }
}
