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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** List of issues raised against a scaffold tree. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    public IssueList(Issue issue) {
        super();
        if (issue != null) {
            add(issue);
        }
    }

    /** Returns the issues raised by failed MUST rules. */
    public IssueList errors() {
        return withSeverity(IssueSev.ERROR);
    }

    /** Returns the issues raised by failed SHOULD rules. */
    public IssueList warnings() {
        return withSeverity(IssueSev.WARN);
    }

    public boolean hasErrors() {
        return stream().anyMatch(Issue::isError);
    }

    public IssueList withId(String ruleId) {
        return stream()
                .filter(issue -> issue.id().equals(ruleId))
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Groups issues by rule id, keeping first-seen order. */
    public Map<String, List<Issue>> byRuleId() {
        return stream()
                .collect(
                        Collectors.groupingBy(
                                Issue::id, LinkedHashMap::new, Collectors.toList()));
    }

    private IssueList withSeverity(IssueSev severity) {
        return stream()
                .filter(issue -> issue.severity() == severity)
                .collect(Collectors.toCollection(IssueList::new));
    }
}
