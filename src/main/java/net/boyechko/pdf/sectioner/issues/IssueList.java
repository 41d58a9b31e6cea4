/*
 * PDF-Sectioner - Outline-Driven PDF Text Sectioning
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
package net.boyechko.pdf.sectioner.issues;

import java.util.ArrayList;
import java.util.stream.Collectors;

/** List of diagnostics raised while sectioning a document. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    /** Returns the subset of this list with the given type. */
    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns the subset of this list with WARNING severity. */
    public IssueList getWarnings() {
        return stream()
                .filter(issue -> issue.severity() != IssueSeverity.INFO)
                .collect(Collectors.toCollection(IssueList::new));
    }
}
