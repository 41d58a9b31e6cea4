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
package net.boyechko.pdf.sectioner.core;

import net.boyechko.pdf.sectioner.issues.IssueList;
import net.boyechko.pdf.sectioner.matching.SplitResult;
import net.boyechko.pdf.sectioner.model.DocumentTree;

/**
 * Outcome of sectioning one document.
 *
 * @param tree the outline tree with node texts populated
 * @param text the assembled text the headings were searched in
 * @param outlineIssues diagnostics from reading and building the outline
 * @param textIssues diagnostics from assembling the text
 * @param split headings found, spans credited and matching diagnostics
 */
public record SectioningResult(
        DocumentTree tree,
        String text,
        IssueList outlineIssues,
        IssueList textIssues,
        SplitResult split) {

    public IssueList allIssues() {
        IssueList all = new IssueList();
        all.addAll(outlineIssues);
        all.addAll(textIssues);
        all.addAll(split.issues());
        return all;
    }

    public int headingCount() {
        return tree.size();
    }

    public int matchedCount() {
        return split.matchedCount();
    }

    public int unmatchedCount() {
        return headingCount() - matchedCount();
    }
}
