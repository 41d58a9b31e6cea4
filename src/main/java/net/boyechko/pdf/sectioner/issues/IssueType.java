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

/** Represents the type of a diagnostic raised while sectioning a document. */
public enum IssueType {
    // Outline issues
    NO_OUTLINE("documents without an outline"),
    MALFORMED_ENTRY("outline entries without a heading number"),
    ORPHAN_ENTRY("outline entries outside any chapter"),
    INVALID_NUMBER("outline entries with unsupported numbering"),
    DUPLICATE_NUMBER("outline entries replacing an earlier heading"),
    BORROWED_TITLE("chapters titled from the following entry"),
    IMPLICIT_SECTION("sections created for orphaned subsections"),

    // Text issues
    EMPTY_DOCUMENT("documents with no extractable text"),

    // Matching issues
    UNMATCHED_HEADING("headings not found in the text"),
    OUT_OF_ORDER_MATCH("headings found before the current position");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
