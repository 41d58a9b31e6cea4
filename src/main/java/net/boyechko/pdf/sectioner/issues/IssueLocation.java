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

/** Where in the outline or the document a diagnostic applies. */
public final class IssueLocation {
    private final Integer entryIndex; // 0-based index into the outline entries, if any
    private final Integer page; // null if not tied to a page
    private final String path; // node path such as "1/2/2.1"

    public IssueLocation() {
        this(null, null, null);
    }

    public IssueLocation(String path) {
        this(null, null, path);
    }

    public IssueLocation(Integer entryIndex, Integer page, String path) {
        this.entryIndex = entryIndex;
        this.page = page;
        this.path = path;
    }

    public static IssueLocation atEntry(int entryIndex, int page) {
        return new IssueLocation(entryIndex, page > 0 ? page : null, null);
    }

    public static IssueLocation atNode(String path) {
        return new IssueLocation(path);
    }

    public Integer entryIndex() {
        return entryIndex;
    }

    public Integer page() {
        return page;
    }

    public String path() {
        return path;
    }

    @Override
    public String toString() {
        String output = "";

        if (entryIndex != null) {
            output += "(entry " + (entryIndex + 1) + ")";
        }
        if (page != null) {
            output += " (page " + page + ")";
        }
        if (path != null) {
            output += " (" + path + ")";
        }
        return output.trim();
    }
}
