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
package net.boyechko.pdf.sectioner.outline;

/**
 * One bookmark of a document outline.
 *
 * @param depth nesting level, 1 for top-level bookmarks
 * @param title the bookmark title as stored in the document
 * @param page 1-based destination page, or -1 if the destination could not be resolved
 */
public record OutlineEntry(int depth, String title, int page) {
    public OutlineEntry {
        if (title == null) {
            title = "";
        }
    }
}
