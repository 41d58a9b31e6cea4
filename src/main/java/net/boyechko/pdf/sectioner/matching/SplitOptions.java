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
package net.boyechko.pdf.sectioner.matching;

/**
 * Switches that change how {@link SequentialSplitter} searches for headings.
 *
 * @param searchFromCursor search each heading only after the end of the previous match instead
 *     of in the whole text, so a title repeated earlier in the document cannot be picked up
 * @param skipUnmatchedSubtrees do not search for the children of a heading that was not found
 */
public record SplitOptions(boolean searchFromCursor, boolean skipUnmatchedSubtrees) {

    /** Whole-text search, every node visited. */
    public static SplitOptions defaults() {
        return new SplitOptions(false, false);
    }
}
