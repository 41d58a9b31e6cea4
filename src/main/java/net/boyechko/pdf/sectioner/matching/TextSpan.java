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

import net.boyechko.pdf.sectioner.model.OutlineNode;

/**
 * A stretch of document text credited to one node.
 *
 * @param owner the node the text was credited to
 * @param start offset of the first character
 * @param end offset just past the last character
 * @param assigned false when the span held only whitespace and the node text was left empty
 */
public record TextSpan(OutlineNode owner, int start, int end, boolean assigned) {

    public int length() {
        return end - start;
    }
}
