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
package net.boyechko.pdf.sectioner.text;

import java.util.List;
import java.util.StringJoiner;

/** Joins the plain text of individual pages into the single string the splitter searches. */
public final class TextAssembler {
    private TextAssembler() {}

    /**
     * Concatenates page texts with newlines, starting at {@code startPage}.
     *
     * <p>Pages before the start page (covers, front matter, the table of contents itself) are
     * left out. Pages without any text are skipped rather than producing blank lines.
     *
     * @param pageTexts text of every page, first page first
     * @param startPage 1-based number of the first page to include
     */
    public static String assemble(List<String> pageTexts, int startPage) {
        if (startPage < 1) {
            throw new IllegalArgumentException("Start page must be 1 or greater, got " + startPage);
        }
        StringJoiner joined = new StringJoiner("\n");
        for (int i = startPage - 1; i < pageTexts.size(); i++) {
            String page = pageTexts.get(i);
            if (page != null && !page.isEmpty()) {
                joined.add(page);
            }
        }
        return joined.toString();
    }
}
