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

import java.util.regex.Pattern;
import net.boyechko.pdf.sectioner.model.NodeKind;
import net.boyechko.pdf.sectioner.model.OutlineNode;

/**
 * Compiles outline headings into patterns that tolerate the whitespace noise of extracted text.
 *
 * <p>Every literal character of the heading must appear, in order, but any whitespace between
 * words may be missing, doubled or replaced by a line break. Chapters are found as marker,
 * number and title anywhere in the text; sections and subsections must start a line.
 */
public final class HeadingPatterns {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;
    private static final Pattern WHITESPACE_RUN =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String ANY_WHITESPACE = "\\s*";

    private final String chapterMarker;

    public HeadingPatterns(String chapterMarker) {
        if (chapterMarker == null || chapterMarker.isBlank()) {
            throw new IllegalArgumentException("Chapter marker must not be blank");
        }
        this.chapterMarker = chapterMarker.strip();
    }

    public Pattern compile(OutlineNode node) {
        return node.kind() == NodeKind.CHAPTER
                ? chapterPattern(node.number(), node.title())
                : linePattern(node.number(), node.title());
    }

    public Pattern chapterPattern(String number, String title) {
        String regex =
                relax(chapterMarker)
                        + ANY_WHITESPACE
                        + Pattern.quote(number)
                        + ANY_WHITESPACE
                        + relax(title);
        return Pattern.compile(regex, FLAGS);
    }

    public Pattern linePattern(String number, String title) {
        String regex = "^" + Pattern.quote(number) + ANY_WHITESPACE + relax(title);
        return Pattern.compile(regex, FLAGS | Pattern.MULTILINE);
    }

    /**
     * Quotes the text literally, except that each run of whitespace matches zero or more
     * whitespace characters.
     */
    static String relax(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        int last = 0;
        var m = WHITESPACE_RUN.matcher(text);
        while (m.find()) {
            if (m.start() > last) {
                sb.append(Pattern.quote(text.substring(last, m.start())));
            }
            sb.append(ANY_WHITESPACE);
            last = m.end();
        }
        if (last < text.length()) {
            sb.append(Pattern.quote(text.substring(last)));
        }
        return sb.toString();
    }
}
