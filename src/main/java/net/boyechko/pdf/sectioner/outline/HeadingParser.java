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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw bookmark titles into a heading number and the remaining title.
 *
 * <p>Chapter titles may start with a chapter marker word ("Глава 3. Отчеты"); section and
 * subsection titles start directly with a possibly dotted numeral ("3.2 Настройка").
 */
public final class HeadingParser {
    private static final Pattern SECTION_TITLE =
            Pattern.compile("^(\\d+(?:\\.\\d+)*)\\.?\\s*(.*)", Pattern.UNICODE_CHARACTER_CLASS);

    private final Pattern chapterTitle;

    public HeadingParser(String chapterMarker) {
        if (chapterMarker == null || chapterMarker.isBlank()) {
            throw new IllegalArgumentException("Chapter marker must not be blank");
        }
        this.chapterTitle =
                Pattern.compile(
                        "^(" + Pattern.quote(chapterMarker.strip()) + "\\s*)?(\\d+)\\.?\\s*(.*)",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    }

    /** A heading number and the title text that followed it. */
    public record ParsedHeading(String number, String title) {}

    /** Parses a chapter bookmark title; empty if it carries no chapter number. */
    public Optional<ParsedHeading> parseChapter(String rawTitle) {
        Matcher m = chapterTitle.matcher(rawTitle);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedHeading(m.group(2), clean(m.group(3))));
    }

    /** Parses a section or subsection bookmark title; empty if it starts with no numeral. */
    public Optional<ParsedHeading> parseSection(String rawTitle) {
        Matcher m = SECTION_TITLE.matcher(rawTitle);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedHeading(m.group(1), clean(m.group(2))));
    }

    static String clean(String text) {
        return text == null ? "" : text.strip();
    }
}
