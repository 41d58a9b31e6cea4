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

import java.util.regex.Pattern;

/** Classifies heading numbers into the outline levels they may occupy below a chapter. */
public enum HeadingNumber {
    /** A bare integer such as "2". */
    SECTION,

    /** Exactly two dotted integers such as "2.1". */
    SUBSECTION,

    /** Anything else, e.g. "2.1.3". */
    INVALID;

    private static final Pattern SECTION_NUMBER =
            Pattern.compile("^\\d+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SUBSECTION_NUMBER =
            Pattern.compile("^\\d+\\.\\d+$", Pattern.UNICODE_CHARACTER_CLASS);

    public static HeadingNumber classify(String number) {
        if (number == null) {
            return INVALID;
        }
        if (SECTION_NUMBER.matcher(number).matches()) {
            return SECTION;
        }
        if (SUBSECTION_NUMBER.matcher(number).matches()) {
            return SUBSECTION;
        }
        return INVALID;
    }

    /** Returns the section number a subsection number belongs to ("2.1" gives "2"). */
    public static String parentOf(String subsectionNumber) {
        int dot = subsectionNumber.indexOf('.');
        return dot < 0 ? subsectionNumber : subsectionNumber.substring(0, dot);
    }
}
