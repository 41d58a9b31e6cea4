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

import static org.junit.jupiter.api.Assertions.*;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.sectioner.model.Chapter;
import net.boyechko.pdf.sectioner.model.Section;
import org.junit.jupiter.api.Test;

class HeadingPatternsTest {
    private final HeadingPatterns patterns = new HeadingPatterns("Глава");

    @Test
    void chapterToleratesMissingAndBrokenWhitespace() {
        Pattern chapter = patterns.chapterPattern("3", "Отчеты и печать");

        assertTrue(chapter.matcher("Глава 3 Отчеты и печать").find());
        assertTrue(chapter.matcher("Глава3Отчетыипечать").find());
        assertTrue(chapter.matcher("Глава  3\nОтчеты и\n  печать").find());
    }

    @Test
    void chapterIsCaseInsensitiveForCyrillic() {
        Pattern chapter = patterns.chapterPattern("3", "Отчеты");

        assertTrue(chapter.matcher("ГЛАВА 3 ОТЧЕТЫ").find());
        assertTrue(chapter.matcher("глава 3 отчеты").find());
    }

    @Test
    void chapterMayAppearMidLine() {
        Pattern chapter = patterns.chapterPattern("1", "Introduction");
        Matcher m = chapter.matcher("noise Глава 1 Introduction");

        assertTrue(m.find());
        assertEquals(6, m.start());
    }

    @Test
    void titleCharactersAreLiteral() {
        Pattern chapter = patterns.chapterPattern("2", "Настройка (v1.2)");

        assertTrue(chapter.matcher("Глава 2 Настройка (v1.2)").find());
        assertFalse(chapter.matcher("Глава 2 Настройка v1x2").find());
    }

    @Test
    void sectionMustStartALine() {
        Pattern section = patterns.linePattern("1.1", "Обзор");
        String text = "см. 1.1 Обзор выше\n1.1 Обзор\nтекст";

        Matcher m = section.matcher(text);
        assertTrue(m.find());
        assertEquals(text.indexOf("\n1.1") + 1, m.start());
    }

    @Test
    void numberDotIsLiteral() {
        Pattern section = patterns.linePattern("1.1", "Обзор");

        assertFalse(section.matcher("1x1 Обзор").find());
        assertTrue(section.matcher("1.1Обзор").find());
    }

    @Test
    void compileChoosesPatternByNodeKind() {
        Chapter chapter = new Chapter("1", "Alpha");
        Section section = new Section("1", "Alpha");
        chapter.putSection(section);

        assertTrue(patterns.compile(chapter).matcher("x Глава 1 Alpha").find());
        assertFalse(patterns.compile(section).matcher("x 1 Alpha").find());
        assertTrue(patterns.compile(section).matcher("x\n1 Alpha").find());
    }

    @Test
    void relaxCollapsesWhitespaceRuns() {
        String relaxed = HeadingPatterns.relax(" a  b\tc ");

        assertTrue(Pattern.matches(relaxed, "abc"));
        assertTrue(Pattern.matches(relaxed, " a \n b c"));
        assertEquals("", HeadingPatterns.relax(""));
    }

    @Test
    void rejectsBlankMarker() {
        assertThrows(IllegalArgumentException.class, () -> new HeadingPatterns(""));
    }
}
