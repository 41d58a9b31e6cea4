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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.sectioner.issues.Issue;
import net.boyechko.pdf.sectioner.issues.IssueList;
import net.boyechko.pdf.sectioner.issues.IssueSeverity;
import net.boyechko.pdf.sectioner.issues.IssueType;
import net.boyechko.pdf.sectioner.model.Chapter;
import net.boyechko.pdf.sectioner.model.DocumentTree;
import net.boyechko.pdf.sectioner.model.OutlineNode;
import net.boyechko.pdf.sectioner.model.Section;
import org.junit.jupiter.api.Test;

class OutlineBuilderTest {
    private final OutlineBuilder builder = new OutlineBuilder("Глава");

    private static OutlineEntry entry(int depth, String title) {
        return new OutlineEntry(depth, title, 1);
    }

    @Test
    void buildsThreeLevelTreeInOutlineOrder() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(1, "Глава 1. Введение"),
                                entry(2, "1 Назначение"),
                                entry(3, "1.1 Область применения"),
                                entry(3, "1.2 Термины"),
                                entry(2, "2 Требования"),
                                entry(1, "Глава 2 Установка")));

        DocumentTree tree = result.tree();
        assertTrue(result.issues().isEmpty(), "Well-formed outline should raise no issues");
        assertEquals(List.of("1", "2"), List.copyOf(tree.chapters().keySet()));

        Chapter first = tree.chapter("1");
        assertEquals("Введение", first.title());
        assertEquals(List.of("1", "2"), List.copyOf(first.sections().keySet()));
        Section purpose = first.section("1");
        assertEquals("Назначение", purpose.title());
        assertEquals(List.of("1.1", "1.2"), List.copyOf(purpose.subsections().keySet()));
        assertEquals("1/1/1.2", purpose.subsection("1.2").path());
        assertTrue(tree.chapter("2").sections().isEmpty());

        for (OutlineNode node : tree.preOrder()) {
            assertEquals("", node.text(), "Fresh tree should carry no text: " + node);
        }
    }

    @Test
    void levelFollowsNumberNotDepth() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(1, "Глава 1 А"),
                                entry(3, "1 Раздел на третьем уровне"),
                                entry(2, "1.1 Подраздел на втором уровне")));

        Section section = result.tree().chapter("1").section("1");
        assertNotNull(section);
        assertEquals("Раздел на третьем уровне", section.title());
        assertNotNull(section.subsection("1.1"));
    }

    @Test
    void untitledChapterBorrowsNextEntryTitle() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(1, "Глава 3"),
                                entry(2, "  Отчеты и печать "),
                                entry(2, "1 Отчеты")));

        assertEquals("Отчеты и печать", result.tree().chapter("3").title());
        IssueList borrowed = result.issues().ofType(IssueType.BORROWED_TITLE);
        assertEquals(1, borrowed.size());
        assertEquals(IssueSeverity.INFO, borrowed.get(0).severity());
        // the borrowed entry itself has no number and is discarded
        assertEquals(1, result.issues().ofType(IssueType.MALFORMED_ENTRY).size());
        assertEquals(List.of("1"), List.copyOf(result.tree().chapter("3").sections().keySet()));
    }

    @Test
    void untitledLastChapterStaysUntitled() {
        OutlineResult result = builder.build(List.of(entry(1, "Глава 9")));

        assertEquals("", result.tree().chapter("9").title());
        assertTrue(result.issues().ofType(IssueType.BORROWED_TITLE).isEmpty());
    }

    @Test
    void subsectionWithoutSectionCreatesImplicitSection() {
        OutlineResult result =
                builder.build(List.of(entry(1, "Глава 2 Б"), entry(2, "2.1 Первый подраздел")));

        Section implicit = result.tree().chapter("2").section("2");
        assertNotNull(implicit, "Implicit section should be keyed by the subsection prefix");
        assertEquals("", implicit.title());
        assertNotNull(implicit.subsection("2.1"));
        assertEquals(1, result.issues().ofType(IssueType.IMPLICIT_SECTION).size());
    }

    @Test
    void implicitSectionBelongsToCurrentChapter() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(1, "Глава 1 А"),
                                entry(2, "4 Раздел"),
                                entry(1, "Глава 2 Б"),
                                entry(2, "4.1 Подраздел")));

        assertTrue(result.tree().chapter("1").section("4").subsections().isEmpty());
        Section implicit = result.tree().chapter("2").section("4");
        assertNotNull(implicit.subsection("4.1"));
    }

    @Test
    void newChapterResetsCurrentSection() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(1, "Глава 1 А"),
                                entry(2, "1 Раздел"),
                                entry(1, "Глава 2 Б"),
                                entry(2, "1.1 Подраздел")));

        assertTrue(result.tree().chapter("1").section("1").subsections().isEmpty());
        assertNotNull(result.tree().chapter("2").section("1").subsection("1.1"));
    }

    @Test
    void entriesBeforeFirstChapterAreOrphans() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(2, "1 Предисловие"),
                                entry(3, "1.1 Благодарности"),
                                entry(1, "Глава 1 А")));

        assertEquals(2, result.issues().ofType(IssueType.ORPHAN_ENTRY).size());
        assertTrue(result.tree().chapter("1").sections().isEmpty());
    }

    @Test
    void unsupportedDepthIsReported() {
        OutlineResult result =
                builder.build(List.of(entry(1, "Глава 1 А"), entry(4, "1.1.1 Глубоко")));

        Issue issue = result.issues().ofType(IssueType.ORPHAN_ENTRY).get(0);
        assertEquals(1, issue.where().entryIndex());
        assertEquals(1, result.tree().size());
    }

    @Test
    void deeperNumberIsRejectedAsInvalid() {
        OutlineResult result =
                builder.build(
                        List.of(entry(1, "Глава 2 А"), entry(2, "2 Раздел"), entry(3, "2.1.3 X")));

        assertEquals(1, result.issues().ofType(IssueType.INVALID_NUMBER).size());
        assertTrue(result.tree().chapter("2").section("2").subsections().isEmpty());
    }

    @Test
    void chapterWithoutNumberIsDiscardedAndPreviousChapterStaysCurrent() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(1, "Глава 1 А"),
                                entry(1, "Приложения"),
                                entry(2, "5 Раздел")));

        assertEquals(1, result.issues().ofType(IssueType.MALFORMED_ENTRY).size());
        assertEquals(1, result.tree().chapters().size());
        assertNotNull(result.tree().chapter("1").section("5"));
    }

    @Test
    void duplicateNumberReplacesInPlace() {
        OutlineResult result =
                builder.build(
                        List.of(
                                entry(1, "Глава 1 Старое"),
                                entry(1, "Глава 2 Б"),
                                entry(1, "Глава 1 Новое")));

        assertEquals(List.of("1", "2"), List.copyOf(result.tree().chapters().keySet()));
        assertEquals("Новое", result.tree().chapter("1").title());
        IssueList duplicates = result.issues().ofType(IssueType.DUPLICATE_NUMBER);
        assertEquals(1, duplicates.size());
        assertEquals(IssueSeverity.WARNING, duplicates.get(0).severity());
    }

    @Test
    void emptyOutlineGivesEmptyTree() {
        OutlineResult result = builder.build(List.of());

        assertTrue(result.tree().isEmpty());
        assertTrue(result.issues().isEmpty());
    }
}
