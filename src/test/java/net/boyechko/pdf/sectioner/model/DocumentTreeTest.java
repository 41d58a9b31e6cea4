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
package net.boyechko.pdf.sectioner.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DocumentTreeTest {
    private DocumentTree tree;
    private Chapter first;
    private Section section;
    private Subsection subsection;

    @BeforeEach
    void buildTree() {
        tree = new DocumentTree();
        first = new Chapter("1", "Введение");
        section = new Section("1", "Назначение");
        subsection = new Subsection("1.1", "Область");
        section.putSubsection(subsection);
        first.putSection(section);
        first.putSection(new Section("2", ""));
        tree.putChapter(first);
        tree.putChapter(new Chapter("2", "Установка"));
    }

    @Test
    void preOrderVisitsChapterThenDescendants() {
        List<String> paths = tree.preOrder().stream().map(OutlineNode::path).toList();

        assertEquals(List.of("1", "1/1", "1/1/1.1", "1/2", "2"), paths);
        assertEquals(5, tree.size());
    }

    @Test
    void nodesKnowTheirKindAndParents() {
        assertEquals(NodeKind.CHAPTER, first.kind());
        assertEquals(NodeKind.SUBSECTION, subsection.kind());
        assertSame(first, section.chapter());
        assertSame(section, subsection.section());
        assertTrue(subsection.children().isEmpty());
    }

    @Test
    void textIsAssignedOnlyOnce() {
        assertFalse(section.hasText());
        section.assignText("body");

        assertEquals("body", section.text());
        assertThrows(IllegalStateException.class, () -> section.assignText("again"));
    }

    @Test
    void indentedTreeShowsDepthAndTextLength() {
        subsection.assignText("12345");

        String rendered = tree.toIndentedTreeString();

        assertEquals(
                "1 Введение\n  1 Назначение\n    1.1 Область [5 chars]\n  2\n2 Установка\n",
                rendered);
        assertEquals(5, tree.assignedLength());
    }

    @Test
    void replacingChapterKeepsPosition() {
        Chapter replaced = tree.putChapter(new Chapter("1", "Другое"));

        assertSame(first, replaced);
        assertEquals(List.of("1", "2"), List.copyOf(tree.chapters().keySet()));
        assertEquals("Другое", tree.chapter("1").title());
    }

    @Test
    void numberIsRequiredAndTitleDefaultsToEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new Chapter("", "x"));
        assertEquals("", new Section("3", null).title());
        assertEquals("3", new Section("3", null).label());
    }
}
