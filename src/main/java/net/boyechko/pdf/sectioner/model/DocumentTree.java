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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ordered forest of chapters, sections and subsections built from a document outline. */
public final class DocumentTree {
    private final Map<String, Chapter> chapters = new LinkedHashMap<>();

    public Map<String, Chapter> chapters() {
        return Collections.unmodifiableMap(chapters);
    }

    public Chapter chapter(String number) {
        return chapters.get(number);
    }

    /**
     * Adds a chapter, replacing any chapter with the same number while keeping its position.
     *
     * @return the chapter that was replaced, or null
     */
    public Chapter putChapter(Chapter chapter) {
        return chapters.put(chapter.number(), chapter);
    }

    public boolean isEmpty() {
        return chapters.isEmpty();
    }

    /** Returns every node in document order: each chapter, then its sections and subsections. */
    public List<OutlineNode> preOrder() {
        List<OutlineNode> nodes = new ArrayList<>();
        for (Chapter chapter : chapters.values()) {
            collect(chapter, nodes);
        }
        return nodes;
    }

    private static void collect(OutlineNode node, List<OutlineNode> out) {
        out.add(node);
        for (OutlineNode child : node.children()) {
            collect(child, out);
        }
    }

    public int size() {
        return preOrder().size();
    }

    /** Returns one line per node, indented by depth, with the length of its text. */
    public String toIndentedTreeString() {
        StringBuilder sb = new StringBuilder();
        for (Chapter chapter : chapters.values()) {
            appendIndentedTree(sb, chapter, 0);
        }
        return sb.toString();
    }

    private static void appendIndentedTree(StringBuilder sb, OutlineNode node, int depth) {
        sb.append("  ".repeat(depth));
        sb.append(node.label());
        if (node.hasText()) {
            sb.append(" [").append(node.text().length()).append(" chars]");
        }
        sb.append('\n');
        for (OutlineNode child : node.children()) {
            appendIndentedTree(sb, child, depth + 1);
        }
    }

    /** Returns the total number of characters assigned to nodes. */
    public int assignedLength() {
        return preOrder().stream().mapToInt(node -> node.text().length()).sum();
    }
}
