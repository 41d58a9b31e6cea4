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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Top level of the outline. Sections are kept in the order the outline lists them. */
public final class Chapter extends OutlineNode {
    private final Map<String, Section> sections = new LinkedHashMap<>();

    public Chapter(String number, String title) {
        super(number, title);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CHAPTER;
    }

    @Override
    public Collection<Section> children() {
        return Collections.unmodifiableCollection(sections.values());
    }

    @Override
    public String path() {
        return number();
    }

    public Map<String, Section> sections() {
        return Collections.unmodifiableMap(sections);
    }

    public Section section(String number) {
        return sections.get(number);
    }

    /**
     * Adds a section, replacing any section with the same number while keeping its position.
     *
     * @return the section that was replaced, or null
     */
    public Section putSection(Section section) {
        section.attachTo(this);
        return sections.put(section.number(), section);
    }
}
