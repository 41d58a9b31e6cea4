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

/** Second level of the outline, numbered "N". */
public final class Section extends OutlineNode {
    private final Map<String, Subsection> subsections = new LinkedHashMap<>();
    private Chapter chapter;

    public Section(String number, String title) {
        super(number, title);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SECTION;
    }

    @Override
    public Collection<Subsection> children() {
        return Collections.unmodifiableCollection(subsections.values());
    }

    @Override
    public String path() {
        return chapter != null ? chapter.path() + "/" + number() : number();
    }

    public Chapter chapter() {
        return chapter;
    }

    void attachTo(Chapter chapter) {
        this.chapter = chapter;
    }

    public Map<String, Subsection> subsections() {
        return Collections.unmodifiableMap(subsections);
    }

    public Subsection subsection(String number) {
        return subsections.get(number);
    }

    /**
     * Adds a subsection, replacing any subsection with the same number while keeping its position.
     *
     * @return the subsection that was replaced, or null
     */
    public Subsection putSubsection(Subsection subsection) {
        subsection.attachTo(this);
        return subsections.put(subsection.number(), subsection);
    }
}
