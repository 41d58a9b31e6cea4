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
import java.util.List;

/** Third and last level of the outline, numbered "N.M". */
public final class Subsection extends OutlineNode {
    private Section section;

    public Subsection(String number, String title) {
        super(number, title);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUBSECTION;
    }

    @Override
    public Collection<OutlineNode> children() {
        return List.of();
    }

    @Override
    public String path() {
        return section != null ? section.path() + "/" + number() : number();
    }

    public Section section() {
        return section;
    }

    void attachTo(Section section) {
        this.section = section;
    }
}
