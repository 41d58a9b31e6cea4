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

/**
 * A numbered heading of the document outline together with the text that falls under it.
 *
 * <p>The number and title are fixed when the node is created. The text starts out empty and is
 * assigned at most once, while the document text is being split.
 */
public abstract class OutlineNode {
    private final String number;
    private final String title;
    private String text = "";
    private boolean textAssigned;

    protected OutlineNode(String number, String title) {
        if (number == null || number.isEmpty()) {
            throw new IllegalArgumentException("Heading number is required");
        }
        this.number = number;
        this.title = title != null ? title : "";
    }

    public String number() {
        return number;
    }

    public String title() {
        return title;
    }

    public String text() {
        return text;
    }

    public abstract NodeKind kind();

    /** Returns the direct children of this node in outline order. */
    public abstract Collection<? extends OutlineNode> children();

    /** Returns a slash-separated path of numbers from the chapter down to this node. */
    public abstract String path();

    public boolean hasText() {
        return !text.isEmpty();
    }

    /**
     * Sets the text owned by this node.
     *
     * @throws IllegalStateException if text was already assigned
     */
    public void assignText(String text) {
        if (textAssigned) {
            throw new IllegalStateException(
                    "Text already assigned to " + kind().label() + " " + path());
        }
        this.text = text != null ? text : "";
        this.textAssigned = true;
    }

    /** Returns "number title", or just the number when the title is empty. */
    public String label() {
        return title.isEmpty() ? number : number + " " + title;
    }

    @Override
    public String toString() {
        return kind().label() + " " + label();
    }
}
