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
package net.boyechko.pdf.sectioner.document;

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNameTree;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfOutline;
import com.itextpdf.kernel.pdf.navigation.PdfDestination;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.sectioner.core.OutlineSource;
import net.boyechko.pdf.sectioner.outline.OutlineEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the bookmark tree of a PDF as a flat list of outline entries, depth first, in the order
 * a viewer shows them.
 */
public class PdfOutlineReader implements OutlineSource {
    private static final Logger logger = LoggerFactory.getLogger(PdfOutlineReader.class);

    private static final int UNKNOWN_PAGE = -1;

    private final PdfDocument doc;

    public PdfOutlineReader(PdfDocument doc) {
        this.doc = doc;
    }

    @Override
    public List<OutlineEntry> readEntries() {
        List<OutlineEntry> entries = new ArrayList<>();
        PdfOutline root = doc.getOutlines(false);
        if (root == null) {
            logger.debug("Document has no outline");
            return entries;
        }
        PdfNameTree destinations = doc.getCatalog().getNameTree(PdfName.Dests);
        collect(root.getAllChildren(), 1, destinations, entries);
        logger.debug("Read {} outline entries", entries.size());
        return entries;
    }

    private void collect(
            List<PdfOutline> outlines,
            int depth,
            PdfNameTree destinations,
            List<OutlineEntry> out) {
        for (PdfOutline outline : outlines) {
            out.add(new OutlineEntry(depth, outline.getTitle(), pageOf(outline, destinations)));
            collect(outline.getAllChildren(), depth + 1, destinations, out);
        }
    }

    /** Returns the 1-based page the bookmark points to, or -1 if it cannot be resolved. */
    private int pageOf(PdfOutline outline, PdfNameTree destinations) {
        PdfDestination destination = outline.getDestination();
        if (destination == null) {
            destination = goToDestination(outline);
        }
        if (destination == null) {
            return UNKNOWN_PAGE;
        }

        PdfObject page = destination.getDestinationPage(destinations);
        if (page instanceof PdfDictionary pageDict) {
            int pageNum = doc.getPageNumber(pageDict);
            return pageNum > 0 ? pageNum : UNKNOWN_PAGE;
        }
        if (page instanceof PdfNumber pageIndex) {
            // Remote-style destinations carry a 0-based page index
            return pageIndex.intValue() + 1;
        }
        return UNKNOWN_PAGE;
    }

    /** Bookmarks may use a GoTo action instead of a direct destination. */
    private static PdfDestination goToDestination(PdfOutline outline) {
        PdfDictionary action = outline.getContent().getAsDictionary(PdfName.A);
        if (action == null || !PdfName.GoTo.equals(action.getAsName(PdfName.S))) {
            return null;
        }
        PdfObject target = action.get(PdfName.D);
        return target != null ? PdfDestination.makeDestination(target) : null;
    }
}
