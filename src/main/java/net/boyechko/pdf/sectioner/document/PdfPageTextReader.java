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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.canvas.parser.PdfTextExtractor;
import com.itextpdf.kernel.pdf.canvas.parser.listener.LocationTextExtractionStrategy;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.sectioner.core.PageTextSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Extracts the plain text of each page in reading order, without layout reconstruction. */
public class PdfPageTextReader implements PageTextSource {
    private static final Logger logger = LoggerFactory.getLogger(PdfPageTextReader.class);

    private final PdfDocument doc;

    public PdfPageTextReader(PdfDocument doc) {
        this.doc = doc;
    }

    /**
     * Returns one string per page. A page whose content cannot be parsed contributes an empty
     * string so that page numbers stay aligned.
     */
    @Override
    public List<String> readPages() {
        int pageCount = doc.getNumberOfPages();
        List<String> pages = new ArrayList<>(pageCount);
        for (int i = 1; i <= pageCount; i++) {
            pages.add(extractPage(i));
        }
        logger.debug("Extracted text from {} pages", pageCount);
        return pages;
    }

    private String extractPage(int pageNum) {
        try {
            String text =
                    PdfTextExtractor.getTextFromPage(
                            doc.getPage(pageNum), new LocationTextExtractionStrategy());
            return text != null ? text : "";
        } catch (RuntimeException e) {
            logger.warn("Failed to extract text from page {}: {}", pageNum, e.getMessage());
            return "";
        }
    }
}
