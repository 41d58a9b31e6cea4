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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfOutline;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.sectioner.PdfTestBase;
import net.boyechko.pdf.sectioner.outline.OutlineEntry;
import org.junit.jupiter.api.Test;

public class PdfOutlineReaderTest extends PdfTestBase {

    @Test
    void readsBookmarksDepthFirstWithPages() throws Exception {
        Path pdf = createSampleBook();

        try (PdfDocument doc = new PdfCustodian(pdf).openForReading()) {
            List<OutlineEntry> entries = new PdfOutlineReader(doc).readEntries();

            assertEquals(
                    List.of(
                            new OutlineEntry(1, "Chapter 1 Alpha", 2),
                            new OutlineEntry(2, "1 One", 2),
                            new OutlineEntry(3, "1.1 Deep", 3),
                            new OutlineEntry(2, "2 Two", 3)),
                    entries);
        }
    }

    @Test
    void documentWithoutBookmarksHasNoEntries() throws Exception {
        Path pdf =
                createTestPdf(
                        (pdfDoc, document) -> addLines(document, "Chapter 1 Alpha", "no outline"));

        try (PdfDocument doc = new PdfCustodian(pdf).openForReading()) {
            assertTrue(new PdfOutlineReader(doc).readEntries().isEmpty());
        }
    }

    @Test
    void bookmarkWithoutDestinationHasUnknownPage() throws Exception {
        Path pdf =
                createTestPdf(
                        (pdfDoc, document) -> {
                            addLines(document, "Chapter 1 Alpha");
                            PdfOutline root = pdfDoc.getOutlines(false);
                            root.addOutline("Chapter 1 Alpha");
                        });

        try (PdfDocument doc = new PdfCustodian(pdf).openForReading()) {
            List<OutlineEntry> entries = new PdfOutlineReader(doc).readEntries();

            assertEquals(List.of(new OutlineEntry(1, "Chapter 1 Alpha", -1)), entries);
        }
    }
}
