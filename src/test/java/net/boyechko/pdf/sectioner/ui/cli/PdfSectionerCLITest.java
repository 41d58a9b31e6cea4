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
package net.boyechko.pdf.sectioner.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.sectioner.PdfTestBase;
import net.boyechko.pdf.sectioner.config.SectionerConfig;
import net.boyechko.pdf.sectioner.core.VerbosityLevel;
import net.boyechko.pdf.sectioner.ui.cli.PdfSectionerCLI.CLIConfig;
import net.boyechko.pdf.sectioner.ui.cli.PdfSectionerCLI.CLIException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public class PdfSectionerCLITest extends PdfTestBase {
    private static final String PROCESSING_LOGGER = "net.boyechko.pdf.sectioner.processing";

    private Path book;

    @BeforeEach
    void createBook() throws Exception {
        book = createSampleBook();
    }

    private static CLIConfig parse(String... args) throws CLIException {
        return PdfSectionerCLI.parseArguments(args);
    }

    @Test
    void defaultOutputSitsNextToInput() throws Exception {
        CLIConfig config = parse(book.toString());

        assertEquals(book.resolveSibling("sample_book_structure.json"), config.outputPath());
        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
        assertNull(config.startPage());
        assertNull(config.chapterMarker());
    }

    @Test
    void outputDirectoryGetsDefaultFileName() throws Exception {
        Path dir = Files.createDirectories(testOutputPath("out"));

        CLIConfig config = parse(book.toString(), dir.toString());

        assertEquals(dir.resolve("sample_book_structure.json"), config.outputPath());
    }

    @Test
    void parsesOptionsInBothForms() throws Exception {
        CLIConfig config =
                parse(
                        "-vv",
                        "--start-page=2",
                        "-m",
                        "Chapter",
                        "--forward-search",
                        "--skip-unmatched",
                        "-p",
                        "secret",
                        book.toString(),
                        "result.json");

        assertEquals(VerbosityLevel.DEBUG, config.verbosity());
        assertEquals(2, config.startPage());
        assertEquals("Chapter", config.chapterMarker());
        assertTrue(config.forwardSearch());
        assertTrue(config.skipUnmatched());
        assertEquals("secret", config.password());
        assertEquals(Path.of("result.json"), config.outputPath());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(CLIException.class, () -> parse());
        assertThrows(CLIException.class, () -> parse("--bogus", book.toString()));
        assertThrows(CLIException.class, () -> parse(book.toString(), "-s"));
        assertThrows(CLIException.class, () -> parse("-s", "0", book.toString()));
        assertThrows(CLIException.class, () -> parse("--start-page=two", book.toString()));
        assertThrows(CLIException.class, () -> parse(book.toString(), "a.json", "b.json"));
        assertThrows(CLIException.class, () -> parse(testOutputPath("none.pdf").toString()));
        assertThrows(
                CLIException.class,
                () -> parse("-c", testOutputPath("none.yaml").toString(), book.toString()));
    }

    @Test
    void commandLineOverridesConfigFile() throws Exception {
        Path yaml = testOutputPath("book.yaml");
        Files.writeString(yaml, "chapter_marker: Part\nstart_page: 4\n");

        CLIConfig config =
                parse("-c", yaml.toString(), "-m", "Chapter", "--forward-search", book.toString());

        SectionerConfig resolved = PdfSectionerCLI.resolveSectionerConfig(config);

        assertEquals("Chapter", resolved.getChapterMarker());
        assertEquals(4, resolved.getStartPage());
        assertTrue(resolved.splitOptions().searchFromCursor());
        assertFalse(resolved.splitOptions().skipUnmatchedSubtrees());
    }

    @Test
    void writesStructureJson() throws Exception {
        Path output = testOutputPath("json/book.json");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int status =
                PdfSectionerCLI.processFile(
                        parse("-q", "-m", "Chapter", "-s", "2", book.toString(), output.toString()),
                        new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(0, status);
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals("Alpha", root.at("/1/title").asText());
        assertEquals("Alpha intro", root.at("/1/text").asText().strip());
        assertEquals("deep text", root.at("/1/sections/1/subsections/1.1/text").asText().strip());
        assertEquals("text two", root.at("/1/sections/2/text").asText().strip());
    }

    @Test
    void dumpOutlinePrintsTreeWithoutWriting() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int status =
                PdfSectionerCLI.processFile(
                        parse("-q", "--dump-outline", "-m", "Chapter", book.toString()),
                        new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(0, status);
        assertEquals(
                "1 Alpha\n  1 One\n    1.1 Deep\n  2 Two\n",
                buffer.toString(StandardCharsets.UTF_8));
        assertFalse(Files.exists(book.resolveSibling("sample_book_structure.json")));
    }

    @Test
    void invalidConfigFileFailsWithStatusOne() throws Exception {
        Path yaml = testOutputPath("invalid.yaml");
        Files.writeString(yaml, "start_page: 0\n");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int status =
                PdfSectionerCLI.processFile(
                        parse("-q", "-c", yaml.toString(), book.toString()),
                        new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(1, status);
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Invalid configuration"));
    }

    @Test
    void unreadablePdfFailsWithStatusOne() throws Exception {
        Path notPdf = testOutputPath("not_a.pdf");
        Files.writeString(notPdf, "plain text, not a PDF");

        int status =
                PdfSectionerCLI.processFile(
                        parse("-q", notPdf.toString()),
                        new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertEquals(1, status);
    }

    @Test
    void plainModeLogsEachPhaseOnceAtDefaultVerbosity() throws Exception {
        Path output = testOutputPath("plain/book.json");
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        Logger processing = (Logger) LoggerFactory.getLogger(PROCESSING_LOGGER);
        Logger sectioner = (Logger) LoggerFactory.getLogger("net.boyechko.pdf.sectioner");
        Level sectionerLevel = sectioner.getLevel();
        int status;
        try {
            System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
            CLIConfig config =
                    parse(
                            "--plain",
                            "-m",
                            "Chapter",
                            "-s",
                            "2",
                            book.toString(),
                            output.toString());
            PdfSectionerCLI.configureLogging(config.verbosity());

            status = PdfSectionerCLI.processFile(config, System.out);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
            processing.detachAppender("SECTIONER_CONSOLE");
            processing.setAdditive(true);
            processing.setLevel(null);
            sectioner.setLevel(sectionerLevel);
        }

        assertEquals(0, status);
        String out = stdout.toString(StandardCharsets.UTF_8);
        assertEquals(1, occurrences(out, "PHASE Matching"), out);
        assertEquals(1, occurrences(out, "OK Output saved to"), out);
        assertEquals(1, occurrences(out, "SUMMARY headings=4"), out);
        assertFalse(stderr.toString(StandardCharsets.UTF_8).contains("PHASE"));
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }
}
