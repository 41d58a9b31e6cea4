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
package net.boyechko.pdf.sectioner.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.sectioner.model.Chapter;
import net.boyechko.pdf.sectioner.model.DocumentTree;
import net.boyechko.pdf.sectioner.model.Section;
import net.boyechko.pdf.sectioner.model.Subsection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a populated outline tree as JSON.
 *
 * <p>The top-level object maps chapter numbers to chapters; chapters map section numbers to
 * sections under {@code "sections"}, and sections map subsection numbers to subsections under
 * {@code "subsections"}. Keys appear in outline order. Every node has {@code "title"} and
 * {@code "text"}.
 */
public class JsonTreeWriter {
    private static final Logger logger = LoggerFactory.getLogger(JsonTreeWriter.class);

    static final String TITLE = "title";
    static final String TEXT = "text";
    static final String SECTIONS = "sections";
    static final String SUBSECTIONS = "subsections";

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public JsonTreeWriter() {
        this(new ObjectMapper());
    }

    public JsonTreeWriter(ObjectMapper mapper) {
        this.mapper = mapper;
        DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
        DefaultPrettyPrinter printer =
                new DefaultPrettyPrinter()
                        .withObjectIndenter(indenter)
                        .withArrayIndenter(indenter);
        this.writer = mapper.writer(printer);
    }

    public ObjectNode toJson(DocumentTree tree) {
        ObjectNode root = mapper.createObjectNode();
        for (Chapter chapter : tree.chapters().values()) {
            ObjectNode chapterNode = root.putObject(chapter.number());
            chapterNode.put(TITLE, chapter.title());
            chapterNode.put(TEXT, chapter.text());
            ObjectNode sections = chapterNode.putObject(SECTIONS);
            for (Section section : chapter.sections().values()) {
                ObjectNode sectionNode = sections.putObject(section.number());
                sectionNode.put(TITLE, section.title());
                sectionNode.put(TEXT, section.text());
                ObjectNode subsections = sectionNode.putObject(SUBSECTIONS);
                for (Subsection subsection : section.subsections().values()) {
                    ObjectNode subsectionNode = subsections.putObject(subsection.number());
                    subsectionNode.put(TITLE, subsection.title());
                    subsectionNode.put(TEXT, subsection.text());
                }
            }
        }
        return root;
    }

    public String writeToString(DocumentTree tree) throws JsonProcessingException {
        return writer.writeValueAsString(toJson(tree));
    }

    /** Writes the tree as UTF-8 JSON, creating parent directories as needed. */
    public void write(DocumentTree tree, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer.writeValue(outputPath.toFile(), toJson(tree));
        logger.info("Saved structure of {} chapters to {}", tree.chapters().size(), outputPath);
    }
}
