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
package net.boyechko.pdf.sectioner.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.sectioner.matching.SplitOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Settings that adapt sectioning to a particular family of documents.
 *
 * <p>Loaded from YAML. Keys mirror the public fields:
 *
 * <pre>
 * chapter_marker: "Глава"
 * start_page: 13
 * search_from_cursor: false
 * skip_unmatched_subtrees: false
 * </pre>
 */
public final class SectionerConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/sectioner-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(SectionerConfig.class);

    /** Word that precedes the chapter number in chapter headings. */
    public String chapter_marker = "Глава";

    /** 1-based number of the first page whose text is searched. */
    public int start_page = 1;

    public boolean search_from_cursor;
    public boolean skip_unmatched_subtrees;

    /** Thrown when a configuration cannot be read or holds invalid values. */
    public static class ConfigException extends RuntimeException {
        public ConfigException(String message) {
            super(message);
        }

        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public String getChapterMarker() {
        return chapter_marker;
    }

    public int getStartPage() {
        return start_page;
    }

    public SplitOptions splitOptions() {
        return new SplitOptions(search_from_cursor, skip_unmatched_subtrees);
    }

    public SectionerConfig withChapterMarker(String chapterMarker) {
        SectionerConfig copy = copy();
        copy.chapter_marker = chapterMarker;
        return copy.validated();
    }

    public SectionerConfig withStartPage(int startPage) {
        SectionerConfig copy = copy();
        copy.start_page = startPage;
        return copy.validated();
    }

    public SectionerConfig withSearchFromCursor(boolean searchFromCursor) {
        SectionerConfig copy = copy();
        copy.search_from_cursor = searchFromCursor;
        return copy;
    }

    public SectionerConfig withSkipUnmatchedSubtrees(boolean skipUnmatchedSubtrees) {
        SectionerConfig copy = copy();
        copy.skip_unmatched_subtrees = skipUnmatchedSubtrees;
        return copy;
    }

    /**
     * Load a configuration from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static SectionerConfig fromResource(String resourcePath) {
        try (InputStream inputStream = SectionerConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new ConfigException("Resource not found: " + resourcePath);
            }
            return load(inputStream, resourcePath);
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration " + resourcePath, e);
        }
    }

    public static SectionerConfig fromFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream, path.toString());
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration " + path, e);
        }
    }

    /** Load default configuration from standard location */
    public static SectionerConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static SectionerConfig load(InputStream inputStream, String origin) {
        SectionerConfig config;
        try {
            var yaml = new Yaml(new Constructor(SectionerConfig.class, new LoaderOptions()));
            config = yaml.load(inputStream);
        } catch (RuntimeException e) {
            logger.error("Failed to parse configuration {}: {}", origin, e.getMessage());
            throw new ConfigException(
                    "Failed to parse configuration " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            // empty document
            config = new SectionerConfig();
        }
        logger.debug(
                "Loaded configuration from {}: marker={}, start page={}",
                origin,
                config.chapter_marker,
                config.start_page);
        return config.validated();
    }

    private SectionerConfig validated() {
        if (chapter_marker == null || chapter_marker.isBlank()) {
            throw new ConfigException("chapter_marker must not be blank");
        }
        if (start_page < 1) {
            throw new ConfigException("start_page must be 1 or greater, got " + start_page);
        }
        return this;
    }

    private SectionerConfig copy() {
        SectionerConfig copy = new SectionerConfig();
        copy.chapter_marker = chapter_marker;
        copy.start_page = start_page;
        copy.search_from_cursor = search_from_cursor;
        copy.skip_unmatched_subtrees = skip_unmatched_subtrees;
        return copy;
    }
}
