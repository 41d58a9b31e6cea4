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
package net.boyechko.pdf.sectioner.outline;

import java.util.List;
import java.util.Optional;
import net.boyechko.pdf.sectioner.issues.Issue;
import net.boyechko.pdf.sectioner.issues.IssueList;
import net.boyechko.pdf.sectioner.issues.IssueLocation;
import net.boyechko.pdf.sectioner.issues.IssueSeverity;
import net.boyechko.pdf.sectioner.issues.IssueType;
import net.boyechko.pdf.sectioner.model.Chapter;
import net.boyechko.pdf.sectioner.model.DocumentTree;
import net.boyechko.pdf.sectioner.model.OutlineNode;
import net.boyechko.pdf.sectioner.model.Section;
import net.boyechko.pdf.sectioner.model.Subsection;
import net.boyechko.pdf.sectioner.outline.HeadingParser.ParsedHeading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the chapter/section/subsection tree from a flat list of outline entries.
 *
 * <p>Depth 1 entries open chapters. Depth 2 and 3 entries become sections or subsections of
 * the current chapter depending on their number, not on their depth: "4" is a section and
 * "4.2" a subsection wherever they appear. Entries that cannot be placed are dropped with a
 * diagnostic; building never fails.
 */
public class OutlineBuilder {
    private static final Logger logger = LoggerFactory.getLogger(OutlineBuilder.class);

    private final HeadingParser parser;

    public OutlineBuilder(String chapterMarker) {
        this(new HeadingParser(chapterMarker));
    }

    public OutlineBuilder(HeadingParser parser) {
        this.parser = parser;
    }

    public OutlineResult build(List<OutlineEntry> entries) {
        DocumentTree tree = new DocumentTree();
        IssueList issues = new IssueList();

        Chapter currentChapter = null;
        Section currentSection = null;

        for (int i = 0; i < entries.size(); i++) {
            OutlineEntry entry = entries.get(i);
            IssueLocation where = IssueLocation.atEntry(i, entry.page());

            if (entry.depth() == 1) {
                Optional<ParsedHeading> parsed = parser.parseChapter(entry.title());
                if (parsed.isEmpty()) {
                    issues.add(
                            warning(
                                    IssueType.MALFORMED_ENTRY,
                                    where,
                                    "No chapter number in \"" + entry.title() + "\""));
                    continue;
                }
                String title = parsed.get().title();
                if (title.isEmpty()) {
                    title = borrowTitle(entries, i, where, issues);
                }
                Chapter chapter = new Chapter(parsed.get().number(), title);
                reportReplaced(tree.putChapter(chapter), where, issues);
                currentChapter = chapter;
                currentSection = null;
                logger.debug("Chapter {} \"{}\"", chapter.number(), chapter.title());
            } else if (entry.depth() == 2 || entry.depth() == 3) {
                if (currentChapter == null) {
                    issues.add(
                            warning(
                                    IssueType.ORPHAN_ENTRY,
                                    where,
                                    "\"" + entry.title() + "\" appears before any chapter"));
                    continue;
                }
                Optional<ParsedHeading> parsed = parser.parseSection(entry.title());
                if (parsed.isEmpty()) {
                    issues.add(
                            warning(
                                    IssueType.MALFORMED_ENTRY,
                                    where,
                                    "No section number in \"" + entry.title() + "\""));
                    continue;
                }
                String number = parsed.get().number();
                String title = parsed.get().title();

                switch (HeadingNumber.classify(number)) {
                    case SECTION -> {
                        Section section = new Section(number, title);
                        reportReplaced(currentChapter.putSection(section), where, issues);
                        currentSection = section;
                        logger.debug("Section {} \"{}\"", section.path(), title);
                    }
                    case SUBSECTION -> {
                        if (currentSection == null) {
                            currentSection =
                                    implicitSection(currentChapter, number, where, issues);
                        }
                        Subsection subsection = new Subsection(number, title);
                        reportReplaced(currentSection.putSubsection(subsection), where, issues);
                        logger.debug("Subsection {} \"{}\"", subsection.path(), title);
                    }
                    case INVALID ->
                            issues.add(
                                    warning(
                                            IssueType.INVALID_NUMBER,
                                            where,
                                            "Heading number "
                                                    + number
                                                    + " is neither a section nor a subsection"));
                }
            } else {
                issues.add(
                        warning(
                                IssueType.ORPHAN_ENTRY,
                                where,
                                "Outline depth " + entry.depth() + " is not supported"));
            }
        }

        logger.debug(
                "Built outline with {} chapters, {} issues", tree.chapters().size(), issues.size());
        return new OutlineResult(tree, issues);
    }

    /**
     * Some outlines carry only "Глава 3" on the chapter bookmark and put the chapter name on the
     * bookmark right after it. Such chapters take the next entry's title verbatim (stripped), or
     * stay untitled when the chapter is the last entry.
     */
    private static String borrowTitle(
            List<OutlineEntry> entries, int index, IssueLocation where, IssueList issues) {
        if (index + 1 >= entries.size()) {
            return "";
        }
        String borrowed = HeadingParser.clean(entries.get(index + 1).title());
        issues.add(
                new Issue(
                        IssueType.BORROWED_TITLE,
                        IssueSeverity.INFO,
                        where,
                        "Untitled chapter takes its title from the next entry: \""
                                + borrowed
                                + "\""));
        return borrowed;
    }

    private static Section implicitSection(
            Chapter chapter, String subsectionNumber, IssueLocation where, IssueList issues) {
        String number = HeadingNumber.parentOf(subsectionNumber);
        Section existing = chapter.section(number);
        if (existing != null) {
            return existing;
        }
        Section section = new Section(number, "");
        chapter.putSection(section);
        issues.add(
                new Issue(
                        IssueType.IMPLICIT_SECTION,
                        IssueSeverity.INFO,
                        where,
                        "Created untitled section "
                                + section.path()
                                + " for subsection "
                                + subsectionNumber));
        return section;
    }

    private static void reportReplaced(
            OutlineNode replaced, IssueLocation where, IssueList issues) {
        if (replaced == null) {
            return;
        }
        issues.add(
                warning(
                        IssueType.DUPLICATE_NUMBER,
                        where,
                        "Duplicate "
                                + replaced.kind().label()
                                + " "
                                + replaced.path()
                                + " replaces \""
                                + replaced.title()
                                + "\""));
    }

    private static Issue warning(IssueType type, IssueLocation where, String message) {
        return new Issue(type, IssueSeverity.WARNING, where, message);
    }
}
