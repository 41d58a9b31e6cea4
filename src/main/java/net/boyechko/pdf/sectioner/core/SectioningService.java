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
package net.boyechko.pdf.sectioner.core;

import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.pdf.PdfDocument;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.pdf.sectioner.config.SectionerConfig;
import net.boyechko.pdf.sectioner.document.PdfCustodian;
import net.boyechko.pdf.sectioner.document.PdfOutlineReader;
import net.boyechko.pdf.sectioner.document.PdfPageTextReader;
import net.boyechko.pdf.sectioner.issues.Issue;
import net.boyechko.pdf.sectioner.issues.IssueList;
import net.boyechko.pdf.sectioner.issues.IssueSeverity;
import net.boyechko.pdf.sectioner.issues.IssueType;
import net.boyechko.pdf.sectioner.matching.HeadingPatterns;
import net.boyechko.pdf.sectioner.matching.SequentialSplitter;
import net.boyechko.pdf.sectioner.matching.SplitResult;
import net.boyechko.pdf.sectioner.model.DocumentTree;
import net.boyechko.pdf.sectioner.outline.OutlineBuilder;
import net.boyechko.pdf.sectioner.outline.OutlineEntry;
import net.boyechko.pdf.sectioner.outline.OutlineResult;
import net.boyechko.pdf.sectioner.text.TextAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates sectioning of a document: outline, text, then matching. */
public class SectioningService {
    private static final Logger logger = LoggerFactory.getLogger(SectioningService.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final PdfCustodian custodian;
    private final OutlineSource outlineSource;
    private final PageTextSource pageTextSource;
    private final SectionerConfig config;
    private final ProcessingListener listener;

    public static class SectioningServiceBuilder {
        private PdfCustodian custodian;
        private OutlineSource outlineSource;
        private PageTextSource pageTextSource;
        private SectionerConfig config;
        private ProcessingListener listener;

        /** Reads both outline and page text from a PDF. */
        public SectioningServiceBuilder withPdfCustodian(PdfCustodian custodian) {
            this.custodian = custodian;
            return this;
        }

        public SectioningServiceBuilder withOutlineSource(OutlineSource outlineSource) {
            this.outlineSource = outlineSource;
            return this;
        }

        public SectioningServiceBuilder withPageTextSource(PageTextSource pageTextSource) {
            this.pageTextSource = pageTextSource;
            return this;
        }

        public SectioningServiceBuilder withConfig(SectionerConfig config) {
            this.config = config;
            return this;
        }

        public SectioningServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public SectioningService build() {
            if (custodian == null && (outlineSource == null || pageTextSource == null)) {
                throw new IllegalStateException(
                        "Either withPdfCustodian(...) or both withOutlineSource(...) and"
                                + " withPageTextSource(...) must be provided before building"
                                + " SectioningService");
            }
            if (custodian != null && (outlineSource != null || pageTextSource != null)) {
                throw new IllegalStateException(
                        "withPdfCustodian(...) cannot be combined with explicit sources");
            }
            return new SectioningService(this);
        }
    }

    private SectioningService(SectioningServiceBuilder builder) {
        this.custodian = builder.custodian;
        this.outlineSource = builder.outlineSource;
        this.pageTextSource = builder.pageTextSource;
        this.config = builder.config != null ? builder.config : SectionerConfig.loadDefault();
        this.listener = builder.listener != null ? builder.listener : new SilentListener();
    }

    /** Reads the document, builds its outline and credits the text to the outline nodes. */
    public SectioningResult process() throws SectioningException {
        listener.onPhaseStart("Reading document");
        DocumentInput input = readInput(true);
        listener.onSuccess(
                "Read "
                        + input.entries().size()
                        + " outline entries and "
                        + input.pages().size()
                        + " pages");

        OutlineResult outline = buildOutline(input.entries());
        DocumentTree tree = outline.tree();

        listener.onPhaseStart("Text");
        IssueList textIssues = new IssueList();
        String text = TextAssembler.assemble(input.pages(), config.getStartPage());
        if (text.isEmpty()) {
            Issue issue =
                    new Issue(
                            IssueType.EMPTY_DOCUMENT,
                            IssueSeverity.INFO,
                            "No text found from page " + config.getStartPage() + " on");
            textIssues.add(issue);
            listener.onWarning(issue);
        } else {
            listener.onSuccess(
                    "Assembled "
                            + text.length()
                            + " characters starting at page "
                            + config.getStartPage());
        }

        listener.onPhaseStart("Matching");
        SequentialSplitter splitter =
                new SequentialSplitter(
                        new HeadingPatterns(config.getChapterMarker()), config.splitOptions());
        SplitResult split = splitter.split(tree, text);
        if (split.issues().isEmpty()) {
            listener.onSuccess("Matched all " + tree.size() + " headings");
        } else {
            reportIssuesGrouped(split.issues());
            listener.onInfo(
                    "Matched " + split.matchedCount() + " of " + tree.size() + " headings");
        }
        if (split.preambleLength() > 0) {
            listener.onInfo(
                    "Dropped " + split.preambleLength() + " characters before the first heading");
        }
        listener.onVerboseOutput(tree.toIndentedTreeString());

        SectioningResult result =
                new SectioningResult(tree, text, outline.issues(), textIssues, split);
        listener.onSummary(result);
        return result;
    }

    /** Reads and builds the outline only, leaving every node text empty. */
    public OutlineResult outline() throws SectioningException {
        listener.onPhaseStart("Reading document");
        DocumentInput input = readInput(false);
        return buildOutline(input.entries());
    }

    private OutlineResult buildOutline(List<OutlineEntry> entries) {
        listener.onPhaseStart("Outline");
        OutlineResult outline = new OutlineBuilder(config.getChapterMarker()).build(entries);
        IssueList issues = outline.issues();
        if (entries.isEmpty()) {
            Issue issue =
                    new Issue(
                            IssueType.NO_OUTLINE,
                            IssueSeverity.WARNING,
                            "Document has no outline; nothing to section");
            issues.add(issue);
        }

        if (issues.isEmpty()) {
            listener.onSuccess("Built outline of " + outline.tree().size() + " headings");
        } else {
            reportIssuesGrouped(issues);
            listener.onInfo(
                    "Built outline of "
                            + outline.tree().size()
                            + " headings from "
                            + entries.size()
                            + " entries");
        }
        return outline;
    }

    private record DocumentInput(List<OutlineEntry> entries, List<String> pages) {}

    private DocumentInput readInput(boolean withText) throws SectioningException {
        if (custodian != null) {
            try (PdfDocument doc = custodian.openForReading()) {
                List<OutlineEntry> entries = new PdfOutlineReader(doc).readEntries();
                List<String> pages =
                        withText ? new PdfPageTextReader(doc).readPages() : List.of();
                return new DocumentInput(entries, pages);
            } catch (IOException | ITextException e) {
                logger.debug("Failed to read {}", custodian.getInputPath(), e);
                listener.onError(
                        "Failed to read " + custodian.getInputPath() + ": " + e.getMessage());
                throw new SectioningException("Failed to read " + custodian.getInputPath(), e);
            }
        }
        try {
            List<OutlineEntry> entries = outlineSource.readEntries();
            List<String> pages = withText ? pageTextSource.readPages() : List.of();
            return new DocumentInput(entries, pages);
        } catch (IOException e) {
            logger.debug("Failed to read document", e);
            listener.onError("Failed to read document: " + e.getMessage());
            throw new SectioningException("Failed to read document: " + e.getMessage(), e);
        }
    }

    // == Reporting helpers ============================================

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Issue::type, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();

            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }

    /** Used when no listener is supplied. */
    private static final class SilentListener implements ProcessingListener {
        @Override
        public void onPhaseStart(String phaseName) {}

        @Override
        public void onSuccess(String message) {}

        @Override
        public void onWarning(Issue issue) {}

        @Override
        public void onSummary(SectioningResult result) {}
    }
}
