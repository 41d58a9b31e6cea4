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
package net.boyechko.pdf.sectioner.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.sectioner.issues.Issue;
import net.boyechko.pdf.sectioner.issues.IssueList;
import net.boyechko.pdf.sectioner.issues.IssueLocation;
import net.boyechko.pdf.sectioner.issues.IssueSeverity;
import net.boyechko.pdf.sectioner.issues.IssueType;
import net.boyechko.pdf.sectioner.model.Chapter;
import net.boyechko.pdf.sectioner.model.DocumentTree;
import net.boyechko.pdf.sectioner.model.OutlineNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributes the document text over the nodes of an outline tree.
 *
 * <p>Nodes are visited in document order (chapter, its sections, each section's subsections).
 * For each node the heading is searched for in the text; when it is found, everything between
 * the end of the previous match and the start of this one is credited to the previously
 * matched node, and this node becomes the owner of the text that follows. Text before the
 * first match belongs to no node and is dropped. A heading that is not found is reported and
 * skipped, so its text ends up with whichever node was matched last.
 *
 * <p>By default each heading is searched for in the whole text and the first occurrence wins,
 * even if it lies before text that was already consumed. {@link
 * SplitOptions#searchFromCursor()} restricts the search to the text after the previous match.
 *
 * <p>The tree must be freshly built: every node text may be assigned only once.
 */
public class SequentialSplitter {
    private static final Logger logger = LoggerFactory.getLogger(SequentialSplitter.class);

    // Same whitespace class as the heading patterns, so no-break spaces count as blank.
    private static final Pattern BLANK =
            Pattern.compile("\\s*", Pattern.UNICODE_CHARACTER_CLASS);

    private final HeadingPatterns patterns;
    private final SplitOptions options;

    public SequentialSplitter(HeadingPatterns patterns) {
        this(patterns, SplitOptions.defaults());
    }

    public SequentialSplitter(HeadingPatterns patterns, SplitOptions options) {
        this.patterns = patterns;
        this.options = options != null ? options : SplitOptions.defaults();
    }

    public SplitResult split(DocumentTree tree, String text) {
        Trace trace = new Trace(text != null ? text : "");

        SplitState state = SplitState.initial();
        for (Chapter chapter : tree.chapters().values()) {
            state = visit(chapter, state, trace);
        }
        finish(state, trace);

        logger.debug(
                "Matched {} of {} headings, {} spans credited",
                trace.matches.size(),
                tree.size(),
                trace.spans.size());
        return new SplitResult(
                List.copyOf(trace.matches),
                List.copyOf(trace.spans),
                trace.preambleLength,
                trace.issues);
    }

    private SplitState visit(OutlineNode node, SplitState state, Trace trace) {
        SplitState next = step(node, state, trace);
        if (next == state && options.skipUnmatchedSubtrees()) {
            return next;
        }
        for (OutlineNode child : node.children()) {
            next = visit(child, next, trace);
        }
        return next;
    }

    /** Searches for one heading and returns the state after it. */
    private SplitState step(OutlineNode node, SplitState state, Trace trace) {
        Matcher m = patterns.compile(node).matcher(trace.text);
        boolean found =
                options.searchFromCursor()
                        ? m.find(Math.min(state.cursor(), trace.text.length()))
                        : m.find();

        if (!found) {
            logger.debug("No match for {}", node);
            trace.issues.add(
                    new Issue(
                            IssueType.UNMATCHED_HEADING,
                            IssueSeverity.WARNING,
                            IssueLocation.atNode(node.path()),
                            "No match found for " + node));
            return state;
        }

        int start = m.start();
        int end = m.end();
        logger.debug("Matched {} at {}-{}", node, start, end);
        trace.matches.add(new HeadingMatch(node, start, end, state.cursor()));

        if (start < state.cursor()) {
            trace.issues.add(
                    new Issue(
                            IssueType.OUT_OF_ORDER_MATCH,
                            IssueSeverity.WARNING,
                            IssueLocation.atNode(node.path()),
                            "Heading of "
                                    + node
                                    + " found at offset "
                                    + start
                                    + ", before the end of the previous match at "
                                    + state.cursor()));
        }

        if (state.inPreamble()) {
            trace.preambleLength = start;
        } else {
            int cursor = state.cursor();
            int spanEnd = Math.max(start, cursor);
            boolean assign = !isBlank(trace.text, cursor, spanEnd);
            credit(state.active(), cursor, spanEnd, assign, trace);
        }
        return new SplitState(end, node);
    }

    /**
     * Credits the text after the last match to the node that was matched last. The tail is
     * assigned even when it is only whitespace.
     */
    private void finish(SplitState state, Trace trace) {
        int length = trace.text.length();
        if (state.inPreamble()) {
            trace.preambleLength = length;
            return;
        }
        if (state.cursor() < length) {
            credit(state.active(), state.cursor(), length, true, trace);
        }
    }

    private static boolean isBlank(String text, int start, int end) {
        return BLANK.matcher(text).region(start, end).matches();
    }

    private static void credit(
            OutlineNode owner, int start, int end, boolean assign, Trace trace) {
        if (assign) {
            owner.assignText(trace.text.substring(start, end));
        }
        trace.spans.add(new TextSpan(owner, start, end, assign));
    }

    /** What a single split has produced so far. */
    private static final class Trace {
        final String text;
        final List<HeadingMatch> matches = new ArrayList<>();
        final List<TextSpan> spans = new ArrayList<>();
        final IssueList issues = new IssueList();
        int preambleLength;

        Trace(String text) {
            this.text = text;
        }
    }
}
