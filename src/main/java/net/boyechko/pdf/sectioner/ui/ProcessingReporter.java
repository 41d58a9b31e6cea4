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
package net.boyechko.pdf.sectioner.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import net.boyechko.pdf.sectioner.core.ProcessingListener;
import net.boyechko.pdf.sectioner.core.SectioningResult;
import net.boyechko.pdf.sectioner.core.VerbosityLevel;
import net.boyechko.pdf.sectioner.issues.Issue;
import net.boyechko.pdf.sectioner.issues.IssueSeverity;
import org.slf4j.LoggerFactory;

/** Renders processing events as boxed, human-readable console output. */
public class ProcessingReporter implements ProcessingListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "️✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ProcessingReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.pdf.sectioner");
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        if (issues.isEmpty()) return;

        Set<Integer> pages =
                issues.stream()
                        .map(i -> i.where().page())
                        .filter(Objects::nonNull)
                        .collect(Collectors.toCollection(TreeSet::new));

        String summary = buildGroupSummary(groupLabel, issues.size(), pages);
        printLine(summary, WARNING);

        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            for (Issue issue : issues) {
                printLine(issue.message(), iconFor(issue), VerbosityLevel.VERBOSE);
            }
        }
    }

    @Override
    public void onSummary(SectioningResult result) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            return;
        }
        closePhaseBoxIfOpen();
        printBoxHeader("Summary");

        printLine("Chapters: " + result.tree().chapters().size(), INFO);
        printLine(
                "Headings matched: " + result.matchedCount() + " of " + result.headingCount(),
                result.unmatchedCount() == 0 ? SUCCESS : WARNING);
        int assigned = result.tree().assignedLength();
        printLine("Characters assigned: " + assigned + " of " + result.text().length(), INFO);
        int warnings = result.allIssues().getWarnings().size();
        if (warnings > 0) {
            printLine("Warnings: " + warnings, WARNING);
        }
        printBoxFooter();
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onWarning(Issue issue) {
        VerbosityLevel level =
                issue.severity() == IssueSeverity.INFO
                        ? VerbosityLevel.VERBOSE
                        : VerbosityLevel.NORMAL;
        printLine(issue.message(), iconFor(issue), level);
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO);
    }

    @Override
    public void onVerboseOutput(String message) {
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            output.print(message);
        }
    }

    private static String iconFor(Issue issue) {
        return issue.severity() == IssueSeverity.INFO ? INFO : WARNING;
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
            output.println("│");
        }
    }

    private void printBoxFooter() {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            drainLogBuffer();
            output.println("│");
            output.println("└─╯");
        }
    }

    /**
     * Flushes log events captured since the last drain into the open box, formatted with the same
     * icons used for warnings and errors elsewhere in the output.
     */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)) {
                continue;
            }
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            String levelString = event.getLevel().toString().toUpperCase();
            String origin = event.getLoggerName();
            printLine("[" + levelString + "] " + origin + ": " + event.getFormattedMessage(), icon);
        }
    }

    /**
     * Prints an indented line with the given message and icon, word-wrapping long messages to stay
     * within the box width. Continuation lines are indented to align with the message start.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.isAtLeast(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix);
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    private String buildGroupSummary(String groupLabel, int count, Set<Integer> pages) {
        StringBuilder sb = new StringBuilder();
        sb.append(count).append(" ").append(groupLabel);

        if (!pages.isEmpty()) {
            sb.append(" (");
            if (pages.size() == 1) {
                sb.append("page ").append(pages.iterator().next());
            } else {
                sb.append("pages ").append(formatPageRange(pages));
            }
            sb.append(")");
        }

        return sb.toString();
    }

    /** Word-wraps text at word boundaries to fit within maxWidth characters per line. */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        String[] words = text.split(" ");
        StringBuilder currentLine = new StringBuilder();

        for (String word : words) {
            if (currentLine.length() == 0) {
                currentLine.append(word);
            } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                currentLine.append(' ').append(word);
            } else {
                lines.add(currentLine.toString());
                currentLine.setLength(0);
                currentLine.append(word);
            }
        }
        if (currentLine.length() > 0) {
            lines.add(currentLine.toString());
        }
        return lines;
    }

    private String formatPageRange(Set<Integer> pages) {
        if (pages.size() == 1) return pages.iterator().next().toString();

        int min = pages.stream().min(Integer::compareTo).orElse(0);
        int max = pages.stream().max(Integer::compareTo).orElse(0);

        if (max - min + 1 == pages.size()) {
            return min + "-" + max;
        } else {
            return pages.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
    }
}
