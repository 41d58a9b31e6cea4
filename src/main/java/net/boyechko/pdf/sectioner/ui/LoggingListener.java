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
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import net.boyechko.pdf.sectioner.core.ProcessingListener;
import net.boyechko.pdf.sectioner.core.SectioningResult;
import net.boyechko.pdf.sectioner.core.VerbosityLevel;
import net.boyechko.pdf.sectioner.issues.Issue;
import net.boyechko.pdf.sectioner.issues.IssueSeverity;
import org.slf4j.LoggerFactory;

/** A {@link ProcessingListener} that routes all events through SLF4J. */
public class LoggingListener implements ProcessingListener {

    static final String PROCESSING_LOGGER = "net.boyechko.pdf.sectioner.processing";
    static final String CONSOLE_APPENDER_NAME = "SECTIONER_CONSOLE";

    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(PROCESSING_LOGGER);

    /**
     * Creates a {@link LoggingListener} whose events are printed to stdout at the given
     * verbosity. Processing events are written by this console appender only, never by the
     * root logger's appenders.
     */
    public static LoggingListener withConsoleOutput(VerbosityLevel verbosity) {
        ch.qos.logback.classic.Logger processing = ensureConsoleAppender();
        processing.setLevel(levelFor(verbosity));
        return new LoggingListener();
    }

    static Level levelFor(VerbosityLevel verbosity) {
        return switch (verbosity) {
            case QUIET -> Level.ERROR;
            case NORMAL, VERBOSE -> Level.INFO;
            case DEBUG -> Level.DEBUG;
        };
    }

    private static ch.qos.logback.classic.Logger ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger processing = ctx.getLogger(PROCESSING_LOGGER);

        if (processing.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return processing;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-30logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        processing.addAppender(console);
        processing.setAdditive(false);
        return processing;
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onWarning(Issue issue) {
        if (issue.severity() == IssueSeverity.INFO) {
            logger.info("ISSUE {}", issue);
        } else {
            logger.warn("ISSUE {}", issue);
        }
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onSummary(SectioningResult result) {
        logger.info(
                "SUMMARY headings={} matched={} warnings={}",
                result.headingCount(),
                result.matchedCount(),
                result.allIssues().getWarnings().size());
    }
}
