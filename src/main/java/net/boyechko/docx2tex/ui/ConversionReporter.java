/*
 * Docx2Tex - Office Open XML to LaTeX Conversion
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
package net.boyechko.docx2tex.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.docx2tex.core.ConversionListener;
import net.boyechko.docx2tex.core.VerbosityLevel;
import net.boyechko.docx2tex.issue.Issue;
import net.boyechko.docx2tex.issue.IssueList;
import org.slf4j.LoggerFactory;

/** Prints conversion progress as boxed sections for the command line. */
public class ConversionReporter implements ConversionListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ConversionReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.docx2tex");
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    /** Stops capturing log events; call once the conversion is done. */
    public void detach() {
        Logger appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.docx2tex");
        appLogger.detachAppender(logBuffer);
        logBuffer.stop();
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

        printLine(issues.size() + " " + groupLabel, WARNING);
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            for (Issue issue : issues) {
                String where = issue.where().isKnown() ? " (" + issue.where() + ")" : "";
                printLine(issue.message() + where, WARNING, VerbosityLevel.VERBOSE);
            }
        }
    }

    @Override
    public void onSummary(IssueList allIssues) {
        if (!verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            return;
        }
        closePhaseBoxIfOpen();
        printBoxHeader("Summary");
        if (allIssues.isEmpty()) {
            printLine("Converted without issues", SUCCESS);
        } else {
            printLine("Issues found: " + allIssues.size(), INFO);
            allIssues
                    .groupedByType()
                    .forEach(
                            (type, issues) ->
                                    printLine(issues.size() + " " + type.groupLabel(), WARNING));
            if (allIssues.hasFatalIssues()) {
                printLine("The output is incomplete", ERROR, VerbosityLevel.QUIET);
            }
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
        printLine(issue.message(), WARNING);
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO, VerbosityLevel.VERBOSE);
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Moves log events captured since the last drain into the open box. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        for (ILoggingEvent event : events) {
            if (!event.getLevel().isGreaterOrEqual(Level.WARN)) {
                continue;
            }
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            printLine(
                    "[" + event.getLevel() + "] " + event.getFormattedMessage(),
                    icon,
                    VerbosityLevel.VERBOSE);
        }
    }

    /**
     * Prints an indented line with the given icon, word-wrapping long messages to stay within the
     * box width. Continuation lines are indented to align with the message start.
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

    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();
        for (String word : text.split(" ")) {
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
}
