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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import net.boyechko.docx2tex.issue.Issue;
import net.boyechko.docx2tex.issue.IssueList;
import net.boyechko.docx2tex.issue.IssueLoc;
import net.boyechko.docx2tex.issue.IssueSev;
import net.boyechko.docx2tex.issue.IssueType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingListenerTest {
    private final Logger conversionLogger =
            (Logger) LoggerFactory.getLogger("net.boyechko.docx2tex.conversion");
    private ListAppender<ILoggingEvent> logs;
    private Level previousLevel;

    @BeforeEach
    void attachAppender() {
        previousLevel = conversionLogger.getLevel();
        conversionLogger.setLevel(Level.INFO);
        logs = new ListAppender<>();
        logs.start();
        conversionLogger.addAppender(logs);
    }

    @AfterEach
    void detachAppender() {
        conversionLogger.detachAppender(logs);
        conversionLogger.setLevel(previousLevel);
    }

    @Test
    void issueSeverityChoosesLogLevel() {
        LoggingListener listener = new LoggingListener();
        listener.onWarning(new Issue(IssueType.MISSING_BOOKMARK_NAME, IssueSev.WARNING, "w"));
        listener.onWarning(
                new Issue(IssueType.UNRESOLVED_IMAGE, IssueSev.ERROR, new IssueLoc(9, 1), "e"));
        listener.onWarning(new Issue(IssueType.READ_ERROR, IssueSev.FATAL, "f"));

        List<Level> levels = logs.list.stream().map(ILoggingEvent::getLevel).toList();
        assertEquals(List.of(Level.WARN, Level.ERROR, Level.ERROR), levels);
        assertEquals(
                "ISSUE UNRESOLVED_IMAGE: e at line 9, column 1",
                logs.list.get(1).getFormattedMessage());
    }

    @Test
    void progressIsLoggedAtInfo() {
        LoggingListener listener = new LoggingListener();
        listener.onPhaseStart("Converting document");
        listener.onSuccess("done");
        IssueList issues = new IssueList(new Issue(IssueType.READ_ERROR, IssueSev.FATAL, "x"));
        listener.onSummary(issues);

        assertEquals(3, logs.list.size());
        assertEquals("PHASE Converting document", logs.list.get(0).getFormattedMessage());
        assertEquals("SUMMARY issues=1 fatal=yes", logs.list.get(2).getFormattedMessage());
        assertTrue(logs.list.stream().allMatch(e -> e.getLevel() == Level.INFO));
    }

    @Test
    void issueGroupsFallBackToOneLinePerIssue() {
        LoggingListener listener = new LoggingListener();
        listener.onIssueGroup(
                "hyperlinks to unknown relationships",
                List.of(
                        new Issue(IssueType.UNRESOLVED_HYPERLINK, IssueSev.WARNING, "a"),
                        new Issue(IssueType.UNRESOLVED_HYPERLINK, IssueSev.WARNING, "b")));
        assertEquals(2, logs.list.size());
    }
}
