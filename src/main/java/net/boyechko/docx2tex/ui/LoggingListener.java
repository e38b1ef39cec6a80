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

import net.boyechko.docx2tex.core.ConversionListener;
import net.boyechko.docx2tex.issue.Issue;
import net.boyechko.docx2tex.issue.IssueList;
import net.boyechko.docx2tex.issue.IssueSev;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ConversionListener} that routes all events through SLF4J, so that progress lines are
 * interleaved with the diagnostic log in the order they happened.
 */
public class LoggingListener implements ConversionListener {

    private static final Logger logger =
            LoggerFactory.getLogger("net.boyechko.docx2tex.conversion");

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
        String message = "ISSUE " + issue.type() + ": " + issue.message() + where(issue);
        IssueSev severity = issue.severity();
        if (severity == IssueSev.INFO) {
            logger.info("{}", message);
        } else if (severity == IssueSev.WARNING) {
            logger.warn("{}", message);
        } else {
            // ERROR/FATAL
            logger.error("{}", message);
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
    public void onSummary(IssueList allIssues) {
        logger.info(
                "SUMMARY issues={} fatal={}",
                allIssues.size(),
                allIssues.hasFatalIssues() ? "yes" : "no");
    }

    private static String where(Issue issue) {
        return issue.where().isKnown() ? " at " + issue.where() : "";
    }
}
