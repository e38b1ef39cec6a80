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
package net.boyechko.docx2tex.core;

import net.boyechko.docx2tex.issue.Issue;
import net.boyechko.docx2tex.issue.IssueList;
import net.boyechko.docx2tex.issue.IssueLoc;
import net.boyechko.docx2tex.issue.IssueSev;
import net.boyechko.docx2tex.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state of one document conversion: math mode, the n-ary tracker, and the issues found so
 * far. Violations are reported and then forced back to a consistent value.
 */
public class ConversionState {
    private static final Logger logger = LoggerFactory.getLogger(ConversionState.class);

    private final IssueList issues = new IssueList();
    private boolean mathMode;
    private NaryState nary = NaryState.NOT_IN_NARY;
    private IssueLoc location = IssueLoc.none();

    public boolean isMathMode() {
        return mathMode;
    }

    public NaryState naryState() {
        return nary;
    }

    public boolean isInNary() {
        return nary != NaryState.NOT_IN_NARY;
    }

    public IssueList getIssues() {
        return issues;
    }

    public IssueLoc location() {
        return location;
    }

    /** Sets the markup position attached to issues reported from now on. */
    public void setLocation(IssueLoc location) {
        this.location = location != null ? location : IssueLoc.none();
    }

    public void enterMathParagraph() {
        if (mathMode) {
            report(
                    IssueType.MATH_MODE_VIOLATION,
                    IssueSev.ERROR,
                    "Math paragraph opened while already in math mode");
        }
        mathMode = true;
    }

    public void exitMathParagraph() {
        if (!mathMode) {
            report(
                    IssueType.MATH_MODE_VIOLATION,
                    IssueSev.ERROR,
                    "Math paragraph closed while not in math mode");
        }
        mathMode = false;
    }

    /**
     * Starts tracking an n-ary operator. Returns false, leaving the tracker untouched, when a region
     * is already open.
     */
    public boolean enterNaryProperties() {
        if (isInNary()) {
            report(
                    IssueType.NARY_VIOLATION,
                    IssueSev.ERROR,
                    "N-ary properties nested inside another n-ary properties region");
            return false;
        }
        nary = NaryState.NO_OPERATOR_YET;
        return true;
    }

    /** Records an operator glyph; outside an n-ary region this is a no-op. */
    public void operatorSeen() {
        switch (nary) {
            case NOT_IN_NARY -> logger.debug("Operator outside of n-ary properties");
            case NO_OPERATOR_YET -> nary = NaryState.OPERATOR_SEEN;
            case OPERATOR_SEEN -> report(
                    IssueType.NARY_VIOLATION,
                    IssueSev.ERROR,
                    "N-ary properties declare more than one operator");
        }
    }

    /**
     * Closes the n-ary region. Returns true if no operator was declared, meaning the default
     * operator has to be written.
     */
    public boolean exitNaryProperties() {
        boolean needsDefault = nary == NaryState.NO_OPERATOR_YET;
        nary = NaryState.NOT_IN_NARY;
        return needsDefault;
    }

    public void report(IssueType type, IssueSev severity, String message) {
        Issue issue = new Issue(type, severity, location, message);
        switch (severity) {
            case INFO -> logger.info("{}", issue);
            case WARNING -> logger.warn("{}", issue);
            case ERROR, FATAL -> logger.error("{}", issue);
        }
        issues.add(issue);
    }
}
