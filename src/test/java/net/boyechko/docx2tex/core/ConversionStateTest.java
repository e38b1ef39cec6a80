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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.docx2tex.issue.IssueLoc;
import net.boyechko.docx2tex.issue.IssueSev;
import net.boyechko.docx2tex.issue.IssueType;
import org.junit.jupiter.api.Test;

class ConversionStateTest {

    @Test
    void mathParagraphTogglesMathMode() {
        ConversionState state = new ConversionState();
        assertFalse(state.isMathMode());
        state.enterMathParagraph();
        assertTrue(state.isMathMode());
        state.exitMathParagraph();
        assertFalse(state.isMathMode());
        assertTrue(state.getIssues().isEmpty());
    }

    @Test
    void exitWithoutEntryIsReportedAndForcesFalse() {
        ConversionState state = new ConversionState();
        state.exitMathParagraph();
        assertFalse(state.isMathMode());
        assertEquals(1, state.getIssues().ofType(IssueType.MATH_MODE_VIOLATION).size());
        assertEquals(IssueSev.ERROR, state.getIssues().get(0).severity());
    }

    @Test
    void doubleEntryIsReportedAndStaysInMathMode() {
        ConversionState state = new ConversionState();
        state.enterMathParagraph();
        state.enterMathParagraph();
        assertTrue(state.isMathMode());
        assertEquals(1, state.getIssues().ofType(IssueType.MATH_MODE_VIOLATION).size());
    }

    @Test
    void naryWithoutOperatorNeedsDefault() {
        ConversionState state = new ConversionState();
        assertTrue(state.enterNaryProperties());
        assertEquals(NaryState.NO_OPERATOR_YET, state.naryState());
        assertTrue(state.exitNaryProperties());
        assertEquals(NaryState.NOT_IN_NARY, state.naryState());
    }

    @Test
    void naryWithOneOperatorNeedsNoDefault() {
        ConversionState state = new ConversionState();
        state.enterNaryProperties();
        state.operatorSeen();
        assertEquals(NaryState.OPERATOR_SEEN, state.naryState());
        assertFalse(state.exitNaryProperties());
        assertTrue(state.getIssues().isEmpty());
    }

    @Test
    void secondOperatorIsReported() {
        ConversionState state = new ConversionState();
        state.enterNaryProperties();
        state.operatorSeen();
        state.operatorSeen();
        assertEquals(1, state.getIssues().ofType(IssueType.NARY_VIOLATION).size());
        assertFalse(state.exitNaryProperties());
    }

    @Test
    void nestedNaryIsReportedAndIgnored() {
        ConversionState state = new ConversionState();
        state.enterNaryProperties();
        state.operatorSeen();
        assertFalse(state.enterNaryProperties());
        assertEquals(NaryState.OPERATOR_SEEN, state.naryState());
        assertEquals(1, state.getIssues().ofType(IssueType.NARY_VIOLATION).size());
    }

    @Test
    void operatorOutsideNaryIsIgnored() {
        ConversionState state = new ConversionState();
        state.operatorSeen();
        assertEquals(NaryState.NOT_IN_NARY, state.naryState());
        assertTrue(state.getIssues().isEmpty());
    }

    @Test
    void reportedIssuesCarryCurrentLocation() {
        ConversionState state = new ConversionState();
        state.setLocation(new IssueLoc(2, 7));
        state.report(IssueType.UNRESOLVED_IMAGE, IssueSev.ERROR, "gone");
        assertEquals(new IssueLoc(2, 7), state.getIssues().get(0).where());
        state.setLocation(null);
        assertEquals(IssueLoc.none(), state.location());
    }
}
