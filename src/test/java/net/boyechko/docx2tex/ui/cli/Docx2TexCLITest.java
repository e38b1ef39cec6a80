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
package net.boyechko.docx2tex.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import net.boyechko.docx2tex.DocxTestBase;
import net.boyechko.docx2tex.core.VerbosityLevel;
import net.boyechko.docx2tex.ui.cli.Docx2TexCLI.CLIConfig;
import net.boyechko.docx2tex.ui.cli.Docx2TexCLI.CLIException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class Docx2TexCLITest extends DocxTestBase {
    private Path input;

    @BeforeEach
    void createInput() throws Exception {
        input = Files.writeString(tempDir.resolve("thesis.docx"), "zip");
    }

    @Test
    void outputDirectoryDefaultsToSiblingNamedAfterInput() throws Exception {
        CLIConfig config = Docx2TexCLI.parseArguments(new String[] {input.toString()});
        assertEquals(input, config.inputPath());
        assertEquals(tempDir.resolve("thesis"), config.outputDir());
        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
        assertFalse(config.bodyOnly());
        assertNull(config.profilePath());
    }

    @Test
    void explicitOutputDirectoryAndOptions() throws Exception {
        Path profile = Files.writeString(tempDir.resolve("p.yaml"), "document_class: book\n");
        Path out = tempDir.resolve("latex");
        CLIConfig config =
                Docx2TexCLI.parseArguments(
                        new String[] {
                            "-v", "--body-only", "--profile=" + profile, input.toString(), out.toString()
                        });
        assertEquals(out, config.outputDir());
        assertEquals(profile, config.profilePath());
        assertTrue(config.bodyOnly());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
    }

    @ParameterizedTest
    @CsvSource({"-q, QUIET", "--quiet, QUIET", "-vv, DEBUG", "--debug, DEBUG", "--verbose, VERBOSE"})
    void verbosityFlags(String flag, VerbosityLevel expected) throws Exception {
        CLIConfig config = Docx2TexCLI.parseArguments(new String[] {flag, input.toString()});
        assertEquals(expected, config.verbosity());
    }

    @Test
    void argumentErrors() {
        assertThrows(CLIException.class, () -> Docx2TexCLI.parseArguments(new String[] {}));
        assertThrows(
                CLIException.class,
                () -> Docx2TexCLI.parseArguments(new String[] {tempDir.resolve("nope.docx").toString()}));
        assertThrows(
                CLIException.class,
                () -> Docx2TexCLI.parseArguments(new String[] {"--frobnicate", input.toString()}));
        assertThrows(
                CLIException.class,
                () -> Docx2TexCLI.parseArguments(new String[] {input.toString(), "a", "b"}));
        assertThrows(
                CLIException.class,
                () -> Docx2TexCLI.parseArguments(new String[] {"--profile=", input.toString()}));
        assertThrows(
                CLIException.class,
                () ->
                        Docx2TexCLI.parseArguments(
                                new String[] {"--profile=" + tempDir.resolve("missing.yaml"), input.toString()}));
    }

    @Test
    void outputPathMustNotBeAFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("taken"), "x");
        CLIException e =
                assertThrows(
                        CLIException.class,
                        () -> Docx2TexCLI.parseArguments(new String[] {input.toString(), file.toString()}));
        assertTrue(e.getMessage().contains("not a directory"));
    }

    @Test
    void helpIsRecognizedAnywhere() {
        assertTrue(Docx2TexCLI.isHelpRequested(new String[] {"in.docx", "--help"}));
        assertTrue(Docx2TexCLI.isHelpRequested(new String[] {"-h"}));
        assertFalse(Docx2TexCLI.isHelpRequested(new String[] {"in.docx"}));
        assertTrue(Docx2TexCLI.usageMessage().startsWith("Usage: docx2tex"));
    }

    @Test
    void imageTargetWithoutFileNameEndsWithErrorStatus() throws Exception {
        String drawing =
                "<w:r><w:drawing><wp:inline><a:graphic>"
                        + "<a:graphicData uri=\"http://schemas.openxmlformats.org/drawingml/2006/picture\">"
                        + "<pic:pic><pic:blipFill><a:blip r:embed=\"rId6\"/></pic:blipFill></pic:pic>"
                        + "</a:graphicData></a:graphic></wp:inline></w:drawing></w:r>";
        Path docx =
                writePackage(
                        "broken.docx",
                        Map.of(
                                "word/document.xml",
                                document(paragraph(drawing)),
                                "word/_rels/document.xml.rels",
                                relationships(Map.of("rId6", "media/"))));
        CLIConfig config =
                Docx2TexCLI.parseArguments(
                        new String[] {"-q", docx.toString(), tempDir.resolve("out").toString()});

        assertEquals(Docx2TexCLI.EXIT_USAGE, Docx2TexCLI.processFile(config));
    }
}
