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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversionProfileTest {
    @TempDir Path tempDir;

    @Test
    void bundledDefaultMatchesBuiltInDefaults() {
        ConversionProfile loaded = ConversionProfile.loadDefault();
        ConversionProfile defaults = ConversionProfile.defaults();
        assertEquals(defaults.documentClass(), loaded.documentClass());
        assertEquals(defaults.packages(), loaded.packages());
        assertEquals(defaults.graphicsOptions(), loaded.graphicsOptions());
        assertEquals("width=\\textwidth", loaded.graphicsOptions());
        assertTrue(loaded.validate().isEmpty());
    }

    @Test
    void loadsProfileFromFile() throws Exception {
        Path file = tempDir.resolve("report.yaml");
        Files.writeString(
                file,
                "document_class: report\n"
                        + "packages: [graphicx, hyperref, amsmath, amssymb]\n"
                        + "graphics_options: 'width=0.8\\textwidth'\n");
        ConversionProfile profile = ConversionProfile.fromFile(file);
        assertEquals("report", profile.documentClass());
        assertEquals(List.of("graphicx", "hyperref", "amsmath", "amssymb"), profile.packages());
        assertEquals("width=0.8\\textwidth", profile.graphicsOptions());
    }

    @Test
    void missingKeysKeepDefaults() throws Exception {
        Path file = tempDir.resolve("partial.yaml");
        Files.writeString(file, "document_class: book\n");
        ConversionProfile profile = ConversionProfile.fromFile(file);
        assertEquals("book", profile.documentClass());
        assertEquals(ConversionProfile.DEFAULT_PACKAGES, profile.packages());
    }

    @Test
    void emptyFileGivesDefaults() throws Exception {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");
        assertEquals("article", ConversionProfile.fromFile(file).documentClass());
    }

    @Test
    void unknownKeyIsRejected() throws Exception {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "documentclass: report\n");
        assertThrows(IllegalArgumentException.class, () -> ConversionProfile.fromFile(file));
    }

    @Test
    void validateRepairsBlankValues() {
        ConversionProfile profile = new ConversionProfile();
        profile.document_class = " ";
        profile.packages = new java.util.ArrayList<>(List.of("amsmath", ""));
        List<String> warnings = profile.validate();
        assertEquals("article", profile.documentClass());
        assertEquals(List.of("amsmath"), profile.packages());
        assertEquals(4, warnings.size());
    }

    @Test
    void missingResourceIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> ConversionProfile.fromResource("/no-such-profile.yaml"));
    }
}
