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

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.docx2tex.document.DocxCustodian;
import net.boyechko.docx2tex.issue.IssueList;
import net.boyechko.docx2tex.latex.Preamble;
import net.boyechko.docx2tex.rels.RelationshipMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates the conversion of a {@code .docx} package into a LaTeX directory. */
public class ConversionService {
    private static final Logger logger = LoggerFactory.getLogger(ConversionService.class);

    private final Path inputPath;
    private final Path outputDir;
    private final ConversionProfile profile;
    private final ConversionListener listener;
    private final boolean bodyOnly;

    public static class ConversionServiceBuilder {
        private Path inputPath;
        private Path outputDir;
        private ConversionProfile profile;
        private ConversionListener listener;
        private boolean bodyOnly;

        public ConversionServiceBuilder withInputPath(Path inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public ConversionServiceBuilder withOutputDirectory(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public ConversionServiceBuilder withProfile(ConversionProfile profile) {
            this.profile = profile;
            return this;
        }

        public ConversionServiceBuilder withListener(ConversionListener listener) {
            this.listener = listener;
            return this;
        }

        public ConversionServiceBuilder withBodyOnly(boolean bodyOnly) {
            this.bodyOnly = bodyOnly;
            return this;
        }

        public ConversionService build() {
            if (inputPath == null) {
                throw new IllegalStateException(
                        "Input path must be provided via withInputPath(...) before building ConversionService");
            }
            if (outputDir == null) {
                throw new IllegalStateException(
                        "Output directory must be provided via withOutputDirectory(...) before building ConversionService");
            }
            return new ConversionService(this);
        }
    }

    private ConversionService(ConversionServiceBuilder builder) {
        this.inputPath = builder.inputPath;
        this.outputDir = builder.outputDir;
        this.profile = builder.profile != null ? builder.profile : ConversionProfile.loadDefault();
        this.listener = builder.listener != null ? builder.listener : new SilentListener();
        this.bodyOnly = builder.bodyOnly;
    }

    /** Name of the generated file for an input such as {@code report.docx}: {@code report.tex}. */
    public static String texFileName(Path inputPath) {
        return baseName(inputPath) + ".tex";
    }

    public static String baseName(Path inputPath) {
        return inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
    }

    public ConversionOutcome convert() throws IOException {
        Files.createDirectories(outputDir);
        Path texFile = outputDir.resolve(texFileName(inputPath));

        try (DocxCustodian custodian = new DocxCustodian(inputPath)) {
            listener.onPhaseStart("Reading package");
            RelationshipMap rels = custodian.readRelationships();
            listener.onInfo(
                    "Found " + rels.size() + " relationships for " + custodian.documentPartName());

            listener.onPhaseStart("Converting document");
            ConversionResult result = writeTex(custodian, rels, texFile);
            reportIssues(result.issues());
            if (result.completed()) {
                listener.onSuccess("LaTeX written to " + texFile);
            } else {
                listener.onError("Conversion stopped early; " + texFile + " is incomplete");
            }

            listener.onPhaseStart("Copying media");
            List<Path> media = custodian.copyMedia(outputDir);
            listener.onSuccess("Copied " + media.size() + " media files to " + outputDir);

            ConversionOutcome outcome =
                    new ConversionOutcome(texFile, media, result, custodian.getIssues());
            listener.onSummary(outcome.allIssues());
            return outcome;
        }
    }

    private ConversionResult writeTex(DocxCustodian custodian, RelationshipMap rels, Path texFile)
            throws IOException {
        Preamble preamble = new Preamble(profile.documentClass(), profile.packages());
        DocumentConverter converter = new DocumentConverter(rels, profile);

        logger.info("Writing {}", texFile);
        try (Writer out = Files.newBufferedWriter(texFile, StandardCharsets.UTF_8);
                InputStream in = custodian.openDocumentPart()) {
            if (!bodyOnly) {
                out.write(preamble.opening());
            }
            ConversionResult result = converter.convert(in, out);
            if (!bodyOnly) {
                out.write(preamble.closing());
            }
            return result;
        }
    }

    private void reportIssues(IssueList issues) {
        issues.groupedByType()
                .forEach((type, grouped) -> listener.onIssueGroup(type.groupLabel(), grouped));
    }

    /** Listener used when the caller does not supply one. */
    private static final class SilentListener implements ConversionListener {
        @Override
        public void onPhaseStart(String phaseName) {
            logger.debug("Phase {}", phaseName);
        }

        @Override
        public void onSuccess(String message) {
            logger.debug("{}", message);
        }

        @Override
        public void onWarning(net.boyechko.docx2tex.issue.Issue issue) {}

        @Override
        public void onSummary(IssueList allIssues) {}
    }
}
