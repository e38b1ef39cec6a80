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
package net.boyechko.docx2tex.document;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import net.boyechko.docx2tex.issue.IssueList;
import net.boyechko.docx2tex.rels.RelationshipMap;
import net.boyechko.docx2tex.rels.RelationshipReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Access to the parts of a {@code .docx} package that conversion needs. */
public final class DocxCustodian implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(DocxCustodian.class);

    static final String PACKAGE_RELS = "_rels/.rels";
    static final String DEFAULT_DOCUMENT_PART = "word/document.xml";
    static final String OFFICE_DOCUMENT_TYPE_SUFFIX = "/officeDocument";

    private static final QName TYPE = new QName("Type");
    private static final QName TARGET = new QName("Target");

    private final Path inputPath;
    private final ZipFile zip;
    private final String documentPart;
    private final IssueList issues = new IssueList();

    public DocxCustodian(Path inputPath) throws IOException {
        this.inputPath = inputPath;
        this.zip = new ZipFile(inputPath.toFile());
        try {
            this.documentPart = locateDocumentPart();
        } catch (IOException | RuntimeException e) {
            zip.close();
            throw e;
        }
        logger.debug("Main document part of {} is {}", inputPath, documentPart);
    }

    public Path getInputPath() {
        return inputPath;
    }

    /** Name of the main document part inside the package, usually {@code word/document.xml}. */
    public String documentPartName() {
        return documentPart;
    }

    /** Issues found while reading the package's relationship parts. */
    public IssueList getIssues() {
        return issues;
    }

    public InputStream openDocumentPart() throws IOException {
        ZipEntry entry = zip.getEntry(documentPart);
        if (entry == null) {
            throw new IOException("Package has no document part " + documentPart);
        }
        return zip.getInputStream(entry);
    }

    /** Reads the document part's relationships; a package without them yields an empty map. */
    public RelationshipMap readRelationships() throws IOException {
        String relsPart = relationshipPartFor(documentPart);
        ZipEntry entry = zip.getEntry(relsPart);
        if (entry == null) {
            logger.warn("Package has no relationship part {}", relsPart);
            return RelationshipMap.empty();
        }
        RelationshipReader reader = new RelationshipReader();
        try (InputStream in = zip.getInputStream(entry)) {
            RelationshipMap rels = reader.read(in);
            issues.addAll(reader.getIssues());
            return rels;
        } catch (XMLStreamException e) {
            throw new IOException("Cannot read " + relsPart + ": " + e.getMessage(), e);
        }
    }

    /** Names of the media entries next to the document part, e.g. {@code word/media/image1.png}. */
    public List<String> mediaEntries() {
        String mediaPrefix = directoryOf(documentPart) + "media/";
        List<String> names = new ArrayList<>();
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            if (!entry.isDirectory() && entry.getName().startsWith(mediaPrefix)) {
                names.add(entry.getName());
            }
        }
        return names;
    }

    /**
     * Copies every media entry into {@code outputDir} under its bare file name, so that {@code
     * \includegraphics} finds it by stem.
     */
    public List<Path> copyMedia(Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> copied = new ArrayList<>();
        for (String name : mediaEntries()) {
            String fileName = name.substring(name.lastIndexOf('/') + 1);
            Path target = outputDir.resolve(fileName).normalize();
            if (!target.startsWith(outputDir.normalize())) {
                logger.warn("Skipping media entry with unsafe name {}", name);
                continue;
            }
            try (InputStream in = zip.getInputStream(zip.getEntry(name))) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Copied {} to {}", name, target);
            copied.add(target);
        }
        return copied;
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }

    /** Follows the package relationship of type officeDocument, falling back to the usual name. */
    private String locateDocumentPart() throws IOException {
        ZipEntry rels = zip.getEntry(PACKAGE_RELS);
        if (rels == null) {
            logger.debug("Package has no {}; assuming {}", PACKAGE_RELS, DEFAULT_DOCUMENT_PART);
            return DEFAULT_DOCUMENT_PART;
        }
        try (InputStream in = zip.getInputStream(rels)) {
            XMLEventReader reader = XmlSupport.newEventReader(in);
            try {
                while (reader.hasNext()) {
                    XMLEvent event = reader.nextEvent();
                    if (!event.isStartElement()) {
                        continue;
                    }
                    StartElement start = event.asStartElement();
                    Optional<String> type = attribute(start, TYPE);
                    Optional<String> target = attribute(start, TARGET);
                    if (type.isPresent()
                            && target.isPresent()
                            && type.get().endsWith(OFFICE_DOCUMENT_TYPE_SUFFIX)) {
                        return stripLeadingSlash(target.get());
                    }
                }
            } finally {
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new IOException("Cannot read " + PACKAGE_RELS + ": " + e.getMessage(), e);
        }
        return DEFAULT_DOCUMENT_PART;
    }

    private static Optional<String> attribute(StartElement start, QName name) {
        var attribute = start.getAttributeByName(name);
        return attribute != null ? Optional.of(attribute.getValue()) : Optional.empty();
    }

    /** {@code word/document.xml} has its relationships in {@code word/_rels/document.xml.rels}. */
    static String relationshipPartFor(String partName) {
        int slash = partName.lastIndexOf('/');
        return partName.substring(0, slash + 1) + "_rels/" + partName.substring(slash + 1) + ".rels";
    }

    static String directoryOf(String partName) {
        return partName.substring(0, partName.lastIndexOf('/') + 1);
    }

    private static String stripLeadingSlash(String target) {
        return target.startsWith("/") ? target.substring(1) : target;
    }
}
