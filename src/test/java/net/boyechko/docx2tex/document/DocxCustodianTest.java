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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.docx2tex.DocxTestBase;
import net.boyechko.docx2tex.issue.IssueType;
import net.boyechko.docx2tex.rels.RelationshipMap;
import org.junit.jupiter.api.Test;

class DocxCustodianTest extends DocxTestBase {

    @Test
    void readsDefaultDocumentPart() throws Exception {
        Path docx = writeSimpleDocx("simple.docx", paragraph(run("Hi")));
        try (DocxCustodian custodian = new DocxCustodian(docx)) {
            assertEquals("word/document.xml", custodian.documentPartName());
            assertEquals(docx, custodian.getInputPath());
            try (InputStream in = custodian.openDocumentPart()) {
                String xml = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                assertTrue(xml.contains("<w:t>Hi</w:t>"));
            }
            RelationshipMap rels = custodian.readRelationships();
            assertEquals(Optional.of("media/image1.png"), rels.resolve("rId5"));
            assertTrue(custodian.getIssues().isEmpty());
        }
    }

    @Test
    void followsPackageRelationshipToDocumentPart() throws Exception {
        Path docx =
                writePackage(
                        "moved.docx",
                        Map.of(
                                "_rels/.rels",
                                "<Relationships xmlns=\""
                                        + RELS_NAMESPACE
                                        + "\">"
                                        + "<Relationship Id=\"rId2\" Type=\"http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties\" Target=\"docProps/core.xml\"/>"
                                        + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument\" Target=\"/content/main.xml\"/>"
                                        + "</Relationships>",
                                "content/main.xml",
                                document(run("moved")),
                                "content/_rels/main.xml.rels",
                                relationships(Map.of("rId1", "https://example.org")),
                                "content/media/chart.png",
                                "png"));
        try (DocxCustodian custodian = new DocxCustodian(docx)) {
            assertEquals("content/main.xml", custodian.documentPartName());
            assertEquals(1, custodian.readRelationships().size());
            assertEquals(List.of("content/media/chart.png"), custodian.mediaEntries());
        }
    }

    @Test
    void missingRelationshipPartGivesEmptyMap() throws Exception {
        Path docx = writePackage("bare.docx", Map.of("word/document.xml", document("")));
        try (DocxCustodian custodian = new DocxCustodian(docx)) {
            assertEquals(0, custodian.readRelationships().size());
            assertTrue(custodian.mediaEntries().isEmpty());
        }
    }

    @Test
    void malformedRelationshipsBecomePackageIssues() throws Exception {
        Path docx =
                writePackage(
                        "bad.docx",
                        Map.of(
                                "word/document.xml",
                                document(""),
                                "word/_rels/document.xml.rels",
                                "<Relationships xmlns=\""
                                        + RELS_NAMESPACE
                                        + "\"><Relationship Target=\"x\"/></Relationships>"));
        try (DocxCustodian custodian = new DocxCustodian(docx)) {
            custodian.readRelationships();
            assertEquals(1, custodian.getIssues().ofType(IssueType.MALFORMED_RELATIONSHIP).size());
        }
    }

    @Test
    void missingDocumentPartFailsOnOpen() throws Exception {
        Path docx = writePackage("empty.docx", Map.of("other.xml", "<x/>"));
        try (DocxCustodian custodian = new DocxCustodian(docx)) {
            assertThrows(IOException.class, custodian::openDocumentPart);
        }
    }

    @Test
    void notAZipFails() throws Exception {
        Path notZip = tempDir.resolve("plain.docx");
        Files.writeString(notZip, "just text");
        assertThrows(IOException.class, () -> new DocxCustodian(notZip));
    }

    @Test
    void copyMediaFlattensNames() throws Exception {
        Path docx =
                writePackage(
                        "media.docx",
                        Map.of(
                                "word/document.xml", document(""),
                                "word/media/image1.png", "one",
                                "word/media/sub/image2.jpeg", "two",
                                "word/embeddings/sheet.xlsx", "not media"));
        Path outDir = tempDir.resolve("out");
        try (DocxCustodian custodian = new DocxCustodian(docx)) {
            List<Path> copied = custodian.copyMedia(outDir);
            assertEquals(2, copied.size());
            assertEquals("one", Files.readString(outDir.resolve("image1.png")));
            assertEquals("two", Files.readString(outDir.resolve("image2.jpeg")));
            assertFalse(Files.exists(outDir.resolve("sheet.xlsx")));
        }
    }

    @Test
    void relationshipPartSitsBesideItsPart() {
        assertEquals(
                "word/_rels/document.xml.rels",
                DocxCustodian.relationshipPartFor("word/document.xml"));
        assertEquals("_rels/main.xml.rels", DocxCustodian.relationshipPartFor("main.xml"));
        assertEquals("word/", DocxCustodian.directoryOf("word/document.xml"));
        assertEquals("", DocxCustodian.directoryOf("main.xml"));
    }
}
