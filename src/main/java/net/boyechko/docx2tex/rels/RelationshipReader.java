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
package net.boyechko.docx2tex.rels;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import net.boyechko.docx2tex.document.XmlSupport;
import net.boyechko.docx2tex.issue.Issue;
import net.boyechko.docx2tex.issue.IssueList;
import net.boyechko.docx2tex.issue.IssueLoc;
import net.boyechko.docx2tex.issue.IssueSev;
import net.boyechko.docx2tex.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads a relationship part ({@code *.rels}) into a {@link RelationshipMap}. */
public class RelationshipReader {
    private static final Logger logger = LoggerFactory.getLogger(RelationshipReader.class);

    private static final String RELATIONSHIPS = "Relationships";
    private static final String RELATIONSHIP = "Relationship";
    private static final QName ID = new QName("Id");
    private static final QName TARGET = new QName("Target");

    private final IssueList issues = new IssueList();

    /** Issues found by the last {@link #read(InputStream)}. */
    public IssueList getIssues() {
        return issues;
    }

    public RelationshipMap read(InputStream in) throws XMLStreamException {
        issues.clear();
        XMLEventReader reader = XmlSupport.newEventReader(in);
        try {
            return read(reader);
        } finally {
            reader.close();
        }
    }

    private RelationshipMap read(XMLEventReader reader) throws XMLStreamException {
        Map<String, String> targets = new LinkedHashMap<>();
        int count = 0;
        while (reader.hasNext()) {
            XMLEvent event = reader.nextEvent();
            if (event.isEndDocument()) {
                break;
            }
            if (!event.isStartElement()) {
                continue;
            }
            StartElement start = event.asStartElement();
            String name = start.getName().getLocalPart();
            if (RELATIONSHIPS.equals(name)) {
                continue;
            }
            if (!RELATIONSHIP.equals(name)) {
                logger.warn("Unknown entry in Relationships: {}", name);
                continue;
            }

            count++;
            Attribute id = start.getAttributeByName(ID);
            Attribute target = start.getAttributeByName(TARGET);
            IssueLoc where = IssueLoc.fromLocation(start.getLocation());
            if (id == null && target == null) {
                report(where, "Relationship #" + count + " is missing attributes 'Id' and 'Target'");
            } else if (id == null) {
                report(where, "Relationship #" + count + " is missing attribute 'Id'");
            } else if (target == null) {
                report(where, "Relationship #" + count + " is missing attribute 'Target'");
            } else {
                String previous = targets.put(id.getValue(), target.getValue());
                if (previous != null) {
                    logger.warn(
                            "Relationship '{}' is defined more than once; using target '{}'",
                            id.getValue(),
                            target.getValue());
                }
            }
        }
        logger.debug("Read {} relationships from {} entries", targets.size(), count);
        return RelationshipMap.of(targets);
    }

    private void report(IssueLoc where, String message) {
        logger.error(message);
        issues.add(new Issue(IssueType.MALFORMED_RELATIONSHIP, IssueSev.ERROR, where, message));
    }
}
