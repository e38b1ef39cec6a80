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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import net.boyechko.docx2tex.document.XmlSupport;
import net.boyechko.docx2tex.issue.IssueLoc;
import net.boyechko.docx2tex.issue.IssueSev;
import net.boyechko.docx2tex.issue.IssueType;
import net.boyechko.docx2tex.latex.LatexEscaper;
import net.boyechko.docx2tex.latex.LatexWriter;
import net.boyechko.docx2tex.match.StructuralMatch;
import net.boyechko.docx2tex.match.StructuralPatterns;
import net.boyechko.docx2tex.rels.RelationshipMap;
import net.boyechko.docx2tex.stack.ContextStack;
import net.boyechko.docx2tex.tag.Attribute;
import net.boyechko.docx2tex.tag.MissingAttributesException;
import net.boyechko.docx2tex.tag.QualifiedName;
import net.boyechko.docx2tex.tag.Tag;
import net.boyechko.docx2tex.tag.TagClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a WordprocessingML body into LaTeX in a single pass over its events. Each call to
 * {@code convert} starts from a fresh stack and state, so one converter may serve several
 * documents; the relationship map is only read.
 */
public class DocumentConverter {
    private static final Logger logger = LoggerFactory.getLogger(DocumentConverter.class);

    private final RelationshipMap rels;
    private final ConversionProfile profile;

    public DocumentConverter(RelationshipMap rels) {
        this(rels, ConversionProfile.defaults());
    }

    public DocumentConverter(RelationshipMap rels, ConversionProfile profile) {
        this.rels = rels != null ? rels : RelationshipMap.empty();
        this.profile = profile != null ? profile : ConversionProfile.defaults();
    }

    /** Reads {@code document.xml} from {@code in} and writes the LaTeX body to {@code out}. */
    public ConversionResult convert(InputStream in, Writer out) throws IOException {
        XMLEventReader events;
        try {
            events = XmlSupport.newEventReader(in);
        } catch (XMLStreamException e) {
            ConversionState state = new ConversionState();
            state.setLocation(IssueLoc.fromLocation(e.getLocation()));
            state.report(
                    IssueType.READ_ERROR, IssueSev.FATAL, "Cannot read document: " + e.getMessage());
            return new ConversionResult(state.getIssues(), false);
        }
        try {
            return convert(events, out);
        } finally {
            closeQuietly(events);
        }
    }

    /**
     * Pulls events until the end of the document or the first read error. Output written before a
     * read error is kept.
     *
     * @throws IOException if writing to {@code out} fails
     */
    public ConversionResult convert(XMLEventReader events, Writer out) throws IOException {
        Conversion conversion = new Conversion(new LatexWriter(out));
        boolean completed = conversion.run(events);
        return new ConversionResult(conversion.state.getIssues(), completed);
    }

    private void closeQuietly(XMLEventReader events) {
        try {
            events.close();
        } catch (XMLStreamException e) {
            logger.debug("Failed to close event reader: {}", e.getMessage());
        }
    }

    /** Per-document state; never shared between conversions. */
    private final class Conversion {
        private final ContextStack<Tag> stack = new ContextStack<>();
        /** One entry per open element: whether it made it onto the stack. */
        private final Deque<Boolean> pushed = new ArrayDeque<>();

        private final ConversionState state = new ConversionState();
        private final LatexWriter out;
        private final TagEmitter emitter;

        Conversion(LatexWriter out) {
            this.out = out;
            this.emitter = new TagEmitter(out, rels, profile, state);
        }

        boolean run(XMLEventReader events) throws IOException {
            try {
                while (events.hasNext()) {
                    XMLEvent event = events.nextEvent();
                    state.setLocation(IssueLoc.fromLocation(event.getLocation()));
                    if (event.isEndDocument()) {
                        logger.debug("EndDocument");
                        if (!stack.isEmpty()) {
                            logger.warn("Document ended with {} open tags: {}", stack.size(), stack);
                        }
                        break;
                    }
                    handle(event);
                }
                return true;
            } catch (XMLStreamException e) {
                state.setLocation(IssueLoc.fromLocation(e.getLocation()));
                state.report(
                        IssueType.READ_ERROR,
                        IssueSev.FATAL,
                        "Stopped reading document: " + e.getMessage());
                return false;
            } finally {
                out.flush();
            }
        }

        private void handle(XMLEvent event) throws IOException {
            if (event.isStartDocument()) {
                logger.debug("StartDocument");
            } else if (event.isStartElement()) {
                startElement(event.asStartElement());
            } else if (event.isEndElement()) {
                endElement();
            } else if (event.isCharacters()) {
                characters(event.asCharacters().getData());
            } else {
                logger.debug("Unmatched event: {}", event);
            }
        }

        private void startElement(StartElement start) throws IOException {
            QualifiedName name = QualifiedName.fromQName(start.getName());
            logger.debug("StartElement '{}'", name);

            Tag tag;
            try {
                tag = TagClassifier.classify(name, attributesOf(start));
            } catch (MissingAttributesException e) {
                emitter.rejected(e);
                pushed.push(Boolean.FALSE);
                return;
            }
            if (tag instanceof Tag.Unknown) {
                logger.debug("Unknown tag '{}'", name);
            }

            emitter.open(tag);
            stack.push(tag);
            pushed.push(Boolean.TRUE);
        }

        private void endElement() throws IOException {
            if (pushed.isEmpty()) {
                logger.warn("End tag without matching start tag");
                return;
            }
            if (!pushed.pop()) {
                return;
            }
            process();
            stack.pop();
        }

        private void characters(String data) throws IOException {
            logger.debug("Characters {}", data);
            stack.push(new Tag.Content(LatexEscaper.escape(data, state.isMathMode())));
            process();
            stack.pop();
        }

        /** Runs the structural patterns against the current stack, then the single-tag rules. */
        private void process() throws IOException {
            logger.debug("Stack: {}", stack);
            Optional<StructuralMatch> match = StructuralPatterns.firstMatch(stack.cursor());
            if (match.isPresent()) {
                emitter.structural(match.get());
                return;
            }
            Optional<Tag> last = stack.last();
            if (last.isPresent()) {
                emitter.close(last.get());
            }
        }
    }

    private static List<Attribute> attributesOf(StartElement start) {
        List<Attribute> attributes = new ArrayList<>();
        Iterator<javax.xml.stream.events.Attribute> it = start.getAttributes();
        while (it.hasNext()) {
            javax.xml.stream.events.Attribute attribute = it.next();
            attributes.add(
                    new Attribute(QualifiedName.fromQName(attribute.getName()), attribute.getValue()));
        }
        return attributes;
    }
}
