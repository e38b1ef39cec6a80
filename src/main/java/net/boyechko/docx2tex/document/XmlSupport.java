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

import java.io.InputStream;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** StAX setup shared by every part reader. */
public final class XmlSupport {
    private static final Logger logger = LoggerFactory.getLogger(XmlSupport.class);

    private XmlSupport() {}

    /** Creates a factory that coalesces text and never resolves DTDs or external entities. */
    public static XMLInputFactory newInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        trySet(factory, XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        trySet(factory, XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        trySet(factory, XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        trySet(factory, XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        return factory;
    }

    /** Opens a reader that takes the encoding from the byte-order mark or XML declaration. */
    public static XMLEventReader newEventReader(InputStream in) throws XMLStreamException {
        return newInputFactory().createXMLEventReader(in);
    }

    private static void trySet(XMLInputFactory factory, String property, Object value) {
        if (factory.isPropertySupported(property)) {
            factory.setProperty(property, value);
        } else {
            logger.debug("XML input factory does not support {}", property);
        }
    }
}
