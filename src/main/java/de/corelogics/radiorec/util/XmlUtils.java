/*
 * MIT License
 *
 * Copyright (c) 2026 Radio Recorder Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package de.corelogics.radiorec.util;

import de.corelogics.radiorec.client.NormalizationException;
import lombok.experimental.UtilityClass;
import lombok.val;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@UtilityClass
public class XmlUtils {
    // neither service sends a DTD, refusing it also rules out external entities
    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    public static Document parse(String xml, String origin) throws NormalizationException {
        try {
            val factory = DocumentBuilderFactory.newDefaultInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(DISALLOW_DOCTYPE, true);
            val docBuilder = factory.newDocumentBuilder();
            return docBuilder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new NormalizationException("Illegal XML format from " + origin, e);
        } catch (ParserConfigurationException | IOException e) {
            throw new NormalizationException("Could not parse XML from " + origin, e);
        }
    }

    public static List<Element> elements(Element parent, String tagName) {
        val nodes = parent.getElementsByTagName(tagName);
        return IntStream.range(0, nodes.getLength())
            .mapToObj(nodes::item)
            .filter(Element.class::isInstance)
            .map(Element.class::cast)
            .collect(Collectors.toList());
    }

    /**
     * Text of the first direct child with the given name, absent if missing or blank.
     */
    public static Optional<String> childText(Element parent, String tagName) {
        for (var node = parent.getFirstChild(); null != node; node = node.getNextSibling()) {
            if (node instanceof Element && tagName.equals(node.getNodeName())) {
                val text = node.getTextContent();
                return null == text || text.isBlank() ? Optional.empty() : Optional.of(text.strip());
            }
        }
        return Optional.empty();
    }
}
