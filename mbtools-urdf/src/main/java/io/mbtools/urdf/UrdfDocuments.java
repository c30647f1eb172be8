package io.mbtools.urdf;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.SAXReader;
import org.dom4j.io.XMLWriter;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/// Parsing and serialization of URDF documents.
///
/// Documents are held as dom4j trees, which keep attributes in source order
/// and append new attributes after existing ones. Serialization writes the
/// tree back without indenting or trimming, so elements the export does not
/// touch come out as they were read.
public final class UrdfDocuments {

    /// Declaration written before every serialized document
    public static final String XML_DECLARATION = "<?xml version=\"1.0\"?>\n";

    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    private UrdfDocuments() {
    }

    /// Parses a template into a fresh document.
    ///
    /// @param source the template
    /// @return the parsed document
    /// @throws UrdfFormatException if the template cannot be read or is malformed
    public static Document parse(UrdfTemplateSource source) {
        try (InputStream in = source.open()) {
            return newReader().read(in);
        } catch (IOException e) {
            throw new UrdfFormatException("Cannot read URDF template " + source.description() + ": " + e.getMessage(), e);
        } catch (DocumentException e) {
            throw new UrdfFormatException("Malformed URDF template " + source.description() + ": " + e.getMessage(), e);
        }
    }

    /// Serializes the root element of a document, preceded by [#XML_DECLARATION].
    ///
    /// @param document the document
    /// @return the URDF text
    public static String serialize(Document document) {
        StringWriter out = new StringWriter();
        XMLWriter writer = new XMLWriter(out, new OutputFormat());
        try {
            writer.write(document.getRootElement());
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize URDF document", e);
        }
        return XML_DECLARATION + out;
    }

    /// Collects every element named `name` below and including `root`, in document order.
    ///
    /// @param root the subtree to search
    /// @param name the element name
    /// @return the matching elements
    public static List<Element> elementsNamed(Element root, String name) {
        List<Element> found = new ArrayList<>();
        collect(root, name, found);
        return found;
    }

    private static void collect(Element element, String name, List<Element> found) {
        if (name.equals(element.getName())) {
            found.add(element);
        }
        for (Element child : element.elements()) {
            collect(child, name, found);
        }
    }

    private static SAXReader newReader() {
        SAXReader reader = SAXReader.createDefault();
        try {
            reader.setFeature(DISALLOW_DOCTYPE, true);
        } catch (SAXException e) {
            throw new IllegalStateException("XML parser does not support " + DISALLOW_DOCTYPE, e);
        }
        return reader;
    }
}
