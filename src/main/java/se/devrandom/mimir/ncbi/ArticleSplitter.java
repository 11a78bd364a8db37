/*
 * Mimir - Literature Harvester
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
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
package se.devrandom.mimir.ncbi;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an efetch XML container into its article sub-documents.
 * Articles nested inside another article are part of their parent and are not returned separately.
 * The PMC DOCTYPE is accepted but its external DTD is never fetched.
 * JAXP factories are not thread-safe, so builder and transformer creation is serialised.
 */
public class ArticleSplitter {
    private static final String ARTICLE = "article";

    private final DocumentBuilderFactory builderFactory;
    private final TransformerFactory transformerFactory;

    public ArticleSplitter() {
        try {
            builderFactory = DocumentBuilderFactory.newInstance();
            builderFactory.setNamespaceAware(false);
            builderFactory.setValidating(false);
            builderFactory.setExpandEntityReferences(false);
            builderFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            builderFactory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            builderFactory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);

            transformerFactory = TransformerFactory.newInstance();
            transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure configuration", e);
        }
    }

    /**
     * @param xml the raw efetch response body
     * @return every top-level article serialised on its own, in document order
     * @throws MalformedResponseException if the body is not well-formed XML
     */
    public List<String> split(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new MalformedResponseException("Empty document batch response");
        }

        Document document;
        try {
            DocumentBuilder builder;
            synchronized (builderFactory) {
                builder = builderFactory.newDocumentBuilder();
            }
            document = builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            throw new MalformedResponseException("Document batch response is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Could not create XML parser", e);
        }

        List<String> articles = new ArrayList<>();
        NodeList candidates = document.getElementsByTagName(ARTICLE);
        for (int i = 0; i < candidates.getLength(); i++) {
            Element article = (Element) candidates.item(i);
            if (!hasArticleAncestor(article)) {
                articles.add(serialize(article));
            }
        }
        return articles;
    }

    private boolean hasArticleAncestor(Element element) {
        Node parent = element.getParentNode();
        while (parent != null && parent.getNodeType() == Node.ELEMENT_NODE) {
            if (ARTICLE.equals(parent.getNodeName())) {
                return true;
            }
            parent = parent.getParentNode();
        }
        return false;
    }

    private String serialize(Element article) {
        try {
            Transformer transformer;
            synchronized (transformerFactory) {
                transformer = transformerFactory.newTransformer();
            }
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(article), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new MalformedResponseException("Could not serialise article: " + e.getMessage(), e);
        }
    }
}
