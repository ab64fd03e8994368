package org.cardiocore.utils;

import java.io.IOException;
import java.io.InputStream;
import java.util.TreeMap;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * DOM and XPath helpers shared by the settings loader and the XML waveform decoder.
 */
public class XPathHelper {

	public static Document parseXml(InputStream in) throws ParserConfigurationException, SAXException, IOException {
		DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
		factory.setNamespaceAware(false);
		factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		return factory.newDocumentBuilder().parse(new InputSource(in));
	}

	/**
	 * Node name to text content for every node matching itemPath. A later node
	 * with the same name replaces an earlier one.
	 */
	public static TreeMap<String, String> findMultipleXMLItems(Document xmldoc, String itemPath)
			throws XPathExpressionException {
		TreeMap<String, String> items = new TreeMap<String, String>();
		NodeList nodes = findNodes(xmldoc, itemPath);
		for (int idx = 0; idx < nodes.getLength(); idx++) {
			items.put(nodes.item(idx).getNodeName(), nodes.item(idx).getTextContent().trim());
		}
		return items;
	}

	public static NodeList findNodes(Object context, String itemPath) throws XPathExpressionException {
		XPath xpath = XPathFactory.newInstance().newXPath();
		return (NodeList) xpath.evaluate(itemPath, context, XPathConstants.NODESET);
	}

	/**
	 * Trimmed text of the first node matching itemPath, or null when absent or empty
	 */
	public static String findXMLItem(Object context, String itemPath) throws XPathExpressionException {
		XPath xpath = XPathFactory.newInstance().newXPath();
		Node node = (Node) xpath.evaluate(itemPath, context, XPathConstants.NODE);
		if (node == null) {
			return null;
		}
		String text = node.getTextContent().trim();
		return text.isEmpty() ? null : text;
	}
}
