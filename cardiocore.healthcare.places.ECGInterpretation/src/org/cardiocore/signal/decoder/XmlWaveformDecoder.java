package org.cardiocore.signal.decoder;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPathExpressionException;

import org.cardiocore.exceptions.DecodeException;
import org.cardiocore.signal.WaveformFormat;
import org.cardiocore.utils.XPathHelper;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * XML waveform export.
 *
 * <pre>
 * &lt;ecg&gt;
 *   &lt;sampleRate&gt;500&lt;/sampleRate&gt;
 *   &lt;acquisitionDate&gt;2024-03-01T10:15:00&lt;/acquisitionDate&gt;
 *   &lt;device&gt;&lt;manufacturer/&gt;&lt;model/&gt;&lt;serialNumber/&gt;&lt;/device&gt;
 *   &lt;waveform&gt;
 *     &lt;lead name="I"&gt;0.01 0.02 ...&lt;/lead&gt;
 *   &lt;/waveform&gt;
 * &lt;/ecg&gt;
 * </pre>
 *
 * A single-lead export may use {@code <waveform><data>...</data></waveform>} instead of lead elements.
 */
public class XmlWaveformDecoder implements WaveformDecoder {

    @Override
    public WaveformFormat getFormat() {
        return WaveformFormat.XML;
    }

    @Override
    public DecodedWaveform decode(byte[] data) throws DecodeException {
        Document doc;
        try {
            doc = XPathHelper.parseXml(new ByteArrayInputStream(data));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "XML waveform is not well formed", e);
        }

        try {
            Double sampleRate = parseSampleRate(XPathHelper.findXMLItem(doc, "//sampleRate"));

            List<String> leadNames = new ArrayList<>();
            List<double[]> leads = new ArrayList<>();
            NodeList leadNodes = XPathHelper.findNodes(doc, "//waveform/lead");
            for (int i = 0; i < leadNodes.getLength(); i++) {
                Element lead = (Element) leadNodes.item(i);
                String name = lead.getAttribute("name").trim();
                leadNames.add(name.isEmpty() ? "Lead_" + (i + 1) : name);
                leads.add(parseSamples(lead.getTextContent(), "lead " + (i + 1)));
            }
            if (leads.isEmpty()) {
                String single = XPathHelper.findXMLItem(doc, "//waveform/data");
                if (single != null) {
                    leads.add(parseSamples(single, "waveform data"));
                    leadNames = null;
                }
            }

            return new DecodedWaveform(leads.toArray(new double[0][]), leads.isEmpty() ? null : leadNames, sampleRate,
                XPathHelper.findXMLItem(doc, "//acquisitionDate"),
                XPathHelper.findXMLItem(doc, "//device/manufacturer"),
                XPathHelper.findXMLItem(doc, "//device/model"),
                XPathHelper.findXMLItem(doc, "//device/serialNumber"));

        } catch (XPathExpressionException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "XML waveform structure unreadable", e);
        }
    }

    private static Double parseSampleRate(String text) throws DecodeException {
        if (text == null) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_HEADER, "Invalid sampleRate: " + text, e);
        }
    }

    private static double[] parseSamples(String text, String location) throws DecodeException {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new double[0];
        }
        String[] tokens = trimmed.split("[\\s,]+");
        double[] samples = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            samples[i] = WaveformDecoder.parseSample(tokens[i], location + ", sample " + (i + 1));
        }
        return samples;
    }
}
