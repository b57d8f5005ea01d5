package com.example.motion_photo_muxer.service.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the XMP packet carrying the motion photo tags, merging into an existing packet when there is one.
 */
@Component
public class XmpPacketBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(XmpPacketBuilder.class);
    private static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    private static final String PACKET_BEGIN = "<?xpacket begin=\"\uFEFF\" id=\"W5M0MpCehiHzreSzNTczkc9d\"?>";
    private static final String PACKET_END = "<?xpacket end=\"w\"?>";

    public String build(String existingXmp, long offset) {
        Map<String, String> tags = MotionPhotoTags.forOffset(offset);
        if (existingXmp == null || existingXmp.isBlank()) {
            return fresh(tags);
        }
        try {
            return merge(existingXmp, tags);
        } catch (Exception e) {
            LOGGER.warn("Existing XMP could not be parsed, replacing it err={}", e.toString());
            return fresh(tags);
        }
    }

    private String fresh(Map<String, String> tags) {
        StringBuilder sb = new StringBuilder();
        sb.append(PACKET_BEGIN).append('\n');
        sb.append("<x:xmpmeta xmlns:x=\"adobe:ns:meta/\">\n");
        sb.append(" <rdf:RDF xmlns:rdf=\"").append(RDF_NS).append("\">\n");
        sb.append("  <rdf:Description rdf:about=\"\"\n");
        sb.append("    xmlns:").append(MotionPhotoTags.PREFIX).append("=\"").append(MotionPhotoTags.NAMESPACE).append('"');
        tags.forEach((name, value) -> sb.append("\n    ").append(MotionPhotoTags.PREFIX).append(':')
                .append(name).append("=\"").append(value).append('"'));
        sb.append("/>\n");
        sb.append(" </rdf:RDF>\n");
        sb.append("</x:xmpmeta>\n");
        sb.append(PACKET_END);
        return sb.toString();
    }

    private String merge(String existingXmp, Map<String, String> tags) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        Document doc = factory.newDocumentBuilder().parse(new InputSource(new StringReader(existingXmp)));

        NodeList rdfs = doc.getElementsByTagNameNS(RDF_NS, "RDF");
        if (rdfs.getLength() == 0) {
            throw new IllegalStateException("no rdf:RDF element");
        }
        Element rdf = (Element) rdfs.item(0);
        Element description = firstDescription(rdf);
        if (description == null) {
            description = doc.createElementNS(RDF_NS, "rdf:Description");
            description.setAttributeNS(RDF_NS, "rdf:about", "");
            rdf.appendChild(description);
        }

        removeElementForm(rdf, tags);
        description.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                "xmlns:" + MotionPhotoTags.PREFIX, MotionPhotoTags.NAMESPACE);
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            description.setAttributeNS(MotionPhotoTags.NAMESPACE,
                    MotionPhotoTags.PREFIX + ":" + tag.getKey(), tag.getValue());
        }

        String body = serialize(doc);
        return body.contains("<?xpacket") ? body : PACKET_BEGIN + "\n" + body + "\n" + PACKET_END;
    }

    private Element firstDescription(Element rdf) {
        NodeList children = rdf.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element element && RDF_NS.equals(element.getNamespaceURI())
                    && "Description".equals(element.getLocalName())) {
                return element;
            }
        }
        return null;
    }

    // tags may also be stored as child elements; drop those so the attributes are authoritative
    private void removeElementForm(Element rdf, Map<String, String> tags) {
        NodeList found = rdf.getElementsByTagNameNS(MotionPhotoTags.NAMESPACE, "*");
        List<Node> stale = new ArrayList<>();
        for (int i = 0; i < found.getLength(); i++) {
            Node node = found.item(i);
            if (tags.containsKey(node.getLocalName())) {
                stale.add(node);
            }
        }
        stale.forEach(node -> node.getParentNode().removeChild(node));
        NodeList descriptions = rdf.getElementsByTagNameNS(RDF_NS, "Description");
        for (int i = 0; i < descriptions.getLength(); i++) {
            Element element = (Element) descriptions.item(i);
            for (String name : tags.keySet()) {
                element.removeAttributeNS(MotionPhotoTags.NAMESPACE, name);
            }
        }
    }

    private String serialize(Document doc) throws Exception {
        TransformerFactory transformerFactory = TransformerFactory.newInstance();
        transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        transformerFactory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        Transformer transformer = transformerFactory.newTransformer();
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        StringWriter writer = new StringWriter();
        transformer.transform(new DOMSource(doc), new StreamResult(writer));
        return writer.toString();
    }
}
