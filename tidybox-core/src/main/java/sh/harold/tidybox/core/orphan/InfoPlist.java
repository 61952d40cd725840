package sh.harold.tidybox.core.orphan;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Top-level string entries of an XML property list.
 */
final class InfoPlist {
    private static final byte[] BINARY_MAGIC = "bplist".getBytes(StandardCharsets.US_ASCII);

    private final Map<String, String> strings;

    private InfoPlist(Map<String, String> strings) {
        this.strings = Map.copyOf(strings);
    }

    static InfoPlist read(Path plist) throws IOException {
        byte[] bytes = Files.readAllBytes(plist);
        if (startsWith(bytes, BINARY_MAGIC)) {
            throw new IOException("Binary property lists are not supported: " + plist);
        }
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            Document document = newBuilder().parse(in);
            return new InfoPlist(topLevelStrings(document));
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Malformed property list: " + plist, e);
        }
    }

    Optional<String> string(String key) {
        String value = strings.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.strip());
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory.newDocumentBuilder();
    }

    private static Map<String, String> topLevelStrings(Document document) {
        Map<String, String> out = new HashMap<>();
        Element root = document.getDocumentElement();
        Element dict = firstChildElement(root, "dict");
        if (dict == null) {
            return out;
        }
        String pendingKey = null;
        NodeList children = dict.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            String tag = node.getNodeName();
            if (tag.equals("key")) {
                pendingKey = node.getTextContent();
                continue;
            }
            if (pendingKey != null && tag.equals("string")) {
                out.put(pendingKey, node.getTextContent());
            }
            pendingKey = null;
        }
        return out;
    }

    private static Element firstChildElement(Element parent, String tag) {
        if (parent == null) {
            return null;
        }
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && node.getNodeName().equals(tag)) {
                return (Element) node;
            }
        }
        return null;
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
