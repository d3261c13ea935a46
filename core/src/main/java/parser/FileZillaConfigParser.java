package parser;

import model.Protocol;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.logging.Logger;

/**
 * Парсер экспорта FileZilla ({@code sitemanager.xml} / {@code recentservers.xml}).
 *
 * <p>Читает все элементы {@code Server} на любой глубине. Пароль с атрибутом
 * {@code encoding="base64"} декодируется как UTF-8; если декодирование не удалось,
 * используется исходный текст.
 */
public final class FileZillaConfigParser {
    private static final Logger logger = Logger.getLogger(FileZillaConfigParser.class.getName());

    private static final int DEFAULT_PORT = 21;
    private static final String DEFAULT_LOGON_TYPE = "1";
    private static final String ANONYMOUS = "anonymous";

    /**
     * @param xmlFile путь к XML файлу
     * @return серверы в порядке следования в файле
     * @throws ConfigurationException если файл не читается или не является корректным XML
     */
    public List<ServerEntry> parse(Path xmlFile) throws ConfigurationException {
        try (InputStream in = Files.newInputStream(xmlFile)) {
            return parse(in);
        } catch (IOException e) {
            throw new ConfigurationException("Error parsing FileZilla XML: " + e.getMessage(), e);
        }
    }

    public List<ServerEntry> parse(InputStream in) throws ConfigurationException {
        Document document;
        try {
            document = newDocumentBuilder().parse(in);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new ConfigurationException("Error parsing FileZilla XML: " + e.getMessage(), e);
        }

        List<ServerEntry> servers = new ArrayList<>();
        NodeList serverNodes = document.getElementsByTagName("Server");
        for (int i = 0; i < serverNodes.getLength(); i++) {
            Element server = (Element) serverNodes.item(i);
            ServerEntry entry = toEntry(server, i);
            if (entry != null) {
                servers.add(entry);
            }
        }

        logger.fine("Parsed " + servers.size() + " server(s) from FileZilla XML");
        return servers;
    }

    private ServerEntry toEntry(Element server, int index) throws ConfigurationException {
        String host = childText(server, "Host");
        if (host == null || host.isBlank()) {
            logger.warning("Skipping FileZilla server #" + (index + 1) + ": no Host");
            return null;
        }

        int port = parseInt(childText(server, "Port"), DEFAULT_PORT, "Port");
        int protocolCode = parseInt(childText(server, "Protocol"), Protocol.FTP.getCode(), "Protocol");
        Protocol protocol;
        try {
            protocol = Protocol.fromCode(protocolCode);
        } catch (IllegalArgumentException e) {
            logger.warning("Skipping FileZilla server " + host + ": unsupported protocol " + protocolCode);
            return null;
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Error parsing FileZilla XML: invalid port " + port + " for " + host);
        }

        String username = childText(server, "User");
        if (username == null || username.isEmpty()) {
            username = ANONYMOUS;
        }
        String password = decodePassword(childElement(server, "Pass"));
        String logonType = childText(server, "Logontype");
        if (logonType == null) {
            logonType = DEFAULT_LOGON_TYPE;
        }
        String name = childText(server, "Name");
        if (name == null || name.isBlank()) {
            name = username + "@" + host + ":" + port;
        }

        return new ServerEntry(name, host.trim(), port, protocol, username, password, logonType);
    }

    static String decodePassword(Element pass) {
        if (pass == null) {
            return null;
        }
        String text = pass.getTextContent();
        if ("base64".equals(pass.getAttribute("encoding")) && text != null && !text.isEmpty()) {
            try {
                byte[] decoded = Base64.getMimeDecoder().decode(text.trim());
                return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(decoded)).toString();
            } catch (IllegalArgumentException | CharacterCodingException e) {
                logger.fine("Password is not valid base64/UTF-8, using raw text");
                return text;
            }
        }
        return text;
    }

    private static int parseInt(String value, int defaultValue, String field) throws ConfigurationException {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Error parsing FileZilla XML: invalid " + field + " '" + value + "'", e);
        }
    }

    private static Element childElement(Element parent, String name) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(child.getNodeName())) {
                return (Element) child;
            }
        }
        return null;
    }

    private static String childText(Element parent, String name) {
        Element child = childElement(parent, name);
        return child != null ? child.getTextContent() : null;
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        // экспорт приходит от пользователя: внешние сущности и DTD запрещены
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }
}
