package com.whereq.evtfilter.reader;

import com.whereq.evtfilter.model.EventRecord;
import com.whereq.evtfilter.model.ParsedRows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the XML written by Log Parser into rows.
 *
 * <p>The first attempt decodes strictly in the encoding named by the byte order mark or
 * the declaration. Log Parser is known to mis-declare it, so when a byte does not decode,
 * the parse fails or no rows are found, the bytes are decoded again ignoring malformed
 * sequences and parsed a second time.</p>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecoderOutputReader {

    static final String ROW_XPATH = "//ROW";

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private static final ErrorHandler QUIET = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) {
            log.debug("XML error: {}", exception.getMessage());
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private final XmlEncodingDetector encodingDetector;

    /**
     * Read all ROW elements of a Log Parser document.
     *
     * @param xml decoder output file
     * @return rows, or empty when the document holds no rows or cannot be decoded
     * @throws IOException if the file cannot be read
     */
    public Optional<ParsedRows> read(Path xml) throws IOException {
        byte[] raw = Files.readAllBytes(xml);
        try {
            NodeList rows = selectRows(parse(new InputSource(new StringReader(decodeStrict(raw)))));
            if (rows.getLength() > 0) {
                return Optional.of(toRows(rows));
            }
        } catch (CharacterCodingException | IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.debug("{} is not valid in its declared encoding ({}), decoding leniently", xml, e.toString());
        } catch (SAXException | IOException e) {
            log.debug("Direct parse of {} failed ({}), decoding manually", xml, e.getMessage());
        }

        return readDecoded(raw, xml);
    }

    /**
     * Manual decode path: detect the encoding, decode leniently, parse the text.
     */
    Optional<ParsedRows> readDecoded(byte[] raw, Path origin) {
        String encoding = encodingDetector.detect(raw);
        Charset charset;
        try {
            charset = Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("{}: unsupported declared encoding '{}', treating as empty", origin, encoding);
            return Optional.empty();
        }

        String text = stripByteOrderMark(LenientDecoding.decode(raw, charset));
        try {
            NodeList rows = selectRows(parse(new InputSource(new StringReader(text))));
            if (rows.getLength() == 0) {
                return Optional.empty();
            }
            return Optional.of(toRows(rows));
        } catch (SAXException | IOException e) {
            log.warn("{}: unreadable after decoding as {} ({}), treating as empty", origin, encoding, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decode in the detected encoding, failing on any malformed or unmappable byte.
     */
    private String decodeStrict(byte[] raw) throws CharacterCodingException {
        Charset charset = Charset.forName(encodingDetector.detect(raw));
        String text = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw))
                .toString();
        return stripByteOrderMark(text);
    }

    private static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    private Document parse(InputSource source) throws SAXException, IOException {
        DocumentBuilder builder = newBuilder();
        builder.setErrorHandler(QUIET);
        return builder.parse(source);
    }

    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }

    private NodeList selectRows(Document document) throws SAXException {
        try {
            return (NodeList) XPathFactory.newInstance().newXPath()
                    .evaluate(ROW_XPATH, document, XPathConstants.NODESET);
        } catch (XPathExpressionException e) {
            throw new SAXException("Row selection failed", e);
        }
    }

    private ParsedRows toRows(NodeList nodes) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, String>> raw = new ArrayList<>(nodes.getLength());

        for (int i = 0; i < nodes.getLength(); i++) {
            Element row = (Element) nodes.item(i);
            Map<String, String> values = new LinkedHashMap<>();

            NamedNodeMap attributes = row.getAttributes();
            for (int a = 0; a < attributes.getLength(); a++) {
                Node attribute = attributes.item(a);
                values.put(attribute.getNodeName(), emptyToNull(attribute.getNodeValue()));
            }

            for (Node child = row.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (child.getNodeType() == Node.ELEMENT_NODE) {
                    values.put(child.getNodeName(), emptyToNull(child.getTextContent()));
                }
            }

            columns.addAll(values.keySet());
            raw.add(values);
        }

        Set<String> integerColumns = integerColumns(columns, raw);
        List<EventRecord> records = new ArrayList<>(raw.size());
        for (Map<String, String> values : raw) {
            EventRecord record = new EventRecord();
            for (String column : columns) {
                String value = values.get(column);
                record.put(column, value != null && integerColumns.contains(column)
                        ? Long.valueOf(value.strip())
                        : value);
            }
            records.add(record);
        }

        return new ParsedRows(List.copyOf(columns), records);
    }

    /**
     * Columns whose every non-null value is an integer that fits a long.
     */
    private Set<String> integerColumns(Set<String> columns, List<Map<String, String>> raw) {
        Set<String> result = new LinkedHashSet<>();
        for (String column : columns) {
            boolean sawValue = false;
            boolean allIntegers = true;
            for (Map<String, String> values : raw) {
                String value = values.get(column);
                if (value == null) {
                    continue;
                }
                sawValue = true;
                if (!isLong(value.strip())) {
                    allIntegers = false;
                    break;
                }
            }
            if (sawValue && allIntegers) {
                result.add(column);
            }
        }
        return result;
    }

    private static boolean isLong(String value) {
        if (!INTEGER.matcher(value).matches()) {
            return false;
        }
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
