package com.twbconvert.testing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

public final class TestWorkbooks {

    private TestWorkbooks() {}

    /** Parses {@code workbooks/<name>} from the test classpath. */
    public static Document load(String name) throws IOException {
        String resource = "workbooks/" + name;
        try (InputStream in = TestWorkbooks.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Missing classpath resource: " + resource);
            }
            return builder().parse(in);
        } catch (SAXException ex) {
            throw new IOException("Unable to parse " + resource, ex);
        }
    }

    public static Document parse(String xml) throws IOException {
        try {
            return builder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (SAXException ex) {
            throw new IOException("Unable to parse inline workbook", ex);
        }
    }

    private static DocumentBuilder builder() throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException ex) {
            throw new IOException("No XML parser available", ex);
        }
    }
}
