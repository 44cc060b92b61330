package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.exception.WorkflowParseException;
import com.etl.migration.kettlegraph.model.DocumentKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;

/**
 * Loads a document's bytes and identifies whether it is a transformation or a job.
 *
 * Detection order: the .ktr / .kjb extension decides; an .xml file is identified by its root tag.
 * A declared extension contradicted by the root tag is rejected.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KettleDocumentReader {

    private static final String TRANSFORMATION_EXTENSION = ".ktr";
    private static final String JOB_EXTENSION = ".kjb";
    private static final String XML_EXTENSION = ".xml";

    private final XmlTreeConverter xmlTreeConverter;

    public ParsedTree read(String fileName, byte[] content) {
        String extension = extensionOf(fileName);
        DocumentKind declaredKind = kindFromExtension(fileName, extension);

        Element root = parseXml(fileName, content);
        String rootTag = root.getNodeName();
        DocumentKind rootKind = DocumentKind.fromRootTag(rootTag);

        DocumentKind kind;
        if (declaredKind == null) {
            if (rootKind == null) {
                throw WorkflowParseException.unrecognized(fileName,
                        "Unknown XML format - root element <" + rootTag + "> is neither a transformation nor a job");
            }
            kind = rootKind;
        } else if (rootKind != declaredKind) {
            throw WorkflowParseException.unrecognized(fileName,
                    "Invalid " + declaredKind.getValue() + " format - root element is <" + rootTag + ">");
        } else {
            kind = declaredKind;
        }

        log.debug("Identified {} as {} (extension '{}', root <{}>)", fileName, kind.getValue(), extension, rootTag);
        return new ParsedTree(fileName, kind, rootTag, xmlTreeConverter.convert(root));
    }

    /**
     * Lower-cased extension including the dot, or an empty string
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private DocumentKind kindFromExtension(String fileName, String extension) {
        switch (extension) {
            case TRANSFORMATION_EXTENSION:
                return DocumentKind.TRANSFORMATION;
            case JOB_EXTENSION:
                return DocumentKind.JOB;
            case XML_EXTENSION:
                return null;
            default:
                throw WorkflowParseException.unrecognized(fileName,
                        "Unsupported file type: " + (extension.isEmpty() ? "(none)" : extension));
        }
    }

    private Element parseXml(String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            throw WorkflowParseException.malformed(fileName, new IllegalArgumentException("document is empty"));
        }
        try {
            DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler(fileName));
            Document document = builder.parse(new ByteArrayInputStream(content));
            Element root = document.getDocumentElement();
            root.normalize();
            return root;
        } catch (SAXException | IOException e) {
            throw WorkflowParseException.malformed(fileName, e);
        }
    }

    private DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    /**
     * Turns parser errors into exceptions instead of printing them to stderr.
     */
    private static final class RethrowingErrorHandler implements ErrorHandler {

        private final String fileName;

        private RethrowingErrorHandler(String fileName) {
            this.fileName = fileName;
        }

        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML warning in {}: {}", fileName, exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
