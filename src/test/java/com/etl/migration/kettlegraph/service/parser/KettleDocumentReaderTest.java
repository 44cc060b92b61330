package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.exception.ParseErrorType;
import com.etl.migration.kettlegraph.exception.WorkflowParseException;
import com.etl.migration.kettlegraph.model.DocumentKind;
import org.junit.jupiter.api.Test;

import static com.etl.migration.kettlegraph.TestFixtures.fixture;
import static com.etl.migration.kettlegraph.TestFixtures.xml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KettleDocumentReaderTest {

    private final KettleDocumentReader reader = new KettleDocumentReader(new XmlTreeConverter());

    @Test
    void identifiesTransformationByExtension() {
        ParsedTree tree = reader.read("load_orders.ktr", fixture("load_orders.ktr"));

        assertThat(tree.getKind()).isEqualTo(DocumentKind.TRANSFORMATION);
        assertThat(tree.getRootTag()).isEqualTo("transformation");
        assertThat(tree.getRoot().get("step")).hasSize(4);
    }

    @Test
    void identifiesXmlFileByRootTag() {
        ParsedTree tree = reader.read("export/daily.xml", xml("<job><name>daily</name></job>"));

        assertThat(tree.getKind()).isEqualTo(DocumentKind.JOB);
    }

    @Test
    void rejectsXmlFileWithUnknownRoot() {
        assertThatThrownBy(() -> reader.read("plugin_registry.xml", fixture("plugin_registry.xml")))
                .isInstanceOfSatisfying(WorkflowParseException.class,
                        e -> assertThat(e.getErrorType()).isEqualTo(ParseErrorType.UNRECOGNIZED_FORMAT))
                .hasMessageContaining("plugins");
    }

    @Test
    void rejectsTransformationExtensionWithJobRoot() {
        assertThatThrownBy(() -> reader.read("mislabelled.ktr", xml("<job/>")))
                .isInstanceOfSatisfying(WorkflowParseException.class,
                        e -> assertThat(e.getErrorType()).isEqualTo(ParseErrorType.UNRECOGNIZED_FORMAT));
    }

    @Test
    void rejectsUnsupportedExtension() {
        assertThatThrownBy(() -> reader.read("notes.txt", xml("<transformation/>")))
                .isInstanceOf(WorkflowParseException.class)
                .hasMessage("Unsupported file type: .txt");
    }

    @Test
    void reportsMalformedMarkup() {
        assertThatThrownBy(() -> reader.read("broken.ktr", fixture("broken.ktr")))
                .isInstanceOfSatisfying(WorkflowParseException.class, e -> {
                    assertThat(e.getErrorType()).isEqualTo(ParseErrorType.MALFORMED);
                    assertThat(e.getFileName()).isEqualTo("broken.ktr");
                });
    }

    @Test
    void reportsEmptyContentAsMalformed() {
        assertThatThrownBy(() -> reader.read("empty.kjb", new byte[0]))
                .isInstanceOfSatisfying(WorkflowParseException.class,
                        e -> assertThat(e.getErrorType()).isEqualTo(ParseErrorType.MALFORMED));
    }

    @Test
    void refusesDoctypeDeclarations() {
        String markup = "<?xml version=\"1.0\"?>"
                + "<!DOCTYPE transformation [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>"
                + "<transformation><info><name>&xxe;</name></info></transformation>";

        assertThatThrownBy(() -> reader.read("evil.ktr", xml(markup)))
                .isInstanceOfSatisfying(WorkflowParseException.class,
                        e -> assertThat(e.getErrorType()).isEqualTo(ParseErrorType.MALFORMED));
    }

    @Test
    void extensionOfIgnoresDotsInDirectories() {
        assertThat(KettleDocumentReader.extensionOf("etl.v2/LOAD.KTR")).isEqualTo(".ktr");
        assertThat(KettleDocumentReader.extensionOf("etl.v2/README")).isEmpty();
        assertThat(KettleDocumentReader.extensionOf(null)).isEmpty();
    }
}
