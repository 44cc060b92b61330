package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.dto.graph.WorkflowNode;
import com.etl.migration.kettlegraph.model.NodeKind;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.etl.migration.kettlegraph.TestFixtures.fixture;
import static com.etl.migration.kettlegraph.TestFixtures.reader;
import static com.etl.migration.kettlegraph.TestFixtures.tree;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class NodeExtractorTest {

    private final NodeExtractor extractor = new NodeExtractor();

    @Test
    void extractsStepsWithTypeAndPosition() {
        List<WorkflowNode> nodes = extractor.extract(reader().read("load_orders.ktr", fixture("load_orders.ktr")));

        assertThat(nodes).extracting(WorkflowNode::getId, WorkflowNode::getStepType, WorkflowNode::getKind)
                .containsExactly(
                        tuple("Read orders", "TextFileInput", NodeKind.STEP),
                        tuple("Clean orders", "Mapping", NodeKind.STEP),
                        tuple("Write orders", "TableOutput", NodeKind.STEP),
                        tuple("Audit log", "WriteToLog", NodeKind.STEP));
        assertThat(nodes.get(0).getPosition().getX()).isEqualTo(80);
        assertThat(nodes.get(0).getPosition().getY()).isEqualTo(160);
    }

    @Test
    void fallsBackToDefaultPosition_whenCoordinateIsNotNumeric() {
        List<WorkflowNode> nodes = extractor.extract(reader().read("load_orders.ktr", fixture("load_orders.ktr")));

        WorkflowNode audit = nodes.get(3);
        assertThat(audit.getPosition().getX()).isEqualTo(560);
        assertThat(audit.getPosition().getY()).isEqualTo(100);
    }

    @Test
    void synthesizesIdsNamesAndType_whenStepIsBare() {
        List<WorkflowNode> nodes = extractor.extract(tree("bare.ktr",
                "<transformation><step><description>no name</description></step></transformation>"));

        assertThat(nodes).hasSize(1);
        WorkflowNode node = nodes.get(0);
        assertThat(node.getId()).isEqualTo("step_0");
        assertThat(node.getName()).isEqualTo("Step 1");
        assertThat(node.getStepType()).isEqualTo("unknown");
        assertThat(node.getDescription()).isEqualTo("no name");
        assertThat(node.getPosition().getX()).isEqualTo(100);
    }

    @Test
    void classifiesJobEntries() {
        List<WorkflowNode> nodes = extractor.extract(reader().read("daily_run.kjb", fixture("daily_run.kjb")));

        assertThat(nodes).extracting(WorkflowNode::getName, WorkflowNode::getKind)
                .containsExactly(
                        tuple("START", NodeKind.START),
                        tuple("Load orders", NodeKind.JOB_ENTRY),
                        tuple("Notify failure", NodeKind.JOB_ENTRY),
                        tuple("Success", NodeKind.END));
        assertThat(nodes.get(1).getPosition().getX()).isEqualTo(192);
    }

    @Test
    void keepsWholeStepAsPropertyBag() {
        List<WorkflowNode> nodes = extractor.extract(reader().read("load_orders.ktr", fixture("load_orders.ktr")));

        assertThat(PropertyBag.text(nodes.get(0).getProperties(), "file.name")).isEqualTo("${BASE_DIR}/orders.csv");
        assertThat(PropertyBag.text(nodes.get(2).getProperties(), "connection")).isEqualTo("warehouse");
    }

    @Test
    void keepsPropertyBagUnchanged_whenReturnedCopyIsModified() {
        WorkflowNode node = extractor.extract(tree("one.ktr", "<transformation><step>"
                + "<name>Read</name><type>TextFileInput</type><filename>/data/in.csv</filename>"
                + "</step></transformation>")).get(0);

        ObjectNode returned = (ObjectNode) node.getProperties();
        returned.removeAll();
        returned.put("injected", "${EVIL}");

        assertThat(node.getProperties().has("filename")).isTrue();
        assertThat(node.getProperties().has("injected")).isFalse();
        assertThat(PropertyBag.text(node.getProperties(), "filename")).isEqualTo("/data/in.csv");
    }

    @Test
    void returnsNoNodes_whenJobHasNoEntries() {
        assertThat(extractor.extract(tree("empty.kjb", "<job><name>empty</name></job>"))).isEmpty();
    }
}
