package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.dto.ParseResult;
import com.etl.migration.kettlegraph.dto.graph.*;
import com.etl.migration.kettlegraph.exception.ParseErrorType;
import com.etl.migration.kettlegraph.model.DependencyCategory;
import com.etl.migration.kettlegraph.model.DocumentKind;
import com.etl.migration.kettlegraph.service.graph.CircularDependencyDetector;
import com.etl.migration.kettlegraph.service.graph.WorkflowStructureAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static com.etl.migration.kettlegraph.TestFixtures.fixture;
import static com.etl.migration.kettlegraph.TestFixtures.parserService;
import static com.etl.migration.kettlegraph.TestFixtures.xml;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

class WorkflowParserServiceTest {

    private final WorkflowParserService parserService = parserService();
    private final WorkflowStructureAnalyzer structureAnalyzer =
            new WorkflowStructureAnalyzer(new CircularDependencyDetector());

    @Test
    void parsesLinearTransformation() {
        WorkflowDocument document = parserService.parseDocument("linear.ktr", xml("<transformation>"
                + "<info><name>linear</name></info>"
                + "<step><name>Read CSV</name><type>CsvInput</type></step>"
                + "<step><name>Filter</name><type>FilterRows</type></step>"
                + "<step><name>Write DB</name><type>TableOutput</type></step>"
                + "<order>"
                + "<hop><from>Read CSV</from><to>Filter</to><enabled>Y</enabled></hop>"
                + "<hop><from>Filter</from><to>Write DB</to><enabled>Y</enabled></hop>"
                + "</order></transformation>"));

        WorkflowStructure structure = structureAnalyzer.analyze(document);

        assertThat(document.getNodes()).hasSize(3);
        assertThat(document.getEdges()).hasSize(2);
        assertThat(structure.getEntryPoints()).containsExactly("Read CSV");
        assertThat(structure.getEndPoints()).containsExactly("Write DB");
        assertThat(structure.getIsolatedNodes()).isEmpty();
    }

    @Test
    void parsesTransformationHeaderAndDeclarations() {
        WorkflowDocument document = parserService.parseDocument("load_orders.ktr", fixture("load_orders.ktr"));

        assertThat(document.getKind()).isEqualTo(DocumentKind.TRANSFORMATION);
        assertThat(document.getName()).isEqualTo("load_orders");
        assertThat(document.getDescription()).isEqualTo("Loads the daily orders extract into the warehouse");
        assertThat(document.getMetadata().getAuthor()).isEqualTo("etl_admin");
        assertThat(document.getMetadata().getVersion()).isEqualTo("3.1");
        assertThat(document.getParameters()).containsExactly(
                entry("BASE_DIR", "/data/in"),
                entry("target_schema", ""));
        assertThat(document.getDatabaseConnections())
                .extracting(DatabaseConnectionInfo::getName, DatabaseConnectionInfo::getType, DatabaseConnectionInfo::getPort)
                .containsExactly(tuple("warehouse", "POSTGRESQL", "5432"));
    }

    @Test
    void collectsDependenciesOfTransformation() {
        DependencySet dependencies = parserService.parseDocument("load_orders.ktr", fixture("load_orders.ktr"))
                .getDependencies();

        assertThat(dependencies.getStepConnections()).hasSize(3);
        assertThat(dependencies.getFileDependencies())
                .extracting(WorkflowDependency::getCategory, WorkflowDependency::getTarget)
                .containsExactly(tuple(DependencyCategory.FILE_INPUT, "${BASE_DIR}/orders.csv"));
        assertThat(dependencies.getDatabaseDependencies())
                .extracting(WorkflowDependency::getOrigin, WorkflowDependency::getTarget)
                .containsExactly(tuple("Write orders", "warehouse"));
        assertThat(dependencies.getSubWorkflowDependencies())
                .extracting(WorkflowDependency::getCategory, WorkflowDependency::getTarget)
                .containsExactly(tuple(DependencyCategory.SUB_TRANSFORMATION, "clean_orders"));
        assertThat(dependencies.getVariableDependencies())
                .filteredOn(dependency -> dependency.getOrigin().equals("Write orders"))
                .extracting(WorkflowDependency::getCategory, WorkflowDependency::getTarget)
                .containsExactly(tuple(DependencyCategory.VARIABLE_USER, "target_schema"));
    }

    @Test
    void parsesJobWithConditionsAndHeader() {
        WorkflowDocument document = parserService.parseDocument("daily_run.kjb", fixture("daily_run.kjb"));

        assertThat(document.getKind()).isEqualTo(DocumentKind.JOB);
        assertThat(document.getName()).isEqualTo("daily_run");
        assertThat(document.getMetadata().getVersion()).isEqualTo("7");
        assertThat(document.getParameters()).containsEntry("RUN_DATE", "today");
        assertThat(document.getEdges()).extracting(WorkflowEdge::getCondition)
                .containsExactly("unconditional", "success", "failure");
        assertThat(document.getDependencies().getSubWorkflowDependencies())
                .extracting(WorkflowDependency::getCategory, WorkflowDependency::getTarget)
                .containsExactly(tuple(DependencyCategory.TRANSFORMATION_CALL, "load_orders"));
    }

    @Test
    void everyEdgeEndpointIsANode() {
        WorkflowDocument document = parserService.parseDocument("dangling.ktr", xml("<transformation>"
                + "<step><name>A</name></step><step><name>B</name></step>"
                + "<order>"
                + "<hop><from>A</from><to>B</to></hop>"
                + "<hop><from>B</from><to>Ghost</to></hop>"
                + "</order></transformation>"));

        Set<String> nodeIds = document.getNodes().stream().map(WorkflowNode::getId).collect(Collectors.toSet());
        assertThat(document.getEdges()).hasSize(1);
        assertThat(document.getEdges()).allSatisfy(edge -> {
            assertThat(nodeIds).contains(edge.getFrom());
            assertThat(nodeIds).contains(edge.getTo());
        });
    }

    @Test
    void keepsDuplicateNodeNamesAndRepeatedHops() {
        WorkflowDocument document = parserService.parseDocument("duplicates.ktr", xml("<transformation>"
                + "<step><name>X</name><type>Dummy</type></step>"
                + "<step><name>X</name><type>Dummy</type></step>"
                + "<order>"
                + "<hop><from>X</from><to>X</to></hop>"
                + "<hop><from>X</from><to>X</to></hop>"
                + "</order></transformation>"));

        assertThat(document.getNodes()).extracting(WorkflowNode::getId).containsExactly("X", "X");
        assertThat(document.getEdges()).extracting(WorkflowEdge::getId, WorkflowEdge::getFrom, WorkflowEdge::getTo)
                .containsExactly(tuple("hop_0", "X", "X"), tuple("hop_1", "X", "X"));
        assertThat(document.getDependencies().getStepConnections()).hasSize(2);
    }

    @Test
    void usesDerivedHops_whenTheyAreMoreComplete() {
        WorkflowDocument document = parserService.parseDocument("split.ktr", xml("<transformation>"
                + "<step><name>A</name></step><step><name>B</name></step><step><name>C</name></step>"
                + "<order><hop><from>A</from><to>B</to></hop></order>"
                + "<hops><hop><from>B</from><to>C</to></hop></hops>"
                + "</transformation>"));

        assertThat(document.getEdges()).extracting(WorkflowEdge::getId)
                .containsExactly("hop_0_0", "hops_hop_0_0");
    }

    @Test
    void reconciledEdgeCountIsNeverBelowExtractedCount() {
        WorkflowDocument document = parserService.parseDocument("hops_only.ktr", fixture("hops_only.ktr"));

        assertThat(document.getEdges()).extracting(WorkflowEdge::getId).containsExactly("hop_0", "hop_1");
    }

    @Test
    void fallsBackToFileName_whenHeaderHasNoName() {
        WorkflowDocument document = parserService.parseDocument("anonymous.kjb", xml("<job><entries/></job>"));

        assertThat(document.getName()).isEqualTo("anonymous.kjb");
        assertThat(document.getNodes()).isEmpty();
        assertThat(document.getEdges()).isEmpty();
        assertThat(document.getDependencies().size()).isZero();
    }

    @Test
    void reportsFailureInsteadOfThrowing() {
        ParseResult result = parserService.parse("broken.ktr", fixture("broken.ktr"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDocument()).isNull();
        assertThat(result.getErrorType()).isEqualTo(ParseErrorType.MALFORMED);
        assertThat(result.toFailure().getFileName()).isEqualTo("broken.ktr");
    }
}
