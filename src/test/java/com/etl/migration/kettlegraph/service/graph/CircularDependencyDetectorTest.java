package com.etl.migration.kettlegraph.service.graph;

import com.etl.migration.kettlegraph.dto.graph.CircularDependency;
import com.etl.migration.kettlegraph.dto.graph.FileDependency;
import com.etl.migration.kettlegraph.model.DependencyCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CircularDependencyDetectorTest {

    private final CircularDependencyDetector detector = new CircularDependencyDetector();

    @Test
    void reportsCycleBetweenFilesOnce() {
        List<CircularDependency> cycles = detector.detectCircularDependencies(List.of(
                dependency("a.kjb", "b.kjb"),
                dependency("b.kjb", "c.kjb"),
                dependency("c.kjb", "a.kjb")));

        assertThat(cycles).hasSize(1);
        CircularDependency cycle = cycles.get(0);
        assertThat(cycle.getSeverity()).isEqualTo(CircularDependency.Severity.ERROR);
        assertThat(cycle.getCycle()).containsExactly("a.kjb", "b.kjb", "c.kjb", "a.kjb");
        assertThat(cycle.getCycleEdges()).extracting(FileDependency::getTo)
                .containsExactly("b.kjb", "c.kjb", "a.kjb");
        assertThat(cycle.getDescription()).isEqualTo("Circular dependency between files: a.kjb -> b.kjb -> c.kjb -> a.kjb");
    }

    @Test
    void reportsSelfCallAsWarning() {
        List<CircularDependency> cycles = detector.detectCircularDependencies(List.of(
                dependency("retry.kjb", "retry.kjb")));

        assertThat(cycles).singleElement().satisfies(cycle -> {
            assertThat(cycle.getSeverity()).isEqualTo(CircularDependency.Severity.WARNING);
            assertThat(cycle.getCycle()).containsExactly("retry.kjb", "retry.kjb");
        });
    }

    @Test
    void findsNothingInAcyclicFolder() {
        assertThat(detector.detectCircularDependencies(List.of(
                dependency("main.kjb", "load.ktr"),
                dependency("main.kjb", "clean.ktr"),
                dependency("load.ktr", "clean.ktr")))).isEmpty();
        assertThat(detector.detectCircularDependencies(List.of())).isEmpty();
    }

    private FileDependency dependency(String from, String to) {
        return FileDependency.builder()
                .id(from + "_to_" + to)
                .from(from)
                .to(to)
                .category(DependencyCategory.JOB_CALL)
                .build();
    }
}
