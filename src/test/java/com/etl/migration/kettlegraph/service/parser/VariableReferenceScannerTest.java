package com.etl.migration.kettlegraph.service.parser;

import com.etl.migration.kettlegraph.service.AnalyzerConfigurationService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VariableReferenceScannerTest {

    @Mock
    private AnalyzerConfigurationService configService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void findsDistinctNamesAnywhereInTree() throws Exception {
        when(configService.getVariableReferencePatterns()).thenReturn(List.of("\\$\\{([^}]+)\\}"));
        VariableReferenceScanner scanner = new VariableReferenceScanner(configService);
        JsonNode tree = objectMapper.readTree("{\"a\":[\"${X}/in\"],\"b\":[{\"c\":[\"${Y} and ${X}\"]}],"
                + "\"${NOT_A_VALUE}\":[\"plain\"]}");

        assertThat(scanner.findReferences(tree)).containsExactly("X", "Y");
    }

    @Test
    void findsSameNames_whenKeysAreInReverseOrder() throws Exception {
        when(configService.getVariableReferencePatterns()).thenReturn(List.of("\\$\\{([^}]+)\\}"));
        VariableReferenceScanner scanner = new VariableReferenceScanner(configService);
        JsonNode forward = objectMapper.readTree("{\"a\":[\"${X}\"],\"b\":[{\"c\":[\"${Y}\"]}],\"d\":[\"${Z}\"]}");
        JsonNode reversed = objectMapper.readTree("{\"d\":[\"${Z}\"],\"b\":[{\"c\":[\"${Y}\"]}],\"a\":[\"${X}\"]}");

        assertThat(scanner.findReferences(reversed))
                .containsExactlyInAnyOrderElementsOf(scanner.findReferences(forward))
                .containsExactlyInAnyOrder("X", "Y", "Z");
    }

    @Test
    void scanningTwiceGivesSameResult() throws Exception {
        when(configService.getVariableReferencePatterns()).thenReturn(List.of("\\$\\{([^}]+)\\}"));
        VariableReferenceScanner scanner = new VariableReferenceScanner(configService);
        JsonNode tree = objectMapper.readTree("{\"sql\":[\"select * from ${schema}.${table}\"]}");

        assertThat(scanner.findReferences(tree)).isEqualTo(scanner.findReferences(tree));
    }

    @Test
    void supportsAdditionalPatterns_andIgnoresUnusableOnes() {
        when(configService.getVariableReferencePatterns())
                .thenReturn(List.of("\\$\\{([^}]+)\\}", "%%([A-Za-z_.]+)%%", "no-group", "([unclosed"));
        VariableReferenceScanner scanner = new VariableReferenceScanner(configService);

        assertThat(scanner.extractAllVariableNames("${base.dir}/%%RUN_DATE%%.csv"))
                .containsExactly("base.dir", "RUN_DATE");
        assertThat(scanner.hasReferences("no variables here")).isFalse();
    }

    @Test
    void returnsNothingForEmptyInput() {
        VariableReferenceScanner scanner = new VariableReferenceScanner(configService);

        assertThat(scanner.findReferences(null)).isEmpty();
        assertThat(scanner.extractAllVariableNames("")).isEmpty();
    }
}
