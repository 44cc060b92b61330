package com.etl.migration.kettlegraph.service;

import com.etl.migration.kettlegraph.model.AnalyzerConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerConfigurationServiceTest {

    private final AnalyzerConfigurationService configService = new AnalyzerConfigurationService();

    @Test
    void seedsDefaultTables() {
        assertThat(configService.getWorkflowFileExtensions()).containsExactly(".ktr", ".kjb", ".xml");
        assertThat(configService.getFilePropertyKeys()).contains("file.name");
        assertThat(configService.getJobCallTypes()).containsExactly("JobExecutor", "JOB", "JOB_EXECUTOR");
        assertThat(configService.getAllActiveConfigurations())
                .extracting(AnalyzerConfiguration::getConfigType)
                .isSorted()
                .contains(AnalyzerConfigurationService.VARIABLE_REFERENCE_PATTERNS);
    }

    @Test
    void updateReplacesValuesAndBumpsVersion() {
        AnalyzerConfiguration updated = configService.updateConfiguration(
                AnalyzerConfigurationService.SCRIPT_FILE_EXTENSIONS, List.of(".js", ".groovy"));

        assertThat(updated.getVersion()).isEqualTo(2L);
        assertThat(configService.getScriptFileExtensions()).containsExactly(".js", ".groovy");
    }

    @Test
    void updateRejectsUnknownType() {
        assertThatThrownBy(() -> configService.updateConfiguration("NOPE", List.of("x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NOPE");
    }

    @Test
    void deactivatedTableReadsAsEmpty_untilSavedAgain() {
        configService.deactivateConfiguration(AnalyzerConfigurationService.EXCEL_STEP_MARKERS);

        assertThat(configService.getExcelStepMarkers()).isEmpty();
        assertThat(configService.getConfigurationByType(AnalyzerConfigurationService.EXCEL_STEP_MARKERS)).isEmpty();

        configService.saveConfiguration(AnalyzerConfiguration.builder()
                .configType(AnalyzerConfigurationService.EXCEL_STEP_MARKERS)
                .values(List.of("excel", "spreadsheet"))
                .build());

        assertThat(configService.getExcelStepMarkers()).containsExactly("excel", "spreadsheet");
    }

    @Test
    void saveRequiresType() {
        assertThatThrownBy(() -> configService.saveConfiguration(AnalyzerConfiguration.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void returnedConfigurationsAreDetachedFromStore() {
        AnalyzerConfiguration listed = configService.getAllActiveConfigurations().get(0);
        String type = listed.getConfigType();
        listed.setActive(false);
        listed.setValues(List.of("tampered"));

        AnalyzerConfiguration byType = configService.getConfigurationByType(type).orElseThrow();
        assertThat(byType.isActive()).isTrue();
        assertThat(byType.getValues()).doesNotContain("tampered");
    }

    @Test
    void deactivationLeavesPreviouslyReturnedInstanceUntouched() {
        AnalyzerConfiguration before = configService
                .getConfigurationByType(AnalyzerConfigurationService.SCRIPT_STEP_MARKERS).orElseThrow();

        configService.deactivateConfiguration(AnalyzerConfigurationService.SCRIPT_STEP_MARKERS);
        configService.deactivateConfiguration(AnalyzerConfigurationService.SCRIPT_STEP_MARKERS);

        assertThat(before.isActive()).isTrue();
        assertThat(before.getVersion()).isEqualTo(1L);
        assertThat(configService.getScriptStepMarkers()).isEmpty();
        assertThat(configService.getAllActiveConfigurations())
                .extracting(AnalyzerConfiguration::getConfigType)
                .doesNotContain(AnalyzerConfigurationService.SCRIPT_STEP_MARKERS);
    }
}
