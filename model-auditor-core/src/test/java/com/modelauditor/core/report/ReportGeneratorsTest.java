package com.modelauditor.core.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ReportGeneratorsTest {

    @Test
    void discover_returnsBuiltInGeneratorsSortedById() {
        assertThat(ReportGenerators.discover())
            .extracting(ReportGenerator::getId)
            .containsExactly("csv", "json", "markdown", "xlsx");
    }

    @Test
    void find_ignoresCaseAndWhitespace() {
        assertThat(ReportGenerators.find(" JSON ")).get()
            .extracting(ReportGenerator::getFileExtension)
            .isEqualTo("json");
    }

    @Test
    void find_unknownId_returnsEmpty() {
        assertThat(ReportGenerators.find("pdf")).isEmpty();
    }
}
