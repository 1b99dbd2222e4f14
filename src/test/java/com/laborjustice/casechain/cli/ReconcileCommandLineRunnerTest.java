package com.laborjustice.casechain.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.laborjustice.casechain.ingest.DataJudJsonRecordLoader;
import com.laborjustice.casechain.report.ReconciliationReportWriter;
import com.laborjustice.casechain.support.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reconcile Command Line Runner Tests")
class ReconcileCommandLineRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private final ReconcileCommandLineRunner runner = new ReconcileCommandLineRunner(
            new DataJudJsonRecordLoader(objectMapper),
            new TestRecords.Engine().service,
            new ReconciliationReportWriter(objectMapper));

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Loads, reconciles and writes the report")
    void testRunWithInputAndOutput() throws IOException {
        Path input = Files.writeString(tempDir.resolve("batch.json"), "["
                + "{\"numeroProcesso\": \"0012345-67.2020.5.02.0001\", \"grau\": \"G1\", \"movimentos\": [{\"codigo\": 220}]},"
                + "{\"numeroProcesso\": \"0012345-67.2020.5.02.0000\", \"grau\": \"G2\", \"movimentos\": [{\"codigo\": 237}]}"
                + "]");
        Path output = tempDir.resolve("report.json");

        runner.run(new DefaultApplicationArguments("--input=" + input, "--output=" + output));

        assertTrue(Files.exists(output));
        String report = Files.readString(output);
        assertTrue(report.contains("\"finalFavorableToEmployee\" : true"));
    }

    @Test
    @DisplayName("Does nothing without --input")
    void testRunWithoutInput() {
        Path output = tempDir.resolve("report.json");

        assertDoesNotThrow(() -> runner.run(new DefaultApplicationArguments("--output=" + output)));
        assertFalse(Files.exists(output));
    }
}
