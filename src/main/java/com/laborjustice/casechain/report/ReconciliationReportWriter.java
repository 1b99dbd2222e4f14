package com.laborjustice.casechain.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import com.laborjustice.casechain.exception.ReconciliationException;
import com.laborjustice.casechain.model.reconciliation.ReconciliationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reconciliation results as pretty-printed JSON.
 */
@Slf4j
@Component
public class ReconciliationReportWriter {

    private final ObjectMapper objectMapper;

    public ReconciliationReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(ReconciliationResult result) {
        Preconditions.checkNotNull(result, "Result cannot be null");
        try {
            return objectMapper.writeValueAsString(result);
        } catch (IOException e) {
            throw new ReconciliationException("Failed to serialize reconciliation result", e);
        }
    }

    public void write(ReconciliationResult result, Path target) {
        Preconditions.checkNotNull(target, "Target cannot be null");
        String json = toJson(result);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json);
        } catch (IOException e) {
            throw new ReconciliationException("Failed to write report to " + target, e);
        }
        log.info("✅ Report written to {}", target);
    }
}
