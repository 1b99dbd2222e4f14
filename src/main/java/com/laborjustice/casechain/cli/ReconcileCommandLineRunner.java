package com.laborjustice.casechain.cli;

import com.laborjustice.casechain.ingest.CaseRecordLoader;
import com.laborjustice.casechain.model.reconciliation.ReconciliationResult;
import com.laborjustice.casechain.model.reconciliation.ReconciliationSummary;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.report.ReconciliationReportWriter;
import com.laborjustice.casechain.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Batch entry point: {@code --input=<file|dir> [--output=<file>]}.
 *
 * <p>Does nothing when {@code --input} is absent, so the application context
 * can start without a batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconcileCommandLineRunner implements ApplicationRunner {

    static final String INPUT_OPTION = "input";
    static final String OUTPUT_OPTION = "output";

    private final CaseRecordLoader loader;
    private final ReconciliationService reconciliationService;
    private final ReconciliationReportWriter reportWriter;

    @Override
    public void run(ApplicationArguments args) {
        String input = firstValue(args, INPUT_OPTION);
        if (input == null) {
            log.debug("No --{} given, skipping batch reconciliation", INPUT_OPTION);
            return;
        }

        List<CaseRecord> records = loader.load(Path.of(input));
        ReconciliationResult result = reconciliationService.reconcile(records);
        logSummary(result.getSummary());

        String output = firstValue(args, OUTPUT_OPTION);
        if (output != null) {
            reportWriter.write(result, Path.of(output));
        }
    }

    private static void logSummary(ReconciliationSummary summary) {
        log.info("📊 Records: {} total, {} chained, {} superseded, {} residual, {} malformed",
                summary.getTotalRecords(), summary.getChainedRecords(), summary.getSupersededRecords(),
                summary.getResidualRecords(), summary.getMalformedRecords());
        log.info("📊 Chains: {} by linkage {}, by length {}", summary.getChains(),
                summary.getChainsByLinkage(), summary.getChainsByLength());
        log.info("📊 Outcomes: by status {}, by confidence {}",
                summary.getChainsByStatus(), summary.getChainsByConfidence());
    }

    private static String firstValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
