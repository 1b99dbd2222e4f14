package com.laborjustice.casechain.service.impl;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.exception.ReconciliationException;
import com.laborjustice.casechain.model.chain.CaseChain;
import com.laborjustice.casechain.model.chain.ChainLinkage;
import com.laborjustice.casechain.model.outcome.Confidence;
import com.laborjustice.casechain.model.outcome.Outcome;
import com.laborjustice.casechain.model.outcome.ResolutionStatus;
import com.laborjustice.casechain.model.reconciliation.ChainResolution;
import com.laborjustice.casechain.model.reconciliation.GroupingResult;
import com.laborjustice.casechain.model.reconciliation.MalformedRecord;
import com.laborjustice.casechain.model.reconciliation.ReconciliationResult;
import com.laborjustice.casechain.model.reconciliation.ReconciliationSummary;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.service.CaseGrouper;
import com.laborjustice.casechain.service.MovementInterpreter;
import com.laborjustice.casechain.service.OutcomeResolver;
import com.laborjustice.casechain.service.ReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pipeline orchestration: validate, group, interpret, resolve, summarize.
 *
 * <p><b>Thread Safety:</b> stateless; concurrent calls share only the
 * immutable configuration and the interpretation executor.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ReconciliationServiceImpl implements ReconciliationService {

    private final CaseGrouper grouper;
    private final MovementInterpreter interpreter;
    private final OutcomeResolver resolver;
    private final ReconciliationProperties properties;

    public ReconciliationServiceImpl(CaseGrouper grouper,
                                     MovementInterpreter interpreter,
                                     OutcomeResolver resolver,
                                     ReconciliationProperties properties) {
        this.grouper = grouper;
        this.interpreter = interpreter;
        this.resolver = resolver;
        this.properties = properties;

        log.info("✅ Reconciliation rules {} loaded", properties.getRulesVersion());
    }

    @Override
    public ReconciliationResult reconcile(List<CaseRecord> records) {
        if (records == null) {
            throw new ReconciliationException("Record batch cannot be null");
        }

        long start = System.currentTimeMillis();
        log.info("Reconciling {} records (rules {})", records.size(), properties.getRulesVersion());

        List<MalformedRecord> malformed = new ArrayList<>();
        List<CaseRecord> valid = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            CaseRecord record = records.get(i);
            String reason = malformedReason(record);
            if (reason != null) {
                malformed.add(MalformedRecord.of(i, record == null ? null : record.getRawNumber(), reason));
                log.warn("❌ Skipping record #{}: {}", i, reason);
            } else {
                valid.add(record);
            }
        }

        GroupingResult grouping = grouper.buildChains(valid);

        List<CaseRecord> toInterpret = new ArrayList<>();
        grouping.getChains().forEach(c -> toInterpret.addAll(c.getRecords()));
        grouping.getResiduals().forEach(c -> toInterpret.addAll(c.getRecords()));
        Map<CaseRecord, Outcome> outcomes = interpreter.interpretAll(toInterpret);

        ReconciliationResult.ReconciliationResultBuilder result = ReconciliationResult.builder()
                .rulesVersion(properties.getRulesVersion())
                .malformedRecords(malformed);

        List<ChainResolution> resolvedChains = new ArrayList<>();
        for (CaseChain chain : grouping.getChains()) {
            resolvedChains.add(ChainResolution.of(chain, resolver.resolve(chain, outcomes)));
        }
        List<ChainResolution> resolvedResiduals = new ArrayList<>();
        for (CaseChain residual : grouping.getResiduals()) {
            resolvedResiduals.add(ChainResolution.of(residual, resolver.resolve(residual, outcomes)));
        }

        ReconciliationSummary summary = summarize(records.size(), malformed.size(), resolvedChains, resolvedResiduals);

        log.info("✅ Reconciled {} records into {} chains ({} residual, {} malformed) in {}ms",
                records.size(), summary.getChains(), summary.getResidualRecords(),
                summary.getMalformedRecords(), System.currentTimeMillis() - start);

        return result.chains(resolvedChains)
                .residuals(resolvedResiduals)
                .summary(summary)
                .build();
    }

    private static String malformedReason(CaseRecord record) {
        if (record == null) {
            return "record is null";
        }
        if (record.getRawNumber() == null || record.getRawNumber().isBlank()) {
            return "missing case number";
        }
        if (record.getTier() == null) {
            return "missing tier";
        }
        return null;
    }

    private static ReconciliationSummary summarize(int total, int malformed,
                                                   List<ChainResolution> chains,
                                                   List<ChainResolution> residuals) {
        Map<ChainLinkage, Integer> byLinkage = new EnumMap<>(ChainLinkage.class);
        Map<Integer, Integer> byLength = new TreeMap<>();
        Map<ResolutionStatus, Integer> byStatus = new EnumMap<>(ResolutionStatus.class);
        Map<Confidence, Integer> byConfidence = new EnumMap<>(Confidence.class);

        int chained = 0;
        int superseded = 0;
        for (ChainResolution resolution : chains) {
            CaseChain chain = resolution.getChain();
            chained += chain.size();
            superseded += chain.getSupersededRecords().size();
            byLinkage.merge(chain.getLinkage(), 1, Integer::sum);
            byLength.merge(chain.size(), 1, Integer::sum);
            byStatus.merge(resolution.getOutcome().getStatus(), 1, Integer::sum);
            byConfidence.merge(resolution.getOutcome().getConfidence(), 1, Integer::sum);
        }

        int residualRecords = 0;
        for (ChainResolution resolution : residuals) {
            residualRecords += resolution.getChain().size();
            superseded += resolution.getChain().getSupersededRecords().size();
        }

        return ReconciliationSummary.builder()
                .totalRecords(total)
                .malformedRecords(malformed)
                .chainedRecords(chained)
                .supersededRecords(superseded)
                .residualRecords(residualRecords)
                .chains(chains.size())
                .chainsByLinkage(byLinkage)
                .chainsByLength(byLength)
                .chainsByStatus(byStatus)
                .chainsByConfidence(byConfidence)
                .build();
    }
}
