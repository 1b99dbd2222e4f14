package com.laborjustice.casechain.service.impl;

import com.google.common.base.Preconditions;
import com.laborjustice.casechain.configuration.MovementCodeProperties;
import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.model.outcome.Outcome;
import com.laborjustice.casechain.model.outcome.Verdict;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.MovementEvent;
import com.laborjustice.casechain.model.record.Tier;
import com.laborjustice.casechain.service.MovementInterpreter;
import com.laborjustice.casechain.util.TextFolding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Table-driven movement interpreter.
 *
 * <p>The code table is an allow-list: unrecognized codes are ignored, not
 * reported. Within a record, later events override earlier ones of the same
 * category, so a decision followed by its reform ends with the reform.
 *
 * <p><b>Thread Safety:</b> stateless after construction; batches are split
 * into partitions interpreted on the interpretation executor.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class MovementInterpreterImpl implements MovementInterpreter {

    private final Map<Integer, Verdict> verdictCodes;
    private final Set<Integer> reformCodes;
    private final List<String> priorDecisionMarkers;
    private final Executor executor;
    private final int parallelThreshold;
    private final int partitionSize;

    public MovementInterpreterImpl(ReconciliationProperties properties,
                                   @Qualifier("interpretationExecutor") Executor executor) {
        MovementCodeProperties movements = properties.getMovements();
        this.verdictCodes = Map.copyOf(movements.getVerdictCodes());
        this.reformCodes = Set.copyOf(movements.getReformCodes());
        this.priorDecisionMarkers = movements.getPriorDecisionMarkers().stream()
                .map(TextFolding::fold)
                .collect(Collectors.toList());
        this.executor = executor;
        this.parallelThreshold = properties.getEngine().getParallelThreshold();
        this.partitionSize = properties.getEngine().getPartitionSize();

        log.info("Initialized MovementInterpreter with {} verdict codes, reform codes {}",
                verdictCodes.size(), reformCodes);
    }

    @Override
    public Outcome interpretRecord(CaseRecord record) {
        Preconditions.checkNotNull(record, "Record cannot be null");

        List<MovementEvent> movements = record.getMovements();
        int lastFirstInstance = -1;
        int lastAppeal = -1;
        int lastReform = -1;

        for (int i = 0; i < movements.size(); i++) {
            Integer code = movements.get(i).getCode();
            if (code == null) {
                continue;
            }
            Verdict verdict = verdictCodes.get(code);
            if (verdict != null) {
                if (verdict.isFirstInstance()) {
                    lastFirstInstance = i;
                } else {
                    lastAppeal = i;
                }
            } else if (reformCodes.contains(code)) {
                lastReform = i;
            }
        }

        if (lastFirstInstance < 0 && lastAppeal < 0 && lastReform < 0) {
            return null;
        }

        Outcome.OutcomeBuilder outcome = Outcome.builder().tier(record.getTier());

        if (lastFirstInstance >= 0) {
            Integer code = movements.get(lastFirstInstance).getCode();
            outcome.firstInstanceVerdict(verdictCodes.get(code)).firstInstanceCode(code);
        }
        if (lastAppeal >= 0) {
            Integer code = movements.get(lastAppeal).getCode();
            outcome.appealVerdict(verdictCodes.get(code)).appealCode(code);
        }

        if (lastReform >= 0) {
            MovementEvent reform = movements.get(lastReform);
            int ownVerdictIndex = record.getTier() == Tier.FIRST_INSTANCE ? lastFirstInstance : lastAppeal;
            outcome.reformCode(reform.getCode())
                    .reformAttachments(reform.getAttachments())
                    .priorDecisionType(findPriorDecisionType(reform.getAttachments()))
                    .reformOnly(ownVerdictIndex < 0)
                    .reformAfterVerdict(ownVerdictIndex >= 0 && lastReform > ownVerdictIndex);
        }

        Outcome result = outcome.build();
        log.debug("Interpreted {} [{}]: firstInstance={}, appeal={}, reformOnly={}, reformAfterVerdict={}",
                record.getRawNumber(), record.getTier(),
                result.getFirstInstanceVerdict(), result.getAppealVerdict(), result.isReformOnly(),
                result.isReformAfterVerdict());
        return result;
    }

    @Override
    public Map<CaseRecord, Outcome> interpretAll(List<CaseRecord> records) {
        Preconditions.checkNotNull(records, "Records cannot be null");

        Map<CaseRecord, Outcome> outcomes = new IdentityHashMap<>();
        if (records.size() < parallelThreshold) {
            records.forEach(r -> putIfKnown(outcomes, r, interpretRecord(r)));
            return outcomes;
        }

        List<CompletableFuture<List<Outcome>>> futures = new ArrayList<>();
        for (int from = 0; from < records.size(); from += partitionSize) {
            List<CaseRecord> partition = records.subList(from, Math.min(from + partitionSize, records.size()));
            futures.add(CompletableFuture.supplyAsync(() -> interpretPartition(partition), executor));
        }
        log.debug("Interpreting {} records in {} partitions", records.size(), futures.size());

        // Merge on the calling thread, in partition order
        int offset = 0;
        for (CompletableFuture<List<Outcome>> future : futures) {
            List<Outcome> partitionOutcomes = future.join();
            for (int i = 0; i < partitionOutcomes.size(); i++) {
                putIfKnown(outcomes, records.get(offset + i), partitionOutcomes.get(i));
            }
            offset += partitionOutcomes.size();
        }
        return outcomes;
    }

    private List<Outcome> interpretPartition(List<CaseRecord> partition) {
        List<Outcome> outcomes = new ArrayList<>(partition.size());
        for (CaseRecord record : partition) {
            outcomes.add(interpretRecord(record));
        }
        return outcomes;
    }

    private static void putIfKnown(Map<CaseRecord, Outcome> outcomes, CaseRecord record, Outcome outcome) {
        if (outcome != null) {
            outcomes.put(record, outcome);
        }
    }

    private String findPriorDecisionType(Map<String, String> attachments) {
        if (attachments == null) {
            return null;
        }
        for (Map.Entry<String, String> attachment : attachments.entrySet()) {
            String key = TextFolding.fold(attachment.getKey());
            if (priorDecisionMarkers.stream().anyMatch(key::contains)) {
                return attachment.getValue();
            }
        }
        return null;
    }
}
