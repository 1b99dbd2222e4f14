package com.laborjustice.casechain.support;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.MovementEvent;
import com.laborjustice.casechain.model.record.SubjectCode;
import com.laborjustice.casechain.model.record.Tier;
import com.laborjustice.casechain.service.impl.CaseGrouperImpl;
import com.laborjustice.casechain.service.impl.CaseNumberSimilarityScorer;
import com.laborjustice.casechain.service.impl.CnjIdentifierNormalizer;
import com.laborjustice.casechain.service.impl.MovementInterpreterImpl;
import com.laborjustice.casechain.service.impl.OutcomeResolverImpl;
import com.laborjustice.casechain.service.impl.ReconciliationServiceImpl;
import com.laborjustice.casechain.service.impl.SubjectAppellantHeuristic;

import java.time.LocalDateTime;
import java.util.Arrays;

/**
 * Record fixtures and a wired engine built without a Spring context.
 */
public final class TestRecords {

    public static final int CLAIM_GRANTED = 219;
    public static final int CLAIM_DENIED = 220;
    public static final int CLAIM_PARTIALLY_GRANTED = 221;
    public static final int APPEAL_NOT_ADMITTED = 236;
    public static final int APPEAL_GRANTED = 237;
    public static final int APPEAL_PARTIALLY_GRANTED = 238;
    public static final int APPEAL_DENIED = 242;
    public static final int DECISION_REFORMED = 190;

    /** Filing of no particular interest, never a recognized code. */
    public static final int HEARING = 970;

    private TestRecords() {
    }

    public static CaseRecord caseRecord(String number, Tier tier, int... codes) {
        return builder(number, tier, codes).build();
    }

    public static CaseRecord.CaseRecordBuilder builder(String number, Tier tier, int... codes) {
        CaseRecord.CaseRecordBuilder builder = CaseRecord.builder()
                .rawNumber(number)
                .tier(tier)
                .court(tier == Tier.SUPERIOR ? "TST" : "TRT2");
        Arrays.stream(codes).forEach(code -> builder.movement(event(code)));
        return builder;
    }

    public static CaseRecord withSubjects(CaseRecord record, String... subjectNames) {
        CaseRecord.CaseRecordBuilder builder = record.toBuilder();
        for (String name : subjectNames) {
            builder.subjectCode(SubjectCode.of(null, name));
        }
        return builder.build();
    }

    public static CaseRecord filed(CaseRecord record, LocalDateTime filedDate) {
        return record.toBuilder().filedDate(filedDate).build();
    }

    public static MovementEvent event(int code) {
        return MovementEvent.builder().code(code).name("Movement " + code).build();
    }

    /**
     * Engine wired by hand with default rules; interpretation runs on the calling thread.
     */
    public static final class Engine {

        public final ReconciliationProperties properties;
        public final CnjIdentifierNormalizer normalizer;
        public final CaseNumberSimilarityScorer scorer;
        public final CaseGrouperImpl grouper;
        public final MovementInterpreterImpl interpreter;
        public final SubjectAppellantHeuristic heuristic;
        public final OutcomeResolverImpl resolver;
        public final ReconciliationServiceImpl service;

        public Engine() {
            this(new ReconciliationProperties());
        }

        public Engine(ReconciliationProperties properties) {
            this.properties = properties;
            this.normalizer = new CnjIdentifierNormalizer(properties);
            this.scorer = new CaseNumberSimilarityScorer(normalizer, properties);
            this.grouper = new CaseGrouperImpl(normalizer, scorer, properties);
            this.interpreter = new MovementInterpreterImpl(properties, Runnable::run);
            this.heuristic = new SubjectAppellantHeuristic(properties);
            this.resolver = new OutcomeResolverImpl(interpreter, heuristic);
            this.service = new ReconciliationServiceImpl(grouper, interpreter, resolver, properties);
        }
    }
}
