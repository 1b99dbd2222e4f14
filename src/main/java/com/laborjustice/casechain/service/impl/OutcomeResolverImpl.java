package com.laborjustice.casechain.service.impl;

import com.google.common.base.Preconditions;
import com.laborjustice.casechain.model.chain.CaseChain;
import com.laborjustice.casechain.model.outcome.Appellant;
import com.laborjustice.casechain.model.outcome.AppellantGuess;
import com.laborjustice.casechain.model.outcome.Confidence;
import com.laborjustice.casechain.model.outcome.Outcome;
import com.laborjustice.casechain.model.outcome.ResolutionStatus;
import com.laborjustice.casechain.model.outcome.ResolvedOutcome;
import com.laborjustice.casechain.model.outcome.StepResolution;
import com.laborjustice.casechain.model.outcome.TransitionEvidence;
import com.laborjustice.casechain.model.outcome.TransitionKind;
import com.laborjustice.casechain.model.outcome.Verdict;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.SubjectCode;
import com.laborjustice.casechain.model.record.Tier;
import com.laborjustice.casechain.service.AppellantHeuristic;
import com.laborjustice.casechain.service.MovementInterpreter;
import com.laborjustice.casechain.service.OutcomeResolver;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks a chain tier by tier and applies the appeal truth table.
 *
 * <p>The walk tracks the employee's position (holding a favorable decision or
 * not) going into each appeal. The party without the favorable decision is the
 * presumed appellant; an upheld appeal flips the position, a denied or
 * non-admitted one keeps it:
 * <pre>
 * lower           higher                       appellant  favorable
 * CLAIM_GRANTED   APPEAL_GRANTED               employer   no
 * CLAIM_GRANTED   APPEAL_DENIED/NOT_ADMITTED   employer   yes
 * CLAIM_DENIED    APPEAL_GRANTED               employee   yes
 * CLAIM_DENIED    APPEAL_DENIED/NOT_ADMITTED   employee   no
 * </pre>
 * Partial grants count as grants. An appellate verdict at the bottom of a
 * chain seeds the position the same way a first-instance verdict would.
 *
 * <p>Subject heuristics are used only for a transition whose lower position is
 * unknown. Reform-only records never feed the table.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeResolverImpl implements OutcomeResolver {

    private final MovementInterpreter interpreter;
    private final AppellantHeuristic heuristic;

    @Override
    public ResolvedOutcome resolve(CaseChain chain) {
        Preconditions.checkNotNull(chain, "Chain cannot be null");

        Map<CaseRecord, Outcome> outcomes = new IdentityHashMap<>();
        for (CaseRecord record : chain.getRecords()) {
            Outcome outcome = interpreter.interpretRecord(record);
            if (outcome != null) {
                outcomes.put(record, outcome);
            }
        }
        return resolve(chain, outcomes);
    }

    @Override
    public ResolvedOutcome resolve(CaseChain chain, Map<CaseRecord, Outcome> outcomesByRecord) {
        Preconditions.checkNotNull(chain, "Chain cannot be null");
        Preconditions.checkNotNull(outcomesByRecord, "Outcomes cannot be null");

        List<Observation> observations = observe(chain, outcomesByRecord);
        boolean reformObserved = chain.getRecords().stream()
                .map(outcomesByRecord::get)
                .anyMatch(o -> o != null && o.hasReform());

        ResolvedOutcome.ResolvedOutcomeBuilder resolved = ResolvedOutcome.builder().reformObserved(reformObserved);

        if (observations.isEmpty()) {
            return resolved.status(ResolutionStatus.UNKNOWN).confidence(Confidence.LOW)
                    .flowSummary("(empty) = unknown").build();
        }

        ResolvedOutcome outcome = observations.size() == 1
                ? resolveSingle(chain, observations.get(0), resolved)
                : resolveTransitions(chain, observations, resolved);

        log.debug("Resolved {}: {} [{}]", chain.getChainId(), outcome.getFlowSummary(), outcome.getConfidence());
        return outcome;
    }

    /**
     * One observation per authoritative record, in tier order. When the chain
     * has no first-instance record but its lowest record's docket carries the
     * first-instance verdict, that verdict becomes the first observation.
     */
    private List<Observation> observe(CaseChain chain, Map<CaseRecord, Outcome> outcomes) {
        List<Observation> observations = new ArrayList<>();
        if (chain.getRecords().isEmpty()) {
            return observations;
        }

        if (chain.recordAt(Tier.FIRST_INSTANCE).isEmpty()) {
            Outcome lowest = outcomes.get(chain.getRecords().get(0));
            if (lowest != null && lowest.getFirstInstanceVerdict() != null) {
                observations.add(new Observation(Tier.FIRST_INSTANCE, lowest.getFirstInstanceVerdict(), false));
            }
        }

        for (CaseRecord record : chain.getRecords()) {
            Outcome outcome = outcomes.get(record);
            if (outcome == null) {
                observations.add(new Observation(record.getTier(), null, false));
            } else if (outcome.isReformAuthoritative()) {
                observations.add(new Observation(record.getTier(), null, true));
            } else {
                observations.add(new Observation(record.getTier(), outcome.ownVerdict(), false));
            }
        }
        return observations;
    }

    private ResolvedOutcome resolveSingle(CaseChain chain, Observation only,
                                          ResolvedOutcome.ResolvedOutcomeBuilder resolved) {
        String flow = describe(only);

        if (only.isReformOnly()) {
            if (only.getTier() != Tier.FIRST_INSTANCE) {
                resolved.step(undetermined(null, only, Appellant.UNKNOWN, TransitionEvidence.REFORMED));
            }
            return resolved.status(ResolutionStatus.REFORMED_UNCONFIRMED).confidence(Confidence.LOW)
                    .flowSummary(flow + " = reformed, unconfirmed").build();
        }

        Verdict verdict = only.getVerdict();
        if (verdict == null) {
            return resolved.status(ResolutionStatus.UNKNOWN).confidence(Confidence.LOW)
                    .flowSummary(flow + " = unknown").build();
        }

        if (verdict.isFirstInstance()) {
            // Only one tier's final code is known
            return resolved.finalFavorableToEmployee(verdict.isPositive())
                    .status(ResolutionStatus.RESOLVED).confidence(Confidence.LOW)
                    .flowSummary(flow + " = " + result(verdict.isPositive())).build();
        }

        StepResolution step = heuristicStep(null, only, subjectsOf(chain));
        return resolved.step(step)
                .finalFavorableToEmployee(step.getFavorableToEmployee())
                .status(ResolutionStatus.RESOLVED)
                .confidence(step.getEvidence().getConfidence())
                .flowSummary(step.getAppellant() + "? -> " + flow + " = " + result(step.getFavorableToEmployee()))
                .build();
    }

    private ResolvedOutcome resolveTransitions(CaseChain chain, List<Observation> observations,
                                               ResolvedOutcome.ResolvedOutcomeBuilder resolved) {
        Observation bottom = observations.get(0);
        Boolean position = bottom.getVerdict() == null ? null : bottom.getVerdict().isPositive();
        Boolean initialPosition = position;
        Boolean lastEvaluated = null;
        Confidence confidence = Confidence.HIGH;
        StepResolution lastStep = null;

        for (int i = 1; i < observations.size(); i++) {
            Observation lower = observations.get(i - 1);
            Observation higher = observations.get(i);
            Appellant presumed = position == null ? Appellant.UNKNOWN
                    : position ? Appellant.EMPLOYER : Appellant.EMPLOYEE;

            StepResolution step;
            if (higher.isReformOnly()) {
                step = undetermined(lower, higher, presumed, TransitionEvidence.REFORMED);
            } else if (higher.getVerdict() == null) {
                step = undetermined(lower, higher, presumed, TransitionEvidence.UNRESOLVED);
            } else if (position != null) {
                boolean upheld = higher.getVerdict().isPositive();
                step = StepResolution.builder()
                        .lowerTier(lower.getTier())
                        .higherTier(higher.getTier())
                        .lowerVerdict(lower.getVerdict())
                        .higherVerdict(higher.getVerdict())
                        .appellant(presumed)
                        .favorableToEmployee(upheld != position)
                        .kind(TransitionKind.of(position, upheld))
                        .evidence(TransitionEvidence.DIRECT)
                        .build();
            } else {
                step = heuristicStep(lower, higher, subjectsOf(chain));
            }

            position = step.getFavorableToEmployee();
            if (step.getEvidence().isEvaluated()) {
                lastEvaluated = step.getFavorableToEmployee();
            }
            confidence = confidence.min(step.getEvidence().getConfidence());
            resolved.step(step);
            lastStep = step;
        }

        String flow = observations.stream().map(OutcomeResolverImpl::describe).collect(Collectors.joining(" -> "));

        if (lastStep != null && lastStep.getEvidence() == TransitionEvidence.REFORMED) {
            return resolved.status(ResolutionStatus.REFORMED_UNCONFIRMED).confidence(Confidence.LOW)
                    .flowSummary(flow + " = reformed, unconfirmed").build();
        }

        Boolean finalValue = lastEvaluated != null ? lastEvaluated : initialPosition;
        if (finalValue == null) {
            return resolved.status(ResolutionStatus.UNKNOWN).confidence(Confidence.LOW)
                    .flowSummary(flow + " = unknown").build();
        }
        return resolved.finalFavorableToEmployee(finalValue)
                .status(ResolutionStatus.RESOLVED)
                .confidence(lastEvaluated == null ? Confidence.LOW : confidence)
                .flowSummary(flow + " = " + result(finalValue))
                .build();
    }

    /**
     * Transition whose lower position is unknown: the appellant comes from the
     * subjects, and the employee's prior position is the opposite of theirs.
     */
    private StepResolution heuristicStep(Observation lower, Observation higher, Set<SubjectCode> subjects) {
        AppellantGuess guess = heuristic.guess(subjects);
        boolean favorableBefore = guess.getAppellant() == Appellant.EMPLOYER;
        boolean upheld = higher.getVerdict().isPositive();

        return StepResolution.builder()
                .lowerTier(lower == null ? null : lower.getTier())
                .higherTier(higher.getTier())
                .lowerVerdict(lower == null ? null : lower.getVerdict())
                .higherVerdict(higher.getVerdict())
                .appellant(guess.getAppellant())
                .favorableToEmployee(upheld != favorableBefore)
                .kind(TransitionKind.of(favorableBefore, upheld))
                .evidence(guess.isTie() ? TransitionEvidence.HEURISTIC_TIE : TransitionEvidence.HEURISTIC)
                .build();
    }

    private static StepResolution undetermined(Observation lower, Observation higher,
                                               Appellant appellant, TransitionEvidence evidence) {
        return StepResolution.builder()
                .lowerTier(lower == null ? null : lower.getTier())
                .higherTier(higher.getTier())
                .lowerVerdict(lower == null ? null : lower.getVerdict())
                .appellant(appellant)
                .kind(TransitionKind.NOT_DETERMINED)
                .evidence(evidence)
                .build();
    }

    private static Set<SubjectCode> subjectsOf(CaseChain chain) {
        Set<SubjectCode> subjects = new LinkedHashSet<>();
        chain.getRecords().forEach(r -> subjects.addAll(r.getSubjectCodes()));
        return subjects;
    }

    private static String describe(Observation observation) {
        String verdict = observation.isReformOnly() ? "REFORMED"
                : observation.getVerdict() == null ? "?" : observation.getVerdict().name();
        return observation.getTier() + ": " + verdict;
    }

    private static String result(boolean favorable) {
        return favorable ? "favorable" : "unfavorable";
    }

    @Value
    private static class Observation {
        Tier tier;
        Verdict verdict;
        boolean reformOnly;
    }
}
