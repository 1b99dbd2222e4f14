package com.laborjustice.casechain.service.impl;

import com.google.common.base.Preconditions;
import com.laborjustice.casechain.configuration.NormalizerProperties;
import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.model.chain.CaseChain;
import com.laborjustice.casechain.model.chain.CaseNumberKeys;
import com.laborjustice.casechain.model.chain.ChainLinkage;
import com.laborjustice.casechain.model.chain.KeyWindowing;
import com.laborjustice.casechain.model.reconciliation.GroupingResult;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.Tier;
import com.laborjustice.casechain.service.CaseGrouper;
import com.laborjustice.casechain.service.IdentifierNormalizer;
import com.laborjustice.casechain.service.SimilarityScorer;
import com.laborjustice.casechain.service.grouping.CandidatePool;
import com.laborjustice.casechain.service.grouping.MatchCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * Chain builder.
 *
 * <p>Passes, in order, over one shrinking {@link CandidatePool}:
 * <ol>
 *   <li>Exact pass - identical primary keys</li>
 *   <li>Alternate-key pass - identical alternate keys, one windowing at a time</li>
 *   <li>Fallback pass - first instance to appellate to superior by similarity</li>
 *   <li>Residual pass - appellate to superior by similarity</li>
 * </ol>
 * Whatever is left becomes a single-record residual chain. A key group forms
 * a chain only when it spans at least two distinct tiers. An alternate-key
 * group must also hold at most one record per tier; otherwise its records
 * are left for the similarity passes.
 *
 * <p><b>Thread Safety:</b> each call owns its pool; the service itself is stateless.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class CaseGrouperImpl implements CaseGrouper {

    private final IdentifierNormalizer normalizer;
    private final SimilarityScorer scorer;
    private final List<KeyWindowing> alternateWindowings;
    private final boolean alternateKeyPassEnabled;

    public CaseGrouperImpl(IdentifierNormalizer normalizer,
                           SimilarityScorer scorer,
                           ReconciliationProperties properties) {
        NormalizerProperties normalizerProperties = properties.getNormalizer();
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.alternateWindowings = List.copyOf(normalizerProperties.getAlternateWindowings());
        this.alternateKeyPassEnabled = normalizerProperties.isAlternateKeyPassEnabled();
    }

    @Override
    public GroupingResult buildChains(List<CaseRecord> records) {
        Preconditions.checkNotNull(records, "Records cannot be null");

        GroupingRun run = new GroupingRun(records);

        int exact = run.keyPass(i -> run.keys.get(i).getPrimaryKey(), ChainLinkage.EXACT_KEY);
        log.info("Exact pass: {} chains, {} records left", exact, run.pool.size());

        if (alternateKeyPassEnabled) {
            for (KeyWindowing windowing : alternateWindowings) {
                int linked = run.keyPass(
                        i -> run.keys.get(i).alternateKey(windowing).orElse(""),
                        ChainLinkage.ALTERNATE_KEY);
                log.info("Alternate-key pass [{}]: {} chains, {} records left", windowing, linked, run.pool.size());
            }
        }

        int fallback = run.fallbackPass();
        log.info("Fallback pass: {} chains, {} records left", fallback, run.pool.size());

        int residual = run.residualPass();
        log.info("Residual pass: {} chains, {} records left", residual, run.pool.size());

        if (run.ambiguousMatches > 0) {
            log.info("Resolved {} ambiguous similarity matches by tie-break", run.ambiguousMatches);
        }

        return run.finish();
    }

    /**
     * State of one {@link #buildChains} call.
     */
    private final class GroupingRun {

        private final CandidatePool pool;
        private final List<CaseNumberKeys> keys;
        private final GroupingResult.GroupingResultBuilder result = GroupingResult.builder();
        private int nextChainId = 1;
        private int ambiguousMatches;

        GroupingRun(List<CaseRecord> records) {
            this.pool = new CandidatePool(records);
            this.keys = records.stream()
                    .map(r -> normalizer.normalize(r.getRawNumber()))
                    .collect(Collectors.toList());
        }

        int keyPass(IntFunction<String> keyOf, ChainLinkage linkage) {
            Map<String, List<Integer>> groups = new LinkedHashMap<>();
            for (int index : pool.remaining()) {
                String key = keyOf.apply(index);
                if (key != null && !key.isEmpty()) {
                    groups.computeIfAbsent(key, k -> new ArrayList<>()).add(index);
                }
            }

            int created = 0;
            for (Map.Entry<String, List<Integer>> group : groups.entrySet()) {
                List<Integer> members = group.getValue();
                long distinctTiers = members.stream().map(i -> pool.record(i).getTier()).distinct().count();
                if (distinctTiers < 2) {
                    continue;
                }
                // Alternate keys drop segments, so a repeated tier there means different lawsuits
                if (linkage == ChainLinkage.ALTERNATE_KEY && distinctTiers < members.size()) {
                    log.debug("Skipping alternate key {}: {} records over {} tiers",
                            group.getKey(), members.size(), distinctTiers);
                    continue;
                }
                members.forEach(pool::claim);
                result.chain(keyChain(members, linkage, group.getKey()));
                created++;
            }
            return created;
        }

        int fallbackPass() {
            int created = 0;
            for (int firstIndex : pool.available(Tier.FIRST_INSTANCE)) {
                if (!pool.isAvailable(firstIndex)) {
                    continue;
                }
                CaseRecord first = pool.record(firstIndex);
                Optional<MatchCandidate> appellate = findBest(first, Tier.APPELLATE);
                if (appellate.isEmpty()) {
                    continue;
                }

                pool.claim(firstIndex);
                pool.claim(appellate.get().getIndex());

                CaseChain.CaseChainBuilder chain = newChain(ChainLinkage.SIMILARITY)
                        .record(first)
                        .record(appellate.get().getRecord());
                double linkScore = appellate.get().getScore();

                Optional<MatchCandidate> superior = findBest(appellate.get().getRecord(), Tier.SUPERIOR);
                if (superior.isPresent()) {
                    pool.claim(superior.get().getIndex());
                    chain.record(superior.get().getRecord());
                    linkScore = Math.min(linkScore, superior.get().getScore());
                }

                result.chain(chain.linkScore(linkScore).build());
                created++;
            }
            return created;
        }

        int residualPass() {
            int created = 0;
            for (int appellateIndex : pool.available(Tier.APPELLATE)) {
                if (!pool.isAvailable(appellateIndex)) {
                    continue;
                }
                CaseRecord appellate = pool.record(appellateIndex);
                Optional<MatchCandidate> superior = findBest(appellate, Tier.SUPERIOR);
                if (superior.isEmpty()) {
                    continue;
                }

                pool.claim(appellateIndex);
                pool.claim(superior.get().getIndex());
                result.chain(newChain(ChainLinkage.SIMILARITY)
                        .record(appellate)
                        .record(superior.get().getRecord())
                        .linkScore(superior.get().getScore())
                        .build());
                created++;
            }
            return created;
        }

        GroupingResult finish() {
            for (int index : pool.remaining()) {
                pool.claim(index);
                result.residual(newChain(ChainLinkage.UNLINKED).record(pool.record(index)).build());
            }
            return result.build();
        }

        private Optional<MatchCandidate> findBest(CaseRecord source, Tier targetTier) {
            List<MatchCandidate> candidates = new ArrayList<>();
            for (int index : pool.available(targetTier)) {
                CaseRecord target = pool.record(index);
                double score = scorer.score(source.getRawNumber(), target.getRawNumber());
                if (scorer.isCandidate(score)) {
                    candidates.add(new MatchCandidate(index, target, score));
                }
            }
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            candidates.sort(MatchCandidate.BEST_FIRST);
            MatchCandidate best = candidates.get(0);

            if (candidates.size() > 1 && candidates.get(1).getScore() == best.getScore()) {
                ambiguousMatches++;
                log.debug("Ambiguous match for {} [{}]: {} candidates in {} scored {}, picked {} (filed {})",
                        source.getRawNumber(), source.getTier(),
                        candidates.stream().filter(c -> c.getScore() == best.getScore()).count(),
                        targetTier, best.getScore(), best.getRecord().getRawNumber(), best.getFiledDate());
            }
            return Optional.of(best);
        }

        /**
         * Builds a key-linked chain, keeping the latest-filed record of each tier.
         */
        private CaseChain keyChain(List<Integer> members, ChainLinkage linkage, String key) {
            Map<Tier, Integer> authoritative = new EnumMap<>(Tier.class);
            for (int index : members) {
                Tier tier = pool.record(index).getTier();
                Integer current = authoritative.get(tier);
                if (current == null || filedLater(pool.record(index), pool.record(current))) {
                    authoritative.put(tier, index);
                }
            }

            CaseChain.CaseChainBuilder chain = newChain(linkage).linkKey(key);
            // EnumMap iterates in tier rank order
            authoritative.values().forEach(i -> chain.record(pool.record(i)));
            for (int index : members) {
                if (!authoritative.containsValue(index)) {
                    chain.supersededRecord(pool.record(index));
                }
            }
            return chain.build();
        }

        private CaseChain.CaseChainBuilder newChain(ChainLinkage linkage) {
            return CaseChain.builder()
                    .chainId(String.format("CH-%06d", nextChainId++))
                    .linkage(linkage);
        }
    }

    /**
     * Strictly later filing date; a missing date is never later.
     */
    private static boolean filedLater(CaseRecord candidate, CaseRecord current) {
        LocalDateTime candidateDate = candidate.getFiledDate();
        LocalDateTime currentDate = current.getFiledDate();
        if (candidateDate == null) {
            return false;
        }
        return currentDate == null || candidateDate.isAfter(currentDate);
    }
}
