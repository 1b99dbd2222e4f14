package com.laborjustice.casechain.service.impl;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.model.chain.CaseChain;
import com.laborjustice.casechain.model.chain.ChainLinkage;
import com.laborjustice.casechain.model.reconciliation.GroupingResult;
import com.laborjustice.casechain.model.record.CaseRecord;
import com.laborjustice.casechain.model.record.Tier;
import com.laborjustice.casechain.support.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.laborjustice.casechain.support.TestRecords.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Case Grouper Tests")
class CaseGrouperImplTest {

    private final CaseGrouperImpl grouper = new TestRecords.Engine().grouper;

    @Test
    @DisplayName("Records sharing the root key form one exact-key chain")
    void testExactKeyChain() {
        // Given: digit-only numbers differing only in the originating unit
        CaseRecord first = caseRecord("00123456720208020001", Tier.FIRST_INSTANCE);
        CaseRecord appellate = caseRecord("00123456720208020099", Tier.APPELLATE);

        // When
        GroupingResult result = grouper.buildChains(List.of(first, appellate));

        // Then
        assertEquals(1, result.getChains().size());
        CaseChain chain = result.getChains().get(0);
        assertEquals(ChainLinkage.EXACT_KEY, chain.getLinkage());
        assertEquals("001234520208", chain.getLinkKey());
        assertSame(first, chain.getRecords().get(0));
        assertSame(appellate, chain.getRecords().get(1));
        assertTrue(result.getResiduals().isEmpty());
    }

    @Test
    @DisplayName("Chains are ordered by tier regardless of input order")
    void testTierOrder() {
        CaseRecord superior = caseRecord("0012345-67.2020.5.00.0000", Tier.SUPERIOR);
        CaseRecord appellate = caseRecord("0012345-67.2020.5.02.0000", Tier.APPELLATE);
        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);

        CaseChain chain = grouper.buildChains(List.of(superior, appellate, first)).getChains().get(0);

        assertEquals(List.of(Tier.FIRST_INSTANCE, Tier.APPELLATE, Tier.SUPERIOR), chain.tiers());
    }

    @Test
    @DisplayName("Same-tier group without a second tier is not a chain")
    void testSingleTierKeyGroup() {
        CaseRecord a = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord b = caseRecord("0012345-67.2020.5.02.0002", Tier.FIRST_INSTANCE);

        GroupingResult result = grouper.buildChains(List.of(a, b));

        assertTrue(result.getChains().isEmpty());
        assertEquals(2, result.getResiduals().size());
        result.getResiduals().forEach(r -> assertEquals(ChainLinkage.UNLINKED, r.getLinkage()));
    }

    @Test
    @DisplayName("Latest-filed record of a tier is authoritative, the others are superseded")
    void testSameTierAuthority() {
        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord olderAppeal = filed(caseRecord("0012345-67.2020.5.02.0000", Tier.APPELLATE, APPEAL_DENIED),
                LocalDateTime.of(2020, 5, 1, 0, 0));
        CaseRecord newerAppeal = filed(caseRecord("0012345-67.2020.5.02.0000", Tier.APPELLATE, APPEAL_GRANTED),
                LocalDateTime.of(2021, 3, 1, 0, 0));

        CaseChain chain = grouper.buildChains(List.of(first, newerAppeal, olderAppeal)).getChains().get(0);

        assertEquals(2, chain.size());
        assertSame(newerAppeal, chain.recordAt(Tier.APPELLATE).orElseThrow());
        assertEquals(1, chain.getSupersededRecords().size());
        assertSame(olderAppeal, chain.getSupersededRecords().get(0));
    }

    @Test
    @DisplayName("Numbers differing in the branch digit link through an alternate key")
    void testAlternateKeyChain() {
        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord appellate = caseRecord("0012345-67.2020.8.02.0000", Tier.APPELLATE);

        CaseChain chain = grouper.buildChains(List.of(first, appellate)).getChains().get(0);

        assertEquals(ChainLinkage.ALTERNATE_KEY, chain.getLinkage());
        assertEquals("20200012345", chain.getLinkKey());
    }

    @Test
    @DisplayName("Same year and region with different sequential numbers never chain")
    void testDifferentSequentialNumbersStayApart() {
        // Given: three lawsuits sharing check digits, year, branch and court
        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord otherFirst = caseRecord("0088888-67.2020.5.02.0005", Tier.FIRST_INSTANCE);
        CaseRecord appellate = caseRecord("0077777-67.2020.5.02.0000", Tier.APPELLATE);

        // When
        GroupingResult result = grouper.buildChains(List.of(first, otherFirst, appellate));

        // Then: each one is its own residual, none is hidden as superseded
        assertTrue(result.getChains().isEmpty());
        assertEquals(3, result.getResiduals().size());
        result.getResiduals().forEach(r -> {
            assertEquals(ChainLinkage.UNLINKED, r.getLinkage());
            assertTrue(r.getSupersededRecords().isEmpty());
        });
    }

    @Test
    @DisplayName("Alternate-key group with a repeated tier is left to the similarity pass")
    void testAlternateKeyGroupWithRepeatedTier() {
        // Given: same year and sequential, three different branch digits
        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord otherFirst = caseRecord("0012345-67.2020.9.02.0005", Tier.FIRST_INSTANCE);
        CaseRecord appellate = caseRecord("0012345-67.2020.8.02.0000", Tier.APPELLATE);

        // When
        GroupingResult result = grouper.buildChains(List.of(first, otherFirst, appellate));

        // Then
        assertEquals(1, result.getChains().size());
        CaseChain chain = result.getChains().get(0);
        assertEquals(ChainLinkage.SIMILARITY, chain.getLinkage());
        assertSame(first, chain.recordAt(Tier.FIRST_INSTANCE).orElseThrow());
        assertSame(appellate, chain.recordAt(Tier.APPELLATE).orElseThrow());
        assertTrue(chain.getSupersededRecords().isEmpty());

        assertEquals(1, result.getResiduals().size());
        assertSame(otherFirst, result.getResiduals().get(0).getRecords().get(0));
    }

    @Test
    @DisplayName("Without the alternate-key pass, similarity links the same records")
    void testSimilarityFallback() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getNormalizer().setAlternateKeyPassEnabled(false);
        CaseGrouperImpl similarityOnly = new TestRecords.Engine(properties).grouper;

        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord appellate = caseRecord("0012345-67.2020.8.02.0000", Tier.APPELLATE);

        CaseChain chain = similarityOnly.buildChains(List.of(first, appellate)).getChains().get(0);

        assertEquals(ChainLinkage.SIMILARITY, chain.getLinkage());
        assertEquals(8.0 / 9.0, chain.getLinkScore(), 1e-9);
        assertNull(chain.getLinkKey());
    }

    @Test
    @DisplayName("Similarity chain extends from appellate to superior with the weakest link as score")
    void testThreeTierSimilarityChain() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getNormalizer().setAlternateKeyPassEnabled(false);
        CaseGrouperImpl similarityOnly = new TestRecords.Engine(properties).grouper;

        // Given: branch digit differs below (8/9), superior number is truncated (substring match 1.0)
        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord appellate = caseRecord("0012345-67.2020.8.02.0000", Tier.APPELLATE);
        CaseRecord superior = caseRecord("0012345672020", Tier.SUPERIOR);

        // When
        GroupingResult result = similarityOnly.buildChains(List.of(superior, appellate, first));

        // Then
        assertEquals(1, result.getChains().size());
        CaseChain chain = result.getChains().get(0);
        assertEquals(ChainLinkage.SIMILARITY, chain.getLinkage());
        assertEquals(List.of(Tier.FIRST_INSTANCE, Tier.APPELLATE, Tier.SUPERIOR), chain.tiers());
        assertSame(superior, chain.recordAt(Tier.SUPERIOR).orElseThrow());
        assertEquals(8.0 / 9.0, chain.getLinkScore(), 1e-9);
        assertTrue(result.getResiduals().isEmpty());
    }

    @Test
    @DisplayName("Unstructured numbers link by longest common substring")
    void testUnstructuredSimilarity() {
        CaseRecord first = caseRecord("12345678", Tier.FIRST_INSTANCE);
        CaseRecord appellate = caseRecord("9-12345678", Tier.APPELLATE);
        CaseRecord unrelated = caseRecord("55501", Tier.APPELLATE);

        GroupingResult result = grouper.buildChains(List.of(first, unrelated, appellate));

        assertEquals(1, result.getChains().size());
        assertSame(appellate, result.getChains().get(0).recordAt(Tier.APPELLATE).orElseThrow());
        assertEquals(1, result.getResiduals().size());
        assertSame(unrelated, result.getResiduals().get(0).getRecords().get(0));
    }

    @Test
    @DisplayName("Equal similarity scores are broken by the most recent filing date")
    void testAmbiguousMatchTieBreak() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getNormalizer().setAlternateKeyPassEnabled(false);
        CaseGrouperImpl similarityOnly = new TestRecords.Engine(properties).grouper;

        CaseRecord first = caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE);
        CaseRecord older = filed(caseRecord("0012345-67.2020.8.02.0000", Tier.APPELLATE), LocalDateTime.of(2021, 1, 1, 0, 0));
        CaseRecord newer = filed(caseRecord("0012345-67.2020.7.15.0000", Tier.APPELLATE), LocalDateTime.of(2022, 1, 1, 0, 0));

        GroupingResult result = similarityOnly.buildChains(List.of(first, older, newer));

        assertSame(newer, result.getChains().get(0).recordAt(Tier.APPELLATE).orElseThrow());
        assertSame(older, result.getResiduals().get(0).getRecords().get(0));
    }

    @Test
    @DisplayName("Appellate and superior records link without a first-instance record")
    void testResidualAppellateToSuperiorChain() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getNormalizer().setAlternateKeyPassEnabled(false);
        CaseGrouperImpl similarityOnly = new TestRecords.Engine(properties).grouper;

        CaseRecord appellate = caseRecord("0099999-11.2019.5.02.0000", Tier.APPELLATE);
        CaseRecord superior = caseRecord("0099999-11.2019.6.00.0000", Tier.SUPERIOR);

        GroupingResult result = similarityOnly.buildChains(List.of(superior, appellate));

        assertEquals(1, result.getChains().size());
        assertEquals(List.of(Tier.APPELLATE, Tier.SUPERIOR), result.getChains().get(0).tiers());
        assertEquals(ChainLinkage.SIMILARITY, result.getChains().get(0).getLinkage());
    }

    @Test
    @DisplayName("Every record ends up in exactly one chain")
    void testDisjointAndComplete() {
        List<CaseRecord> records = mixedBatch();

        GroupingResult result = grouper.buildChains(records);

        Map<CaseRecord, Integer> seen = new IdentityHashMap<>();
        Stream.concat(result.getChains().stream(), result.getResiduals().stream())
                .flatMap(c -> Stream.concat(c.getRecords().stream(), c.getSupersededRecords().stream()))
                .forEach(r -> seen.merge(r, 1, Integer::sum));

        assertEquals(records.size(), seen.size());
        assertTrue(seen.values().stream().allMatch(count -> count == 1));
        result.getChains().forEach(c -> assertEquals(c.size(),
                c.tiers().stream().distinct().count(), "At most one authoritative record per tier"));
    }

    @Test
    @DisplayName("Same input yields the same chains")
    void testDeterministic() {
        List<CaseRecord> records = mixedBatch();

        assertEquals(describe(grouper.buildChains(records)), describe(grouper.buildChains(records)));
    }

    @Test
    @DisplayName("Empty input yields no chains")
    void testEmptyInput() {
        GroupingResult result = grouper.buildChains(Collections.emptyList());

        assertTrue(result.getChains().isEmpty());
        assertTrue(result.getResiduals().isEmpty());
    }

    private static List<CaseRecord> mixedBatch() {
        List<CaseRecord> records = new ArrayList<>();
        records.add(caseRecord("0012345-67.2020.5.02.0001", Tier.FIRST_INSTANCE, CLAIM_GRANTED));
        records.add(caseRecord("0012345-67.2020.5.02.0000", Tier.APPELLATE, APPEAL_GRANTED));
        records.add(caseRecord("0012345-67.2020.5.00.0000", Tier.SUPERIOR, APPEAL_DENIED));
        records.add(caseRecord("0012345-67.2020.5.02.0000", Tier.APPELLATE, APPEAL_DENIED));
        records.add(caseRecord("0054321-10.2018.5.15.0010", Tier.FIRST_INSTANCE, CLAIM_DENIED));
        records.add(caseRecord("0054321-10.2018.8.15.0000", Tier.APPELLATE, APPEAL_GRANTED));
        records.add(caseRecord("0077777-01.2021.5.01.0001", Tier.FIRST_INSTANCE));
        records.add(caseRecord("12345678", Tier.FIRST_INSTANCE));
        records.add(caseRecord("912345678", Tier.APPELLATE));
        records.add(caseRecord("0099999-11.2019.5.02.0000", Tier.APPELLATE));
        return records;
    }

    private static List<String> describe(GroupingResult result) {
        return Stream.concat(result.getChains().stream(), result.getResiduals().stream())
                .map(c -> c.getChainId() + " " + c.getLinkage() + " "
                        + c.getRecords().stream().map(CaseRecord::getRawNumber).collect(Collectors.joining(",")))
                .collect(Collectors.toList());
    }
}
