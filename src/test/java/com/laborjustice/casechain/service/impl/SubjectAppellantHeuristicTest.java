package com.laborjustice.casechain.service.impl;

import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.model.outcome.Appellant;
import com.laborjustice.casechain.model.outcome.AppellantGuess;
import com.laborjustice.casechain.model.record.SubjectCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Subject Appellant Heuristic Tests")
class SubjectAppellantHeuristicTest {

    private final SubjectAppellantHeuristic heuristic = new SubjectAppellantHeuristic(new ReconciliationProperties());

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Horas Extras, EMPLOYEE",
            "Verbas Rescisórias, EMPLOYEE",
            "DIFERENÇAS SALARIAIS, EMPLOYEE",
            "Justa Causa, EMPLOYER",
            "Reintegração / Readmissão, EMPLOYER",
            "Assédio Moral, EMPLOYEE"
    })
    @DisplayName("Single subject points to the expected appellant")
    void testSingleSubject(String subject, Appellant expected) {
        AppellantGuess guess = heuristic.guess(List.of(SubjectCode.of(null, subject)));

        assertEquals(expected, guess.getAppellant());
        assertFalse(guess.isTie());
    }

    @Test
    @DisplayName("Weak keywords weigh less than strong ones")
    void testWeakKeyword() {
        AppellantGuess guess = heuristic.guess(List.of(
                SubjectCode.of(1, "Assédio Moral"),
                SubjectCode.of(2, "Justa Causa")));

        assertEquals(1, guess.getEmployeeScore());
        assertEquals(2, guess.getEmployerScore());
        assertEquals(Appellant.EMPLOYER, guess.getAppellant());
    }

    @Test
    @DisplayName("Ties and empty subjects default to the employee")
    void testTie() {
        AppellantGuess empty = heuristic.guess(List.of());
        AppellantGuess balanced = heuristic.guess(List.of(
                SubjectCode.of(1, "Horas Extras"),
                SubjectCode.of(2, "Justa Causa")));

        assertTrue(empty.isTie());
        assertEquals(Appellant.EMPLOYEE, empty.getAppellant());
        assertTrue(balanced.isTie());
        assertEquals(Appellant.EMPLOYEE, balanced.getAppellant());
        assertEquals(Appellant.EMPLOYEE, heuristic.guess(null).getAppellant());
    }

    @Test
    @DisplayName("Configured subject codes take precedence over names")
    void testSubjectCodes() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getHeuristics().setEmployerSubjectCodes(List.of(2546));
        SubjectAppellantHeuristic byCode = new SubjectAppellantHeuristic(properties);

        AppellantGuess guess = byCode.guess(List.of(SubjectCode.of(2546, "Horas Extras")));

        assertEquals(Appellant.EMPLOYER, guess.getAppellant());
    }
}
