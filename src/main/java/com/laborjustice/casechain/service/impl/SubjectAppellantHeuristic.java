package com.laborjustice.casechain.service.impl;

import com.laborjustice.casechain.configuration.AppellantHeuristicProperties;
import com.laborjustice.casechain.configuration.ReconciliationProperties;
import com.laborjustice.casechain.model.outcome.Appellant;
import com.laborjustice.casechain.model.outcome.AppellantGuess;
import com.laborjustice.casechain.model.record.SubjectCode;
import com.laborjustice.casechain.service.AppellantHeuristic;
import com.laborjustice.casechain.util.TextFolding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword scoring over subject codes.
 *
 * <p>Each subject contributes to at most one side: configured subject codes
 * first, then employee keywords, employer keywords and finally the weak
 * employee keywords. Wage-type claims point to an employee appeal; just-cause
 * and reinstatement disputes point to an employer appeal.
 */
@Slf4j
@Service
public class SubjectAppellantHeuristic implements AppellantHeuristic {

    private final List<String> employeeKeywords;
    private final List<String> employerKeywords;
    private final List<String> weakEmployeeKeywords;
    private final Set<Integer> employeeCodes;
    private final Set<Integer> employerCodes;
    private final int keywordWeight;
    private final int weakKeywordWeight;
    private final Appellant tieAppellant;

    public SubjectAppellantHeuristic(ReconciliationProperties properties) {
        AppellantHeuristicProperties heuristics = properties.getHeuristics();
        this.employeeKeywords = folded(heuristics.getEmployeeKeywords());
        this.employerKeywords = folded(heuristics.getEmployerKeywords());
        this.weakEmployeeKeywords = folded(heuristics.getWeakEmployeeKeywords());
        this.employeeCodes = Set.copyOf(heuristics.getEmployeeSubjectCodes());
        this.employerCodes = Set.copyOf(heuristics.getEmployerSubjectCodes());
        this.keywordWeight = heuristics.getKeywordWeight();
        this.weakKeywordWeight = heuristics.getWeakKeywordWeight();
        this.tieAppellant = heuristics.getTieAppellant();
    }

    @Override
    public AppellantGuess guess(Collection<SubjectCode> subjects) {
        int employeeScore = 0;
        int employerScore = 0;

        if (subjects != null) {
            for (SubjectCode subject : subjects) {
                if (subject == null) {
                    continue;
                }
                String name = TextFolding.fold(subject.getName());
                Integer code = subject.getCode();

                if (code != null && employeeCodes.contains(code)) {
                    employeeScore += keywordWeight;
                } else if (code != null && employerCodes.contains(code)) {
                    employerScore += keywordWeight;
                } else if (containsAny(name, employeeKeywords)) {
                    employeeScore += keywordWeight;
                } else if (containsAny(name, employerKeywords)) {
                    employerScore += keywordWeight;
                } else if (containsAny(name, weakEmployeeKeywords)) {
                    employeeScore += weakKeywordWeight;
                }
            }
        }

        Appellant appellant;
        if (employeeScore > employerScore) {
            appellant = Appellant.EMPLOYEE;
        } else if (employerScore > employeeScore) {
            appellant = Appellant.EMPLOYER;
        } else {
            appellant = tieAppellant;
        }

        log.debug("Appellant heuristic: employee={}, employer={} -> {}", employeeScore, employerScore, appellant);
        return new AppellantGuess(appellant, employeeScore, employerScore);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return !text.isEmpty() && keywords.stream().anyMatch(text::contains);
    }

    private static List<String> folded(List<String> keywords) {
        return keywords.stream().map(TextFolding::fold).filter(k -> !k.isBlank()).collect(Collectors.toList());
    }
}
