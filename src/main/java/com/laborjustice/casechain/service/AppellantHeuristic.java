package com.laborjustice.casechain.service;

import com.laborjustice.casechain.model.outcome.AppellantGuess;
import com.laborjustice.casechain.model.record.SubjectCode;

import java.util.Collection;

/**
 * Guesses who filed an appeal from the subjects of the case.
 */
public interface AppellantHeuristic {

    AppellantGuess guess(Collection<SubjectCode> subjects);
}
