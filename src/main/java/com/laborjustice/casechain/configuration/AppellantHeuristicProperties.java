package com.laborjustice.casechain.configuration;

import com.laborjustice.casechain.model.outcome.Appellant;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Subject keywords used to guess the appellant when a chain has no direct
 * evidence for a transition.
 *
 * <p>These lists encode approximate legal assumptions. Results produced with
 * them are never reported above MEDIUM confidence.
 */
@Data
public class AppellantHeuristicProperties {

    /** Claims typically pursued on appeal by the employee (wages, overtime, indemnities). */
    private List<String> employeeKeywords = new ArrayList<>(List.of(
            "salario", "remuneracao", "verbas rescisorias", "horas extras", "adicional",
            "indenizacao por dano", "equiparacao", "diferencas salariais", "gratificacao",
            "comissoes", "premios", "participacao nos lucros"));

    /** Subjects typically appealed by the employer (just cause, reinstatement). */
    private List<String> employerKeywords = new ArrayList<>(List.of(
            "justa causa", "contribuicao sindical", "multa administrativa",
            "reintegracao", "estabilidade", "readmissao"));

    /** Context-dependent subjects that lean weakly toward the employee. */
    private List<String> weakEmployeeKeywords = new ArrayList<>(List.of("assedio", "dano moral"));

    private List<Integer> employeeSubjectCodes = new ArrayList<>();

    private List<Integer> employerSubjectCodes = new ArrayList<>();

    @Min(0)
    private int keywordWeight = 2;

    @Min(0)
    private int weakKeywordWeight = 1;

    @NotNull
    private Appellant tieAppellant = Appellant.EMPLOYEE;
}
