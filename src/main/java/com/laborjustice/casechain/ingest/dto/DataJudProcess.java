package com.laborjustice.casechain.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One process document of a court-registry export.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataJudProcess {
    private String id;
    private String numeroProcesso;
    private String grau;
    private String tribunal;
    private String dataAjuizamento;
    private List<DataJudSubject> assuntos = new ArrayList<>();
    private List<DataJudMovement> movimentos = new ArrayList<>();
}
