package com.laborjustice.casechain.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataJudMovement {
    private Integer codigo;
    private String nome;
    private String dataHora;
    private List<DataJudAttachment> complementosTabelados = new ArrayList<>();
}
