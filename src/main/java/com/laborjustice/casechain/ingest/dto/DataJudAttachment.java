package com.laborjustice.casechain.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Tabulated complement of a movement ({@code complementosTabelados}).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataJudAttachment {
    private Integer codigo;
    private String nome;
    private String descricao;
    private Object valor;
}
