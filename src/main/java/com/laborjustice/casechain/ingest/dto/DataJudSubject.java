package com.laborjustice.casechain.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataJudSubject {
    private Integer codigo;
    private String nome;
}
