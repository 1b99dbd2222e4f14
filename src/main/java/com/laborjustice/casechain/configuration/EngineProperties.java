package com.laborjustice.casechain.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Execution settings for the interpretation stage.
 */
@Data
public class EngineProperties {

    /** Worker threads for per-record movement interpretation. */
    @Min(1)
    private int interpretationThreads = 4;

    /** Batches smaller than this are interpreted on the calling thread. */
    @Min(1)
    private int parallelThreshold = 2000;

    /** Records handed to a worker at a time. */
    @Min(1)
    private int partitionSize = 500;
}
