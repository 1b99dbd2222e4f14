package com.laborjustice.casechain.model.record;

import lombok.Value;

/**
 * Subject classification attached to a lawsuit (numeric code plus label).
 */
@Value(staticConstructor = "of")
public class SubjectCode {
    Integer code;
    String name;
}
