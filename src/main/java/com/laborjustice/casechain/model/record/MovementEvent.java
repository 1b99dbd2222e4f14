package com.laborjustice.casechain.model.record;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One procedural event in a record's docket.
 *
 * <p>{@code attachments} holds the tabulated complements of the event
 * (description → value), e.g. the type of the decision being reformed.
 */
@Value
@Builder
public class MovementEvent {
    Integer code;
    String name;
    String timestamp;

    @Singular
    Map<String, String> attachments;
}
