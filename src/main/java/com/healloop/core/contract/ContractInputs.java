package com.healloop.core.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The input section of an {@link ExecutionContract}.
 *
 * @param required     required field names, either plain strings or {@code {"name": ...}} objects
 * @param optional     optional field names, same shapes as {@code required}
 * @param finalPayload values the planner wants in the outgoing payload
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ContractInputs(
    List<Object> required,
    List<Object> optional,
    Map<String, Object> finalPayload
) {
    public ContractInputs {
        required = required == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(required));
        optional = optional == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(optional));
        finalPayload = finalPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(finalPayload));
    }
}
