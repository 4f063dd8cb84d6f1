package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Narrows the work units a hook applies to. Every present criterion must match;
 * list criteria match when any member matches.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record HookCondition(
    List<String> tags,
    List<String> prefix,
    String epic,
    Integer estimateMin,
    Integer estimateMax
) {
    public HookCondition {
        tags = tags == null ? List.of() : List.copyOf(tags);
        prefix = prefix == null ? List.of() : List.copyOf(prefix);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tags.isEmpty() && prefix.isEmpty() && epic == null
                && estimateMin == null && estimateMax == null;
    }
}
