package com.precheck.engine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A parsed custom checklist: optional name plus its raw rules.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawChecklist(
        @JsonProperty("name") String name,
        @JsonProperty("rules") List<RawRule> rules
) {
}
