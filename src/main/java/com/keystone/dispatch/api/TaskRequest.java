package com.keystone.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param goal               natural-language goal
 * @param provenance         supporting sources; at least two distinct ones unless single source is allowed
 * @param allowSingleSource  accept one source; requires {@code overrideReason}
 * @param overrideReason     why a single source is acceptable
 * @param projectedSteps     submitter's own step estimate; nullable
 * @param projectedToolCalls submitter's own tool-call estimate; nullable
 * @param submittedBy        submitter identity; nullable
 */
public record TaskRequest(
    String goal,
    List<ProvenanceInput> provenance,
    @JsonProperty("allow_single_source") Boolean allowSingleSource,
    @JsonProperty("override_reason") String overrideReason,
    @JsonProperty("projected_steps") Integer projectedSteps,
    @JsonProperty("projected_tool_calls") Integer projectedToolCalls,
    @JsonProperty("submitted_by") String submittedBy
) {}
