package com.example.workflowdispatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How an edge binds its source output into the target's parameters.
 */
public enum ParamType {

    @JsonProperty("arg")
    ARG,

    @JsonProperty("kwarg")
    KWARG
}
