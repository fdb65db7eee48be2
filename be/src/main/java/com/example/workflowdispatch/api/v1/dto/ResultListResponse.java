package com.example.workflowdispatch.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/results.
 */
public record ResultListResponse(List<ResultSummary> results) {}
