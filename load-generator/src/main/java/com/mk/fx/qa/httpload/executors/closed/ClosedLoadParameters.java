package com.mk.fx.qa.httpload.executors.closed;

/**
 * Parameters for a closed load execution.
 *
 * @param workers the number of concurrent workers
 * @param totalRequests the request budget shared by all workers
 */
public record ClosedLoadParameters(int workers, long totalRequests) {}
