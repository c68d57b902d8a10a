/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

/**
 * Performs the actual (expensive) query against a backing service.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li><b>Blocking:</b> May block on network I/O. The caching layer never holds a lock while calling it.</li>
 * <li><b>Idempotent:</b> Only read queries belong here; repeated calls must be safe.</li>
 * <li><b>Stateless:</b> Shared across all threads of one executor without extra locking.</li>
 * <li><b>Failure:</b> Throw {@link RemoteExecutionException}. Retries, if any, happen inside the implementation.</li>
 * </ul>
 *
 * @param <R> raw result type
 */
@FunctionalInterface
public interface RemoteExecutor<R> {

    /**
     * @param queryText the query to run
     * @param endpointId identifies the backing endpoint (URL, service name, etc.)
     * @return the raw, unformatted result
     * @throws RemoteExecutionException if the endpoint is unreachable, rejects the request or reports a query error
     */
    R execute(String queryText, String endpointId) throws RemoteExecutionException;
}
