/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

/**
 * The remote executor failed. Never cached, never retried by the caching layer.
 */
public class RemoteExecutionException extends QueryExecutionException {

    public enum Reason {
        ENDPOINT_UNREACHABLE,
        MALFORMED_QUERY,
        REMOTE_ERROR
    }

    private final Reason reason;
    private final String endpointId;

    public RemoteExecutionException(Reason reason, String endpointId, String message) {
        super(message);
        this.reason = reason;
        this.endpointId = endpointId;
    }

    public RemoteExecutionException(Reason reason, String endpointId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.endpointId = endpointId;
    }

    public Reason reason() {
        return reason;
    }

    public String endpointId() {
        return endpointId;
    }
}
