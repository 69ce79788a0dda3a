/*
 * Copyright The WildFly Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.a2a.protocol.model;

/**
 * All the error codes for A2A errors. The values are part of the wire contract and must not change.
 */
public interface A2AErrorCodes {
    final int JSON_PARSE_ERROR_CODE = -32700;
    final int INVALID_REQUEST_ERROR_CODE = -32600;
    final int METHOD_NOT_FOUND_ERROR_CODE = -32601;
    final int INVALID_PARAMS_ERROR_CODE = -32602;
    final int INTERNAL_ERROR_CODE = -32603;
    final int TASK_NOT_FOUND_ERROR_CODE = -32001;
    final int TASK_NOT_CANCELABLE_ERROR_CODE = -32002;
    final int PUSH_NOTIFICATION_NOT_SUPPORTED_ERROR_CODE = -32003;
    final int UNSUPPORTED_OPERATION_ERROR_CODE = -32004;
}
