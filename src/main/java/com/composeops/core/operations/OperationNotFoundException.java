package com.composeops.core.operations;

import com.composeops.core.model.ResourceNotFoundException;

public class OperationNotFoundException extends ResourceNotFoundException {

    public OperationNotFoundException(String operationId) {
        super("Operation not found: " + operationId, operationId);
    }
}
