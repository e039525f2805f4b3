package com.composeops.core.connection;

import com.composeops.core.model.ResourceNotFoundException;

public class ConnectionNotFoundException extends ResourceNotFoundException {

    public ConnectionNotFoundException(String connectionId) {
        super("Connection not found: " + connectionId, connectionId);
    }
}
