package com.composeops.docker;

import com.composeops.core.model.ResourceNotFoundException;

/**
 * Thrown when a project directory is missing or holds no compose file.
 */
public class ComposeProjectNotFoundException extends ResourceNotFoundException {

    public ComposeProjectNotFoundException(String message, String projectPath) {
        super(message, projectPath);
    }
}
