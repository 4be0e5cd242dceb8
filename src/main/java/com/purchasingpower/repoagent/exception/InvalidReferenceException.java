package com.purchasingpower.repoagent.exception;

import lombok.Getter;

@Getter
public class InvalidReferenceException extends InputValidationException {

    private final String reference;

    public InvalidReferenceException(String reference, String reason) {
        super("Invalid repository URL '" + reference + "': " + reason);
        this.reference = reference;
    }
}
