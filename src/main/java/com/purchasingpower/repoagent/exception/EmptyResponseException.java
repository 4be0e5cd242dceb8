package com.purchasingpower.repoagent.exception;

public class EmptyResponseException extends MalformedResponseException {

    public EmptyResponseException() {
        super("Empty response received from API");
    }
}
