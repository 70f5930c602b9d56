package com.linlay.threadagent.error;

public class PreprocessingException extends AgentException {

    public PreprocessingException(String message, Throwable cause) {
        super(AgentErrorKind.PREPROCESSING_FAILED, message, cause);
    }
}
