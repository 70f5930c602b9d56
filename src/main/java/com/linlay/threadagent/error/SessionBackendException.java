package com.linlay.threadagent.error;

public class SessionBackendException extends AgentException {

    public SessionBackendException(AgentErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static SessionBackendException unavailable(String key, Throwable cause) {
        return new SessionBackendException(AgentErrorKind.CACHE_UNAVAILABLE, "Session backend unavailable for " + key, cause);
    }

    public static SessionBackendException writeFailed(String key, Throwable cause) {
        return new SessionBackendException(AgentErrorKind.PERSISTENCE_FAILED, "Cannot persist session " + key, cause);
    }
}
