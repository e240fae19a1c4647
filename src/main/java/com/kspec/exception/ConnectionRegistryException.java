package com.kspec.exception;

import java.util.Map;

/**
 * Thrown when a connection cannot be registered: the session id is already taken, or the registry has
 * been shut down and no longer accepts connections.
 */
public class ConnectionRegistryException extends BaseException {

    private ConnectionRegistryException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static ConnectionRegistryException duplicateSession(String sessionId) {
        return new ConnectionRegistryException(
                ErrorCode.CONFLICT, "Session already registered: " + sessionId, Map.of("sessionId", sessionId));
    }

    public static ConnectionRegistryException registryClosed(String sessionId) {
        return new ConnectionRegistryException(
                ErrorCode.SERVICE_UNAVAILABLE,
                "Registry is shutting down, rejecting session " + sessionId,
                Map.of("sessionId", sessionId));
    }
}
