package com.kspec.exception;

import lombok.Getter;

/** No live socket connection carries the requested session id. */
@Getter
public class SessionNotFoundException extends BaseException {

    static final String SUGGESTION = "GET /api/ws/connections lists the live session ids";

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.NOT_FOUND, "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSuggestion() {
        return SUGGESTION;
    }
}
