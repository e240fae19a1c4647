package com.kspec.exception;

/**
 * Raised while validating an inbound socket command. The message is the exact text sent back in the
 * failed acknowledgement, so it must stay human-readable.
 */
public class CommandValidationException extends BaseException {

    public CommandValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
