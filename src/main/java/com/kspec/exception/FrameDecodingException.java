package com.kspec.exception;

/**
 * A socket frame that is not a JSON object, or not one of the known frame shapes.
 */
public class FrameDecodingException extends BaseException {

    public FrameDecodingException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public FrameDecodingException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
