package com.volumemonitor.exception;

/**
 * Missing or expired Kite credentials. Fatal to {@code start()}, and stops a running
 * engine when a quote batch reports it.
 */
public class AuthException extends BaseException {

    public AuthException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }

    public AuthException(String message, Throwable cause) {
        super(ErrorCode.UNAUTHORIZED, message, cause);
    }
}
