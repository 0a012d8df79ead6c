package com.volumemonitor.exception;

/**
 * A Kite call failed for a reason other than an invalid session: network, timeout,
 * rate limit, or a malformed response. Inside the polling loop this is a batch failure.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
