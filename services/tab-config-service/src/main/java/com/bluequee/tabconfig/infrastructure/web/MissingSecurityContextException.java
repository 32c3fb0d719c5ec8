package com.bluequee.tabconfig.infrastructure.web;

/** The request carried no usable identity. Mapped to HTTP 401. */
public class MissingSecurityContextException extends RuntimeException {

    public MissingSecurityContextException(String message) {
        super(message);
    }

    public MissingSecurityContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
