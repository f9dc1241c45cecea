package com.chih.JXcb.core.exception;

/**
 * JXcb 框架根异常
 */
public class XcbException extends RuntimeException {
    public XcbException(String message) {
        super(message);
    }

    public XcbException(String message, Throwable cause) {
        super(message, cause);
    }
}
