package com.chih.JXcb.core.exception;

public class TemplateRecursionException extends XcbException {
    public TemplateRecursionException(String message) {
        super(message);
    }
}
