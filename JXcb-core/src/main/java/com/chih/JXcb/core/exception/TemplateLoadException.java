package com.chih.JXcb.core.exception;

public class TemplateLoadException extends XcbException {
    public TemplateLoadException(String id, Throwable cause) {
        super("Failed to load template: " + id, cause);
    }
}
