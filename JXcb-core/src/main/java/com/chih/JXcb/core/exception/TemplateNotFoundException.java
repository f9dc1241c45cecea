package com.chih.JXcb.core.exception;

public class TemplateNotFoundException extends XcbException {
    public TemplateNotFoundException(String id) {
        super("Template not found for id: " + id);
    }
}
