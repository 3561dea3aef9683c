package com.intention.exception;

/**
 * Raised when an action cannot be rendered by its template.
 */
public class TemplateException extends IntentionException {

    public TemplateException(String message) {
        super(ErrorKind.TEMPLATE_ERROR, message);
    }

    public TemplateException(String message, Throwable cause) {
        super(ErrorKind.TEMPLATE_ERROR, message, cause);
    }
}
