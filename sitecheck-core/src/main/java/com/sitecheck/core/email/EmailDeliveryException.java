package com.sitecheck.core.email;

/**
 * The report email could not be handed to the provider. Never a verdict on the audited
 * site, so always retryable from the queue's point of view.
 */
public class EmailDeliveryException extends RuntimeException {

    public EmailDeliveryException(String message) {
        super(message);
    }

    public EmailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
