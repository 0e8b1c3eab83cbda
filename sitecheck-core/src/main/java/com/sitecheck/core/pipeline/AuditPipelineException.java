package com.sitecheck.core.pipeline;

public class AuditPipelineException extends RuntimeException {

    public AuditPipelineException(String message) {
        super(message);
    }

    public AuditPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
