package com.delta.jobharvester.harvest.classify;

public class ReconciliationViolationException extends IllegalStateException {
    public ReconciliationViolationException(String message) {
        super(message);
    }
}
