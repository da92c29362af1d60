package com.delta.jobharvester.harvest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class TaskSubmissionException extends RuntimeException {
    private final long taskId;

    public TaskSubmissionException(long taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public long getTaskId() {
        return taskId;
    }
}
