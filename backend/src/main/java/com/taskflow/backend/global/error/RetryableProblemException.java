package com.taskflow.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A {@link ProblemException} the caller may retry after re-reading fresh state,
 * such as a lost optimistic-lock race on a task row.
 */
public class RetryableProblemException extends ProblemException {

    public RetryableProblemException(HttpStatus status, String code, String detail) {
        super(status, code, detail);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
