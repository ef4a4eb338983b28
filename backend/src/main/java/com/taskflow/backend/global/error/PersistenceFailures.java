package com.taskflow.backend.global.error;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;

/**
 * Maps data-access failures raised inside a unit of work to engine errors.
 * The exception is thrown from within the transactional method, so the unit rolls back.
 */
public final class PersistenceFailures {

    public static final String CODE_CONFLICT = "TASK_CONFLICT";
    public static final String CODE_PERSISTENCE_FAILURE = "PERSISTENCE_FAILURE";

    private PersistenceFailures() {
    }

    public static ProblemException translate(DataAccessException ex) {
        if (ex instanceof OptimisticLockingFailureException) {
            return conflict("record was modified concurrently; reload and retry");
        }
        Throwable cause = ex.getMostSpecificCause();
        return new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, CODE_PERSISTENCE_FAILURE, cause.getMessage());
    }

    public static RetryableProblemException conflict(String detail) {
        return new RetryableProblemException(HttpStatus.CONFLICT, CODE_CONFLICT, detail);
    }
}
