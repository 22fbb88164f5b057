package com.autoya.backend.result;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Converts persistence exceptions caught at a service boundary into a
 * {@link ServiceError}.
 *
 * Message format: {@code An error occurred while <action> the <entity>: <cause>}.
 */
public final class PersistenceFailures {

    private PersistenceFailures() {
    }

    /**
     * @param action verb in progressive form ("saving", "updating", "deleting")
     * @param entity entity label as shown to clients ("Vehiculo")
     * @param ex exception raised by a repository or the unit of work
     * @return CONFLICT for constraint violations, INTERNAL otherwise
     */
    public static ServiceError classify(String action, String entity, RuntimeException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String message = "An error occurred while " + action + " the " + entity.toLowerCase() + ": " + detail;

        ErrorKind kind = ex instanceof DataIntegrityViolationException
                ? ErrorKind.CONFLICT
                : ErrorKind.INTERNAL;

        return ServiceError.of(kind, message, entity);
    }
}
