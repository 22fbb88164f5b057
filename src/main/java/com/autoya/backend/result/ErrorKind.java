package com.autoya.backend.result;

/**
 * Closed set of failure categories a service can report.
 *
 * The transport layer decides how each kind maps to a status code
 * (see {@code com.autoya.backend.util.ErrorStatusMapper}).
 */
public enum ErrorKind {

    /** Requested entity, or an entity it references, does not exist. */
    NOT_FOUND,

    /** Write rejected by a database constraint (unique, foreign key, check). */
    CONFLICT,

    /** Input passed request validation but is not acceptable to the service. */
    VALIDATION,

    /** Any other persistence or transaction failure. */
    INTERNAL
}
