package com.autoya.backend.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import com.autoya.backend.result.ErrorKind;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps service error kinds to HTTP status codes.
 *
 * With autoya.api.errors.legacy-status=true (default) every service failure
 * is reported as 400, which is what existing clients expect. With false:
 * <pre>
 * NOT_FOUND  -> 404
 * CONFLICT   -> 409
 * VALIDATION -> 400
 * INTERNAL   -> 500
 * </pre>
 */
@Slf4j
@Component
public class ErrorStatusMapper {

    private final boolean legacyStatus;

    public ErrorStatusMapper(@Value("${autoya.api.errors.legacy-status:true}") boolean legacyStatus) {
        this.legacyStatus = legacyStatus;
        log.info("Service error status mapping: legacyStatus={}", legacyStatus);
    }

    public HttpStatus statusFor(ErrorKind kind) {
        if (legacyStatus) {
            return HttpStatus.BAD_REQUEST;
        }
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case INTERNAL:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
