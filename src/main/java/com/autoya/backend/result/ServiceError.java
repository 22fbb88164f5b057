package com.autoya.backend.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Failure reported by a service: its kind, a human-readable message and
 * structured context (entity name, id, ...).
 *
 * @param kind failure category
 * @param message message safe to show to API clients
 * @param context additional key/value details, never null
 */
public record ServiceError(ErrorKind kind, String message, Map<String, Object> context) {

    public ServiceError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static ServiceError notFound(String entity, Object id) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("entity", entity);
        context.put("id", id);
        return new ServiceError(ErrorKind.NOT_FOUND, entity + " not found.", context);
    }

    public static ServiceError of(ErrorKind kind, String message, String entity) {
        return new ServiceError(kind, message, Map.of("entity", entity));
    }
}
