package com.autoya.backend.controller.dto;

import java.time.Instant;

/**
 * Owner as returned by the API.
 */
public record OwnerResource(
        Long id,
        String firstName,
        String lastName,
        String email,
        String phone,
        Instant createdAt,
        Instant updatedAt
) {
}
