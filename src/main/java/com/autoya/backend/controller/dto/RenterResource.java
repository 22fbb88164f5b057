package com.autoya.backend.controller.dto;

import java.time.Instant;

/**
 * Renter as returned by the API.
 */
public record RenterResource(
        Long id,
        String firstName,
        String lastName,
        String email,
        String phone,
        Instant createdAt,
        Instant updatedAt
) {
}
