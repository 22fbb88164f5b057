package com.autoya.backend.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Rental agreement as returned by the API. References are exposed as ids.
 */
public record RentalAgreementResource(
        Long id,
        String status,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal totalCost,
        Long ownerId,
        Long renterId,
        Long vehicleId
) {
}
