package com.autoya.backend.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request body for creating or replacing a rental agreement.
 */
public record SaveRentalAgreementRequest(
        @NotBlank @Size(max = 50) String status,
        @NotNull LocalDate startDate,
        @NotNull LocalDate endDate,
        @NotNull @PositiveOrZero @Digits(integer = 10, fraction = 2) BigDecimal totalCost,
        @NotNull Long ownerId,
        @NotNull Long renterId,
        @NotNull Long vehicleId
) {
}
