package com.autoya.backend.controller.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Request body for a partial vehicle update.
 *
 * Every field is optional; omitted (or null) fields keep their stored value.
 * {@code renterId} / {@code rentalId} reassign the references,
 * {@code releaseRenter} / {@code releaseRental} clear them.
 */
public record UpdateVehicleRequest(
        @Size(max = 100) String brand,
        @Size(max = 100) String model,
        @PositiveOrZero Integer topSpeed,
        @PositiveOrZero Integer consumption,
        @PositiveOrZero Integer dimensions,
        @PositiveOrZero Integer weight,
        @Size(max = 50) String vehicleClass,
        @Size(max = 50) String transmission,
        @PositiveOrZero Integer rentalTime,
        @Size(max = 20) String rentalTimeUnit,
        @PositiveOrZero Integer rentalCost,
        @Size(max = 255) String pickupLocation,
        @Size(max = 1024) String imageUrl,
        @Size(max = 1024) String contractPdf,
        @Size(max = 50) String rentalState,
        Long renterId,
        Long rentalId,
        @Schema(description = "Clear the renter reference; wins over renterId")
        Boolean releaseRenter,
        @Schema(description = "Clear the rental reference; wins over rentalId")
        Boolean releaseRental
) {
}
