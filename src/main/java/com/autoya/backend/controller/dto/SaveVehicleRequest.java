package com.autoya.backend.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request body for creating a vehicle.
 */
public record SaveVehicleRequest(
        @NotBlank @Size(max = 100) String brand,
        @NotBlank @Size(max = 100) String model,
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
        @NotNull Long ownerId,
        Long renterId,
        Long rentalId
) {
}
