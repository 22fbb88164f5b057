package com.autoya.backend.controller.dto;

/**
 * Vehicle as returned by the API. References are exposed as ids; renter and
 * rental are null while the vehicle is not rented.
 */
public record VehicleResource(
        Long id,
        String brand,
        String model,
        Integer topSpeed,
        Integer consumption,
        Integer dimensions,
        Integer weight,
        String vehicleClass,
        String transmission,
        Integer rentalTime,
        String rentalTimeUnit,
        Integer rentalCost,
        String pickupLocation,
        String imageUrl,
        String contractPdf,
        String rentalState,
        Long ownerId,
        Long renterId,
        Long rentalId
) {
}
