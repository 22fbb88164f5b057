package com.autoya.backend.domain;

import java.util.Optional;
import java.util.function.Consumer;

import lombok.Builder;
import lombok.ToString;

/**
 * Partial update of a {@link Vehicle}.
 *
 * Every scalar field is optional: an empty value means "do not change".
 * There are no placeholder values at this level; a supplied empty string or
 * zero is applied like any other value.
 *
 * References (renter, rental) are expressed with {@link ReferenceUpdate} and
 * resolved by the service, which needs repository lookups to attach them.
 * Both default to {@link ReferenceUpdate#keep()}; callers must not pass null.
 */
@Builder
@ToString
public final class VehiclePatch {

    private final String brand;
    private final String model;
    private final Integer topSpeed;
    private final Integer consumption;
    private final Integer dimensions;
    private final Integer weight;
    private final String vehicleClass;
    private final String transmission;
    private final Integer rentalTime;
    private final String rentalTimeUnit;
    private final Integer rentalCost;
    private final String pickupLocation;
    private final String imageUrl;
    private final String contractPdf;
    private final String rentalState;
    @Builder.Default
    private final ReferenceUpdate renter = ReferenceUpdate.keep();
    @Builder.Default
    private final ReferenceUpdate rental = ReferenceUpdate.keep();

    public static VehiclePatch empty() {
        return builder().build();
    }

    public Optional<String> getBrand() {
        return Optional.ofNullable(brand);
    }

    public Optional<String> getModel() {
        return Optional.ofNullable(model);
    }

    public Optional<Integer> getTopSpeed() {
        return Optional.ofNullable(topSpeed);
    }

    public Optional<Integer> getConsumption() {
        return Optional.ofNullable(consumption);
    }

    public Optional<Integer> getDimensions() {
        return Optional.ofNullable(dimensions);
    }

    public Optional<Integer> getWeight() {
        return Optional.ofNullable(weight);
    }

    public Optional<String> getVehicleClass() {
        return Optional.ofNullable(vehicleClass);
    }

    public Optional<String> getTransmission() {
        return Optional.ofNullable(transmission);
    }

    public Optional<Integer> getRentalTime() {
        return Optional.ofNullable(rentalTime);
    }

    public Optional<String> getRentalTimeUnit() {
        return Optional.ofNullable(rentalTimeUnit);
    }

    public Optional<Integer> getRentalCost() {
        return Optional.ofNullable(rentalCost);
    }

    public Optional<String> getPickupLocation() {
        return Optional.ofNullable(pickupLocation);
    }

    public Optional<String> getImageUrl() {
        return Optional.ofNullable(imageUrl);
    }

    public Optional<String> getContractPdf() {
        return Optional.ofNullable(contractPdf);
    }

    public Optional<String> getRentalState() {
        return Optional.ofNullable(rentalState);
    }

    public ReferenceUpdate getRenter() {
        return renter;
    }

    public ReferenceUpdate getRental() {
        return rental;
    }

    /**
     * Copies every supplied scalar field onto the target. References are left
     * untouched.
     *
     * @param target vehicle loaded from the database
     */
    public void applyScalarsTo(Vehicle target) {
        set(brand, target::setBrand);
        set(model, target::setModel);
        set(topSpeed, target::setTopSpeed);
        set(consumption, target::setConsumption);
        set(dimensions, target::setDimensions);
        set(weight, target::setWeight);
        set(vehicleClass, target::setVehicleClass);
        set(transmission, target::setTransmission);
        set(rentalTime, target::setRentalTime);
        set(rentalTimeUnit, target::setRentalTimeUnit);
        set(rentalCost, target::setRentalCost);
        set(pickupLocation, target::setPickupLocation);
        set(imageUrl, target::setImageUrl);
        set(contractPdf, target::setContractPdf);
        set(rentalState, target::setRentalState);
    }

    private static <T> void set(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
