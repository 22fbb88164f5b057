package com.autoya.backend.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Vehicle entity (vehiculo) listed by an owner for rent.
 *
 * Key points:
 * - Owner is mandatory; renter and current rental agreement are optional
 * - Renter and rental references are nulled by the database when the
 *   referenced row is deleted (ON DELETE SET NULL)
 * - Updates go through {@link VehiclePatch}, never field-by-field from a request
 *
 * @see com.autoya.backend.repository.VehicleRepository
 */
@Entity
@Table(name = "vehicles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"owner", "renter", "rental"})  // Avoid circular references
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String brand;

    @Column(nullable = false, length = 100)
    private String model;

    /**
     * Top speed in km/h.
     */
    @Column(name = "top_speed")
    private Integer topSpeed;

    /**
     * Fuel consumption in km per litre.
     */
    private Integer consumption;

    private Integer dimensions;

    /**
     * Weight in kg.
     */
    private Integer weight;

    @Column(name = "vehicle_class", length = 50)
    private String vehicleClass;

    @Column(length = 50)
    private String transmission;

    /**
     * Rental duration, expressed in {@link #rentalTimeUnit} units.
     */
    @Column(name = "rental_time")
    private Integer rentalTime;

    @Column(name = "rental_time_unit", length = 20)
    private String rentalTimeUnit;

    @Column(name = "rental_cost")
    private Integer rentalCost;

    @Column(name = "pickup_location", length = 255)
    private String pickupLocation;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "contract_pdf", length = 1024)
    private String contractPdf;

    @Column(name = "rental_state", length = 50)
    private String rentalState;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id", nullable = false)
    private Owner owner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "renter_id")
    private Renter renter;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "rental_id")
    private RentalAgreement rental;

    @Column(nullable = false, updatable = false, name = "created_at")
    private Instant createdAt;

    @Column(nullable = false, name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
