package com.autoya.backend.controller;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.autoya.backend.controller.dto.RentalAgreementResource;
import com.autoya.backend.controller.dto.SaveRentalAgreementRequest;
import com.autoya.backend.controller.mapper.RentalAgreementMapper;
import com.autoya.backend.domain.RentalAgreement;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.service.RentalAgreementService;
import com.autoya.backend.util.ErrorResponseFactory;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for rental agreements (alquileres).
 *
 * Endpoints:
 * - GET    /api/v1/alquileres
 * - GET    /api/v1/alquileres/{id}
 * - POST   /api/v1/alquileres
 * - PUT    /api/v1/alquileres/{id}
 * - DELETE /api/v1/alquileres/{id}
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alquileres")
@RequiredArgsConstructor
@Tag(name = "Alquileres", description = "Rental agreement CRUD")
public class RentalAgreementController {

    private final RentalAgreementService rentalAgreementService;
    private final RentalAgreementMapper rentalAgreementMapper;
    private final ErrorResponseFactory errorResponseFactory;

    @GetMapping
    @Timed(value = "api.rentals.list", description = "Time taken to list rental agreements")
    @Operation(summary = "List rental agreements")
    public List<RentalAgreementResource> getAll() {
        List<RentalAgreement> rentals = rentalAgreementService.list();
        log.debug("GET /api/v1/alquileres: count={}", rentals.size());
        return rentalAgreementMapper.toResources(rentals);
    }

    @GetMapping("/{id}")
    @Timed(value = "api.rentals.get", description = "Time taken to get a rental agreement")
    @Operation(summary = "Get a rental agreement by id")
    public ResponseEntity<Object> getById(@PathVariable Long id, HttpServletRequest request) {
        return respond(rentalAgreementService.findById(id), request);
    }

    @PostMapping
    @Timed(value = "api.rentals.create", description = "Time taken to create a rental agreement")
    @Operation(summary = "Create a rental agreement")
    public ResponseEntity<Object> create(
            @Valid @RequestBody SaveRentalAgreementRequest resource,
            HttpServletRequest request
    ) {
        log.info("POST /api/v1/alquileres: status={}, startDate={}, endDate={}, totalCost={}",
                resource.status(), resource.startDate(), resource.endDate(), resource.totalCost());

        RentalAgreement rental = rentalAgreementMapper.toEntity(resource);
        return respond(rentalAgreementService.save(rental), request);
    }

    @PutMapping("/{id}")
    @Timed(value = "api.rentals.update", description = "Time taken to update a rental agreement")
    @Operation(summary = "Replace a rental agreement")
    public ResponseEntity<Object> update(
            @PathVariable Long id,
            @Valid @RequestBody SaveRentalAgreementRequest resource,
            HttpServletRequest request
    ) {
        log.info("PUT /api/v1/alquileres/{}: status={}", id, resource.status());

        RentalAgreement rental = rentalAgreementMapper.toEntity(resource);
        return respond(rentalAgreementService.update(id, rental), request);
    }

    @DeleteMapping("/{id}")
    @Timed(value = "api.rentals.delete", description = "Time taken to delete a rental agreement")
    @Operation(summary = "Delete a rental agreement", description = "Returns the deleted agreement")
    public ResponseEntity<Object> delete(@PathVariable Long id, HttpServletRequest request) {
        log.info("DELETE /api/v1/alquileres/{}", id);
        return respond(rentalAgreementService.delete(id), request);
    }

    private ResponseEntity<Object> respond(ServiceResult<RentalAgreement> result, HttpServletRequest request) {
        if (!result.isSuccess()) {
            log.warn("{} {} failed: {}", request.getMethod(), request.getRequestURI(), result.getMessage());
            return errorResponseFactory.fromServiceError(result.getError(), request.getRequestURI());
        }
        return ResponseEntity.ok(rentalAgreementMapper.toResource(result.getValue()));
    }
}
