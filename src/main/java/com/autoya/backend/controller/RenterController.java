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

import com.autoya.backend.controller.dto.RenterResource;
import com.autoya.backend.controller.dto.SaveRenterRequest;
import com.autoya.backend.controller.mapper.RenterMapper;
import com.autoya.backend.domain.Renter;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.service.RenterService;
import com.autoya.backend.util.ErrorResponseFactory;

import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for renters (arrendatarios).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/arrendatarios")
@RequiredArgsConstructor
@Tag(name = "Arrendatarios", description = "Renter CRUD")
public class RenterController {

    private final RenterService renterService;
    private final RenterMapper renterMapper;
    private final ErrorResponseFactory errorResponseFactory;

    @GetMapping
    @Timed(value = "api.renters.list", description = "Time taken to list renters")
    @Operation(summary = "List renters")
    public List<RenterResource> getAll() {
        return renterMapper.toResources(renterService.list());
    }

    @GetMapping("/{id}")
    @Timed(value = "api.renters.get", description = "Time taken to get a renter")
    @Operation(summary = "Get a renter by id")
    public ResponseEntity<Object> getById(@PathVariable Long id, HttpServletRequest request) {
        return respond(renterService.findById(id), request);
    }

    @PostMapping
    @Timed(value = "api.renters.create", description = "Time taken to create a renter")
    @Operation(summary = "Create a renter")
    public ResponseEntity<Object> create(@Valid @RequestBody SaveRenterRequest resource, HttpServletRequest request) {
        log.info("POST /api/v1/arrendatarios: email={}", resource.email());
        Renter renter = renterMapper.toEntity(resource);
        return respond(renterService.save(renter), request);
    }

    @PutMapping("/{id}")
    @Timed(value = "api.renters.update", description = "Time taken to update a renter")
    @Operation(summary = "Replace a renter")
    public ResponseEntity<Object> update(
            @PathVariable Long id,
            @Valid @RequestBody SaveRenterRequest resource,
            HttpServletRequest request
    ) {
        log.info("PUT /api/v1/arrendatarios/{}", id);
        Renter renter = renterMapper.toEntity(resource);
        return respond(renterService.update(id, renter), request);
    }

    @DeleteMapping("/{id}")
    @Timed(value = "api.renters.delete", description = "Time taken to delete a renter")
    @Operation(summary = "Delete a renter", description = "Fails while agreements reference the renter")
    public ResponseEntity<Object> delete(@PathVariable Long id, HttpServletRequest request) {
        log.info("DELETE /api/v1/arrendatarios/{}", id);
        return respond(renterService.delete(id), request);
    }

    private ResponseEntity<Object> respond(ServiceResult<Renter> result, HttpServletRequest request) {
        if (!result.isSuccess()) {
            log.warn("{} {} failed: {}", request.getMethod(), request.getRequestURI(), result.getMessage());
            return errorResponseFactory.fromServiceError(result.getError(), request.getRequestURI());
        }
        return ResponseEntity.ok(renterMapper.toResource(result.getValue()));
    }
}
