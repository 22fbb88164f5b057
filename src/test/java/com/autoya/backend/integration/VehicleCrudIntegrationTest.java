package com.autoya.backend.integration;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.autoya.backend.repository.OwnerRepository;
import com.autoya.backend.repository.VehicleRepository;

/**
 * End-to-end CRUD tests over HTTP.
 *
 * Tests verify that:
 * - A created vehicle is listed back with identical fields
 * - Placeholder values in an update leave stored fields unchanged
 * - Deleting a missing vehicle fails without side effects
 * - Deleting an agreement releases the vehicles that pointed to it
 * - Deleting an owner that still owns vehicles is rejected
 */
class VehicleCrudIntegrationTest extends BaseIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP = new ParameterizedTypeReference<>() { };
    private static final ParameterizedTypeReference<List<Map<String, Object>>> LIST =
        new ParameterizedTypeReference<>() { };

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private VehicleRepository vehicleRepository;

    @Autowired
    private OwnerRepository ownerRepository;

    private Number ownerId;
    private Number renterId;

    @BeforeEach
    void createPeople() {
        ownerId = (Number) post("/api/v1/propietarios", Map.of(
            "firstName", "Ana", "lastName", "Rojas", "email", "ana@autoya.pe", "phone", "987654321"))
            .getBody().get("id");
        renterId = (Number) post("/api/v1/arrendatarios", Map.of(
            "firstName", "Luis", "lastName", "Paz", "email", "luis@autoya.pe"))
            .getBody().get("id");
    }

    @Test
    void createThenList_ShouldReturnIdenticalFields() {
        // Given
        Map<String, Object> created = post("/api/v1/vehiculos", toyotaBody()).getBody();

        // When
        ResponseEntity<List<Map<String, Object>>> listed =
            restTemplate.exchange("/api/v1/vehiculos", HttpMethod.GET, null, LIST);

        // Then
        assertThat(listed.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(listed.getBody()).hasSize(1);
        assertThat(listed.getBody().get(0)).isEqualTo(created);
        assertThat(created).containsEntry("brand", "Toyota").containsEntry("rentalCost", 120);
    }

    @Test
    void updateWithPlaceholders_ShouldKeepStoredValues() {
        // Given
        Number vehicleId = (Number) post("/api/v1/vehiculos", toyotaBody()).getBody().get("id");
        Map<String, Object> update = new LinkedHashMap<>();
        update.put("brand", "string");
        update.put("model", "Yaris");
        update.put("topSpeed", 0);
        update.put("renterId", renterId);

        // When
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
            "/api/v1/vehiculos/" + vehicleId, HttpMethod.PUT, new HttpEntity<>(update), MAP);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
            .containsEntry("brand", "Toyota")
            .containsEntry("model", "Yaris")
            .containsEntry("topSpeed", 180)
            .containsEntry("renterId", renterId.intValue());
    }

    @Test
    void deleteMissingVehicle_ShouldFailWithoutSideEffects() {
        // Given
        post("/api/v1/vehiculos", toyotaBody());

        // When
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
            "/api/v1/vehiculos/99999", HttpMethod.DELETE, null, MAP);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("message", "Vehiculo not found.");
        assertThat(vehicleRepository.count()).isEqualTo(1);
    }

    @Test
    void deleteAgreement_ShouldReleaseVehicle() {
        // Given
        Number vehicleId = (Number) post("/api/v1/vehiculos", toyotaBody()).getBody().get("id");
        Map<String, Object> agreement = post("/api/v1/alquileres", Map.of(
            "status", "ACTIVE",
            "startDate", "2025-03-01",
            "endDate", "2025-03-05",
            "totalCost", 400.00,
            "ownerId", ownerId,
            "renterId", renterId,
            "vehicleId", vehicleId)).getBody();
        Number rentalId = (Number) agreement.get("id");
        restTemplate.exchange("/api/v1/vehiculos/" + vehicleId, HttpMethod.PUT,
            new HttpEntity<>(Map.of("rentalId", rentalId)), MAP);

        // When
        ResponseEntity<Map<String, Object>> deleted = restTemplate.exchange(
            "/api/v1/alquileres/" + rentalId, HttpMethod.DELETE, null, MAP);

        // Then
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> vehicle = restTemplate.exchange(
            "/api/v1/vehiculos/" + vehicleId, HttpMethod.GET, null, MAP).getBody();
        assertThat(vehicle.get("rentalId")).isNull();
    }

    @Test
    void deleteOwnerWithVehicles_ShouldBeRejected() {
        // Given
        post("/api/v1/vehiculos", toyotaBody());

        // When
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
            "/api/v1/propietarios/" + ownerId, HttpMethod.DELETE, null, MAP);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("code", "CONFLICT");
        assertThat(ownerRepository.count()).isEqualTo(1);
    }

    private ResponseEntity<Map<String, Object>> post(String path, Map<String, Object> body) {
        ResponseEntity<Map<String, Object>> response =
            restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body), MAP);
        assertThat(response.getStatusCode()).as("POST %s", path).isEqualTo(HttpStatus.OK);
        return response;
    }

    private Map<String, Object> toyotaBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("brand", "Toyota");
        body.put("model", "Corolla");
        body.put("topSpeed", 180);
        body.put("vehicleClass", "Sedan");
        body.put("transmission", "Automatica");
        body.put("rentalTime", 1);
        body.put("rentalTimeUnit", "dia");
        body.put("rentalCost", 120);
        body.put("pickupLocation", "Miraflores");
        body.put("ownerId", ownerId);
        return body;
    }
}
