package com.autoya.backend.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.autoya.backend.controller.mapper.OwnerMapperImpl;
import com.autoya.backend.domain.Owner;
import com.autoya.backend.result.ErrorKind;
import com.autoya.backend.result.ServiceError;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.service.OwnerService;
import com.autoya.backend.util.ErrorResponseFactory;
import com.autoya.backend.util.ErrorStatusMapper;
import com.autoya.backend.util.MetricsHelper;

/**
 * Web layer tests for {@link OwnerController} with status codes derived
 * from the error kind.
 */
@WebMvcTest(controllers = OwnerController.class, properties = "autoya.api.errors.legacy-status=false")
@Import({OwnerMapperImpl.class, ErrorResponseFactory.class, ErrorStatusMapper.class})
class OwnerControllerTest {

    private static final String VALID_BODY =
        "{\"firstName\":\"Ana\",\"lastName\":\"Rojas\",\"email\":\"ana@autoya.pe\",\"phone\":\"987654321\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OwnerService ownerService;

    @MockBean
    private MetricsHelper metricsHelper;

    @Test
    void getById_MissingOwner_ShouldReturnNotFound() throws Exception {
        given(ownerService.findById(9L)).willReturn(ServiceResult.failure(ServiceError.notFound("Propietario", 9L)));

        mockMvc.perform(get("/api/v1/propietarios/9"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404))
            .andExpect(jsonPath("$.message").value("Propietario not found."));
    }

    @Test
    void create_DuplicateEmail_ShouldReturnConflict() throws Exception {
        given(ownerService.save(any(Owner.class))).willReturn(ServiceResult.failure(ServiceError.of(
            ErrorKind.CONFLICT, "An error occurred while saving the propietario: duplicate key", "Propietario")));

        mockMvc.perform(post("/api/v1/propietarios").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("CONFLICT"));
    }

    @Test
    void create_InvalidEmail_ShouldReturnFieldError() throws Exception {
        mockMvc.perform(post("/api/v1/propietarios")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"firstName\":\"Ana\",\"lastName\":\"Rojas\",\"email\":\"not-an-email\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0]", startsWith("email ")));
    }

    @Test
    void update_ShouldReturnUpdatedOwner() throws Exception {
        Owner updated = Owner.builder().id(1L).firstName("Ana").lastName("Rojas").email("ana@autoya.pe").build();
        given(ownerService.update(eq(1L), any(Owner.class))).willReturn(ServiceResult.success(updated));

        mockMvc.perform(put("/api/v1/propietarios/1").contentType(MediaType.APPLICATION_JSON).content(VALID_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(1))
            .andExpect(jsonPath("$.email").value("ana@autoya.pe"));
    }

    @Test
    void delete_DatabaseDown_ShouldReturnInternalError() throws Exception {
        given(ownerService.delete(1L)).willReturn(ServiceResult.failure(ServiceError.of(
            ErrorKind.INTERNAL, "An error occurred while deleting the propietario: connection refused", "Propietario")));

        mockMvc.perform(delete("/api/v1/propietarios/1"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value("INTERNAL"));
    }
}
