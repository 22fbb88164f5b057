package com.autoya.backend.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.autoya.backend.controller.mapper.RenterMapperImpl;
import com.autoya.backend.domain.Renter;
import com.autoya.backend.result.ServiceError;
import com.autoya.backend.result.ServiceResult;
import com.autoya.backend.service.RenterService;
import com.autoya.backend.util.ErrorResponseFactory;
import com.autoya.backend.util.ErrorStatusMapper;
import com.autoya.backend.util.MetricsHelper;

/**
 * Web layer tests for {@link RenterController} with the default legacy
 * status mapping, where every failure is answered with 400.
 */
@WebMvcTest(RenterController.class)
@Import({RenterMapperImpl.class, ErrorResponseFactory.class, ErrorStatusMapper.class})
class RenterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RenterService renterService;

    @MockBean
    private MetricsHelper metricsHelper;

    @Test
    void getAll_ShouldReturnRenters() throws Exception {
        Renter renter = Renter.builder().id(2L).firstName("Luis").lastName("Paz").email("luis@autoya.pe").build();
        given(renterService.list()).willReturn(List.of(renter));

        mockMvc.perform(get("/api/v1/arrendatarios"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(2))
            .andExpect(jsonPath("$[0].lastName").value("Paz"));
    }

    @Test
    void getById_MissingRenter_ShouldReturnBadRequest() throws Exception {
        given(renterService.findById(9L)).willReturn(ServiceResult.failure(ServiceError.notFound("Arrendatario", 9L)));

        mockMvc.perform(get("/api/v1/arrendatarios/9"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"))
            .andExpect(jsonPath("$.message").value("Arrendatario not found."))
            .andExpect(jsonPath("$.path").value("/api/v1/arrendatarios/9"));
    }

    @Test
    void create_MissingLastName_ShouldReturnFieldErrorWithoutSaving() throws Exception {
        mockMvc.perform(post("/api/v1/arrendatarios")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"firstName\":\"Luis\",\"email\":\"luis@autoya.pe\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0]", startsWith("lastName ")));

        then(renterService).should(never()).save(any(Renter.class));
    }

    @Test
    void delete_MissingRenter_ShouldReturnBadRequest() throws Exception {
        given(renterService.delete(4L)).willReturn(ServiceResult.failure(ServiceError.notFound("Arrendatario", 4L)));

        mockMvc.perform(delete("/api/v1/arrendatarios/4"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Arrendatario not found."));
    }
}
