package com.autoya.backend.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ServiceResultTest {

    @Test
    void failure_ShouldExposeMessageAndNoValue() {
        ServiceResult<String> result = ServiceResult.failure(ServiceError.notFound("Vehiculo", 99L));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getValue()).isNull();
        assertThat(result.getMessage()).isEqualTo("Vehiculo not found.");
        assertThat(result.getError().context()).containsEntry("entity", "Vehiculo").containsEntry("id", 99L);
    }

    @Test
    void map_ShouldTransformSuccessAndPassFailureThrough() {
        assertThat(ServiceResult.success(4).map(n -> n * 2).getValue()).isEqualTo(8);

        ServiceResult<Integer> failed = ServiceResult.failure(ServiceError.of(ErrorKind.CONFLICT, "taken", "Propietario"));
        assertThat(failed.map(n -> n * 2).getError().kind()).isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    void success_NullValue_ShouldBeRejected() {
        assertThatThrownBy(() -> ServiceResult.success(null)).isInstanceOf(NullPointerException.class);
    }
}
