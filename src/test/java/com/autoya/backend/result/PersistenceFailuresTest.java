package com.autoya.backend.result;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

class PersistenceFailuresTest {

    @Test
    void classify_IntegrityViolation_ShouldBeConflictWithRootCauseMessage() {
        // Given
        DataIntegrityViolationException ex = new DataIntegrityViolationException(
            "could not execute statement",
            new SQLException("duplicate key value violates unique constraint \"owners_email_key\""));

        // When
        ServiceError error = PersistenceFailures.classify("saving", "Propietario", ex);

        // Then
        assertThat(error.kind()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(error.message()).isEqualTo(
            "An error occurred while saving the propietario: "
                + "duplicate key value violates unique constraint \"owners_email_key\"");
        assertThat(error.context()).containsEntry("entity", "Propietario");
    }

    @Test
    void classify_OtherDataAccessFailure_ShouldBeInternal() {
        ServiceError error = PersistenceFailures.classify("updating", "Vehiculo",
            new QueryTimeoutException("statement timeout"));

        assertThat(error.kind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(error.message()).isEqualTo("An error occurred while updating the vehiculo: statement timeout");
    }

    @Test
    void classify_TransactionFailure_ShouldBeInternal() {
        ServiceError error = PersistenceFailures.classify("deleting", "Alquiler",
            new CannotCreateTransactionException("connection refused"));

        assertThat(error.kind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(error.message()).startsWith("An error occurred while deleting the alquiler: ");
    }
}
