package com.bidscope.api;

import com.bidscope.error.BackingStoreException;
import com.bidscope.error.CancelledException;
import com.bidscope.error.CapacityException;
import com.bidscope.error.ErrorKind;
import com.bidscope.error.NotFoundException;
import com.bidscope.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApiExceptionHandler Tests")
class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    @DisplayName("Should map every error kind to its HTTP status")
    void shouldMapKindsToStatuses() {
        assertThat(ApiExceptionHandler.statusFor(ErrorKind.VALIDATION)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ApiExceptionHandler.statusFor(ErrorKind.NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ApiExceptionHandler.statusFor(ErrorKind.CAPACITY)).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(ApiExceptionHandler.statusFor(ErrorKind.CANCELLED)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ApiExceptionHandler.statusFor(ErrorKind.BACKING_STORE))
            .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    @DisplayName("Should name the offending field for validation errors")
    void shouldIncludeField() {
        ResponseEntity<ErrorResponse> response =
            handler.handle(new ValidationException("page_size", "page_size must be between 1 and 100"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getError()).isEqualTo("validation_error");
        assertThat(response.getBody().getMessage()).isEqualTo("page_size must be between 1 and 100");
        assertThat(response.getBody().getField()).isEqualTo("page_size");
    }

    @Test
    @DisplayName("Should keep rendered SQL out of store error bodies")
    void shouldNotLeakSql() {
        BackingStoreException error = new BackingStoreException("Search failed", "search",
            "SELECT * FROM contracts WHERE award_title = ?", new SQLException("IO Error"));

        ResponseEntity<ErrorResponse> response = handler.handle(error);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo("Search failed").doesNotContain("SELECT");
        assertThat(response.getBody().getField()).isNull();
    }

    @Test
    @DisplayName("Should carry the kind value for other errors")
    void shouldCarryKind() {
        assertThat(handler.handle(new NotFoundException("Task", "abc")).getBody().getError()).isEqualTo("not_found");
        assertThat(handler.handle(new CapacityException("Too slow", "aggregate")).getBody().getError())
            .isEqualTo("capacity_error");
        assertThat(handler.handle(new CancelledException("Stopped")).getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }
}
