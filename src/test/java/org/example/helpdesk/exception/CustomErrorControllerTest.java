package org.example.helpdesk.exception;

import jakarta.servlet.RequestDispatcher;
import org.example.helpdesk.config.HelpdeskProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CustomErrorController")
class CustomErrorControllerTest {

    private final CustomErrorController controller = new CustomErrorController(new HelpdeskProperties(
            new HelpdeskProperties.Upload(DataSize.ofMegabytes(5)),
            new HelpdeskProperties.Retention(true, 30, Duration.ofHours(24)),
            new HelpdeskProperties.Errors(false),
            new HelpdeskProperties.Tickets("Normal", 50)));

    @Test
    @DisplayName("not found uses endpoint message")
    void notFoundUsesEndpointMessage() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/error");
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 404);
        request.setAttribute(RequestDispatcher.ERROR_REQUEST_URI, "/nope");

        ResponseEntity<ErrorResponse> response = controller.handleError(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().message()).isEqualTo("Endpoint not found");
        assertThat(response.getBody().path()).isEqualTo("uri=/nope");
    }

    @Test
    @DisplayName("server error hides exception message")
    void serverErrorHidesExceptionMessage() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/error");
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, 500);
        request.setAttribute(RequestDispatcher.ERROR_EXCEPTION, new IllegalStateException("secret"));

        ResponseEntity<ErrorResponse> response = controller.handleError(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).isEqualTo(GlobalExceptionHandler.GENERIC_MESSAGE);
    }

    @Test
    @DisplayName("missing status defaults to 500")
    void missingStatusDefaultsTo500() {
        ResponseEntity<ErrorResponse> response = controller.handleError(new MockHttpServletRequest("GET", "/error"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
