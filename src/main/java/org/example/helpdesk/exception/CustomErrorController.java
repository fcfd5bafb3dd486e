package org.example.helpdesk.exception;

import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.HelpdeskProperties;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

/**
 * Serves {@code /error} for faults raised outside Spring MVC, e.g. by a servlet filter or
 * the container itself. The body has the same shape as {@link GlobalExceptionHandler} responses.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class CustomErrorController implements ErrorController {

    private final HelpdeskProperties properties;

    @RequestMapping(value = "/error", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ErrorResponse> handleError(HttpServletRequest request) {
        Object statusObj = request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE);
        Throwable exception = (Throwable) request.getAttribute(RequestDispatcher.ERROR_EXCEPTION);
        Object requestUriObj = request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);

        HttpStatus httpStatus = resolveStatus(statusObj);
        String requestUri = requestUriObj != null ? requestUriObj.toString() : request.getRequestURI();

        String message;
        if (httpStatus == HttpStatus.NOT_FOUND) {
            message = "Endpoint not found";
        } else if (httpStatus.is5xxServerError()) {
            log.error("❌ ERROR CONTROLLER - Status: {}, Path: {}", httpStatus.value(), requestUri, exception);
            message = properties.errors().includeDetails() && exception != null && exception.getMessage() != null
                    ? exception.getMessage()
                    : GlobalExceptionHandler.GENERIC_MESSAGE;
        } else {
            log.warn("❌ ERROR CONTROLLER - Status: {}, Path: {}", httpStatus.value(), requestUri);
            message = httpStatus.getReasonPhrase();
        }

        ErrorResponse errorResponse = new ErrorResponse(
                LocalDateTime.now(),
                httpStatus.value(),
                httpStatus.getReasonPhrase(),
                message,
                "uri=" + requestUri
        );
        return new ResponseEntity<>(errorResponse, httpStatus);
    }

    private HttpStatus resolveStatus(Object statusObj) {
        if (statusObj == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        HttpStatus status = HttpStatus.resolve(Integer.parseInt(statusObj.toString()));
        return status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
