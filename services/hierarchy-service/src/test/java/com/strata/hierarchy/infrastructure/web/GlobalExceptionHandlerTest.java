package com.strata.hierarchy.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.strata.database.session.SessionBindingException;
import com.strata.hierarchy.domain.ConflictException;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.ForbiddenException;
import com.strata.hierarchy.domain.NotFoundException;
import com.strata.hierarchy.domain.UnauthenticatedException;
import com.strata.hierarchy.domain.ValidationFailedException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Nested
    @DisplayName("domain failures")
    class DomainFailures {

        @Test
        @DisplayName("validation failures are 422 with flattened and per-field messages")
        void validation() {
            var ex =
                    new ValidationFailedException(
                            Map.of("name", List.of("can't be blank", "is too short")));

            var response = handler.handleValidationFailed(ex);

            assertThat(response.getStatusCode().value()).isEqualTo(422);
            assertThat(response.getBody().success()).isFalse();
            assertThat(response.getBody().errorCode()).isEqualTo("validation_failed");
            assertThat(response.getBody().errors())
                    .containsExactly("name can't be blank", "name is too short");
            assertThat(response.getBody().fieldErrors()).containsKey("name");
        }

        @Test
        @DisplayName("maps each failure type to its status and code")
        void statusMapping() {
            assertThat(handler.handleUnauthenticated(new UnauthenticatedException("no")))
                    .satisfies(r -> assertThat(r.getStatusCode().value()).isEqualTo(401));
            assertThat(handler.handleForbidden(new ForbiddenException("no")))
                    .satisfies(r -> assertThat(r.getBody().errorCode()).isEqualTo("forbidden"))
                    .satisfies(r -> assertThat(r.getStatusCode().value()).isEqualTo(403));
            assertThat(handler.handleNotFound(NotFoundException.of(EntityKind.DOMAIN, UUID.randomUUID())))
                    .satisfies(r -> assertThat(r.getStatusCode().value()).isEqualTo(404));
            assertThat(handler.handleConflict(new ConflictException("last owner")))
                    .satisfies(r -> assertThat(r.getBody().error()).isEqualTo("last owner"))
                    .satisfies(r -> assertThat(r.getStatusCode().value()).isEqualTo(409));
        }

        @Test
        @DisplayName("a rejected identity is 401 without echoing the problems")
        void sessionBinding() {
            var response =
                    handler.handleSessionBinding(
                            new SessionBindingException(List.of("identityId must not be blank")));

            assertThat(response.getStatusCode().value()).isEqualTo(401);
            assertThat(response.getBody().error()).isEqualTo("Invalid identity");
        }

        @Test
        @DisplayName("a unique-key race is 409")
        void duplicateKey() {
            var response = handler.handleDuplicateKey(new DuplicateKeyException("dup"));

            assertThat(response.getStatusCode().value()).isEqualTo(409);
            assertThat(response.getBody().errorCode()).isEqualTo("conflict");
        }

        @Test
        @DisplayName("other integrity violations are not reported as conflicts")
        void otherIntegrityViolation() {
            var response =
                    handler.handleGeneric(
                            new DataIntegrityViolationException("value too long for column"));

            assertThat(response.getStatusCode().value()).isEqualTo(500);
            assertThat(response.getBody().errorCode()).isEqualTo("internal_error");
            assertThat(response.getBody().error()).doesNotContain("value too long");
        }
    }

    @Nested
    @DisplayName("request failures")
    class RequestFailures {

        @Test
        @DisplayName("bean validation field names are reported in snake_case")
        void beanValidation() throws Exception {
            var binding = new BeanPropertyBindingResult(new Object(), "request");
            binding.addError(
                    new FieldError("request", "resourceType", "is too long (maximum is 100 characters)"));
            var parameter =
                    new MethodParameter(
                            Object.class.getDeclaredMethod("toString"), -1);

            var response =
                    handler.handleInvalidBody(new MethodArgumentNotValidException(parameter, binding));

            assertThat(response.getStatusCode().value()).isEqualTo(422);
            assertThat(response.getBody().fieldErrors()).containsOnlyKeys("resource_type");
            assertThat(response.getBody().errors())
                    .containsExactly("resource_type is too long (maximum is 100 characters)");
        }

        @Test
        @DisplayName("IllegalArgumentException is 400")
        void illegalArgument() {
            var response =
                    handler.handleIllegalArgument(new IllegalArgumentException("page must be at least 1"));

            assertThat(response.getStatusCode().value()).isEqualTo(400);
            assertThat(response.getBody().error()).isEqualTo("page must be at least 1");
        }

        @Test
        @DisplayName("anything else is a 500 without internal detail")
        void generic() {
            var response = handler.handleGeneric(new RuntimeException("connection string leaked"));

            assertThat(response.getStatusCode().value()).isEqualTo(500);
            assertThat(response.getBody().errorCode()).isEqualTo("internal_error");
            assertThat(response.getBody().error()).doesNotContain("leaked");
        }
    }
}
