package com.storefront.request_gateway.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.endpoint.EndpointMatch;
import com.storefront.request_gateway.error.ValidationException;
import com.storefront.request_gateway.gateway.HandlerResponse;
import com.storefront.request_gateway.gateway.RawRequest;
import com.storefront.request_gateway.gateway.RequestMetadata;
import com.storefront.request_gateway.gateway.ValidatedRequest;
import jakarta.validation.Validation;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMethod;

import java.time.Instant;
import java.util.Map;

import static com.storefront.request_gateway.support.TestRequests.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayName("RequestValidator")
class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator(
            new ObjectMapper(), Validation.buildDefaultValidatorFactory().getValidator());
    private final RequestMetadata metadata = new RequestMetadata("req_1", Instant.parse("2026-01-01T00:00:00Z"));

    record NumericParams(@NotNull(message = "required") Integer id) {}

    record ThingParams(
            @NotNull(message = "required")
            @UUID(message = "valid UUID")
            String id
    ) {}

    record PageQuery(@Min(value = 1, message = "minimum {value}") Integer limit) {
        PageQuery {
            limit = limit == null ? 20 : limit;
        }
    }

    record ThingBody(
            @NotNull(message = "required")
            String name,

            @Min(value = 0, message = "minimum {value}")
            Integer count
    ) {}

    record TenantHeaders(
            @JsonProperty("x-tenant")
            @NotNull(message = "required")
            @Size(min = 3, message = "minimum {min} characters")
            String tenant
    ) {}

    private static EndpointMatch match(ValidationConfig validation, Map<String, String> params) {
        EndpointDefinition definition = EndpointDefinition.builder()
                .method(RequestMethod.POST)
                .path("/api/things/:id")
                .validation(validation)
                .handler((request, context) -> HandlerResponse.ok(null))
                .build();
        return new EndpointMatch(definition, params);
    }

    private ValidationException rejection(RawRequest request, ValidationConfig config) {
        Throwable thrown = catchThrowable(
                () -> validator.validate(request, match(config, Map.of("id", "1")), metadata));
        assertThat(thrown).isInstanceOf(ValidationException.class);
        return (ValidationException) thrown;
    }

    @Test
    @DisplayName("bound sections replace the raw ones, with coerced types and defaults")
    void coercedOutput() {
        // given
        ValidationConfig config = new ValidationConfig(NumericParams.class, PageQuery.class, ThingBody.class, null);
        RawRequest request = raw("POST", "/api/things/7").body("{\"name\":\"lamp\"}").build();

        // when
        ValidatedRequest validated = validator.validate(request, match(config, Map.of("id", "7")), metadata);

        // then
        assertThat(validated.params().get("id").isNumber()).isTrue();
        assertThat(validated.query().get("limit").asInt()).isEqualTo(20);
        assertThat(validated.body().get("name").asText()).isEqualTo("lamp");
        assertThat(validated.body().has("count")).isFalse();
        assertThat(validated.principal()).isNull();
        assertThat(validated.method()).isEqualTo(RequestMethod.POST);
    }

    @Test
    @DisplayName("sections are checked params first, so a bad param hides a bad body")
    void sectionOrder() {
        ValidationConfig config = new ValidationConfig(ThingParams.class, null, ThingBody.class, null);
        RawRequest request = raw("POST", "/api/things/x").body("{}").build();

        assertThatThrownBy(() -> validator.validate(request, match(config, Map.of("id", "x")), metadata))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getField()).isEqualTo("params.id");
                    assertThat(e.getConstraint()).isEqualTo("valid UUID");
                });
    }

    @Test
    @DisplayName("a malformed body fails before any body type is bound")
    void malformedBody() {
        ValidationException e = rejection(raw("POST", "/api/things/1").body("{not json").build(), ValidationConfig.none());

        assertThat(e.getField()).isEqualTo("body");
        assertThat(e.getConstraint()).isEqualTo("well-formed JSON");
    }

    @Test
    @DisplayName("content after the first JSON value makes the body malformed")
    void trailingTokens() {
        // given
        RawRequest request = raw("POST", "/api/things/1").body("{\"a\":1} }}} not json").build();

        // when
        ValidationException e = rejection(request, ValidationConfig.none());

        // then
        assertThat(e.getField()).isEqualTo("body");
        assertThat(e.getConstraint()).isEqualTo("well-formed JSON");
    }

    @Test
    @DisplayName("an absent body is null and fails a body type")
    void absentBody() {
        ValidationException e = rejection(raw("POST", "/api/things/1").build(), ValidationConfig.body(ThingBody.class));

        assertThat(e.getField()).isEqualTo("body");
        assertThat(e.getConstraint()).isEqualTo("expected object");
    }

    @Test
    @DisplayName("a missing body field is reported with its path")
    void missingBodyField() {
        ValidationException e = rejection(raw("POST", "/api/things/1").body("{\"count\":2}").build(),
                ValidationConfig.body(ThingBody.class));

        assertThat(e.getField()).isEqualTo("body.name");
        assertThat(e.getConstraint()).isEqualTo("required");
    }

    @Test
    @DisplayName("body numbers are not coerced from strings")
    void bodyStringIsNotANumber() {
        ValidationException e = rejection(raw("POST", "/api/things/1").body("{\"name\":\"lamp\",\"count\":\"3\"}").build(),
                ValidationConfig.body(ThingBody.class));

        assertThat(e.getField()).isEqualTo("body.count");
        assertThat(e.getConstraint()).isEqualTo("integer");
    }

    @Test
    @DisplayName("query values are coerced from strings and then checked")
    void queryBounds() {
        ValidationException e = rejection(raw("POST", "/api/things/1").query(Map.of("limit", "0")).build(),
                ValidationConfig.query(PageQuery.class));

        assertThat(e.getField()).isEqualTo("query.limit");
        assertThat(e.getConstraint()).isEqualTo("minimum 1");
    }

    @Test
    @DisplayName("header violations use the lower-cased header name")
    void headerValidation() {
        ValidationConfig config = new ValidationConfig(null, null, null, TenantHeaders.class);
        RawRequest request = raw("POST", "/api/things/1").headers(Map.of("X-Tenant", "ab")).build();

        ValidationException e = rejection(request, config);

        assertThat(e.getField()).isEqualTo("headers.x-tenant");
        assertThat(e.getConstraint()).isEqualTo("minimum 3 characters");
    }
}
