package com.storefront.request_gateway.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storefront.request_gateway.endpoint.EndpointDefinition;
import com.storefront.request_gateway.endpoint.EndpointMatch;
import com.storefront.request_gateway.error.ValidationException;
import com.storefront.request_gateway.gateway.RawRequest;
import com.storefront.request_gateway.gateway.RequestMetadata;
import com.storefront.request_gateway.gateway.ValidatedRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestMethod;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * Checks a raw request against its endpoint's {@link ValidationConfig} and builds the
 * {@link ValidatedRequest} handlers receive.
 *
 * Each section is bound to its request type with Jackson, then checked with Bean
 * Validation. Params, query and headers arrive as strings and are coerced to the
 * declared field types; the body must carry the JSON types the request type declares.
 * Sections are checked in a fixed order: params, query, body, headers. The first
 * violation ends validation and is reported as {@code <section>.<path>}; within a
 * section violations are ordered by property path.
 *
 * Handlers see the bound value written back as JSON, so defaults set by the request
 * type are present and absent optional fields are omitted.
 */
@Component
public class RequestValidator {

    private static final Logger log = LoggerFactory.getLogger(RequestValidator.class);

    private static final Comparator<ConstraintViolation<Object>> BY_PATH =
            Comparator.<ConstraintViolation<Object>, String>comparing(v -> v.getPropertyPath().toString())
                      .thenComparing(ConstraintViolation::getMessage);

    private final ObjectMapper textMapper;
    private final ObjectMapper bodyMapper;
    private final ObjectReader bodyReader;
    private final Validator validator;

    public RequestValidator(ObjectMapper objectMapper, Validator validator) {
        this.textMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.bodyMapper = textMapper.copy()
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        bodyMapper.coercionConfigDefaults().setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        this.bodyReader = bodyMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.validator = validator;
    }

    public ValidatedRequest validate(RawRequest raw, EndpointMatch match, RequestMetadata metadata) {
        EndpointDefinition definition = match.definition();
        ValidationConfig config = definition.validation();

        ObjectNode params = (ObjectNode) check(config.params(), toObject(match.pathParams()), "params", textMapper);
        ObjectNode query = (ObjectNode) check(config.query(), toObject(raw.query()), "query", textMapper);
        JsonNode body = check(config.body(), parseBody(raw.body()), "body", bodyMapper);
        check(config.headers(), toObject(raw.headers()), "headers", textMapper);

        return new ValidatedRequest(
                RequestMethod.valueOf(raw.method()),
                raw.url(),
                raw.path(),
                raw.headers(),
                params,
                query,
                body,
                null,
                null,
                metadata);
    }

    private JsonNode check(Class<?> type, JsonNode value, String section, ObjectMapper mapper) {
        if (type == null) {
            return value;
        }
        if (!value.isObject()) {
            throw violation(section, "expected object");
        }

        Object bound;
        try {
            bound = mapper.treeToValue(value, type);
        } catch (MismatchedInputException e) {
            throw violation(pathOf(section, e), constraintFor(e.getTargetType()));
        } catch (JsonProcessingException e) {
            throw violation(pathOf(section, e), "expected object");
        }

        Optional<ConstraintViolation<Object>> first = validator.validate(bound).stream().min(BY_PATH);
        if (first.isPresent()) {
            String property = wireName(mapper, type, first.get().getPropertyPath().toString());
            throw violation(property.isEmpty() ? section : section + "." + property, first.get().getMessage());
        }
        return mapper.valueToTree(bound);
    }

    /**
     * Rewrites the leading property of a violation path to the name it has on the wire,
     * e.g. {@code tenant} bound from {@code x-tenant}.
     */
    private static String wireName(ObjectMapper mapper, Class<?> type, String path) {
        int end = path.length();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.' || c == '[') {
                end = i;
                break;
            }
        }
        String property = path.substring(0, end);
        if (property.isEmpty()) {
            return path;
        }
        String name = mapper.getSerializationConfig()
                .introspect(mapper.constructType(type))
                .findProperties().stream()
                .filter(candidate -> candidate.getInternalName().equals(property))
                .map(BeanPropertyDefinition::getName)
                .findFirst()
                .orElse(property);
        return name + path.substring(end);
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return bodyReader.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Request body is not valid JSON", "body", "well-formed JSON");
        }
    }

    private static ValidationException violation(String field, String constraint) {
        log.debug("Validation failed at {}: {}", field, constraint);
        return new ValidationException("Validation failed for " + field + ": " + constraint, field, constraint);
    }

    private static String pathOf(String section, JsonMappingException e) {
        StringBuilder path = new StringBuilder(section);
        for (JsonMappingException.Reference reference : e.getPath()) {
            if (reference.getFieldName() != null) {
                path.append('.').append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.toString();
    }

    private static String constraintFor(Class<?> target) {
        if (target == null) {
            return "expected object";
        }
        if (target == int.class || target == long.class || target == short.class
                || target == Integer.class || target == Long.class || target == Short.class
                || target == BigInteger.class) {
            return "integer";
        }
        if (target == double.class || target == float.class || Number.class.isAssignableFrom(target)
                || target == BigDecimal.class) {
            return "expected number";
        }
        if (target == boolean.class || target == Boolean.class) {
            return "expected boolean";
        }
        if (target == String.class) {
            return "expected string";
        }
        if (target.isArray() || Collection.class.isAssignableFrom(target)) {
            return "expected array";
        }
        return "expected object";
    }

    private static ObjectNode toObject(Map<String, String> values) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        values.forEach(node::put);
        return node;
    }
}
