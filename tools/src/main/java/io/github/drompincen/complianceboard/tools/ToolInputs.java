package io.github.drompincen.complianceboard.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.complianceboard.runtime.tools.ToolContext;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** Input helpers shared by the project tools. */
final class ToolInputs {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ToolInputs() {}

    /** Project from the invocation context, or from the {@code projectId} input field when the context has none. */
    static String projectId(ToolContext ctx, JsonNode input) {
        if (ctx != null && ctx.projectId() != null && !ctx.projectId().isBlank()) return ctx.projectId();
        return text(input, "projectId");
    }

    /** Trimmed text of a field; null when missing, null or blank. */
    static String text(JsonNode input, String field) {
        JsonNode node = input.path(field);
        if (node.isMissingNode() || node.isNull()) return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    /** Raw text of a field, keeping an empty string so callers can clear a reference. */
    static String rawText(JsonNode input, String field) {
        JsonNode node = input.path(field);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    static Integer integer(JsonNode input, String field) {
        JsonNode node = input.path(field);
        return node.canConvertToInt() ? node.asInt() : null;
    }

    static LocalDate date(JsonNode input, String field) {
        String value = text(input, field);
        if (value == null) return null;
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'" + field + "' must be a date like 2026-03-31");
        }
    }
}
