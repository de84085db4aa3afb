package com.stashguard.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields of the service configuration. Every field has a default, so an empty file is a
 * complete configuration.
 */
public class ConfigSchema {

    private final Map<String, FieldDefinition> fields;

    public ConfigSchema(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Fills in defaults for absent fields and checks the ones that are present.
     *
     * @param config raw values keyed by field name; defaults are written into it
     * @throws ConfigValidationException on the first invalid field
     */
    public void validate(Map<String, Object> config) throws ConfigValidationException {
        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            Object value = config.get(entry.getKey());
            if (value == null) {
                config.put(entry.getKey(), entry.getValue().defaultValue());
            } else {
                entry.getValue().check(entry.getKey(), value);
            }
        }
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * A non-blank string field.
     */
    public static FieldDefinition text(String defaultValue) {
        return new FieldDefinition(FieldType.STRING, defaultValue, 0, 0);
    }

    /**
     * A whole-number field within {@code [min, max]}.
     */
    public static FieldDefinition wholeNumber(int defaultValue, int min, int max) {
        if (defaultValue < min || defaultValue > max) {
            throw new IllegalArgumentException("Default " + defaultValue + " outside [" + min + ", " + max + "]");
        }
        return new FieldDefinition(FieldType.NUMBER, defaultValue, min, max);
    }

    /**
     * One configuration field. Bounds apply to {@link FieldType#NUMBER} fields only.
     */
    public record FieldDefinition(FieldType type, Object defaultValue, int min, int max) {

        void check(String fieldName, Object value) throws ConfigValidationException {
            switch (type) {
                case STRING:
                    if (!(value instanceof String)) {
                        throw mismatch(fieldName, value);
                    }
                    if (((String) value).isBlank()) {
                        throw new ConfigValidationException(
                            String.format("Field '%s' must not be blank", fieldName));
                    }
                    break;
                case NUMBER:
                    if (!(value instanceof Number)) {
                        throw mismatch(fieldName, value);
                    }
                    double number = ((Number) value).doubleValue();
                    if (number != Math.rint(number)) {
                        throw new ConfigValidationException(
                            String.format("Field '%s' value %s must be a whole number", fieldName, value));
                    }
                    if (number < min || number > max) {
                        throw new ConfigValidationException(
                            String.format("Field '%s' value %s is outside %d-%d", fieldName, value, min, max));
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled field type " + type);
            }
        }

        private ConfigValidationException mismatch(String fieldName, Object value) {
            return new ConfigValidationException(
                String.format("Field '%s' expected %s, got %s", fieldName, type, value.getClass().getSimpleName()));
        }
    }

    public enum FieldType {
        STRING,
        NUMBER
    }
}
