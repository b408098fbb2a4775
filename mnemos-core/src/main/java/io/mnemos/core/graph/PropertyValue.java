package io.mnemos.core.graph;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Closed value type for node and relationship properties: a string, a number, a boolean,
 * a list of scalars, or a flat map whose values are scalars or lists of scalars.
 * Integral numbers are held as {@link Long}, everything else numeric as {@link Double}.
 */
public record PropertyValue(Kind kind, Object value) {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        LIST,
        MAP
    }

    public PropertyValue {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
        boolean matches = switch (kind) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Long || value instanceof Double;
            case BOOLEAN -> value instanceof Boolean;
            case LIST -> value instanceof List<?>;
            case MAP -> value instanceof Map<?, ?>;
        };
        if (!matches) {
            throw new ValidationException("Value of type " + value.getClass().getSimpleName() + " is not a " + kind);
        }
    }

    public static PropertyValue of(Object raw) {
        if (raw == null) {
            throw new ValidationException("Property values must not be null");
        }
        if (raw instanceof PropertyValue value) {
            return value;
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new ValidationException("Map property keys must be strings");
                }
                if (entry.getValue() == null) {
                    continue;
                }
                Object nested = entry.getValue();
                copy.put(key, nested instanceof Collection<?> list ? scalarList(list) : scalar(nested));
            }
            return new PropertyValue(Kind.MAP, Collections.unmodifiableMap(copy));
        }
        if (raw instanceof Collection<?> list) {
            return new PropertyValue(Kind.LIST, scalarList(list));
        }
        if (raw instanceof double[] vector) {
            List<Object> values = new ArrayList<>(vector.length);
            for (double v : vector) {
                values.add(v);
            }
            return new PropertyValue(Kind.LIST, Collections.unmodifiableList(values));
        }
        Object scalar = scalar(raw);
        if (scalar instanceof String) {
            return new PropertyValue(Kind.STRING, scalar);
        }
        if (scalar instanceof Boolean) {
            return new PropertyValue(Kind.BOOLEAN, scalar);
        }
        return new PropertyValue(Kind.NUMBER, scalar);
    }

    /**
     * Converts a plain map, dropping null values. Keys must be non-blank.
     */
    public static Map<String, PropertyValue> ofAll(Map<String, ?> raw) {
        Map<String, PropertyValue> converted = new LinkedHashMap<>();
        if (raw == null) {
            return converted;
        }
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ValidationException("Property names must not be blank");
            }
            if (entry.getValue() != null) {
                converted.put(entry.getKey(), of(entry.getValue()));
            }
        }
        return converted;
    }

    public static Map<String, Object> toPlain(Map<String, PropertyValue> properties) {
        Map<String, Object> plain = new LinkedHashMap<>();
        if (properties != null) {
            properties.forEach((key, value) -> plain.put(key, value.value()));
        }
        return plain;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public String asString() {
        return String.valueOf(value);
    }

    public double asDouble() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Not a number: " + text);
            }
        }
        throw new ValidationException(kind + " is not numeric");
    }

    public boolean asBoolean() {
        if (value instanceof Boolean flag) {
            return flag;
        }
        return Boolean.parseBoolean(asString());
    }

    @SuppressWarnings("unchecked")
    public List<Object> asList() {
        if (kind == Kind.LIST) {
            return (List<Object>) value;
        }
        return List.of(value);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> asMap() {
        if (kind == Kind.MAP) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    /**
     * Numeric list as a vector, or {@code null} when this is not a non-empty list of numbers.
     */
    public double[] asVector() {
        if (kind != Kind.LIST) {
            return null;
        }
        List<Object> list = asList();
        if (list.isEmpty()) {
            return null;
        }
        double[] vector = new double[list.size()];
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Number number)) {
                return null;
            }
            vector[i] = number.doubleValue();
        }
        return vector;
    }

    /**
     * Loose equality used by exact-match filters: numbers compare by value, everything else by equals.
     */
    public boolean matches(PropertyValue other) {
        if (other == null) {
            return false;
        }
        if (kind == Kind.NUMBER && other.kind == Kind.NUMBER) {
            return Double.compare(asDouble(), other.asDouble()) == 0;
        }
        return kind == other.kind && value.equals(other.value);
    }

    /**
     * Counter arithmetic: stays integral while both the current value and the delta are whole numbers.
     */
    public static PropertyValue increment(PropertyValue current, double delta) {
        double base = 0.0;
        boolean integral = true;
        if (current != null) {
            base = current.asDouble();
            integral = current.value() instanceof Long;
        }
        double next = base + delta;
        if (integral && delta == Math.rint(delta)) {
            return new PropertyValue(Kind.NUMBER, (long) next);
        }
        return new PropertyValue(Kind.NUMBER, next);
    }

    private static List<Object> scalarList(Collection<?> raw) {
        List<Object> values = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (item == null) {
                throw new ValidationException("List properties must not contain null");
            }
            values.add(scalar(item));
        }
        return Collections.unmodifiableList(values);
    }

    private static Object scalar(Object raw) {
        if (raw instanceof String || raw instanceof Boolean) {
            return raw;
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ValidationException("Numeric properties must be finite");
            }
            return value;
        }
        if (raw instanceof Enum<?> constant) {
            return constant.name().toLowerCase(Locale.ROOT);
        }
        if (raw instanceof TemporalAccessor) {
            return raw.toString();
        }
        throw new ValidationException("Unsupported property value type: " + raw.getClass().getName());
    }
}
