package com.vidnyan.rpax.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tagged value used for activity properties and nested configuration.
 * One of: text, number, boolean, nested map, nested list.
 */
public interface AttributeValue {

    Pattern NUMERIC = Pattern.compile("-?\\d{1,18}(\\.\\d+)?");

    /**
     * Plain Java view (String, BigDecimal, Boolean, Map, List) for serialization.
     */
    Object toPlain();

    /**
     * Deterministic rendering used for content hashing.
     */
    String render();

    record TextValue(String value) implements AttributeValue {
        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String render() {
            return value == null ? "" : value;
        }
    }

    record NumberValue(BigDecimal value) implements AttributeValue {
        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String render() {
            return value.toPlainString();
        }
    }

    record BoolValue(boolean value) implements AttributeValue {
        @Override
        public Object toPlain() {
            return value;
        }

        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    record MapValue(Map<String, AttributeValue> entries) implements AttributeValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public AttributeValue get(String key) {
            return entries.get(key);
        }

        @Override
        public Object toPlain() {
            Map<String, Object> plain = new LinkedHashMap<>();
            entries.forEach((k, v) -> plain.put(k, v.toPlain()));
            return plain;
        }

        @Override
        public String render() {
            return entries.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .map(e -> e.getKey() + "=" + e.getValue().render())
                    .collect(Collectors.joining(",", "{", "}"));
        }
    }

    record ListValue(List<AttributeValue> items) implements AttributeValue {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public Object toPlain() {
            return items.stream().map(AttributeValue::toPlain).toList();
        }

        @Override
        public String render() {
            return items.stream()
                    .map(AttributeValue::render)
                    .collect(Collectors.joining(",", "[", "]"));
        }
    }

    static AttributeValue text(String value) {
        return new TextValue(value);
    }

    static AttributeValue map(Map<String, AttributeValue> entries) {
        return new MapValue(entries);
    }

    static AttributeValue list(List<AttributeValue> items) {
        return new ListValue(items);
    }

    /**
     * Interpret a raw XAML attribute literal: True/False become booleans,
     * plain decimal literals become numbers, anything else stays text.
     */
    static AttributeValue parse(String raw) {
        if (raw == null) {
            return new TextValue(null);
        }
        String trimmed = raw.trim();
        if ("True".equalsIgnoreCase(trimmed) || "False".equalsIgnoreCase(trimmed)) {
            return new BoolValue(Boolean.parseBoolean(trimmed.toLowerCase(Locale.ROOT)));
        }
        if (NUMERIC.matcher(trimmed).matches()) {
            return new NumberValue(new BigDecimal(trimmed));
        }
        return new TextValue(raw);
    }

    /**
     * Rebuild a tagged value from its plain Java view.
     */
    @SuppressWarnings("unchecked")
    static AttributeValue fromPlain(Object plain) {
        if (plain == null) {
            return new TextValue(null);
        }
        if (plain instanceof AttributeValue value) {
            return value;
        }
        if (plain instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (plain instanceof BigDecimal d) {
            return new NumberValue(d);
        }
        if (plain instanceof Number n) {
            return new NumberValue(new BigDecimal(n.toString()));
        }
        if (plain instanceof Map<?, ?> m) {
            Map<String, AttributeValue> entries = new LinkedHashMap<>();
            ((Map<String, Object>) m).forEach((k, v) -> entries.put(k, fromPlain(v)));
            return new MapValue(entries);
        }
        if (plain instanceof List<?> l) {
            List<AttributeValue> items = new ArrayList<>();
            l.forEach(item -> items.add(fromPlain(item)));
            return new ListValue(items);
        }
        return new TextValue(plain.toString());
    }
}
