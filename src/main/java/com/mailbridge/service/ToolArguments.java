package com.mailbridge.service;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loosely typed tool arguments.
 * Keys are looked up in snake_case first, then camelCase.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public static ToolArguments of(Map<String, Object> values) {
        return new ToolArguments(values);
    }

    public Object get(String key) {
        Object value = values.get(key);
        return value != null ? value : values.get(toCamelCase(key));
    }

    public String getString(String key) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Accepts a JSON array or a comma-separated string
     */
    public List<String> getList(String key) {
        Object value = get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .filter(v -> v != null && !v.toString().isBlank())
                    .map(v -> v.toString().trim())
                    .toList();
        }
        return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Copy safe for logging: password removed, address local part shortened
     */
    public Map<String, Object> masked() {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove("password");
        copy.remove("smtp_password");
        for (String key : List.of("email_address", "emailAddress")) {
            Object address = copy.get(key);
            if (address != null) {
                copy.put(key, maskAddress(address.toString()));
            }
        }
        return copy;
    }

    static String maskAddress(String address) {
        int at = address.indexOf('@');
        if (at < 0) {
            return address;
        }
        String local = address.substring(0, at);
        return local.substring(0, Math.min(3, local.length())) + "***" + address.substring(at);
    }

    private static String toCamelCase(String key) {
        StringBuilder camel = new StringBuilder();
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                camel.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return camel.toString();
    }
}
