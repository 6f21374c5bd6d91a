package com.mailbridge.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ToolArguments unit tests
 */
class ToolArgumentsTest {

    @Test
    @DisplayName("snake_case keys win, camelCase is the fallback")
    void testKeyLookup() {
        ToolArguments args = ToolArguments.of(Map.of("emailAddress", "camel@example.com", "page_size", 3));

        assertThat(args.getString("email_address")).isEqualTo("camel@example.com");
        assertThat(args.get("page_size")).isEqualTo(3);
        assertThat(args.get("missing_key")).isNull();
    }

    @Test
    @DisplayName("Blank strings read as absent")
    void testBlankString() {
        ToolArguments args = ToolArguments.of(Map.of("folder", "   ", "subject", "  Hi "));

        assertThat(args.getString("folder")).isNull();
        assertThat(args.getString("subject")).isEqualTo("Hi");
    }

    @Test
    @DisplayName("Lists accept arrays and comma-separated strings")
    void testGetList() {
        ToolArguments args = ToolArguments.of(Map.of(
                "to_addresses", Arrays.asList("a@example.com", " ", "b@example.com"),
                "cc_addresses", "c@example.com, ,d@example.com"));

        assertThat(args.getList("to_addresses")).containsExactly("a@example.com", "b@example.com");
        assertThat(args.getList("cc_addresses")).containsExactly("c@example.com", "d@example.com");
        assertThat(args.getList("bcc_addresses")).isEmpty();
    }

    @Test
    @DisplayName("Null argument map behaves as empty")
    void testNullMap() {
        assertThat(ToolArguments.of(null).getList("to_addresses")).isEmpty();
    }

    @Test
    @DisplayName("Masked copy drops passwords and shortens addresses")
    void testMasked() {
        Map<String, Object> values = new HashMap<>();
        values.put("email_address", "alice.smith@example.com");
        values.put("password", "secret");
        values.put("limit", 5);

        Map<String, Object> masked = ToolArguments.of(values).masked();

        assertThat(masked).doesNotContainKey("password");
        assertThat(masked.get("email_address")).isEqualTo("ali***@example.com");
        assertThat(masked.get("limit")).isEqualTo(5);
        assertThat(values).containsKey("password");
    }

    @Test
    @DisplayName("Short local parts and non-addresses are masked safely")
    void testMaskAddress() {
        assertThat(ToolArguments.maskAddress("al@example.com")).isEqualTo("al***@example.com");
        assertThat(ToolArguments.maskAddress("not-an-address")).isEqualTo("not-an-address");
        assertThat(List.of(ToolArguments.maskAddress("@example.com"))).containsExactly("***@example.com");
    }
}
