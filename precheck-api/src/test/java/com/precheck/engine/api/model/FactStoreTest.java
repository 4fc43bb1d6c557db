package com.precheck.engine.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactStoreTest {

    @Test
    @DisplayName("Should treat a missing key as absent")
    void shouldTreatMissingKeyAsAbsent() {
        FactStore facts = FactStore.of(Map.of("company_name", "Demo Company Ltd"));

        assertThat(facts.text("vat_number")).isEmpty();
        assertThat(facts.contains("vat_number")).isFalse();
        assertThat(facts.lookup("vat_number")).isEmpty();
    }

    @Test
    @DisplayName("Should treat null values as absent")
    void shouldTreatNullAsAbsent() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("vat_number", null);
        FactStore facts = FactStore.of(raw);

        assertThat(facts.text("vat_number")).isEmpty();
        assertThat(facts.contains("vat_number")).isFalse();
        assertThat(facts.size()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Not found", "NOT FOUND", "not found", "  Not Found  ", "", "   "})
    @DisplayName("Should treat the sentinel in any casing and blank text as absent")
    void shouldTreatSentinelAsAbsent(String value) {
        FactStore facts = FactStore.of(Map.of("support_email", value));

        assertThat(facts.text("support_email")).isEmpty();
        assertThat(FactStore.isAbsent(value)).isTrue();
    }

    @Test
    @DisplayName("Should coerce booleans, numbers and lists to text")
    void shouldCoerceValuesToText() {
        FactStore facts = FactStore.of(Map.of(
                "has_privacy_policy", true,
                "has_refund_policy", false,
                "refund_period_days", 30,
                "refund_period_double", 14.0,
                "fee_rate", 2.5,
                "price", new BigDecimal("19.900"),
                "payment_methods_mentioned", List.of("Visa", "Mastercard", "PayPal")
        ));

        assertThat(facts.text("has_privacy_policy")).contains("true");
        assertThat(facts.text("has_refund_policy")).contains("false");
        assertThat(facts.text("refund_period_days")).contains("30");
        assertThat(facts.text("refund_period_double")).contains("14");
        assertThat(facts.text("fee_rate")).contains("2.5");
        assertThat(facts.text("price")).contains("19.9");
        assertThat(facts.text("payment_methods_mentioned")).contains("Visa, Mastercard, PayPal");
    }

    @Test
    @DisplayName("Should skip null list elements and treat an empty list as absent")
    void shouldHandleListsWithNulls() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("payment_methods_mentioned", Arrays.asList("Visa", null, "PayPal"));
        raw.put("languages", List.of());
        FactStore facts = FactStore.of(raw);

        assertThat(facts.text("payment_methods_mentioned")).contains("Visa, PayPal");
        assertThat(facts.text("languages")).isEmpty();
    }

    @Test
    @DisplayName("Should render nested maps as key-value text")
    void shouldRenderNestedMaps() {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("city", "London");
        address.put("postcode", "EC1A 1BB");
        FactStore facts = FactStore.of(Map.of("physical_address", address));

        assertThat(facts.text("physical_address")).contains("{city: London, postcode: EC1A 1BB}");
    }

    @Test
    @DisplayName("Should resolve dotted keys through nested maps")
    void shouldResolveDottedKeys() {
        FactStore facts = FactStore.of(Map.of(
                "company", Map.of("vat_number", "GB123456789", "registration", Map.of("number", "12345678"))
        ));

        assertThat(facts.text("company.vat_number")).contains("GB123456789");
        assertThat(facts.text("company.registration.number")).contains("12345678");
        assertThat(facts.text("company.missing")).isEmpty();
        assertThat(facts.text("company.vat_number.deeper")).isEmpty();
    }

    @Test
    @DisplayName("Should prefer an exact key over a dotted path")
    void shouldPreferExactKey() {
        FactStore facts = FactStore.of(Map.of(
                "company.vat_number", "exact",
                "company", Map.of("vat_number", "nested")
        ));

        assertThat(facts.text("company.vat_number")).contains("exact");
    }

    @Test
    @DisplayName("Should be immutable and reject a null map")
    void shouldBeImmutable() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("company_name", "Demo");
        FactStore facts = FactStore.of(raw);
        raw.put("company_name", "Changed");

        assertThat(facts.text("company_name")).contains("Demo");
        assertThatThrownBy(() -> facts.asMap().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> FactStore.of(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should share one empty instance")
    void shouldShareEmptyInstance() {
        assertThat(FactStore.of(Map.of())).isSameAs(FactStore.empty());
        assertThat(FactStore.empty().isEmpty()).isTrue();
    }
}
