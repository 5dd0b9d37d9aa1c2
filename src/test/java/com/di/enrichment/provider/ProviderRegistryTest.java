package com.di.enrichment.provider;

import com.di.enrichment.model.DataTypes;
import com.di.enrichment.support.Payloads;
import com.di.enrichment.support.Registries;
import com.di.enrichment.support.StubProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Registry is built by hand; {@code initialize()} normally runs as {@code @PostConstruct}.
 */
@DisplayName("ProviderRegistry Tests")
class ProviderRegistryTest {

    @Test
    @DisplayName("Lookup is case-insensitive and trimmed")
    void testLookup() {
        StubProvider credit = StubProvider.returning(DataTypes.CREDIT, Payloads.credit(700, "good"));
        ProviderRegistry registry = Registries.of(credit);

        assertSame(credit, registry.find(" Credit ").orElseThrow());
        assertTrue(registry.hasProvider("CREDIT"));
        assertEquals(Set.of(DataTypes.CREDIT), registry.getRegisteredTypes());
    }

    @Test
    @DisplayName("Unknown, null and blank types are absent")
    void testMissing() {
        ProviderRegistry registry = Registries.of(StubProvider.returning(DataTypes.CREDIT, Payloads.credit(700, "good")));
        assertTrue(registry.find("telematics").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertTrue(registry.find(" ").isEmpty());
        assertFalse(registry.hasProvider(""));
    }

    @Test
    @DisplayName("Empty registry is allowed")
    void testEmpty() {
        assertTrue(Registries.of().getRegisteredTypes().isEmpty());
    }

    @Test
    @DisplayName("Two adapters for the same data type fail startup")
    void testDuplicates() {
        StubProvider a = StubProvider.returning(DataTypes.CREDIT, Payloads.credit(700, "good"));
        StubProvider b = StubProvider.returning("CREDIT", Payloads.credit(600, "fair"));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Registries.of(a, b));
        assertTrue(e.getMessage().contains("credit"));
    }

    @Test
    @DisplayName("Blank dataType() fails startup")
    void testBlankType() {
        assertThrows(IllegalStateException.class,
                () -> Registries.of(StubProvider.returning(" ", Payloads.credit(700, "good"))));
    }
}
