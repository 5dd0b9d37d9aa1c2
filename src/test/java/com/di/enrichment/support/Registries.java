package com.di.enrichment.support;

import com.di.enrichment.provider.ProviderAdapter;
import com.di.enrichment.provider.ProviderRegistry;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Builds a {@link ProviderRegistry} outside Spring, invoking the {@code @PostConstruct} hook by hand.
 */
public final class Registries {

    private Registries() {
    }

    public static ProviderRegistry of(ProviderAdapter... adapters) {
        ProviderRegistry registry = new ProviderRegistry(List.of(adapters));
        try {
            Method initialize = ProviderRegistry.class.getDeclaredMethod("initialize");
            initialize.setAccessible(true);
            initialize.invoke(registry);
        } catch (ReflectiveOperationException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e);
        }
        return registry;
    }
}
