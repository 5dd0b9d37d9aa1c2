package com.di.enrichment;

import com.di.enrichment.cache.CacheAdministrationService;
import com.di.enrichment.model.DataTypes;
import com.di.enrichment.model.EnrichmentResult;
import com.di.enrichment.pipeline.EnrichmentPipeline;
import com.di.enrichment.provider.ProviderRegistry;
import com.di.enrichment.task.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the in-memory application with the simulated providers and runs a policy and a claim through it.
 */
@SpringBootTest(properties = "enrichment.cache.cleanup-enabled=false")
@DisplayName("EnrichmentPipelineApplication Tests")
class EnrichmentPipelineApplicationTests {

	@Autowired
	private EnrichmentPipeline pipeline;

	@Autowired
	private ProviderRegistry providerRegistry;

	@Autowired
	private CacheAdministrationService cacheAdministration;

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = EnrichmentPipelineApplication.class.getMethod("main", String[].class);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Simulated providers are registered for every built-in data type")
	void testProvidersRegistered() {
		assertEquals(Set.copyOf(DataTypes.ALL), Set.copyOf(providerRegistry.getRegisteredTypes()));
	}

	@Test
	@DisplayName("Policy and claim enrich end to end")
	void testEndToEnd() {
		EnrichmentResult policy = pipeline.enrichPolicy("POL-SMOKE-1");
		assertEquals(EnrichmentResult.Status.COMPLETED, policy.getStatus());
		assertEquals(Set.copyOf(DataTypes.ALL), policy.getData().keySet());
		assertEquals(TaskStatus.COMPLETED, pipeline.getTask(policy.getTaskId()).orElseThrow().getStatus());

		EnrichmentResult claim = pipeline.enrichClaim("CLM-SMOKE-1");
		assertFalse(claim.getData().containsKey(DataTypes.DRIVING_RECORD));
		assertEquals(3, claim.getData().size());

		assertTrue(cacheAdministration.getCacheStatistics().getTotalEntries() >= 7);
	}
}
