package com.di.enrichment.provider.simulated;

import com.di.enrichment.config.EnrichmentProperties;
import com.di.enrichment.model.DataTypes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Random;

@Component
@ConditionalOnProperty(prefix = "enrichment.providers", name = "simulated-enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedBackgroundProvider extends SimulatedProvider {

    public SimulatedBackgroundProvider(ObjectMapper objectMapper, EnrichmentProperties properties) {
        super(objectMapper, properties);
    }

    @Override
    public String dataType() {
        return DataTypes.BACKGROUND;
    }

    @Override
    protected void generate(Random random, ObjectNode payload) {
        boolean criminalRecord = random.nextDouble() < 0.12;
        payload.put("criminalRecord", criminalRecord);
        payload.put("felonyCount", criminalRecord ? random.nextInt(2) + 1 : 0);
        payload.put("violentCrime", criminalRecord && random.nextDouble() < 0.25);
        payload.put("fraudHistory", random.nextDouble() < 0.04);
        payload.put("ssnVerified", random.nextDouble() > 0.08);
        payload.put("addressChanges", random.nextInt(4));
    }
}
