package com.di.enrichment.dispatch;

import com.di.enrichment.model.EntityKind;
import com.di.enrichment.util.MdcPropagation;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Routes each finished run to the {@link DownstreamTrigger} registered for its entity kind,
 * off the caller's thread. Trigger failures are logged, never propagated.
 */
@Slf4j
@Component
public class RoutingDownstreamDispatcher implements DownstreamDispatcher {

    private final Map<EntityKind, DownstreamTrigger> triggers = new EnumMap<>(EntityKind.class);
    private final Executor executor;

    public RoutingDownstreamDispatcher(List<DownstreamTrigger> triggers,
                                       @Qualifier("dispatchExecutor") Executor executor) {
        for (DownstreamTrigger trigger : triggers) {
            DownstreamTrigger previous = this.triggers.putIfAbsent(trigger.entityKind(), trigger);
            if (previous != null) {
                throw new IllegalStateException(String.format("Duplicate DownstreamTrigger for %s: %s and %s",
                        trigger.entityKind(), previous.getClass().getName(), trigger.getClass().getName()));
            }
        }
        this.executor = MdcPropagation.wrapExecutor(executor);
    }

    @Override
    public void dispatch(String entityId, EntityKind entityKind, Map<String, JsonNode> mergedPayload) {
        DownstreamTrigger trigger = triggers.get(entityKind);
        if (trigger == null) {
            log.debug("[DISPATCH] No downstream trigger for {}:{}", entityKind, entityId);
            return;
        }
        Map<String, JsonNode> payload = Map.copyOf(mergedPayload);
        try {
            executor.execute(() -> {
                try {
                    trigger.trigger(entityId, payload);
                } catch (RuntimeException e) {
                    log.error("[DISPATCH] {} failed for {}:{}: {}",
                            trigger.getClass().getSimpleName(), entityKind, entityId, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("[DISPATCH] Hand-off rejected for {}:{}: {}", entityKind, entityId, e.getMessage());
        }
    }
}
