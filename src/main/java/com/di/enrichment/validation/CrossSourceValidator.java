package com.di.enrichment.validation;

import com.di.enrichment.quality.MergedPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered {@link CrossSourceCheck} over a merged payload. A check that throws is
 * logged and skipped; validation never fails a run.
 */
@Slf4j
@Component
public class CrossSourceValidator {

    private final List<CrossSourceCheck> checks;

    public CrossSourceValidator(List<CrossSourceCheck> checks) {
        this.checks = checks != null ? List.copyOf(checks) : List.of();
    }

    public List<ValidationNotice> validate(MergedPayload merged) {
        List<ValidationNotice> notices = new ArrayList<>();
        if (merged == null || merged.isEmpty()) {
            return notices;
        }
        for (CrossSourceCheck check : checks) {
            try {
                check.check(merged).ifPresent(notices::add);
            } catch (RuntimeException e) {
                log.warn("[PIPELINE] Cross-source check {} failed and was skipped: {}",
                        check.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        return notices;
    }
}
