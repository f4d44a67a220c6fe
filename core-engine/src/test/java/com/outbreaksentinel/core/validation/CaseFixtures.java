package com.outbreaksentinel.core.validation;

import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds screened cases with hand-picked fusion outputs.
 */
final class CaseFixtures {

    static final String RUN_ID = "run-test-1";

    private CaseFixtures() {
        // utility class — not instantiable
    }

    static FusionResult fusion(MetricCell cell, double composite, double confidence, int valid, int total,
            Map<SourceCategory, Double> signals) {
        Set<SourceCategory> withData = cell.getSources().isEmpty()
                ? EnumSet.noneOf(SourceCategory.class)
                : EnumSet.copyOf(cell.getSources());
        return new FusionResult(cell.getKey(), composite, confidence, Map.of(), Map.of(),
                new EnumMap<>(signals), withData, valid, total, "hash-" + composite + "-" + confidence);
    }

    static Case screened(MetricCell cell, FusionResult fusion, int priorDeferrals) {
        return Case.open(RUN_ID, cell, fusion, new EvidenceAssembler().assemble(cell, fusion), priorDeferrals);
    }

    static Case screened(MetricCell cell, FusionResult fusion) {
        return screened(cell, fusion, 0);
    }
}
