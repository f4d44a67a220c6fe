package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.model.CellKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AuditTrail} and {@link DeferralRegistry}.
 */
class AuditTrailTest {

    private static final Instant AT = Instant.parse("2024-03-15T23:30:00Z");

    private static CellOutcome outcome(String location, CellOutcome.Kind kind) {
        return CellOutcome.builder(new CellKey(location, TODAY), kind).rationale(kind.name()).build();
    }

    @Test
    @DisplayName("Should audit only suppressed, deferred and failed cells")
    void auditsNonEscalations() {
        AuditTrail audit = new AuditTrail();

        for (CellOutcome.Kind kind : CellOutcome.Kind.values()) {
            audit.record("run-1", AT, outcome("district-" + kind.ordinal(), kind));
        }

        assertThat(audit.size()).isEqualTo(3);
        assertThat(audit.recent(10)).extracting(e -> e.getOutcome().getKind()).containsExactly(
                CellOutcome.Kind.FAILED, CellOutcome.Kind.DEFERRED, CellOutcome.Kind.SUPPRESSED);
    }

    @Test
    @DisplayName("Should drop the oldest entries beyond capacity")
    void boundedCapacity() {
        AuditTrail audit = new AuditTrail(2);

        audit.record("run-1", AT, outcome("district-1", CellOutcome.Kind.DEFERRED));
        audit.record("run-2", AT, outcome("district-2", CellOutcome.Kind.DEFERRED));
        audit.record("run-3", AT, outcome("district-3", CellOutcome.Kind.SUPPRESSED));

        assertThat(audit.size()).isEqualTo(2);
        assertThat(audit.forCell(new CellKey("district-1", TODAY))).isEmpty();
        assertThat(audit.recent(1)).singleElement().extracting(AuditTrail.Entry::getRunId).isEqualTo("run-3");
    }

    @Test
    @DisplayName("Should count deferrals per cell until cleared")
    void deferralRegistry() {
        DeferralRegistry registry = new DeferralRegistry();
        CellKey key = new CellKey("district-5", TODAY);

        assertThat(registry.recordDeferral(key)).isEqualTo(1);
        assertThat(registry.recordDeferral(key)).isEqualTo(2);
        assertThat(registry.pending()).containsEntry(key, 2);

        registry.clear(key);

        assertThat(registry.deferralsOf(key)).isZero();
        assertThat(registry.size()).isZero();
    }
}
