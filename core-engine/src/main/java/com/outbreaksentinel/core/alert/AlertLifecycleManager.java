package com.outbreaksentinel.core.alert;

import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.AlertStatus;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.ContentHash;
import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.SourceCategory;
import com.outbreaksentinel.core.validation.Case;
import com.outbreaksentinel.core.validation.CaseState;
import com.outbreaksentinel.core.validation.StageVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Sole owner of alert identity and state.
 *
 * <h3>Deduplication</h3>
 * <p>
 * {@link #materialize(Case)} looks for an open alert of the same location
 * whose window, widened by {@code dedupWindowDays}, contains the case's day.
 * If one exists the case is merged into it, otherwise a new alert is
 * inserted. The check-then-write runs under a per-location lock held by this
 * manager, and every write is a compare-and-set against the store. Runs that
 * share one manager therefore never insert twice for the same window; callers
 * with several managers over one store must route a location to one of them.
 * </p>
 *
 * <h3>Merge rules</h3>
 * <ul>
 * <li>severity never goes down</li>
 * <li>the window grows to include the new day</li>
 * <li>evidence, score and confidence are replaced by the newer case</li>
 * <li>status and the notified flag are left alone</li>
 * <li>a case whose fusion result is already on the alert writes nothing</li>
 * </ul>
 *
 * <h3>Status</h3>
 * <p>
 * {@code active → acknowledged → resolved}; anything else, including every
 * transition out of {@code resolved}, throws
 * {@link InvalidTransitionException} and leaves the alert unchanged.
 * </p>
 *
 * <h3>Retries</h3>
 * <p>
 * Transient store failures are retried with exponential backoff up to
 * {@code maxPersistAttempts}; then {@link AlertPersistenceException} is
 * thrown. Each operation writes at most one document, so a failed operation
 * leaves no partial state behind.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLifecycleManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLifecycleManager.class);

    /** Bound on compare-and-set conflicts tolerated within one attempt. */
    static final int MAX_CAS_ROUNDS = 16;

    static final String META_MERGE_COUNT = "merge_count";
    static final String META_FUSION_RESULTS = "fusion_result_ids";

    private final AlertStore store;
    private final Clock clock;
    private final PipelineSettings.Lifecycle settings;
    private final Sleeper sleeper;
    private final ConcurrentMap<String, ReentrantLock> locationLocks = new ConcurrentHashMap<>();

    public AlertLifecycleManager(AlertStore store, Clock clock, PipelineSettings.Lifecycle settings) {
        this(store, clock, settings, Sleeper.SYSTEM);
    }

    public AlertLifecycleManager(AlertStore store, Clock clock, PipelineSettings.Lifecycle settings,
            Sleeper sleeper) {
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.settings = Objects.requireNonNull(settings, "Lifecycle settings must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "Sleeper must not be null");
    }

    /**
     * Stable alert identifier.
     *
     * @return hex SHA-256 of location, day bucket and run id
     */
    public static String alertId(CellKey key, String runId) {
        return ContentHash.sha256(key.getLocation(), key.getTimeBucket().toString(), runId);
    }

    // ---------------------------------------------------------------
    // Materialization
    // ---------------------------------------------------------------

    /**
     * Create an alert for an escalated case, or merge it into the open alert
     * already covering its window.
     *
     * @param escalated a case in {@link CaseState#ESCALATED}
     * @return what was written
     * @throws IllegalArgumentException   if the case is not escalated
     * @throws AlertPersistenceException  if the store keeps failing
     */
    public MaterializationResult materialize(Case escalated) {
        Objects.requireNonNull(escalated, "Case must not be null");
        if (escalated.getState() != CaseState.ESCALATED || escalated.getSeverity() == null) {
            throw new IllegalArgumentException("Only escalated cases can be materialized, got "
                    + escalated.getState() + " for " + escalated.getKey());
        }

        String location = escalated.getKey().getLocation();
        ReentrantLock lock = locationLocks.computeIfAbsent(location, l -> new ReentrantLock());
        lock.lock();
        try {
            MaterializationResult result = withRetry("materialize " + escalated.getKey(),
                    () -> materializeOnce(escalated));
            LOG.info("Alert {} {} for {} (severity {})", result.getAlert().getAlertId(),
                    result.getKind().name().toLowerCase(Locale.ROOT), escalated.getKey(),
                    result.getAlert().getSeverity().key());
            return result;
        } finally {
            lock.unlock();
        }
    }

    private MaterializationResult materializeOnce(Case escalated) {
        LocalDate bucket = escalated.getKey().getTimeBucket();
        String resultId = escalated.getFusion().getResultId();
        for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
            List<Alert> alerts = store.findByLocation(escalated.getKey().getLocation());
            Optional<Alert> replayed = alerts.stream()
                    .filter(a -> recordsFusionResult(a, resultId))
                    .findFirst();
            if (replayed.isPresent()) {
                return MaterializationResult.unchanged(replayed.get());
            }

            Optional<Alert> match = alerts.stream()
                    .filter(Alert::isOpen)
                    .filter(a -> a.overlaps(bucket, settings.getDedupWindowDays()))
                    .min(Comparator.comparing(Alert::getCreatedAt).thenComparing(Alert::getAlertId));

            if (match.isEmpty()) {
                Alert created = newAlert(escalated);
                if (store.insert(created)) {
                    return MaterializationResult.created(store.findById(created.getAlertId()).orElse(created));
                }
                // Same id already stored, by this run on an earlier attempt or a concurrent writer.
                Optional<Alert> existing = store.findById(created.getAlertId());
                if (existing.isPresent() && !existing.get().isOpen()) {
                    return MaterializationResult.unchanged(existing.get());
                }
                continue;
            }

            Alert existing = match.get();
            Alert merged = merge(existing, escalated);
            if (store.replace(merged, existing.getVersion())) {
                boolean raised = merged.getSeverity().compareTo(existing.getSeverity()) > 0;
                return MaterializationResult.merged(store.findById(merged.getAlertId()).orElse(merged), raised);
            }
            LOG.debug("Concurrent update of alert {}, re-reading", existing.getAlertId());
        }
        throw new AlertStoreException("Alert for " + escalated.getKey() + " kept changing concurrently", true);
    }

    private Alert newAlert(Case escalated) {
        Instant now = clock.instant();
        FusionResult fusion = escalated.getFusion();
        Map<String, Object> metadata = caseMetadata(escalated);
        metadata.put(META_MERGE_COUNT, 0);
        metadata.put(META_FUSION_RESULTS, List.of(fusion.getResultId()));

        return Alert.builder()
                .alertId(alertId(escalated.getKey(), escalated.getRunId()))
                .runId(escalated.getRunId())
                .fusionResultId(fusion.getResultId())
                .location(escalated.getKey().getLocation())
                .timeBucket(escalated.getKey().getTimeBucket())
                .createdAt(now)
                .updatedAt(now)
                .anomalyScore(fusion.getCompositeScore())
                .confidence(fusion.getConfidence())
                .severity(escalated.getSeverity())
                .evidence(escalated.getEvidence().toSnapshot())
                .recommendedActions(escalated.getActions())
                .status(AlertStatus.ACTIVE)
                .notified(false)
                .metadata(metadata)
                .build();
    }

    private Alert merge(Alert existing, Case escalated) {
        FusionResult fusion = escalated.getFusion();
        LocalDate bucket = escalated.getKey().getTimeBucket();
        Severity severity = Severity.max(existing.getSeverity(), escalated.getSeverity());

        LinkedHashSet<RecommendedAction> actions = new LinkedHashSet<>(existing.getRecommendedActions());
        actions.addAll(escalated.getActions());

        Map<String, Object> metadata = new LinkedHashMap<>(existing.getMetadata());
        metadata.putAll(caseMetadata(escalated));
        Object count = existing.getMetadata().get(META_MERGE_COUNT);
        metadata.put(META_MERGE_COUNT, (count instanceof Number n ? n.intValue() : 0) + 1);
        metadata.put("last_merged_run", escalated.getRunId());
        List<Object> results = new ArrayList<>();
        if (existing.getMetadata().get(META_FUSION_RESULTS) instanceof List<?> recorded) {
            results.addAll(recorded);
        }
        results.add(fusion.getResultId());
        metadata.put(META_FUSION_RESULTS, results);

        return existing.toBuilder()
                .fusionResultId(fusion.getResultId())
                .windowStart(bucket.isBefore(existing.getWindowStart()) ? bucket : existing.getWindowStart())
                .windowEnd(bucket.isAfter(existing.getWindowEnd()) ? bucket : existing.getWindowEnd())
                .updatedAt(clock.instant())
                .anomalyScore(fusion.getCompositeScore())
                .confidence(fusion.getConfidence())
                .severity(severity)
                .evidence(escalated.getEvidence().toSnapshot())
                .recommendedActions(new ArrayList<>(actions))
                .metadata(metadata)
                .build();
    }

    private static boolean recordsFusionResult(Alert alert, String resultId) {
        if (resultId.equals(alert.getFusionResultId())) {
            return true;
        }
        return alert.getMetadata().get(META_FUSION_RESULTS) instanceof List<?> recorded
                && recorded.contains(resultId);
    }

    private static Map<String, Object> caseMetadata(Case c) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("run_id", c.getRunId());
        metadata.put("fusion_result_id", c.getFusion().getResultId());
        metadata.put("source_bucket", c.getKey().getTimeBucket().toString());
        metadata.put("valid_detectors", c.getFusion().getValidDetectors());
        metadata.put("total_detectors", c.getFusion().getTotalDetectors());
        metadata.put("corroborating_sources", c.getCorroborating().stream().map(SourceCategory::key).toList());
        List<String> verdicts = new ArrayList<>();
        for (StageVerdict v : c.getVerdicts()) {
            verdicts.add(v.toString());
        }
        metadata.put("verdicts", verdicts);
        if (c.getNarrative() != null) {
            metadata.put("narrative", c.getNarrative());
        }
        return metadata;
    }

    // ---------------------------------------------------------------
    // Status and notification
    // ---------------------------------------------------------------

    /**
     * @param alertId alert to change
     * @param target  requested status
     * @return the updated alert
     * @throws AlertNotFoundException      if no such alert exists
     * @throws InvalidTransitionException  if the state machine forbids the change
     * @throws AlertPersistenceException   if the store keeps failing
     */
    public Alert transition(String alertId, AlertStatus target) {
        Objects.requireNonNull(target, "target status must not be null");
        Alert updated = update(alertId, "transition " + alertId, current -> {
            if (!current.getStatus().canTransitionTo(target)) {
                throw new InvalidTransitionException(alertId, current.getStatus(), target);
            }
            return Optional.of(current.toBuilder().status(target).updatedAt(clock.instant()).build());
        });
        LOG.info("Alert {} is now {}", alertId, target.key());
        return updated;
    }

    /**
     * Record a definitive notification outcome. Calling it again is a no-op.
     *
     * @return the alert with {@code notified = true}
     * @throws AlertNotFoundException    if no such alert exists
     * @throws AlertPersistenceException if the store keeps failing
     */
    public Alert markNotified(String alertId) {
        return update(alertId, "mark notified " + alertId, current -> current.isNotified()
                ? Optional.empty()
                : Optional.of(current.toBuilder().notified(true).updatedAt(clock.instant()).build()));
    }

    public Optional<Alert> find(String alertId) {
        return withRetry("find " + alertId, () -> store.findById(alertId));
    }

    public List<Alert> alertsForLocation(String location) {
        return withRetry("list " + location, () -> store.findByLocation(location));
    }

    /**
     * Read-modify-write with compare-and-set. {@code change} returns empty
     * when the alert already has the desired state.
     */
    private Alert update(String alertId, String description,
            Function<Alert, Optional<Alert>> change) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        return withRetry(description, () -> {
            for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
                Alert current = store.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
                Optional<Alert> next = change.apply(current);
                if (next.isEmpty()) {
                    return current;
                }
                if (store.replace(next.get(), current.getVersion())) {
                    return store.findById(alertId).orElse(next.get());
                }
            }
            throw new AlertStoreException("Alert " + alertId + " kept changing concurrently", true);
        });
    }

    private <T> T withRetry(String description, Supplier<T> operation) {
        int maxAttempts = settings.getMaxPersistAttempts();
        long backoff = settings.getInitialBackoffMs();
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (AlertStoreException e) {
                if (!e.isTransient()) {
                    throw new AlertPersistenceException("Failed to " + description + ": " + e.getMessage(),
                            attempt, e);
                }
                if (attempt >= maxAttempts) {
                    LOG.error("Giving up on {} after {} attempt(s)", description, attempt, e);
                    throw new AlertPersistenceException("Failed to " + description + " after " + attempt
                            + " attempt(s): " + e.getMessage(), attempt, e);
                }
                LOG.warn("Attempt {}/{} to {} failed, retrying in {} ms: {}",
                        attempt, maxAttempts, description, backoff, e.getMessage());
                try {
                    sleeper.sleep(Duration.ofMillis(backoff));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new AlertPersistenceException("Interrupted while retrying " + description, attempt, ie);
                }
                backoff = (long) (backoff * settings.getBackoffMultiplier());
            }
        }
    }
}
