package com.riskmodels.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskmodels.client.ArtifactStore;
import com.riskmodels.dto.DeploymentRecordResponse;
import com.riskmodels.dto.ModelMetadata;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.RegistryStatsResponse;
import com.riskmodels.dto.VersionComparisonResponse;
import com.riskmodels.entity.DeploymentAction;
import com.riskmodels.entity.DeploymentRecord;
import com.riskmodels.entity.ModelLineage;
import com.riskmodels.entity.ModelStatus;
import com.riskmodels.entity.ModelVersionRecord;
import com.riskmodels.exception.ArtifactStorageException;
import com.riskmodels.exception.ConcurrentPromotionConflictException;
import com.riskmodels.exception.InvalidMetricException;
import com.riskmodels.exception.InvalidRollbackException;
import com.riskmodels.exception.InvalidStatusTransitionException;
import com.riskmodels.exception.ModelLifecycleException;
import com.riskmodels.exception.ModelNotFoundException;
import com.riskmodels.exception.RegistrationTimeoutException;
import com.riskmodels.repository.DeploymentRecordRepository;
import com.riskmodels.repository.ModelLineageRepository;
import com.riskmodels.repository.ModelVersionRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Source of truth for model versions, their lifecycle status and the deployment audit trail.
 *
 * <p>All status changes for one model family go through {@link #setStatus} or
 * {@link #rollback}. Both run inside a per-model critical section: an in-process lock plus a
 * pessimistic lock on the family's {@link ModelLineage} row, so at most one version is ever
 * PRODUCTION and deployment records are numbered in execution order.</p>
 *
 * <p>{@link #getProduction} is on the inference path and is answered from an in-process
 * cache that is refreshed after every committed status change.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    public static final String DEFAULT_SORT_METRIC = "roc_auc";

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,100}$");
    private static final DateTimeFormatter VERSION_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final TypeReference<Map<String, List<Double>>> SAMPLE_TYPE = new TypeReference<>() {};

    private final ModelVersionRepository versionRepository;
    private final ModelLineageRepository lineageRepository;
    private final DeploymentRecordRepository deploymentRepository;
    private final ArtifactStore artifactStore;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    @Value("${lifecycle.registry.registration-timeout:PT5S}")
    private Duration registrationTimeout = Duration.ofSeconds(5);

    @Value("${lifecycle.registry.lock-timeout:PT10S}")
    private Duration lockTimeout = Duration.ofSeconds(10);

    @Value("${lifecycle.registry.production-cache-ttl:PT30S}")
    private Duration productionCacheTtl = Duration.ofSeconds(30);

    @Value("${lifecycle.registry.default-history-limit:50}")
    private int defaultHistoryLimit = 50;

    @Value("${lifecycle.registry.registration-pool-size:4}")
    private int registrationPoolSize = 4;

    private ExecutorService registrationExecutor;
    private final ConcurrentHashMap<String, ReentrantLock> modelLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CachedProduction> productionCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> cacheGenerations = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        registrationExecutor = Executors.newFixedThreadPool(Math.max(1, registrationPoolSize));
    }

    @PreDestroy
    void shutdown() {
        if (registrationExecutor != null) {
            registrationExecutor.shutdown();
        }
    }

    // ---------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------

    /**
     * Stores the artifact and creates a REGISTERED version. The artifact write and the insert
     * share one deadline; when it passes, {@link RegistrationTimeoutException} is thrown and
     * the insert is rolled back.
     */
    public String register(String modelName, byte[] artifact, ModelMetadata metadata) {
        validateName(modelName);
        if (artifact == null || artifact.length == 0) {
            throw new ArtifactStorageException("Artifact for '" + modelName + "' is empty", null);
        }
        ModelMetadata meta = metadata != null ? metadata : ModelMetadata.builder().build();
        String versionId = newVersionId();
        long deadline = System.nanoTime() + registrationTimeout.toNanos();
        AtomicBoolean abandoned = new AtomicBoolean(false);

        Future<ModelVersionRecord> pending = registrationExecutor.submit(
            () -> persistRegistration(modelName, versionId, artifact, meta, deadline, abandoned));
        try {
            ModelVersionRecord saved = pending.get(registrationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Model registered | model={} | version={} | datasetRef={} | artifact={}",
                     modelName, versionId, saved.getDatasetRef(), saved.getArtifactLocation());
            return saved.getVersionId();
        } catch (TimeoutException ex) {
            abandoned.set(true);
            pending.cancel(true);
            log.warn("Registration timed out | model={} | version={} | budget={}", modelName, versionId, registrationTimeout);
            throw new RegistrationTimeoutException(modelName, registrationTimeout, ex);
        } catch (InterruptedException ex) {
            abandoned.set(true);
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new RegistrationTimeoutException(modelName, registrationTimeout, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ArtifactStorageException("Registration of '" + modelName + "' failed", cause);
        }
    }

    private ModelVersionRecord persistRegistration(String modelName, String versionId, byte[] artifact,
                                                   ModelMetadata meta, long deadline, AtomicBoolean abandoned) {
        String artifactLocation = artifactStore.put(artifact);
        String referenceLocation = null;
        try {
            if (meta.getReferenceSample() != null && !meta.getReferenceSample().isEmpty()) {
                referenceLocation = artifactStore.put(writeSample(meta.getReferenceSample()));
            }
            return insertVersion(modelName, versionId, meta, artifactLocation, referenceLocation, deadline, abandoned);
        } catch (RuntimeException ex) {
            discardBlobs(modelName, artifactLocation, referenceLocation);
            throw ex;
        }
    }

    private ModelVersionRecord insertVersion(String modelName, String versionId, ModelMetadata meta,
                                             String artifactLocation, String referenceHandle, long deadline,
                                             AtomicBoolean abandoned) {
        return withModelLock(modelName, () -> transactionTemplate.execute(tx -> {
            if (lineageRepository.findById(modelName).isEmpty()) {
                lineageRepository.save(ModelLineage.builder().modelName(modelName).build());
            }
            ModelVersionRecord saved = versionRepository.save(ModelVersionRecord.builder()
                .modelName(modelName)
                .versionId(versionId)
                .createdAt(Instant.now())
                .datasetRef(meta.getDatasetRef())
                .datasetSnapshotAt(meta.getDatasetSnapshotAt())
                .hyperparameters(new LinkedHashMap<>(meta.getHyperparameters()))
                .featureSchema(new ArrayList<>(meta.getFeatureSchema()))
                .metrics(new LinkedHashMap<>(meta.getMetrics()))
                .trainingSampleCount(meta.getTrainingSampleCount())
                .artifactLocation(artifactLocation)
                .referenceSampleLocation(referenceHandle)
                .status(ModelStatus.REGISTERED)
                .registeredBy(meta.getRegisteredBy() != null ? meta.getRegisteredBy() : "system")
                .build());
            versionRepository.flush();
            if (abandoned.get() || System.nanoTime() > deadline) {
                // roll back rather than leave a row the caller was told does not exist
                throw new RegistrationTimeoutException(modelName, registrationTimeout, null);
            }
            return saved;
        }));
    }

    private void discardBlobs(String modelName, String... handles) {
        for (String handle : handles) {
            if (handle == null) {
                continue;
            }
            try {
                artifactStore.delete(handle);
            } catch (RuntimeException ex) {
                log.warn("Orphaned artifact left behind | model={} | handle={} | reason={}",
                         modelName, handle, ex.getMessage());
            }
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public ModelVersionResponse get(String modelName, String versionId) {
        return versionRepository.findByModelNameAndVersionId(modelName, versionId)
            .map(this::toResponse)
            .orElseThrow(() -> ModelNotFoundException.version(modelName, versionId));
    }

    /**
     * Current PRODUCTION version, served from the cache while the entry is fresh. A value
     * loaded before a concurrent status change committed is returned but never cached.
     */
    public ModelVersionResponse getProduction(String modelName) {
        CachedProduction cached = productionCache.get(modelName);
        if (cached != null && !cached.isExpired(productionCacheTtl)) {
            return cached.version();
        }
        long generation = generation(modelName).get();
        ModelVersionResponse production = loadProduction(modelName);
        cacheIfCurrent(modelName, production, generation);
        return production;
    }

    public List<ModelVersionResponse> listVersions(String modelName, ModelStatus status) {
        List<ModelVersionRecord> records = status == null
            ? versionRepository.findByModelNameOrderByCreatedAtDescVersionIdDesc(modelName)
            : versionRepository.findByModelNameAndStatusOrderByCreatedAtDescVersionIdDesc(modelName, status);
        return records.stream().map(this::toResponse).toList();
    }

    /**
     * Ranks versions by {@code sortMetric} (default {@value #DEFAULT_SORT_METRIC}), best first.
     * An empty {@code versionIds} compares every version of the model.
     */
    public List<VersionComparisonResponse> compareVersions(String modelName, List<String> versionIds, String sortMetric) {
        String metric = sortMetric == null || sortMetric.isBlank() ? DEFAULT_SORT_METRIC : sortMetric;
        List<ModelVersionRecord> records;
        if (versionIds == null || versionIds.isEmpty()) {
            records = versionRepository.findByModelNameOrderByCreatedAtDescVersionIdDesc(modelName);
            if (records.isEmpty()) {
                throw new ModelNotFoundException("Model '" + modelName + "' has no registered versions.");
            }
        } else {
            Set<String> requested = new LinkedHashSet<>(versionIds);
            records = versionRepository.findByModelNameAndVersionIdIn(modelName, requested);
            Set<String> found = new LinkedHashSet<>();
            records.forEach(r -> found.add(r.getVersionId()));
            requested.stream()
                .filter(id -> !found.contains(id))
                .findFirst()
                .ifPresent(id -> { throw ModelNotFoundException.version(modelName, id); });
        }

        for (ModelVersionRecord r : records) {
            Double value = r.getMetrics().get(metric);
            if (value == null || value.isNaN()) {
                throw new InvalidMetricException(metric, r.getVersionId());
            }
        }

        List<ModelVersionRecord> ranked = records.stream()
            .sorted(Comparator.comparing((ModelVersionRecord r) -> r.getMetrics().get(metric)).reversed()
                .thenComparing(ModelVersionRecord::getCreatedAt, Comparator.reverseOrder()))
            .toList();

        List<VersionComparisonResponse> result = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            ModelVersionRecord r = ranked.get(i);
            result.add(VersionComparisonResponse.builder()
                .rank(i + 1)
                .versionId(r.getVersionId())
                .status(r.getStatus())
                .createdAt(r.getCreatedAt())
                .sortMetric(metric)
                .sortValue(r.getMetrics().get(metric))
                .metrics(Map.copyOf(r.getMetrics()))
                .datasetRef(r.getDatasetRef())
                .trainingSampleCount(r.getTrainingSampleCount())
                .build());
        }
        log.debug("Compared versions | model={} | count={} | metric={}", modelName, result.size(), metric);
        return result;
    }

    public List<DeploymentRecordResponse> getDeploymentHistory(String modelName, Integer limit) {
        int size = limit != null && limit > 0 ? limit : defaultHistoryLimit;
        return deploymentRepository.findByModelNameOrderBySequenceDesc(modelName, PageRequest.of(0, size))
            .stream()
            .map(this::toResponse)
            .toList();
    }

    public List<String> listModelNames() {
        return versionRepository.findDistinctModelNames();
    }

    public RegistryStatsResponse statistics() {
        Map<ModelStatus, Long> byStatus = new EnumMap<>(ModelStatus.class);
        for (ModelStatus s : ModelStatus.values()) {
            byStatus.put(s, 0L);
        }
        long total = 0;
        for (Object[] row : versionRepository.countByStatus()) {
            long count = ((Number) row[1]).longValue();
            byStatus.put((ModelStatus) row[0], count);
            total += count;
        }
        return RegistryStatsResponse.builder()
            .totalModels(versionRepository.findDistinctModelNames().size())
            .totalVersions(total)
            .modelsInProduction(lineageRepository.countByProductionVersionIdIsNotNull())
            .versionsByStatus(byStatus)
            .build();
    }

    /** Training-time feature sample stored with the version, keyed by feature name. */
    public Map<String, double[]> loadReferenceSample(ModelVersionResponse version) {
        if (version.getReferenceSampleLocation() == null) {
            return Map.of();
        }
        try {
            Map<String, List<Double>> raw = objectMapper.readValue(
                artifactStore.get(version.getReferenceSampleLocation()), SAMPLE_TYPE);
            Map<String, double[]> sample = new LinkedHashMap<>();
            raw.forEach((feature, values) ->
                sample.put(feature, values.stream().mapToDouble(Double::doubleValue).toArray()));
            return sample;
        } catch (IOException ex) {
            throw new ArtifactStorageException(
                "Reference sample of " + version.getModelName() + "/" + version.getVersionId() + " is unreadable", ex);
        }
    }

    // ---------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------

    /** Merges held-out evaluation metrics into a version. Not a status change. */
    public ModelVersionResponse recordEvaluationMetrics(String modelName, String versionId, Map<String, Double> metrics) {
        ModelVersionResponse updated = transactionTemplate.execute(tx -> {
            ModelVersionRecord record = findVersion(modelName, versionId);
            record.getMetrics().putAll(metrics);
            return toResponse(versionRepository.save(record));
        });
        if (updated != null && updated.getStatus() == ModelStatus.PRODUCTION) {
            invalidateProduction(modelName);
        }
        return updated;
    }

    /**
     * The only way a version's status changes outside a rollback. Promoting to PRODUCTION
     * archives the current PRODUCTION version in the same transaction. Appends exactly one
     * deployment record.
     */
    public DeploymentRecordResponse setStatus(String modelName, String versionId, ModelStatus newStatus,
                                              String actor, String reason) {
        if (newStatus == null) {
            throw new IllegalArgumentException("Target status must not be null");
        }
        requireActor(actor);
        DeploymentRecordResponse record = mutate(modelName, () -> {
            ModelLineage lineage = lockLineage(modelName);
            ModelVersionRecord target = findVersion(modelName, versionId);
            ModelStatus previous = target.getStatus();
            if (!previous.canTransitionTo(newStatus)) {
                throw new InvalidStatusTransitionException(versionId, previous, newStatus);
            }

            Instant now = Instant.now();
            String replaced = null;
            if (newStatus == ModelStatus.PRODUCTION) {
                replaced = demoteProduction(lineage, versionId);
                target.setDeployedAt(now);
                lineage.setProductionVersionId(versionId);
            } else if (previous == ModelStatus.PRODUCTION) {
                lineage.setProductionVersionId(null);
            }
            target.setStatus(newStatus);
            versionRepository.save(target);

            return append(lineage, target, DeploymentAction.forTarget(newStatus), previous, replaced, actor, reason, now);
        });
        log.info("Status changed | model={} | version={} | {} -> {} | replaced={} | actor={}",
                 modelName, versionId, record.getPreviousStatus(), newStatus, record.getReplacedVersionId(), actor);
        return record;
    }

    /**
     * Atomically archives the current PRODUCTION version (if any) and restores
     * {@code targetVersionId}. The reason is mandatory.
     */
    public DeploymentRecordResponse rollback(String modelName, String targetVersionId, String actor, String reason) {
        requireActor(actor);
        if (reason == null || reason.isBlank()) {
            throw new InvalidRollbackException("Rollback of '" + modelName + "' requires a non-empty reason.");
        }
        DeploymentRecordResponse record = mutate(modelName, () -> {
            ModelLineage lineage = lockLineage(modelName);
            ModelVersionRecord target = findVersion(modelName, targetVersionId);
            ModelStatus previous = target.getStatus();
            if (previous == ModelStatus.PRODUCTION) {
                throw new InvalidRollbackException("Version '" + targetVersionId + "' is already in PRODUCTION.");
            }
            if (!previous.isRollbackTarget()) {
                throw new InvalidRollbackException(
                    "Version '" + targetVersionId + "' is " + previous + "; only ARCHIVED, STAGING or ROLLED_BACK versions can be restored.");
            }

            Instant now = Instant.now();
            String replaced = demoteProduction(lineage, targetVersionId);
            target.setStatus(ModelStatus.PRODUCTION);
            target.setDeployedAt(now);
            lineage.setProductionVersionId(targetVersionId);
            versionRepository.save(target);

            return append(lineage, target, DeploymentAction.ROLLBACK, previous, replaced, actor, reason, now);
        });
        log.warn("Rollback applied | model={} | restored={} | replaced={} | actor={} | reason={}",
                 modelName, targetVersionId, record.getReplacedVersionId(), actor, reason);
        return record;
    }

    private <T> T mutate(String modelName, Supplier<T> work) {
        try {
            return withModelLock(modelName, () -> {
                T result = transactionTemplate.execute(tx -> work.get());
                refreshProductionCache(modelName);
                return result;
            });
        } catch (OptimisticLockingFailureException | PessimisticLockingFailureException ex) {
            invalidateProduction(modelName);
            throw new ConcurrentPromotionConflictException(modelName, ex);
        }
    }

    private <T> T withModelLock(String modelName, Supplier<T> work) {
        ReentrantLock lock = modelLocks.computeIfAbsent(modelName, k -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ConcurrentPromotionConflictException(modelName, ex);
        }
        if (!acquired) {
            throw new ConcurrentPromotionConflictException(modelName, null);
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private String demoteProduction(ModelLineage lineage, String incomingVersionId) {
        String replaced = null;
        List<ModelVersionRecord> current = versionRepository
            .findByModelNameAndStatusOrderByCreatedAtDescVersionIdDesc(lineage.getModelName(), ModelStatus.PRODUCTION);
        for (ModelVersionRecord r : current) {
            if (r.getVersionId().equals(incomingVersionId)) {
                continue;
            }
            r.setStatus(ModelStatus.ARCHIVED);
            versionRepository.save(r);
            if (replaced == null || r.getVersionId().equals(lineage.getProductionVersionId())) {
                replaced = r.getVersionId();
            }
        }
        return replaced;
    }

    private DeploymentRecordResponse append(ModelLineage lineage, ModelVersionRecord target, DeploymentAction action,
                                            ModelStatus previous, String replaced, String actor, String reason,
                                            Instant now) {
        long sequence = lineage.nextSequence();
        lineageRepository.save(lineage);
        DeploymentRecord saved = deploymentRepository.save(DeploymentRecord.builder()
            .modelName(lineage.getModelName())
            .versionId(target.getVersionId())
            .sequence(sequence)
            .action(action)
            .previousStatus(previous)
            .newStatus(target.getStatus())
            .replacedVersionId(replaced)
            .actor(actor)
            .occurredAt(now)
            .reason(reason)
            .build());
        return toResponse(saved);
    }

    private ModelLineage lockLineage(String modelName) {
        return lineageRepository.findForUpdate(modelName)
            .orElseThrow(() -> new ModelNotFoundException("Model '" + modelName + "' is not registered."));
    }

    private ModelVersionRecord findVersion(String modelName, String versionId) {
        return versionRepository.findByModelNameAndVersionId(modelName, versionId)
            .orElseThrow(() -> ModelNotFoundException.version(modelName, versionId));
    }

    private ModelVersionResponse loadProduction(String modelName) {
        String productionId = lineageRepository.findById(modelName)
            .map(ModelLineage::getProductionVersionId)
            .orElse(null);
        if (productionId == null) {
            throw ModelNotFoundException.production(modelName);
        }
        return get(modelName, productionId);
    }

    /** Runs under the model lock after a commit; readers that started earlier lose their put. */
    private void refreshProductionCache(String modelName) {
        long generation = invalidateProduction(modelName);
        try {
            cacheIfCurrent(modelName, loadProduction(modelName), generation);
        } catch (ModelNotFoundException ex) {
            log.debug("No production version after status change | model={}", modelName);
        } catch (ModelLifecycleException | DataAccessException ex) {
            log.warn("Production cache refresh failed | model={} | reason={}", modelName, ex.getMessage());
        }
    }

    private long invalidateProduction(String modelName) {
        long next = generation(modelName).incrementAndGet();
        productionCache.remove(modelName);
        return next;
    }

    private void cacheIfCurrent(String modelName, ModelVersionResponse production, long generation) {
        productionCache.compute(modelName, (name, existing) -> {
            if (generation(name).get() != generation) {
                return existing;
            }
            if (existing != null && existing.generation() > generation) {
                return existing;
            }
            return new CachedProduction(production, Instant.now(), generation);
        });
    }

    private AtomicLong generation(String modelName) {
        return cacheGenerations.computeIfAbsent(modelName, k -> new AtomicLong());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static String newVersionId() {
        return "v" + VERSION_TIMESTAMP.format(Instant.now()) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void validateName(String modelName) {
        if (modelName == null || !NAME_PATTERN.matcher(modelName).matches()) {
            throw new IllegalArgumentException("Model name must match " + NAME_PATTERN.pattern());
        }
    }

    private void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Actor must not be blank");
        }
    }

    private byte[] writeSample(Map<String, List<Double>> sample) {
        try {
            return objectMapper.writeValueAsBytes(sample);
        } catch (JsonProcessingException ex) {
            throw new ArtifactStorageException("Reference sample could not be serialised", ex);
        }
    }

    private ModelVersionResponse toResponse(ModelVersionRecord r) {
        return ModelVersionResponse.builder()
            .modelName(r.getModelName())
            .versionId(r.getVersionId())
            .createdAt(r.getCreatedAt())
            .datasetRef(r.getDatasetRef())
            .datasetSnapshotAt(r.getDatasetSnapshotAt())
            .hyperparameters(Map.copyOf(r.getHyperparameters()))
            .featureSchema(List.copyOf(r.getFeatureSchema()))
            .metrics(Map.copyOf(r.getMetrics()))
            .trainingSampleCount(r.getTrainingSampleCount())
            .artifactLocation(r.getArtifactLocation())
            .referenceSampleLocation(r.getReferenceSampleLocation())
            .status(r.getStatus())
            .deployedAt(r.getDeployedAt())
            .registeredBy(r.getRegisteredBy())
            .build();
    }

    private DeploymentRecordResponse toResponse(DeploymentRecord d) {
        return DeploymentRecordResponse.builder()
            .modelName(d.getModelName())
            .versionId(d.getVersionId())
            .sequence(d.getSequence())
            .action(d.getAction())
            .previousStatus(d.getPreviousStatus())
            .newStatus(d.getNewStatus())
            .replacedVersionId(d.getReplacedVersionId())
            .actor(d.getActor())
            .occurredAt(d.getOccurredAt())
            .reason(d.getReason())
            .build();
    }

    private record CachedProduction(ModelVersionResponse version, Instant loadedAt, long generation) {
        private boolean isExpired(Duration ttl) {
            return loadedAt.plus(ttl).isBefore(Instant.now());
        }
    }
}
