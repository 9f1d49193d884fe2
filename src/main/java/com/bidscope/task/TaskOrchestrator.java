package com.bidscope.task;

import com.bidscope.analytics.ContractExplorerService;
import com.bidscope.analytics.PreparedQuery;
import com.bidscope.cache.Fingerprints;
import com.bidscope.cache.ResultCache;
import com.bidscope.config.BidScopeProperties;
import com.bidscope.domain.ContractQueryRequest;
import com.bidscope.domain.ExportEstimate;
import com.bidscope.error.BidScopeException;
import com.bidscope.error.CancelledException;
import com.bidscope.error.CapacityException;
import com.bidscope.error.NotFoundException;
import com.bidscope.export.CancellationToken;
import com.bidscope.export.ExportArtifact;
import com.bidscope.export.ExportPipeline;
import com.bidscope.export.ExportProgressListener;
import com.bidscope.export.WriterExportSink;
import com.bidscope.filter.FilterSpec;
import com.bidscope.query.Dimension;
import com.bidscope.query.QueryMetrics;
import com.bidscope.query.QueryPlan;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs searches, aggregates and exports in the background with progress, cancellation and
 * retries.
 *
 * <p>Work runs on a bounded elastic scheduler whose thread cap is the worker count, which also
 * caps concurrent heavy queries against the store. Submissions beyond workers plus queue capacity
 * are refused with {@link CapacityException}. Store failures are retried with exponential backoff;
 * everything else fails the task at once. Results go to the {@link ResultCache} under the key
 * returned at submission.
 *
 * <p>Progress for searches and aggregates is reported at 10 (compiled), 30 (querying) and
 * 80 (caching); exports report once per flushed batch as rows written over the estimate.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final ContractExplorerService explorer;
    private final ExportPipeline exportPipeline;
    private final ResultCache cache;
    private final TaskRegistry registry;
    private final TaskEventPublisher publisher;
    private final QueryMetrics metrics;
    private final BidScopeProperties.Tasks settings;
    private final Duration exportResultTtl;
    private final Path exportDirectory;
    private final Scheduler scheduler;

    @Autowired
    public TaskOrchestrator(ContractExplorerService explorer,
                            ExportPipeline exportPipeline,
                            ResultCache cache,
                            TaskRegistry registry,
                            TaskEventPublisher publisher,
                            QueryMetrics metrics,
                            BidScopeProperties properties) {
        this(explorer, exportPipeline, cache, registry, publisher, metrics, properties,
            Schedulers.newBoundedElastic(properties.getTasks().getWorkers(),
                properties.getTasks().getQueueCapacity(), "bidscope-task"));
    }

    TaskOrchestrator(ContractExplorerService explorer,
                     ExportPipeline exportPipeline,
                     ResultCache cache,
                     TaskRegistry registry,
                     TaskEventPublisher publisher,
                     QueryMetrics metrics,
                     BidScopeProperties properties,
                     Scheduler scheduler) {
        this.explorer = explorer;
        this.exportPipeline = exportPipeline;
        this.cache = cache;
        this.registry = registry;
        this.publisher = publisher;
        this.metrics = metrics;
        this.settings = properties.getTasks();
        this.exportResultTtl = properties.getCache().getTaskResultTtl();
        this.exportDirectory = Paths.get(properties.getExport().getDirectory());
        this.scheduler = scheduler;

        log.info("Task orchestrator initialized (workers={}, queueCapacity={}, maxRetries={})",
            settings.getWorkers(), settings.getQueueCapacity(), settings.getMaxRetries());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.dispose();
    }

    // ========== Submission ==========

    /**
     * Validate and enqueue. Validation failures are thrown here and never create a task.
     */
    public TaskSubmission submit(TaskKind kind, ContractQueryRequest request) {
        int limit = settings.getWorkers() + settings.getQueueCapacity();

        String taskId = UUID.randomUUID().toString();
        TaskRecord record;
        Work work;
        Retry retry;

        switch (kind) {
            case SEARCH:
            case AGGREGATE: {
                PreparedQuery<?> prepared = kind == TaskKind.SEARCH
                    ? explorer.prepareSearch(request)
                    : explorer.prepareAggregateTask(request);
                record = new TaskRecord(taskId, kind, prepared.getCacheKey(), registry.now());
                work = task -> runQuery(task, prepared);
                retry = retrySpec(record, settings.getMaxRetries(), settings.getRetryBackoff());
                break;
            }
            case EXPORT: {
                FilterSpec spec = explorer.parseFilters(request);
                QueryPlan plan = explorer.prepareExportPlan(request);
                Dimension dimension = request.getDimension() == null || request.getDimension().isBlank()
                    ? null
                    : explorer.dimension(request.getDimension(), "dimension");
                Map<String, Object> params = new LinkedHashMap<>();
                params.put("task_id", taskId);
                params.put("dimension", dimension == null ? "" : dimension.getValue());
                record = new TaskRecord(taskId, kind, Fingerprints.key("export", spec, params), registry.now());
                work = task -> runExport(task, plan, dimension);
                retry = retrySpec(record, settings.getExportMaxRetries(), settings.getExportRetryBackoff());
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported task kind: " + kind);
        }

        if (!registry.registerWithin(record, limit)) {
            throw new CapacityException("Task queue is full (" + limit + " active tasks); retry later", "task_submit");
        }
        metrics.recordTaskSubmitted();
        publish(record);
        log.info("Submitted {} task {} (cache key {})", kind.getValue(), taskId, record.getCacheKey());

        Disposable subscription = Mono.fromCallable(() -> attempt(record, work))
            .subscribeOn(scheduler)
            .retryWhen(retry)
            .subscribe(value -> onSuccess(record), error -> onError(record, error));
        record.attachSubscription(subscription);

        return new TaskSubmission(taskId, record.getCacheKey(), record.getState());
    }

    private Retry retrySpec(TaskRecord record, int maxRetries, Duration backoff) {
        return Retry.backoff(maxRetries, backoff)
            .filter(TaskOrchestrator::isRetryable)
            .doBeforeRetry(signal -> {
                metrics.recordTaskRetry();
                log.warn("Retrying task {} after attempt {} failed: {}", record.getId(),
                    signal.totalRetries() + 1, signal.failure().getMessage());
            })
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof BidScopeException && ((BidScopeException) error).isRetryable();
    }

    // ========== Execution ==========

    @FunctionalInterface
    private interface Work {
        Object run(TaskRecord record) throws Exception;
    }

    private Object attempt(TaskRecord record, Work work) throws Exception {
        checkCancelled(record);
        if (record.start(registry.now())) {
            publish(record);
        }
        return work.run(record);
    }

    private Object runQuery(TaskRecord record, PreparedQuery<?> prepared) {
        Optional<Object> cached = cache.get(prepared.getCacheKey());
        if (cached.isPresent()) {
            log.debug("Task {} served from cache", record.getId());
            return cached.get();
        }

        progress(record, 10, "Filters compiled");
        progress(record, 30, record.getKind() == TaskKind.SEARCH ? "Searching contracts" : "Computing aggregates");
        Object value = prepared.run();
        checkCancelled(record);

        progress(record, 80, "Caching results");
        cache.put(prepared.getCacheKey(), value, prepared.getTtl());
        return value;
    }

    private Object runExport(TaskRecord record, QueryPlan plan, Dimension dimension) throws IOException {
        progress(record, 1, "Estimating export size");
        ExportEstimate estimate = dimension == null
            ? exportPipeline.estimate(plan)
            : exportPipeline.estimateAggregated(plan, dimension);
        long expected = Math.max(1, estimate.getTotalCount());

        Files.createDirectories(exportDirectory);
        Path file = exportDirectory.resolve(record.getId() + ".csv");
        CancellationToken token = record.getCancellationToken();
        ExportProgressListener listener = rows ->
            progress(record, (int) Math.min(99, rows * 100 / expected), "Exported " + rows + " rows");

        long rows;
        long bytes;
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            WriterExportSink sink = new WriterExportSink(writer);
            rows = dimension == null
                ? exportPipeline.stream(plan, sink, token, listener)
                : exportPipeline.streamAggregated(plan, dimension, sink, token, listener);
            bytes = sink.getBytesWritten();
        } catch (RuntimeException e) {
            Files.deleteIfExists(file);
            throw e;
        }

        if (token.isCancelled()) {
            Files.deleteIfExists(file);
            throw new CancelledException("Export cancelled after " + rows + " rows");
        }

        ExportArtifact artifact = new ExportArtifact(file.getFileName().toString(), rows,
            estimate.getTotalCount(), bytes);
        cache.put(record.getCacheKey(), artifact, exportResultTtl);
        return artifact;
    }

    private void checkCancelled(TaskRecord record) {
        if (record.getCancellationToken().isCancelled()) {
            throw new CancelledException("Task " + record.getId() + " was cancelled");
        }
    }

    private void progress(TaskRecord record, int percent, String message) {
        checkCancelled(record);
        if (record.progress(percent, message)) {
            publish(record);
        }
    }

    private void onSuccess(TaskRecord record) {
        if (record.succeed(registry.now())) {
            metrics.recordTaskSucceeded();
            publish(record);
            log.info("Task {} completed", record.getId());
        } else {
            log.debug("Task {} finished after reaching {}; result kept in cache only", record.getId(),
                record.getState());
        }
    }

    private void onError(TaskRecord record, Throwable error) {
        if (error instanceof CancelledException) {
            if (record.cancel(registry.now())) {
                metrics.recordTaskCancelled();
                publish(record);
            }
            log.info("Task {} stopped after cancellation", record.getId());
            return;
        }
        if (record.fail(summarize(error), registry.now())) {
            metrics.recordTaskFailed();
            publish(record);
            log.error("Task {} failed", record.getId(), error);
        }
    }

    private static String summarize(Throwable error) {
        if (error instanceof BidScopeException) {
            BidScopeException failure = (BidScopeException) error;
            return failure.getKind().getValue() + ": " + failure.getReason();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private void publish(TaskRecord record) {
        publisher.publish(TaskEvent.of(record.snapshot(), registry.now()));
    }

    // ========== Queries ==========

    public TaskSnapshot status(String taskId) {
        return find(taskId).snapshot();
    }

    /**
     * The cached payload of a successful task, or a not-ready marker with the current state.
     */
    public TaskResult result(String taskId) {
        TaskSnapshot snapshot = status(taskId);
        if (snapshot.getState() != TaskState.SUCCESS) {
            return TaskResult.notReady(taskId, snapshot.getState(), snapshot.getError());
        }
        Optional<Object> payload = cache.get(snapshot.getCacheKey());
        return payload.map(value -> TaskResult.ready(taskId, value))
            .orElseGet(() -> TaskResult.notReady(taskId, snapshot.getState(), "Result expired from cache"));
    }

    /**
     * Location of a finished export's file.
     */
    public Path exportFile(String taskId) {
        TaskResult result = result(taskId);
        if (!result.isReady() || !(result.getResult() instanceof ExportArtifact)) {
            throw new NotFoundException("Export", taskId);
        }
        Path file = exportDirectory.resolve(((ExportArtifact) result.getResult()).getFileName());
        if (!Files.exists(file)) {
            throw new NotFoundException("Export file", taskId);
        }
        return file;
    }

    public TaskSnapshot cancel(String taskId) {
        TaskRecord record = find(taskId);
        if (record.cancel(registry.now())) {
            metrics.recordTaskCancelled();
            publish(record);
            log.warn("Task {} cancelled by request", taskId);
        }
        return record.snapshot();
    }

    public List<TaskSnapshot> activeTasks() {
        return registry.active().stream().map(TaskRecord::snapshot).toList();
    }

    /**
     * Live events for one task, starting with its current state.
     */
    public Flux<TaskEvent> events(String taskId) {
        TaskRecord record = find(taskId);
        return publisher.events(taskId).startWith(TaskEvent.of(record.snapshot(), registry.now()));
    }

    public Flux<TaskEvent> events() {
        return publisher.events();
    }

    private TaskRecord find(String taskId) {
        return registry.find(taskId).orElseThrow(() -> new NotFoundException("Task", taskId));
    }
}
