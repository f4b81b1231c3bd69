package com.example.assetembed.service;

import com.example.assetembed.config.EmbeddingProperties;
import com.example.assetembed.model.BatchPage;
import com.example.assetembed.model.BatchPageResult;
import com.example.assetembed.model.BatchRequest;
import com.example.assetembed.model.EmbeddingOptions;
import com.example.assetembed.model.EmbeddingResult;
import com.example.assetembed.model.EmbeddingTask;
import com.example.assetembed.model.EmbeddingTaskEntity;
import com.example.assetembed.repo.EmbeddingTaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;

/**
 * Runs batches of pages, either inline or as background tasks on a bounded pool. Pages
 * are independent documents, so separate tasks never share mutable state.
 */
@Service
public class EmbeddingManager {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingManager.class);

    private final AssetEmbeddingService embeddingService;
    private final EmbeddingRequestMapper requestMapper;
    private final EmbeddingTaskRepository repo;
    private final EmbeddingProperties properties;
    private final ObjectMapper objectMapper;
    private ExecutorService executor;
    private final ConcurrentHashMap<String, EmbeddingTask> tasks = new ConcurrentHashMap<String, EmbeddingTask>();
    private final ConcurrentHashMap<String, Future<?>> futures = new ConcurrentHashMap<String, Future<?>>();

    public EmbeddingManager(AssetEmbeddingService embeddingService,
                            EmbeddingRequestMapper requestMapper,
                            EmbeddingTaskRepository repo,
                            EmbeddingProperties properties,
                            ObjectMapper objectMapper) {
        this.embeddingService = embeddingService;
        this.requestMapper = requestMapper;
        this.repo = repo;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        int configured = properties.getExecutor().getThreads();
        int threads = configured > 0 ? configured : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        this.executor = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<Runnable>(properties.getExecutor().getQueueCapacity()),
                new ThreadFactory() {
                    private final ThreadFactory df = Executors.defaultThreadFactory();
                    public Thread newThread(Runnable r) {
                        Thread t = df.newThread(r);
                        t.setName("asset-embedder-" + t.getId());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy());
        log.info("[BATCH][INIT] threads={}, queueCapacity={}", threads, properties.getExecutor().getQueueCapacity());
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) executor.shutdownNow();
    }

    /**
     * Processes every page in order. A failing page is reported in its own result and
     * does not stop the batch.
     */
    public List<BatchPageResult> runBatch(BatchRequest request) {
        List<BatchPageResult> results = new ArrayList<>();
        if (request.getPages() == null) return results;
        for (BatchPage page : request.getPages()) {
            if (Thread.currentThread().isInterrupted()) break;
            if (page == null || page.getHtml() == null || page.getAssets() == null) {
                results.add(BatchPageResult.failed(page == null ? "Unknown" : page.displayName(), "Missing HTML or assets"));
                continue;
            }
            try {
                EmbeddingOptions options = requestMapper.options(request.getGlobalOptions(), page.getOptions());
                EmbeddingResult result = embeddingService.process(page.getHtml(), requestMapper.decodeAssets(page.getAssets()), options);
                results.add(BatchPageResult.succeeded(page.displayName(), result));
            } catch (RuntimeException ex) {
                log.warn("[BATCH][PAGE-FAIL] {} -> {}", page.displayName(), ex.getMessage());
                results.add(BatchPageResult.failed(page.displayName(), ex.getMessage()));
            }
        }
        return results;
    }

    public EmbeddingTask submit(BatchRequest request) {
        final EmbeddingTask task = new EmbeddingTask(request);
        tasks.put(task.getId(), task);
        // 持久化初始任务（未开始）
        final EmbeddingTaskEntity entity = new EmbeddingTaskEntity();
        entity.setTaskUuid(task.getId());
        entity.setStatus(EmbeddingTask.Status.QUEUED.name());
        entity.setPageCount(task.getPageCount());
        if (request.getGlobalOptions() != null) {
            try {
                entity.setGlobalOptionsJson(objectMapper.writeValueAsString(request.getGlobalOptions()));
            } catch (JsonProcessingException e) {
                log.warn("[BATCH][OPTIONS-JSON] {} -> {}", task.getId(), e.getOriginalMessage());
            }
        }
        repo.save(entity);

        final FutureTask<Void> f = new FutureTask<Void>(new Runnable() {
            public void run() {
                if (!task.transition(EmbeddingTask.Status.QUEUED, EmbeddingTask.Status.RUNNING)) {
                    // 排队期间已被取消
                    futures.remove(task.getId());
                    task.setEndTime(Instant.now());
                    return;
                }
                task.setStartTime(Instant.now());
                task.setThreadName(Thread.currentThread().getName());
                try {
                    entity.setStatus(EmbeddingTask.Status.RUNNING.name());
                    entity.setStartTime(task.getStartTime());
                    entity.setThreadName(task.getThreadName());
                    repo.save(entity);

                    List<BatchPageResult> results = runBatch(request);
                    task.setResults(results);
                    task.transition(EmbeddingTask.Status.RUNNING, EmbeddingTask.Status.SUCCEEDED);
                    // 以任务的实际状态落库，不覆盖 cancel() 已写入的 CANCELLED
                    entity.setStatus(task.getStatus().name());
                    summarize(entity, results);
                    entity.setEndTime(Instant.now());
                    entity.setErrorMessage(null);
                    repo.save(entity);
                    log.info("[BATCH][DONE] task={}, status={}, pages={}, failed={}",
                            task.getId(), task.getStatus(), results.size(), task.getPagesFailed());
                } catch (Throwable ex) {
                    log.error("[BATCH][FAIL] task={}", task.getId(), ex);
                    task.setErrorMessage(ex.getMessage());
                    task.transition(EmbeddingTask.Status.RUNNING, EmbeddingTask.Status.FAILED);

                    entity.setStatus(task.getStatus().name());
                    entity.setEndTime(Instant.now());
                    entity.setErrorMessage(ex.getMessage());
                    repo.save(entity);
                } finally {
                    futures.remove(task.getId());
                    task.setEndTime(Instant.now());
                }
            }
        }, null);
        // 先登记再提交，保证任务结束时的移除发生在登记之后
        futures.put(task.getId(), f);
        try {
            executor.execute(f);
        } catch (RejectedExecutionException ex) {
            futures.remove(task.getId());
            tasks.remove(task.getId());
            entity.setStatus(EmbeddingTask.Status.FAILED.name());
            entity.setEndTime(Instant.now());
            entity.setErrorMessage("Task queue is full");
            repo.save(entity);
            throw ex;
        }
        return task;
    }

    /**
     * Cancels a queued or running task. Returns false when the task is unknown or has
     * already finished.
     */
    public boolean cancel(String id) {
        EmbeddingTask t = tasks.get(id);
        Future<?> f = futures.get(id);
        if (t == null || f == null) return false;
        EmbeddingTask.Status previous = t.cancel();
        if (previous == null) return false;
        f.cancel(true);
        if (previous == EmbeddingTask.Status.QUEUED) {
            // 未开始的任务不会再进入 run()
            futures.remove(id);
            t.setEndTime(Instant.now());
        }
        EmbeddingTaskEntity e = repo.findByTaskUuid(id);
        if (e != null) {
            e.setStatus(EmbeddingTask.Status.CANCELLED.name());
            e.setEndTime(Instant.now());
            repo.save(e);
        }
        log.info("[BATCH][CANCEL] task={}, from={}", id, previous);
        return true;
    }

    public EmbeddingTask get(String id) {
        return tasks.get(id);
    }

    public Collection<EmbeddingTask> list() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    public List<EmbeddingTaskEntity> history() {
        return repo.findAllByOrderByIdDesc();
    }

    private static void summarize(EmbeddingTaskEntity entity, List<BatchPageResult> results) {
        int ok = 0, inlined = 0, external = 0, uploaded = 0, saved = 0;
        long before = 0, after = 0;
        StringBuilder errors = new StringBuilder();
        for (BatchPageResult r : results) {
            if (!r.isSuccess()) {
                if (errors.length() > 0) errors.append('\n');
                errors.append(r.getPageName()).append(" -> ").append(r.getError());
                continue;
            }
            ok++;
            inlined += r.getStats().getInlined();
            external += r.getStats().getExternal();
            uploaded += r.getStats().getWordPressUploaded();
            saved += r.getStats().getHttpRequestsSaved();
            before += r.getStats().getTotalSizeBefore();
            after += r.getStats().getTotalSizeAfter();
        }
        entity.setPagesSucceeded(ok);
        entity.setPagesFailed(results.size() - ok);
        entity.setAssetsInlined(inlined);
        entity.setAssetsExternal(external);
        entity.setAssetsUploaded(uploaded);
        entity.setRequestsSaved(saved);
        entity.setBytesBefore(before);
        entity.setBytesAfter(after);
        entity.setErrorsText(errors.length() == 0 ? null : errors.toString());
    }
}
