package io.quirrel.delivery;

import io.quirrel.security.SensitiveDataMasker;
import io.quirrel.security.WebhookSignature;
import io.quirrel.storage.HttpAction;
import io.quirrel.storage.SqliteScheduler;
import io.quirrel.storage.StoredJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires due entries of a {@link SqliteScheduler} over HTTP and reports the outcome back to it.
 *
 * <p>Each delivery is signed at fire time and carries fresh {@link JobMeta}. A 2xx response
 * acknowledges the entry; anything else, including a transport error, counts as a failure and the
 * entry's retry ladder decides what happens next. While an exclusive job of a route is in flight no
 * other job of that route is fired, and an exclusive job waits for in-flight jobs of its route.
 */
public final class Dispatcher implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "host", "upgrade", "expect");

    private final SqliteScheduler scheduler;
    private final String token;
    private final Settings settings;
    private final Clock clock;
    private final HttpClient httpClient;
    private final ExecutorService workers;
    private final Map<String, Integer> inFlight = new HashMap<>();
    private final Set<String> exclusiveRoutes = new HashSet<>();
    private ScheduledExecutorService ticker;

    /**
     * @param token signing secret, null sends unsigned deliveries
     */
    public Dispatcher(SqliteScheduler scheduler, String token, Settings settings, Clock clock) {
        this.scheduler = scheduler;
        this.token = token == null || token.isBlank() ? null : token;
        this.settings = settings;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(settings.requestTimeout())
                .build();
        this.workers = Executors.newFixedThreadPool(Math.max(1, settings.concurrency()), runnable -> {
            Thread t = new Thread(runnable, "quirrel-dispatch");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts polling in the background until {@link #close()}.
     */
    public synchronized void start() {
        if (ticker != null) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread t = new Thread(runnable, "quirrel-dispatch-tick");
            t.setDaemon(true);
            return t;
        });
        long interval = settings.pollInterval().toMillis();
        ticker.scheduleWithFixedDelay(this::tick, 0L, interval, TimeUnit.MILLISECONDS);
        LOG.info("Dispatcher started (poll every {} ms, cron {})", interval, settings.cronEnabled() ? "enabled" : "disabled");
    }

    /**
     * Claims one batch of due entries and delivers them, waiting until every delivery has finished.
     *
     * @return number of deliveries attempted
     */
    public int runOnce() {
        List<StoredJob> claimed = scheduler.claimDue(
                settings.batchSize(),
                settings.lease().toMillis(),
                settings.cronEnabled(),
                busyRoutes()
        );
        List<Future<?>> pending = new ArrayList<>();
        for (StoredJob job : claimed) {
            if (job.times() != null && job.count() > job.times()) {
                LOG.info("Job {} on {} reached its repetition limit", job.externalId(), job.route());
                scheduler.retire(job);
                continue;
            }
            if (!tryAcquire(job)) {
                scheduler.release(job);
                continue;
            }
            pending.add(workers.submit(() -> {
                try {
                    deliver(job);
                } finally {
                    release(job);
                }
            }));
        }
        for (Future<?> future : pending) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return pending.size();
            } catch (ExecutionException e) {
                LOG.error("Delivery task failed", e.getCause());
            }
        }
        return pending.size();
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void deliver(StoredJob job) {
        HttpAction action = job.action();
        String body = action.body() == null ? "" : action.body();
        JobMeta meta = new JobMeta(
                job.externalId(),
                job.count(),
                job.retry(),
                scheduler.nextRepetition(job),
                job.exclusive()
        );
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(action.url()))
                .timeout(settings.requestTimeout())
                .method(action.method(), HttpRequest.BodyPublishers.ofString(body));
        for (Map.Entry<String, String> header : action.headers().entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (RESTRICTED_HEADERS.contains(name) || name.equals(JobMeta.HEADER) || name.equals(WebhookSignature.HEADER)) {
                continue;
            }
            request.setHeader(header.getKey(), header.getValue());
            LOG.debug("Job {} header {}: {}", job.externalId(), header.getKey(),
                    SensitiveDataMasker.maskedValue(header.getKey(), header.getValue()));
        }
        request.setHeader("Content-Type", action.contentType());
        request.setHeader(JobMeta.HEADER, meta.toHeader());
        if (token != null) {
            request.setHeader(WebhookSignature.HEADER, WebhookSignature.sign(body, token, clock.instant()));
        }

        int status;
        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            status = response.statusCode();
        } catch (IOException e) {
            LOG.warn("Delivery of job {} to {} failed: {}", job.externalId(), action.url(), e.toString());
            fail(job);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.release(job);
            return;
        }
        if (status >= 200 && status < 300) {
            LOG.info("Delivered job {} (count {}) to {}", job.externalId(), job.count(), action.url());
            scheduler.completeSuccess(job);
        } else {
            LOG.warn("Delivery of job {} to {} answered {}", job.externalId(), action.url(), status);
            fail(job);
        }
    }

    private void fail(StoredJob job) {
        if (scheduler.completeFailure(job)) {
            LOG.info("Job {} on {} will be retried (attempt {} of {})",
                    job.externalId(), job.route(), job.count() + 1, job.retry().size() + 1);
        }
    }

    private void tick() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            LOG.error("Dispatcher tick failed", e);
        }
    }

    private synchronized Set<String> busyRoutes() {
        return Set.copyOf(exclusiveRoutes);
    }

    private synchronized boolean tryAcquire(StoredJob job) {
        String route = job.route();
        if (exclusiveRoutes.contains(route)) {
            return false;
        }
        if (job.exclusive() && inFlight.getOrDefault(route, 0) > 0) {
            return false;
        }
        inFlight.merge(route, 1, Integer::sum);
        if (job.exclusive()) {
            exclusiveRoutes.add(route);
        }
        return true;
    }

    private synchronized void release(StoredJob job) {
        String route = job.route();
        inFlight.computeIfPresent(route, (k, v) -> v <= 1 ? null : v - 1);
        if (job.exclusive()) {
            exclusiveRoutes.remove(route);
        }
    }

    /**
     * @param cronEnabled    false leaves cron entries unfired
     * @param lease          how long a claimed entry is hidden from other dispatchers; longer than
     *                       {@code requestTimeout}
     */
    public record Settings(
            boolean cronEnabled,
            int batchSize,
            int concurrency,
            Duration pollInterval,
            Duration lease,
            Duration requestTimeout
    ) {
        public static Settings defaults() {
            return new Settings(true, 50, 8, Duration.ofSeconds(1), Duration.ofMinutes(2), Duration.ofSeconds(30));
        }

        public Settings withCronEnabled(boolean enabled) {
            return new Settings(enabled, batchSize, concurrency, pollInterval, lease, requestTimeout);
        }
    }
}
