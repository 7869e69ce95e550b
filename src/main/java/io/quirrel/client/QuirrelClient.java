package io.quirrel.client;

import com.fasterxml.jackson.core.type.TypeReference;
import io.quirrel.config.QuirrelConfig;
import io.quirrel.delivery.DeliveryResponder;
import io.quirrel.delivery.DeliveryResponse;
import io.quirrel.delivery.JobHandler;
import io.quirrel.observability.AuditLogger;
import io.quirrel.registry.JobReference;
import io.quirrel.registry.JobRegistry;
import io.quirrel.schedule.EnqueueOptions;
import io.quirrel.schedule.ScheduleKind;
import io.quirrel.schedule.ScheduleNormalizer;
import io.quirrel.schedule.ScheduleNormalizer.NormalizedJob;
import io.quirrel.security.DecryptionFailedException;
import io.quirrel.security.PayloadCrypto;
import io.quirrel.storage.CorruptRegistryEntryException;
import io.quirrel.storage.DurableScheduler;
import io.quirrel.storage.JobNames;
import io.quirrel.storage.SchedulerConnections;
import io.quirrel.storage.StoredJob;
import io.quirrel.util.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Queue bound to one route: enqueues jobs for it, looks them up, and answers their deliveries.
 *
 * <pre>{@code
 * QuirrelClient<Email> queue = QuirrelClient.builder("api/emails", Email.class)
 *     .config(QuirrelConfig.fromEnvironment(System.getenv()).build())
 *     .handler((email, meta) -> mailer.send(email))
 *     .build();
 * queue.enqueue(email, EnqueueOptions.builder().delay("5min").build());
 * }</pre>
 *
 * <p>Instances are thread-safe.
 */
public final class QuirrelClient<T> {
    private static final Logger LOG = LoggerFactory.getLogger(QuirrelClient.class);

    private final String route;
    private final String endpoint;
    private final QuirrelConfig config;
    private final PayloadCodec<T> codec;
    private final PayloadCrypto crypto;
    private final EnqueueOptions defaultOptions;
    private final ScheduleNormalizer normalizer;
    private final JobRegistry registry;
    private final DeliveryResponder<T> responder;
    private final Consumer<DecryptionFailedException> catchDecryptionErrors;

    private QuirrelClient(Builder<T> b) {
        this.route = b.route;
        this.config = b.config;
        this.codec = b.codec;
        this.crypto = PayloadCrypto.fromConfig(config);
        this.defaultOptions = b.defaultOptions;
        this.catchDecryptionErrors = b.catchDecryptionErrors;
        this.endpoint = endpointFor(config.requireApplicationBaseUrl(), route);
        this.normalizer = new ScheduleNormalizer(b.clock, codec, crypto);
        DurableScheduler scheduler = b.scheduler != null ? b.scheduler : SchedulerConnections.shared(config);
        AuditLogger auditLogger = b.auditLogger != null ? b.auditLogger : AuditLogger.fromConfig(config, b.clock);
        this.registry = new JobRegistry(scheduler, config.token(), auditLogger, b.clock);
        JobHandler<T> handler = b.handler != null ? b.handler : (payload, meta) -> {
            throw new IllegalStateException("No handler registered for route " + route);
        };
        this.responder = new DeliveryResponder<>(
                route, handler, codec, crypto, config.token(), config.production(), catchDecryptionErrors, auditLogger);
    }

    public static <T> Builder<T> builder(String route, Class<T> payloadType) {
        return new Builder<>(route, PayloadCodec.of(payloadType));
    }

    public static <T> Builder<T> builder(String route, TypeReference<T> payloadType) {
        return new Builder<>(route, PayloadCodec.of(payloadType));
    }

    public String route() {
        return route;
    }

    public String endpoint() {
        return endpoint;
    }

    public DeliveryResponder<T> responder() {
        return responder;
    }

    public JobRegistry registry() {
        return registry;
    }

    public Job<T> enqueue(T payload) {
        return enqueue(payload, EnqueueOptions.none());
    }

    /**
     * @throws io.quirrel.schedule.ValidationException before any registry call if the options are invalid
     */
    public Job<T> enqueue(T payload, EnqueueOptions options) {
        NormalizedJob job = normalize(payload, options);
        return toJob(registry.register(route, endpoint, job).job());
    }

    /**
     * Validates every item first; nothing is registered if any item is invalid.
     *
     * @return jobs in input order
     */
    public List<Job<T>> enqueueMany(List<Item<T>> items) {
        List<NormalizedJob> normalized = new ArrayList<>(items.size());
        for (Item<T> item : items) {
            normalized.add(normalize(item.payload(), item.options()));
        }
        List<Job<T>> out = new ArrayList<>(normalized.size());
        for (NormalizedJob job : normalized) {
            out.add(toJob(registry.register(route, endpoint, job).job()));
        }
        return out;
    }

    /**
     * Lazily pages through this route's jobs. Every call to {@code iterator()} starts over.
     */
    public Iterable<List<Job<T>>> get() {
        return () -> new BatchIterator(route);
    }

    /**
     * @param id a job id, or {@code "@cron"} for the route's recurring job
     */
    public Optional<Job<T>> getById(String id) {
        return getById(JobReference.parse(id, route));
    }

    public Optional<Job<T>> getById(JobReference ref) {
        return registry.get(ref).map(this::toJob);
    }

    /**
     * Every job owned by this client's registry, across routes. Bodies are decrypted but not decoded.
     */
    public List<Job<String>> getAllJobs() {
        List<Job<String>> out = new ArrayList<>();
        long cursor = 0L;
        while (true) {
            List<StoredJob> page = registry.page(null, cursor, config.listBatchSize());
            if (page.isEmpty()) {
                return out;
            }
            for (StoredJob stored : page) {
                out.add(toJob(stored, decrypt(stored)));
                cursor = stored.id();
            }
        }
    }

    public boolean invoke(String id) {
        return invoke(JobReference.parse(id, route));
    }

    /**
     * @return false if the job could not be found
     */
    public boolean invoke(JobReference ref) {
        return registry.invoke(ref);
    }

    public boolean delete(String id) {
        return delete(JobReference.parse(id, route));
    }

    /**
     * @return false if the job could not be found
     */
    public boolean delete(JobReference ref) {
        return registry.delete(ref);
    }

    /**
     * Removes every job owned by this client's registry.
     */
    public int deleteAll() {
        return registry.deleteAll();
    }

    public DeliveryResponse respondTo(String body, Map<String, String> headers) {
        return responder.respond(body, headers);
    }

    /**
     * Best-effort cleanup of every job this process owns. Never throws.
     */
    public CleanupOutcome shutdown() {
        try {
            return CleanupOutcome.completed(registry.deleteAll());
        } catch (RuntimeException e) {
            LOG.error("Error cleaning up jobs on shutdown", e);
            return CleanupOutcome.failed(e);
        }
    }

    static String endpointFor(String baseUrl, String route) {
        return route.startsWith("/") ? baseUrl + route : baseUrl + "/" + route;
    }

    private NormalizedJob normalize(T payload, EnqueueOptions options) {
        EnqueueOptions merged = (options == null ? EnqueueOptions.none() : options).withDefaults(defaultOptions);
        return normalizer.normalize(payload, merged);
    }

    private Job<T> toJob(StoredJob stored) {
        String plaintext = decrypt(stored);
        T body;
        if (plaintext == null || plaintext.isEmpty()) {
            body = codec.empty();
        } else {
            try {
                body = codec.decode(plaintext);
            } catch (IOException e) {
                if (catchDecryptionErrors == null) {
                    throw new CorruptRegistryEntryException("Payload of job " + stored.id() + " cannot be decoded", e);
                }
                body = null;
            }
        }
        return toJob(stored, body);
    }

    private <B> Job<B> toJob(StoredJob stored, B body) {
        Job.Repeat repeat = stored.kind() == ScheduleKind.ONCE
                ? null
                : new Job.Repeat(stored.everyMs(), stored.times(), stored.cron());
        return new Job<>(
                stored.externalId() != null ? stored.externalId() : Long.toString(stored.id()),
                stored.id(),
                stored.route(),
                stored.endpoint(),
                body,
                stored.runAt(),
                stored.exclusive(),
                stored.retry(),
                stored.count(),
                repeat,
                this
        );
    }

    private String decrypt(StoredJob stored) {
        String raw = stored.action().body();
        if (crypto == null || raw == null || raw.isEmpty()) {
            return raw;
        }
        try {
            return crypto.decrypt(raw);
        } catch (DecryptionFailedException e) {
            if (catchDecryptionErrors == null) {
                throw e;
            }
            LOG.warn("Decryption failed for stored job {}: {}", stored.id(), e.getMessage());
            catchDecryptionErrors.accept(e);
            return null;
        }
    }

    private final class BatchIterator implements Iterator<List<Job<T>>> {
        private final String pageRoute;
        private long cursor;
        private List<Job<T>> next;
        private boolean exhausted;

        BatchIterator(String pageRoute) {
            this.pageRoute = pageRoute;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                List<StoredJob> page = registry.page(pageRoute, cursor, config.listBatchSize());
                if (page.isEmpty()) {
                    exhausted = true;
                } else {
                    List<Job<T>> batch = new ArrayList<>(page.size());
                    for (StoredJob stored : page) {
                        batch.add(toJob(stored));
                    }
                    cursor = page.get(page.size() - 1).id();
                    next = batch;
                }
            }
            return next != null;
        }

        @Override
        public List<Job<T>> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<Job<T>> out = next;
            next = null;
            return out;
        }
    }

    /**
     * One entry of {@link #enqueueMany(List)}.
     */
    public record Item<T>(T payload, EnqueueOptions options) {
        public static <T> Item<T> of(T payload) {
            return new Item<>(payload, EnqueueOptions.none());
        }
    }

    public static final class Builder<T> {
        private final String route;
        private final PayloadCodec<T> codec;
        private QuirrelConfig config;
        private JobHandler<T> handler;
        private EnqueueOptions defaultOptions;
        private DurableScheduler scheduler;
        private AuditLogger auditLogger;
        private Clock clock = Clock.systemUTC();
        private Consumer<DecryptionFailedException> catchDecryptionErrors;

        private Builder(String route, PayloadCodec<T> codec) {
            this.route = JobNames.requireRoute(route);
            this.codec = codec;
        }

        public Builder<T> config(QuirrelConfig config) {
            this.config = config;
            return this;
        }

        public Builder<T> handler(JobHandler<T> handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Queue-wide {@code exclusive} and {@code retry}, used where a job's own options leave them unset.
         */
        public Builder<T> defaultOptions(EnqueueOptions defaultOptions) {
            this.defaultOptions = defaultOptions;
            return this;
        }

        /**
         * Overrides the scheduler otherwise shared per database URL.
         */
        public Builder<T> scheduler(DurableScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder<T> auditLogger(AuditLogger auditLogger) {
            this.auditLogger = auditLogger;
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Observes payloads that no configured secret can decrypt instead of failing the operation.
         */
        public Builder<T> catchDecryptionErrors(Consumer<DecryptionFailedException> catchDecryptionErrors) {
            this.catchDecryptionErrors = catchDecryptionErrors;
            return this;
        }

        public QuirrelClient<T> build() {
            Objects.requireNonNull(config, "config");
            return new QuirrelClient<>(this);
        }
    }
}
