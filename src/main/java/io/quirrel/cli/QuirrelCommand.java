package io.quirrel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.quirrel.QuirrelException;
import io.quirrel.client.Job;
import io.quirrel.client.QuirrelClient;
import io.quirrel.config.QuirrelConfig;
import io.quirrel.delivery.Dispatcher;
import io.quirrel.observability.AuditLogger;
import io.quirrel.registry.JobReference;
import io.quirrel.registry.JobRegistry;
import io.quirrel.schedule.EnqueueOptions;
import io.quirrel.schedule.Repeat;
import io.quirrel.schedule.TimeSpan;
import io.quirrel.security.PayloadCrypto;
import io.quirrel.storage.DurableScheduler;
import io.quirrel.storage.RegistryUnavailableException;
import io.quirrel.storage.SchedulerConnections;
import io.quirrel.storage.SqliteScheduler;
import io.quirrel.storage.StoredJob;
import io.quirrel.util.Hashing;
import io.quirrel.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "quirrel",
        mixinStandardHelpOptions = true,
        description = "Durable job scheduler and delivery engine",
        subcommands = {
                QuirrelCommand.ServeCommand.class,
                QuirrelCommand.EnqueueCommand.class,
                QuirrelCommand.JobsCommand.class,
                QuirrelCommand.DeleteCommand.class,
                QuirrelCommand.DeleteAllCommand.class
        }
)
public final class QuirrelCommand implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(QuirrelCommand.class);
    static final int EXIT_STORE_UNREACHABLE = 1;
    static final int EXIT_UNSUPPORTED_BACKEND = 2;

    @Option(names = {"--config"}, description = "Optional JSON settings file, applied over the environment")
    Path configFile;

    @Option(names = {"--database-url"}, description = "Durable scheduler database (default: $QUIRREL_DATABASE_URL)")
    String databaseUrl;

    @Option(names = {"--base-url"}, description = "Application base URL deliveries are sent to (default: $QUIRREL_BASE_URL)")
    String baseUrl;

    @Option(names = {"--owner"}, description = "Owner scope of the jobs this process manages")
    String owner;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | enqueue | jobs | delete | delete-all");
    }

    QuirrelConfig config() {
        QuirrelConfig.Builder builder = QuirrelConfig.fromEnvironment(System.getenv());
        if (configFile != null) {
            builder.applyFile(configFile);
        }
        if (databaseUrl != null) {
            builder.databaseUrl(databaseUrl);
        }
        if (baseUrl != null) {
            builder.applicationBaseUrl(baseUrl);
        }
        if (owner != null) {
            builder.owner(owner);
        }
        return builder.build();
    }

    JobRegistry registry(QuirrelConfig config) {
        DurableScheduler scheduler = SchedulerConnections.shared(config);
        return new JobRegistry(scheduler, config.token(), AuditLogger.fromConfig(config, Clock.systemUTC()), Clock.systemUTC());
    }

    @Command(name = "serve", description = "Run the scheduler: fire due jobs and serve the admin endpoints")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        QuirrelCommand parent;

        @Option(names = {"-h", "--host"}, defaultValue = "localhost", description = "Host to bind on")
        String host;

        @Option(names = {"-p", "--port"}, defaultValue = "9181", description = "Port to bind on")
        int port;

        @Option(names = {"-r", "--redis-url"}, description = "Redis backend (not supported by this engine)")
        String redisUrl;

        @Option(names = {"--no-cron"}, negatable = false, defaultValue = "false", description = "Do not fire cron jobs")
        boolean noCron;

        @Option(names = {"--passphrase"}, description = "Secure the admin endpoints with a passphrase (repeatable)")
        List<String> passphrases = new ArrayList<>();

        @Override
        public Integer call() throws Exception {
            if (redisUrl != null && !redisUrl.isBlank()) {
                System.err.println("The Redis backend is not supported; configure --database-url instead.");
                return EXIT_UNSUPPORTED_BACKEND;
            }
            QuirrelConfig config = parent.config();
            JobRegistry registry;
            try {
                registry = parent.registry(config);
            } catch (RegistryUnavailableException e) {
                System.err.println("Couldn't connect to the database: " + e.getMessage());
                return EXIT_STORE_UNREACHABLE;
            }

            LOG.info("Payload encryption {}", encryptionSummary(config));
            Dispatcher dispatcher = null;
            if (registry.scheduler() instanceof SqliteScheduler sqlite) {
                dispatcher = new Dispatcher(sqlite, config.token(), Dispatcher.Settings.defaults().withCronEnabled(!noCron), Clock.systemUTC());
                dispatcher.start();
            } else if (noCron) {
                LOG.warn("--no-cron has no effect on a pg_cron database; cron jobs are fired by the database");
            }

            HttpServer server = HttpServer.create(new InetSocketAddress(host, port), 0);
            server.createContext("/", exchange -> {
                if (!"/".equals(exchange.getRequestURI().getPath())) {
                    writeText(exchange, "Not Found", 404, "text/plain; charset=utf-8");
                    return;
                }
                writeText(exchange, welcomePage(), 200, "text/html; charset=utf-8");
            });
            server.createContext("/health", exchange -> writeJson(exchange, Map.of("status", "ok"), 200));
            server.createContext("/jobs", exchange -> {
                if (!authorize(exchange, passphrases)) {
                    return;
                }
                try {
                    writeJson(exchange, listAll(registry, config.listBatchSize()), 200);
                } catch (QuirrelException e) {
                    writeJson(exchange, Map.of("error", e.code().name(), "message", String.valueOf(e.getMessage())), 503);
                }
            });
            server.setExecutor(null);
            server.start();
            System.out.println("Quirrel listening on http://" + host + ":" + port + "/, cron=" + (noCron ? "disabled" : "enabled")
                    + ", passphrases=" + passphrases.size());

            CountDownLatch stopped = new CountDownLatch(1);
            Dispatcher runningDispatcher = dispatcher;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (runningDispatcher != null) {
                    runningDispatcher.close();
                }
                server.stop(0);
                try {
                    registry.deleteAll();
                } catch (RuntimeException e) {
                    LOG.error("Error cleaning up jobs on shutdown", e);
                }
                stopped.countDown();
            }, "quirrel-shutdown-hook"));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Enqueue a job for a route")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        QuirrelCommand parent;

        @Option(names = {"--route"}, required = true, description = "Route the job is delivered to")
        String route;

        @Option(names = {"--body"}, defaultValue = "{}", description = "JSON payload")
        String body;

        @Option(names = {"--id"}, description = "Job id; an existing job with this id is kept unless --override")
        String id;

        @Option(names = {"--override"}, defaultValue = "false", description = "Replace an existing job with the same id")
        boolean override;

        @Option(names = {"--exclusive"}, defaultValue = "false", description = "Run no other job of the route concurrently")
        boolean exclusive;

        @Option(names = {"--delay"}, description = "Delay before execution, e.g. 5min or 3000")
        String delay;

        @Option(names = {"--run-at"}, description = "ISO-8601 execution time")
        String runAt;

        @Option(names = {"--every"}, description = "Repeat interval, e.g. 1h")
        String every;

        @Option(names = {"--times"}, description = "Maximum number of repetitions")
        Integer times;

        @Option(names = {"--cron"}, description = "5-field cron expression (UTC)")
        String cron;

        @Option(names = {"--retry"}, description = "Retry delay after a failed attempt (repeatable)")
        List<String> retry = new ArrayList<>();

        @Override
        public Integer call() throws Exception {
            QuirrelConfig config = parent.config();
            QuirrelClient<JsonNode> client = QuirrelClient.builder(route, JsonNode.class).config(config).build();
            Job<JsonNode> job = client.enqueue(Jsons.compact().readTree(body), options());
            System.out.println(Jsons.toJson(view(job)));
            return 0;
        }

        EnqueueOptions options() {
            EnqueueOptions.Builder b = EnqueueOptions.builder()
                    .override(override)
                    .exclusive(exclusive);
            if (id != null) {
                b.id(id);
            }
            if (delay != null) {
                b.delay(delay);
            }
            if (runAt != null) {
                b.runAt(Instant.parse(runAt));
            }
            if (!retry.isEmpty()) {
                b.retry(retry.toArray(new String[0]));
            }
            if (every != null || cron != null) {
                b.repeat(new Repeat(every == null ? null : TimeSpan.of(every), times, cron));
            }
            return b.build();
        }
    }

    @Command(name = "jobs", description = "List scheduled jobs")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        QuirrelCommand parent;

        @Option(names = {"--route"}, description = "Only jobs of this route")
        String route;

        @Override
        public Integer call() {
            QuirrelConfig config = parent.config();
            JobRegistry registry = parent.registry(config);
            List<Map<String, Object>> out = new ArrayList<>();
            long cursor = 0L;
            while (true) {
                List<StoredJob> page = registry.page(route, cursor, config.listBatchSize());
                if (page.isEmpty()) {
                    break;
                }
                for (StoredJob job : page) {
                    out.add(view(job));
                    cursor = job.id();
                }
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "delete", description = "Delete one job")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        QuirrelCommand parent;

        @Option(names = {"--route"}, description = "Route of the job (required unless --store-id)")
        String route;

        @Option(names = {"--store-id"}, description = "Scheduler id of the job")
        Long storeId;

        @Parameters(index = "0", arity = "0..1", description = "Job id, or @cron for the route's recurring job")
        String id;

        @Override
        public Integer call() {
            JobReference ref;
            if (storeId != null) {
                ref = JobReference.byStoreId(storeId);
            } else if (id != null && route != null) {
                ref = JobReference.parse(id, route);
            } else {
                System.err.println("delete requires --store-id, or --route with a job id");
                return 2;
            }
            boolean deleted = parent.registry(parent.config()).delete(ref);
            System.out.println(Jsons.toJson(Map.of("deleted", deleted, "job", ref.toString())));
            return deleted ? 0 : 3;
        }
    }

    @Command(name = "delete-all", description = "Delete every job of this owner")
    static final class DeleteAllCommand implements Callable<Integer> {
        @ParentCommand
        QuirrelCommand parent;

        @Override
        public Integer call() {
            int count = parent.registry(parent.config()).deleteAll();
            System.out.println(Jsons.toJson(Map.of("deleted", count)));
            return 0;
        }
    }

    static String encryptionSummary(QuirrelConfig config) {
        PayloadCrypto crypto = PayloadCrypto.fromConfig(config);
        if (crypto == null) {
            return "disabled";
        }
        PayloadCrypto.KeyringStatus status = crypto.status();
        return "enabled (active key " + status.activeKid() + ", " + status.totalKeys() + " key(s) for decryption)";
    }

    static boolean passphraseAccepted(String authorizationHeader, List<String> passphrases) {
        if (passphrases == null || passphrases.isEmpty()) {
            return true;
        }
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, "Basic ", 0, 6)) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(authorizationHeader.substring(6).trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }
        int colon = decoded.indexOf(':');
        String password = colon < 0 ? decoded : decoded.substring(colon + 1);
        boolean accepted = false;
        for (String passphrase : passphrases) {
            accepted |= Hashing.constantTimeEquals(passphrase, password);
        }
        return accepted;
    }

    private static boolean authorize(HttpExchange exchange, List<String> passphrases) throws IOException {
        if (passphraseAccepted(exchange.getRequestHeaders().getFirst("Authorization"), passphrases)) {
            return true;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Basic realm=\"quirrel\"");
        writeJson(exchange, Map.of("error", "unauthorized"), 401);
        return false;
    }

    private static List<Map<String, Object>> listAll(JobRegistry registry, int batchSize) {
        List<Map<String, Object>> out = new ArrayList<>();
        long cursor = 0L;
        while (true) {
            List<StoredJob> page = registry.page(null, cursor, batchSize);
            if (page.isEmpty()) {
                return out;
            }
            for (StoredJob job : page) {
                out.add(view(job));
                cursor = job.id();
            }
        }
    }

    static Map<String, Object> view(StoredJob job) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("store_id", job.id());
        row.put("name", job.name());
        row.put("route", job.route());
        row.put("id", job.externalId());
        row.put("kind", job.kind().name());
        row.put("endpoint", job.endpoint());
        row.put("run_at", job.runAt() == null ? null : job.runAt().toString());
        row.put("count", job.count());
        row.put("cron", job.cron());
        row.put("every_ms", job.everyMs());
        row.put("times", job.times());
        row.put("retry", job.retry());
        row.put("exclusive", job.exclusive());
        return row;
    }

    static Map<String, Object> view(Job<JsonNode> job) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("store_id", job.storeId());
        row.put("id", job.id());
        row.put("route", job.route());
        row.put("endpoint", job.endpoint());
        row.put("body", job.body());
        row.put("run_at", job.runAt() == null ? null : job.runAt().toString());
        row.put("count", job.count());
        row.put("exclusive", job.exclusive());
        row.put("retry", job.retry());
        row.put("repeat", job.repeat());
        return row;
    }

    private static String welcomePage() {
        return """
                <!doctype html>
                <html>
                <head><meta charset="utf-8"><title>Quirrel</title></head>
                <body>
                <h1>Welcome to the Quirrel API!</h1>
                <p>This process fires scheduled jobs. Useful endpoints:</p>
                <ul>
                  <li><a href="/health">/health</a></li>
                  <li><a href="/jobs">/jobs</a> (passphrase protected when configured)</li>
                </ul>
                </body>
                </html>
                """;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        writeText(exchange, Jsons.toJson(body), status, "application/json; charset=utf-8");
    }

    private static void writeText(HttpExchange exchange, String text, int status, String contentType) throws IOException {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
