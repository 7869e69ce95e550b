package io.quirrel.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.quirrel.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable engine configuration.
 *
 * <p>Sources are layered by call order on the {@link Builder}: start from
 * {@link #fromEnvironment(Map)}, overlay a settings file with {@link Builder#applyFile(Path)},
 * then set explicit values. Later layers win.
 */
public final class QuirrelConfig {
    public static final int ENCRYPTION_SECRET_LENGTH = 32;
    public static final int DEFAULT_LIST_BATCH_SIZE = 100;
    public static final String DEFAULT_OWNER = "default";
    public static final String ENV_DATABASE_URL = "QUIRREL_DATABASE_URL";
    public static final String ENV_BASE_URL = "QUIRREL_BASE_URL";
    public static final String ENV_TOKEN = "QUIRREL_TOKEN";
    public static final String ENV_ENCRYPTION_SECRET = "QUIRREL_ENCRYPTION_SECRET";
    public static final String ENV_OLD_SECRETS = "QUIRREL_OLD_SECRETS";
    public static final String ENV_ENVIRONMENT = "QUIRREL_ENV";
    public static final String ENV_PRODUCTION = "QUIRREL_PRODUCTION";
    public static final String ENV_RUNNING_IN_CONTAINER = "QUIRREL_RUNNING_IN_CONTAINER";
    public static final String ENV_AUDIT_LOG = "QUIRREL_AUDIT_LOG";

    private final String databaseUrl;
    private final String applicationBaseUrl;
    private final String token;
    private final String encryptionSecret;
    private final List<String> oldSecrets;
    private final boolean production;
    private final boolean runningInContainer;
    private final Path auditLogFile;
    private final String owner;
    private final int listBatchSize;

    private QuirrelConfig(Builder b) {
        this.databaseUrl = blankToNull(b.databaseUrl);
        this.runningInContainer = b.runningInContainer;
        this.applicationBaseUrl = normalizeBaseUrl(b.applicationBaseUrl, b.runningInContainer);
        this.token = blankToNull(b.token);
        this.encryptionSecret = blankToNull(b.encryptionSecret);
        this.oldSecrets = List.copyOf(b.oldSecrets);
        this.production = b.production;
        this.auditLogFile = b.auditLogFile;
        this.owner = b.owner == null || b.owner.isBlank() ? DEFAULT_OWNER : b.owner.trim();
        this.listBatchSize = b.listBatchSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder fromEnvironment(Map<String, String> env) {
        Builder b = new Builder();
        b.databaseUrl = env.get(ENV_DATABASE_URL);
        b.applicationBaseUrl = env.get(ENV_BASE_URL);
        b.token = env.get(ENV_TOKEN);
        b.encryptionSecret = env.get(ENV_ENCRYPTION_SECRET);
        b.oldSecrets = parseSecretList(env.get(ENV_OLD_SECRETS));
        String environment = env.getOrDefault(ENV_ENVIRONMENT, "");
        b.production = "production".equalsIgnoreCase(environment.trim())
                || Boolean.parseBoolean(env.getOrDefault(ENV_PRODUCTION, "false"));
        String container = env.get(ENV_RUNNING_IN_CONTAINER);
        b.runningInContainer = container == null
                ? Files.exists(Paths.get("/.dockerenv"))
                : Boolean.parseBoolean(container);
        String audit = env.get(ENV_AUDIT_LOG);
        b.auditLogFile = audit == null || audit.isBlank() ? null : Paths.get(audit.trim());
        return b;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public String applicationBaseUrl() {
        return applicationBaseUrl;
    }

    public String token() {
        return token;
    }

    public String encryptionSecret() {
        return encryptionSecret;
    }

    public List<String> oldSecrets() {
        return oldSecrets;
    }

    /**
     * Signatures on inbound deliveries are only enforced when this is true.
     */
    public boolean production() {
        return production;
    }

    public boolean runningInContainer() {
        return runningInContainer;
    }

    public Path auditLogFile() {
        return auditLogFile;
    }

    public String owner() {
        return owner;
    }

    public int listBatchSize() {
        return listBatchSize;
    }

    public String requireDatabaseUrl() {
        if (databaseUrl == null) {
            throw new ConfigurationException("Missing required " + ENV_DATABASE_URL);
        }
        return databaseUrl;
    }

    public String requireApplicationBaseUrl() {
        if (applicationBaseUrl == null) {
            throw new ConfigurationException("Missing required " + ENV_BASE_URL);
        }
        return applicationBaseUrl;
    }

    static String normalizeBaseUrl(String raw, boolean runningInContainer) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            boolean local = lower.startsWith("localhost") || lower.startsWith("127.0.0.1");
            value = (local ? "http://" : "https://") + value;
        }
        if (runningInContainer) {
            value = value.replace("//localhost:", "//host.docker.internal:");
        }
        return value;
    }

    static List<String> parseSecretList(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (value.startsWith("[")) {
            try {
                for (JsonNode item : Jsons.mapper().readTree(value)) {
                    String secret = item.asText("");
                    if (!secret.isBlank()) {
                        out.add(secret);
                    }
                }
                return out;
            } catch (IOException e) {
                throw new ConfigurationException(ENV_OLD_SECRETS + " is not a valid JSON array", e);
            }
        }
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    public static final class Builder {
        private String databaseUrl;
        private String applicationBaseUrl;
        private String token;
        private String encryptionSecret;
        private List<String> oldSecrets = List.of();
        private boolean production;
        private boolean runningInContainer;
        private Path auditLogFile;
        private String owner;
        private int listBatchSize = DEFAULT_LIST_BATCH_SIZE;

        private Builder() {
        }

        /**
         * Overlays values present in a JSON settings file. Absent keys keep the current value;
         * unknown keys are ignored.
         */
        public Builder applyFile(Path settingsFile) {
            SettingsFile file;
            try {
                file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read settings file: " + settingsFile, e);
            }
            if (file.databaseUrl() != null) {
                databaseUrl = file.databaseUrl();
            }
            if (file.applicationBaseUrl() != null) {
                applicationBaseUrl = file.applicationBaseUrl();
            }
            if (file.token() != null) {
                token = file.token();
            }
            if (file.encryptionSecret() != null) {
                encryptionSecret = file.encryptionSecret();
            }
            if (file.oldSecrets() != null) {
                oldSecrets = List.copyOf(file.oldSecrets());
            }
            if (file.production() != null) {
                production = file.production();
            }
            if (file.auditLogFile() != null) {
                auditLogFile = Paths.get(file.auditLogFile());
            }
            if (file.owner() != null) {
                owner = file.owner();
            }
            if (file.listBatchSize() != null) {
                listBatchSize = file.listBatchSize();
            }
            return this;
        }

        public Builder databaseUrl(String databaseUrl) {
            this.databaseUrl = databaseUrl;
            return this;
        }

        public Builder applicationBaseUrl(String applicationBaseUrl) {
            this.applicationBaseUrl = applicationBaseUrl;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder encryptionSecret(String encryptionSecret) {
            this.encryptionSecret = encryptionSecret;
            return this;
        }

        public Builder oldSecrets(List<String> oldSecrets) {
            this.oldSecrets = oldSecrets == null ? List.of() : List.copyOf(oldSecrets);
            return this;
        }

        public Builder production(boolean production) {
            this.production = production;
            return this;
        }

        public Builder runningInContainer(boolean runningInContainer) {
            this.runningInContainer = runningInContainer;
            return this;
        }

        public Builder auditLogFile(Path auditLogFile) {
            this.auditLogFile = auditLogFile;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder listBatchSize(int listBatchSize) {
            this.listBatchSize = listBatchSize;
            return this;
        }

        public QuirrelConfig build() {
            if (encryptionSecret != null && !encryptionSecret.isBlank()
                    && encryptionSecret.trim().length() != ENCRYPTION_SECRET_LENGTH) {
                throw new ConfigurationException(
                        "encryptionSecret must be exactly " + ENCRYPTION_SECRET_LENGTH + " characters long");
            }
            for (String old : oldSecrets) {
                if (old == null || old.length() != ENCRYPTION_SECRET_LENGTH) {
                    throw new ConfigurationException(
                            "every entry of oldSecrets must be exactly " + ENCRYPTION_SECRET_LENGTH + " characters long");
                }
            }
            if (listBatchSize < 1) {
                throw new ConfigurationException("listBatchSize must be >= 1");
            }
            return new QuirrelConfig(this);
        }
    }

    private record SettingsFile(
            String databaseUrl,
            String applicationBaseUrl,
            String token,
            String encryptionSecret,
            List<String> oldSecrets,
            Boolean production,
            String auditLogFile,
            String owner,
            Integer listBatchSize
    ) {
    }
}
