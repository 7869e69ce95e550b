package io.quirrel.schedule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw enqueue options, before validation.
 *
 * <pre>{@code
 * EnqueueOptions options = EnqueueOptions.builder()
 *     .id("welcome-42")
 *     .delay("5min")
 *     .retry("10s", "1min", "1h")
 *     .build();
 * }</pre>
 */
public final class EnqueueOptions {
    private static final EnqueueOptions NONE = builder().build();

    private final String id;
    private final Boolean exclusive;
    private final Boolean override;
    private final List<TimeSpan> retry;
    private final TimeSpan delay;
    private final Instant runAt;
    private final Repeat repeat;

    private EnqueueOptions(Builder b) {
        this.id = b.id;
        this.exclusive = b.exclusive;
        this.override = b.override;
        this.retry = b.retry == null ? null : List.copyOf(b.retry);
        this.delay = b.delay;
        this.runAt = b.runAt;
        this.repeat = b.repeat;
    }

    public static EnqueueOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String id() {
        return id;
    }

    public Boolean exclusive() {
        return exclusive;
    }

    public Boolean override() {
        return override;
    }

    /**
     * @return null when the caller gave no retry ladder
     */
    public List<TimeSpan> retry() {
        return retry;
    }

    public TimeSpan delay() {
        return delay;
    }

    public Instant runAt() {
        return runAt;
    }

    public Repeat repeat() {
        return repeat;
    }

    /**
     * Fills {@code exclusive} and {@code retry} from queue-level defaults where this instance leaves them unset.
     */
    public EnqueueOptions withDefaults(EnqueueOptions defaults) {
        if (defaults == null) {
            return this;
        }
        Builder b = toBuilder();
        if (b.exclusive == null) {
            b.exclusive = defaults.exclusive;
        }
        if (b.retry == null && defaults.retry != null && b.repeat == null) {
            b.retry = new ArrayList<>(defaults.retry);
        }
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.exclusive = exclusive;
        b.override = override;
        b.retry = retry == null ? null : new ArrayList<>(retry);
        b.delay = delay;
        b.runAt = runAt;
        b.repeat = repeat;
        return b;
    }

    public static final class Builder {
        private String id;
        private Boolean exclusive;
        private Boolean override;
        private List<TimeSpan> retry;
        private TimeSpan delay;
        private Instant runAt;
        private Repeat repeat;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder id(long id) {
            this.id = Long.toString(id);
            return this;
        }

        /** No other job of the same queue runs while this one runs. */
        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        /** Replace an existing job with the same id instead of keeping it. */
        public Builder override(boolean override) {
            this.override = override;
            return this;
        }

        public Builder retry(String... spans) {
            List<TimeSpan> out = new ArrayList<>(spans.length);
            for (String span : spans) {
                out.add(TimeSpan.of(span));
            }
            this.retry = out;
            return this;
        }

        public Builder retry(List<TimeSpan> spans) {
            this.retry = spans == null ? null : new ArrayList<>(spans);
            return this;
        }

        public Builder delay(long millis) {
            this.delay = TimeSpan.ofMillis(millis);
            return this;
        }

        public Builder delay(String span) {
            this.delay = TimeSpan.of(span);
            return this;
        }

        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder repeat(Repeat repeat) {
            this.repeat = repeat;
            return this;
        }

        public EnqueueOptions build() {
            return new EnqueueOptions(this);
        }
    }
}
