package work.lcod.components.api;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a {@code ComponentRuntime}.
 */
public record RuntimeConfiguration(
    Duration httpTimeout,
    Optional<Path> stateDirectory,
    Clock clock,
    LogLevel logLevel
) {
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    public RuntimeConfiguration {
        Objects.requireNonNull(httpTimeout, "httpTimeout");
        Objects.requireNonNull(stateDirectory, "stateDirectory");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(logLevel, "logLevel");
        if (httpTimeout.isNegative() || httpTimeout.isZero()) {
            throw new IllegalArgumentException("httpTimeout must be > 0");
        }
    }

    public static RuntimeConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;
        private Optional<Path> stateDirectory = Optional.empty();
        private Clock clock = Clock.systemUTC();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder stateDirectory(Path stateDirectory) {
            this.stateDirectory = Optional.ofNullable(stateDirectory);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RuntimeConfiguration build() {
            return new RuntimeConfiguration(httpTimeout, stateDirectory, clock, logLevel);
        }
    }
}
