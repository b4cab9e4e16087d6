package work.marlowe.kernel.api;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.marlowe.kernel.semantics.TimeInterval;

/**
 * Immutable configuration of a single {@link TransactionRunner} run.
 *
 * <p>{@code inputPayload} is a JSON array of inputs and is only used by {@link Operation#APPLY}. Without a state
 * file the run starts from an empty state whose minimum time is the interval start (or {@code now}).
 */
public record RunConfiguration(
    Operation operation,
    Path contractPath,
    Optional<Path> statePath,
    String inputPayload,
    Optional<TimeInterval> interval,
    Optional<BigInteger> now,
    List<Path> bundles,
    long maxSteps,
    Duration window,
    LogLevel logLevel
) {
    public RunConfiguration {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(contractPath, "contractPath");
        Objects.requireNonNull(statePath, "statePath");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(now, "now");
        bundles = List.copyOf(bundles);
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Operation operation = Operation.REDUCE;
        private Path contractPath;
        private Optional<Path> statePath = Optional.empty();
        private String inputPayload = "[]";
        private Optional<TimeInterval> interval = Optional.empty();
        private Optional<BigInteger> now = Optional.empty();
        private List<Path> bundles = List.of();
        private long maxSteps = Settings.DEFAULT.maxSteps();
        private Duration window = Settings.DEFAULT.window();
        private LogLevel logLevel = Settings.DEFAULT.logLevel();

        /**
         * Copies the file-level defaults; explicit builder calls made afterwards win.
         */
        public Builder settings(Settings settings) {
            this.maxSteps = settings.maxSteps();
            this.window = settings.window();
            this.logLevel = settings.logLevel();
            return this;
        }

        public Builder operation(Operation operation) {
            this.operation = operation;
            return this;
        }

        public Builder contractPath(Path contractPath) {
            this.contractPath = contractPath;
            return this;
        }

        public Builder statePath(Optional<Path> statePath) {
            this.statePath = statePath;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder interval(Optional<TimeInterval> interval) {
            this.interval = interval;
            return this;
        }

        public Builder now(Optional<BigInteger> now) {
            this.now = now;
            return this;
        }

        public Builder bundles(List<Path> bundles) {
            this.bundles = bundles;
            return this;
        }

        public Builder maxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                operation,
                contractPath,
                statePath,
                inputPayload,
                interval,
                now,
                bundles,
                maxSteps,
                window,
                logLevel
            );
        }
    }
}
