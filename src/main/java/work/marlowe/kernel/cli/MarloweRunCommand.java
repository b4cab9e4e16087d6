package work.marlowe.kernel.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.marlowe.kernel.api.LogLevel;
import work.marlowe.kernel.api.Operation;
import work.marlowe.kernel.api.RunConfiguration;
import work.marlowe.kernel.api.RunResult;
import work.marlowe.kernel.api.Settings;
import work.marlowe.kernel.api.TransactionRunner;
import work.marlowe.kernel.codec.CodecException;
import work.marlowe.kernel.codec.MarloweJson;
import work.marlowe.kernel.semantics.TimeInterval;
import work.marlowe.kernel.shared.TimeParser;

@CommandLine.Command(
    name = "marlowe-run",
    description = "Run Marlowe contracts with the Java interpreter.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        MarloweRunCommand.Reduce.class,
        MarloweRunCommand.Apply.class,
        MarloweRunCommand.Next.class
    }
)
final class MarloweRunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Options shared by every subcommand.
     */
    static final class CommonOptions {
        @CommandLine.Option(names = {"-c", "--contract"}, required = true, description = "Contract file (JSON or YAML).")
        Path contract;

        @CommandLine.Option(
            names = {"-s", "--state"},
            description = "State file (default: empty state starting at the interval start)."
        )
        Path state;

        @CommandLine.Option(names = "--from", description = "Interval start (epoch millis or ISO instant).")
        String from;

        @CommandLine.Option(names = "--to", description = "Interval end (epoch millis or ISO instant).")
        String to;

        @CommandLine.Option(
            names = "--config",
            description = "Settings file (default: ./" + Settings.FILE_NAME + ")."
        )
        Path config;

        @CommandLine.Option(names = "--max-steps", description = "Reduction step budget; 0 means unbounded.")
        Long maxSteps;

        @CommandLine.Option(
            names = "--log-level",
            description = "Log threshold (trace|debug|info|warn|error|fatal)."
        )
        String logLevel;

        Optional<TimeInterval> interval() {
            if (from == null && to == null) {
                return Optional.empty();
            }
            if (from == null || to == null) {
                throw new IllegalArgumentException("--from and --to must be given together");
            }
            return Optional.of(new TimeInterval(TimeParser.parseTimestamp(from), TimeParser.parseTimestamp(to)));
        }

        RunConfiguration.Builder configure(Operation operation) {
            // slf4j-simple fixes its level when the first logger is created
            Optional<LogLevel> explicit = Optional.ofNullable(logLevel).map(LogLevel::from);
            explicit.ifPresent(LogLevel::install);
            var settings = Settings.load(config != null ? config : Paths.get(Settings.FILE_NAME));
            var level = explicit.orElse(settings.logLevel());
            level.install();
            var builder = RunConfiguration.builder()
                .settings(settings)
                .operation(operation)
                .contractPath(contract.toAbsolutePath().normalize())
                .statePath(Optional.ofNullable(state))
                .interval(interval());
            if (maxSteps != null) {
                builder.maxSteps(maxSteps);
            }
            return builder.logLevel(level);
        }
    }

    abstract static class RunSubcommand implements Callable<Integer> {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common = new CommonOptions();

        abstract RunConfiguration configuration();

        @Override
        public Integer call() {
            RunResult result = new TransactionRunner().run(configuration());
            spec.commandLine().getOut().println(result.toPrettyJson());
            spec.commandLine().getOut().flush();
            return result.status().exitCode();
        }
    }

    @CommandLine.Command(name = "reduce", description = "Reduce a contract to quiescence without inputs.")
    static final class Reduce extends RunSubcommand {
        @Override
        RunConfiguration configuration() {
            return common.configure(Operation.REDUCE).build();
        }
    }

    @CommandLine.Command(name = "apply", description = "Apply one transaction (interval plus inputs).")
    static final class Apply extends RunSubcommand {
        @CommandLine.Option(
            names = {"-i", "--inputs"},
            paramLabel = "PATH|-|JSON",
            description = "JSON array of inputs, a file holding one, or '-' for stdin (default: [])."
        )
        String inputs;

        @Override
        RunConfiguration configuration() {
            return common.configure(Operation.APPLY).inputPayload(loadInputPayload()).build();
        }

        private String loadInputPayload() {
            if (inputs == null || inputs.isBlank()) {
                return "[]";
            }
            String payload;
            String trimmed = inputs.trim();
            if ("-".equals(trimmed)) {
                payload = readStdin();
            } else if (trimmed.startsWith("[")) {
                payload = trimmed;
            } else {
                Path path = Paths.get(trimmed).toAbsolutePath().normalize();
                try {
                    payload = Files.readString(path, StandardCharsets.UTF_8);
                } catch (IOException ex) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read inputs file: " + path);
                }
            }
            try {
                if (!MarloweJson.parse(payload).isArray()) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "Inputs must be a JSON array");
                }
            } catch (CodecException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
            return payload;
        }

        private String readStdin() {
            try {
                InputStream stdin = System.in;
                byte[] bytes = stdin.readAllBytes();
                if (bytes.length == 0) {
                    return "[]";
                }
                return new String(bytes, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
            }
        }
    }

    @CommandLine.Command(name = "next", description = "List the actions that can be taken now.")
    static final class Next extends RunSubcommand {
        @CommandLine.Option(names = "--now", description = "Current time (default: the interval start or the clock).")
        String now;

        @CommandLine.Option(names = "--window", description = "Advisory window when no timeout is pending (e.g. 24h).")
        String window;

        @CommandLine.Option(
            names = {"-b", "--bundle"},
            description = "Continuation bundle files for merkleized cases.",
            arity = "1..*"
        )
        List<Path> bundles = new ArrayList<>();

        @Override
        RunConfiguration configuration() {
            var builder = common.configure(Operation.NEXT)
                .bundles(bundles)
                .now(Optional.ofNullable(now).map(TimeParser::parseTimestamp));
            TimeParser.parseDuration(window).ifPresent(builder::window);
            return builder.build();
        }
    }
}
