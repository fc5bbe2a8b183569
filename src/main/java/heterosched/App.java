package heterosched;

import heterosched.engine.config.Dependencies;
import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.SyntheticWorkExecutor;
import heterosched.engine.generator.GenerationException;
import heterosched.engine.generator.TaskGenerator;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import heterosched.engine.policy.PolicyType;
import heterosched.engine.report.ComparisonReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command line driver: generates a batch and runs one policy or all of them on it.
 */
@CommandLine.Command(name = "heterosched",
        mixinStandardHelpOptions = true,
        version = "heterosched 1.0",
        description = "Run a heterogeneous task batch under one or all scheduling policies.")
public class App implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String COMPARE_ALL = "compare-all";

    static final int EXIT_OK = 0;
    static final int EXIT_GENERATION_ERROR = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = { "-n", "--tasks" }, defaultValue = "50",
            description = "Number of tasks to generate (default: ${DEFAULT-VALUE})")
    private int tasks;

    @CommandLine.Option(names = "--min-cost", defaultValue = "10",
            description = "Lowest cost hint (default: ${DEFAULT-VALUE})")
    private int minCost;

    @CommandLine.Option(names = "--max-cost", defaultValue = "100",
            description = "Highest cost hint (default: ${DEFAULT-VALUE})")
    private int maxCost;

    @CommandLine.Option(names = { "-w", "--workers" },
            description = "Worker count (default: HETEROSCHED_WORKERS or available processors)")
    private Integer workers;

    @CommandLine.Option(names = { "-p", "--policy" }, defaultValue = COMPARE_ALL,
            description = "naive, grouped, priority, partitioned, adaptive, capped, batched or compare-all "
                    + "(default: ${DEFAULT-VALUE})")
    private String policy;

    @CommandLine.Option(names = "--ratios", split = ",", paramLabel = "c,m,i,x",
            description = "Compute, Memory, IO and Mixed weights (default: 0.4,0.3,0.2,0.1)")
    private double[] ratios;

    @CommandLine.Option(names = "--seed", description = "Seed for reproducible batches")
    private Long seed;

    @CommandLine.Option(names = "--fail-types", split = ",",
            description = "Task types whose synthetic work fails, e.g. io,mixed")
    private Set<TaskType> failTypes;

    @CommandLine.Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    @Override
    public Integer call() {
        PolicyType selected = selectedPolicy();
        SchedulerConfig config = buildConfig();
        Dependencies deps = Dependencies.create(config);

        List<TaskDescriptor> batch;
        try {
            TaskGenerator generator = deps.taskGenerator();
            batch = TaskGenerator.requireViable(ratios != null
                    ? generator.generate(tasks, minCost, maxCost, ratios)
                    : generator.generate(tasks, minCost, maxCost));
        } catch (GenerationException e) {
            log.error("Task generation failed: {}", e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_GENERATION_ERROR;
        }

        SyntheticWorkExecutor executor = new SyntheticWorkExecutor(
                failTypes != null ? failTypes : EnumSet.noneOf(TaskType.class));

        ComparisonReport report = selected == null
                ? deps.comparisonRunner().compareAll(batch, executor)
                : deps.comparisonRunner().single(selected, batch, executor);

        spec.commandLine().getOut().print(json ? report.toJson() + System.lineSeparator() : report.toText());
        spec.commandLine().getOut().flush();
        return EXIT_OK;
    }

    /** Null means every policy. */
    private PolicyType selectedPolicy() {
        if (COMPARE_ALL.equalsIgnoreCase(policy.trim())) {
            return null;
        }
        try {
            return PolicyType.fromSelector(policy);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    private SchedulerConfig buildConfig() {
        SchedulerConfig config = SchedulerConfig.fromEnv();
        if (workers != null) {
            try {
                config.withWorkerCount(workers);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--workers: " + e.getMessage());
            }
        }
        if (seed != null) {
            config.withSeed(seed);
        }
        return config;
    }

    /** Command line with the driver's parser settings. */
    public static CommandLine commandLine() {
        return new CommandLine(new App()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
