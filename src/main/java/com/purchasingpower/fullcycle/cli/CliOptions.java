package com.purchasingpower.fullcycle.cli;

import com.purchasingpower.fullcycle.model.PipelineConfig;
import lombok.Getter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parsed command line: the task text plus switches that override the configured defaults.
 */
@Getter
@Command(
        name = "fullcycle",
        description = "Plan, apply, validate and merge a change described in plain text."
)
public class CliOptions {

    /**
     * Spring property overrides such as {@code --app.pipeline.base-branch=develop}; Spring binds these itself.
     */
    private static final Pattern SPRING_PROPERTY = Pattern.compile("--[\\w-]+(\\.[\\w-]+)+=.*");

    @Parameters(paramLabel = "TASK", arity = "0..*", description = "Task description.")
    private List<String> words = new ArrayList<>();

    @Option(names = "--auto", description = "Execute the plan without asking for confirmation.")
    private boolean auto;

    @Option(names = "--no-merge", description = "Stop after CI instead of merging the pull request.")
    private boolean noMerge;

    @Option(names = "--no-ci", description = "Do not wait for CI.")
    private boolean noCi;

    @Option(names = "--force-approve", description = "Allow the review loop to force-approve repeated findings.")
    private boolean forceApprove;

    @Option(names = "--keep-ours", description = "Resolve merge conflicts by keeping this branch's version.")
    private boolean keepOurs;

    @Option(names = "--output", paramLabel = "FILE", description = "Also write the report as markdown to FILE.")
    private Path outputFile;

    /**
     * @throws CommandLine.ParameterException on an unknown option or a missing option value
     */
    public static CliOptions parse(String... args) {
        CliOptions options = new CliOptions();
        String[] own = Arrays.stream(args)
                .filter(arg -> !SPRING_PROPERTY.matcher(arg).matches())
                .toArray(String[]::new);
        new CommandLine(options).parseArgs(own);
        return options;
    }

    public static String usage() {
        return new CommandLine(new CliOptions()).getUsageMessage();
    }

    public String getTask() {
        return String.join(" ", words).trim();
    }

    public boolean hasTask() {
        return !getTask().isBlank();
    }

    /**
     * Apply the switches on top of the configured defaults.
     */
    public PipelineConfig applyTo(PipelineConfig defaults) {
        PipelineConfig.PipelineConfigBuilder config = defaults.toBuilder();
        if (noMerge) {
            config.autoMerge(false);
        }
        if (noCi) {
            config.requireCIPass(false);
        }
        if (forceApprove) {
            config.forceApproveEnabled(true);
        }
        if (keepOurs) {
            config.keepOursOnConflict(true);
        }
        return config.build();
    }
}
