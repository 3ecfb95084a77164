package com.purchasingpower.fullcycle.cli;

import com.purchasingpower.fullcycle.config.AppProperties;
import com.purchasingpower.fullcycle.config.PipelineProperties;
import com.purchasingpower.fullcycle.model.PipelineReport;
import com.purchasingpower.fullcycle.service.ReportWriter;
import com.purchasingpower.fullcycle.workflow.PipelineOrchestrator;
import com.purchasingpower.fullcycle.workflow.pipeline.PipelineListener;
import com.purchasingpower.fullcycle.workflow.pipeline.PipelineRequest;
import com.purchasingpower.fullcycle.workflow.pipeline.PlanConfirmation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Command line entry point: runs one task and exits with 0 on success, 1 otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FullCycleCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties pipelineProperties;
    private final AppProperties appProperties;
    private final ReportWriter reportWriter;

    private int exitCode;

    @Override
    public void run(String... args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (CommandLine.ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(e.getCommandLine().getUsageMessage());
            exitCode = 1;
            return;
        }
        if (!options.hasTask()) {
            System.err.println(CliOptions.usage());
            exitCode = 1;
            return;
        }

        PlanConfirmation confirmation = options.isAuto()
                ? PlanConfirmation.autoApprove()
                : new ConsolePlanConfirmation(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);

        PipelineRequest request = PipelineRequest.builder()
                .taskDescription(options.getTask())
                .projectRoot(Path.of(appProperties.getProjectRoot()).toAbsolutePath().normalize())
                .config(options.applyTo(pipelineProperties.toConfig()))
                .confirmation(confirmation)
                .listener(new PipelineListener() {
                    @Override
                    public void onProgress(String message) {
                        System.out.println(message);
                    }
                })
                .build();

        PipelineReport report = orchestrator.run(request);

        System.out.println();
        System.out.println(reportWriter.render(report));
        if (options.getOutputFile() != null) {
            reportWriter.write(report, options.getOutputFile());
        }
        exitCode = report.isSuccess() ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
