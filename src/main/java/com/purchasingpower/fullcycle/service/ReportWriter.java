package com.purchasingpower.fullcycle.service;

import com.purchasingpower.fullcycle.exception.PipelineException;
import com.purchasingpower.fullcycle.model.FileChange;
import com.purchasingpower.fullcycle.model.PipelineReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Renders a {@link PipelineReport} as markdown.
 */
@Slf4j
@Service
public class ReportWriter {

    public String render(PipelineReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# Pipeline report\n\n");

        md.append("## Result\n\n");
        md.append("- Status: ").append(report.isSuccess() ? "✅ success" : "❌ failed").append('\n');
        md.append("- Summary: ").append(report.getSummary()).append('\n');
        if (report.getBranchName() != null) {
            md.append("- Branch: `").append(report.getBranchName()).append("`\n");
        }
        if (report.getPrNumber() != null) {
            md.append("- Pull request: #").append(report.getPrNumber());
            if (report.getPrUrl() != null) {
                md.append(" (").append(report.getPrUrl()).append(')');
            }
            md.append('\n');
        }
        md.append('\n');

        md.append("## Changed files\n\n");
        if (report.getChangedFiles().isEmpty()) {
            md.append("_none_\n");
        }
        for (FileChange change : report.getChangedFiles()) {
            md.append("- ").append(change.isNew() ? "🆕 " : "").append('`').append(change.path()).append("` ")
                    .append("+").append(change.linesAdded()).append(" / -").append(change.linesRemoved())
                    .append('\n');
        }
        md.append('\n');

        md.append("## Statistics\n\n");
        md.append("| Metric | Value |\n|---|---|\n");
        md.append("| Lines added | ").append(report.getTotalLinesAdded()).append(" |\n");
        md.append("| Lines removed | ").append(report.getTotalLinesRemoved()).append(" |\n");
        md.append("| Review iterations | ").append(report.getReviewIterations()).append(" |\n");
        md.append("| CI runs | ").append(report.getCiRuns()).append(" |\n");
        md.append("| Duration | ").append(report.getTotalDuration() == null ? "-"
                : report.getTotalDuration().toSeconds() + "s").append(" |\n");
        for (Map.Entry<String, Integer> visit : report.getStateVisits().entrySet()) {
            md.append("| State ").append(visit.getKey()).append(" | ").append(visit.getValue()).append(" |\n");
        }
        md.append('\n');

        if (!report.getWarnings().isEmpty()) {
            md.append("## Warnings\n\n");
            report.getWarnings().forEach(w -> md.append("- ⚠️ ").append(w).append('\n'));
            md.append('\n');
        }
        if (!report.getErrors().isEmpty()) {
            md.append("## Errors\n\n");
            report.getErrors().forEach(e -> md.append("- ").append(e).append('\n'));
            md.append('\n');
        }
        return md.toString();
    }

    public void write(PipelineReport report, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, render(report), StandardCharsets.UTF_8);
            log.info("📄 Report written to {}", target);
        } catch (IOException e) {
            throw new PipelineException("Failed to write report to " + target, e);
        }
    }
}
