package com.purchasingpower.fullcycle.cli;

import com.purchasingpower.fullcycle.model.ExecutionPlan;
import com.purchasingpower.fullcycle.workflow.pipeline.PlanConfirmation;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Shows the plan on the console and waits for a yes/no answer.
 */
@Slf4j
public class ConsolePlanConfirmation implements PlanConfirmation {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePlanConfirmation(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirmPlan(ExecutionPlan plan) {
        out.println();
        out.println("📋 Planned changes:");
        out.print(plan.describe());
        out.print("Execute this plan? [y/N] ");
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            log.warn("Could not read confirmation: {}", e.getMessage());
            return false;
        }
    }
}
