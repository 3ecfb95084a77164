package com.purchasingpower.fullcycle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /**
     * Working copy the pipeline operates on. Must be a git repository with an {@code origin} remote.
     */
    @NotBlank(message = "Project root is required")
    private String projectRoot = ".";

    @Valid
    @NotNull
    private Cli cli = new Cli();

    @Data
    public static class Cli {
        private boolean enabled = true;
    }
}
