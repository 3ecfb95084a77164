package com.purchasingpower.fullcycle.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * GitHub access settings ({@code app.github}).
 *
 * <p>{@code owner} and {@code repo} are optional: when blank they are parsed from the
 * {@code origin} remote of the working copy.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.github")
public class GitHubProperties {

    private String token = "";

    /**
     * User name sent with the token for git over HTTPS. GitHub accepts any non-empty value.
     */
    @NotBlank
    private String username = "x-access-token";

    @NotBlank
    private String apiBaseUrl = "https://api.github.com";

    private String owner = "";

    private String repo = "";
}
