package com.purchasingpower.fullcycle.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.fullcycle.config.GitHubProperties;
import com.purchasingpower.fullcycle.exception.PullRequestException;
import com.purchasingpower.fullcycle.model.CallContext;
import com.purchasingpower.fullcycle.model.MergeMethod;
import com.purchasingpower.fullcycle.model.Mergeability;
import com.purchasingpower.fullcycle.model.PullRequestRef;
import com.purchasingpower.fullcycle.model.RepositoryCoordinates;
import com.purchasingpower.fullcycle.model.ServiceType;
import com.purchasingpower.fullcycle.service.PullRequestGateway;
import com.purchasingpower.fullcycle.util.ExternalCallLogger;
import com.purchasingpower.fullcycle.workflow.state.CIResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * GitHub REST implementation of {@link PullRequestGateway}.
 */
@Slf4j
@Service
public class GitHubPullRequestGateway implements PullRequestGateway {

    private static final String GITHUB_JSON = "application/vnd.github+json";
    private static final String GITHUB_DIFF = "application/vnd.github.v3.diff";
    private static final int MAX_LOG_CHARS = 200_000;

    private final WebClient webClient;
    private final WebClient downloadClient;

    public GitHubPullRequestGateway(WebClient.Builder builder, GitHubProperties props) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();

        WebClient.Builder api = builder.clone()
                .baseUrl(props.getApiBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON)
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .exchangeStrategies(strategies);
        if (props.getToken() != null && !props.getToken().isBlank()) {
            api.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getToken());
        }
        this.webClient = api.build();

        // Log archives live on a signed storage URL that must not receive the API token
        this.downloadClient = builder.clone().exchangeStrategies(strategies).build();
    }

    @Override
    public Optional<PullRequestRef> findOpenPullRequest(RepositoryCoordinates repo, String headBranch) {
        JsonNode prs = call("findOpenPullRequest", () -> webClient.get()
                .uri(uri -> uri.path("/repos/{owner}/{repo}/pulls")
                        .queryParam("state", "open")
                        .queryParam("head", repo.owner() + ":" + headBranch)
                        .build(repo.owner(), repo.repo()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());

        if (prs == null || !prs.isArray() || prs.isEmpty()) {
            return Optional.empty();
        }
        JsonNode pr = prs.get(0);
        return Optional.of(new PullRequestRef(pr.path("number").asInt(), pr.path("html_url").asText()));
    }

    @Override
    public PullRequestRef createPullRequest(RepositoryCoordinates repo, String title, String body,
                                            String headBranch, String baseBranch) {
        log.info("Creating PR: {} -> {} in repo {}", headBranch, baseBranch, repo);

        Map<String, Object> payload = Map.of(
                "title", title,
                "body", body,
                "head", headBranch,
                "base", baseBranch
        );

        JsonNode response = call("createPullRequest", () -> webClient.post()
                .uri("/repos/{owner}/{repo}/pulls", repo.owner(), repo.repo())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());

        if (response == null || !response.has("number")) {
            throw new PullRequestException("GitHub API Error: PR created but response has no number");
        }
        return new PullRequestRef(response.path("number").asInt(), response.path("html_url").asText());
    }

    @Override
    public Mergeability getMergeability(RepositoryCoordinates repo, int prNumber) {
        JsonNode pr = getPullRequest(repo, prNumber);
        JsonNode mergeable = pr.path("mergeable");
        if (mergeable.isBoolean()) {
            return mergeable.asBoolean() ? Mergeability.MERGEABLE : Mergeability.CONFLICTING;
        }
        // GitHub computes mergeability asynchronously and reports null until it is done
        return Mergeability.UNKNOWN;
    }

    @Override
    public CIResult getCiStatus(RepositoryCoordinates repo, int prNumber) {
        JsonNode pr = getPullRequest(repo, prNumber);
        String headSha = pr.path("head").path("sha").asText();
        boolean mergeable = pr.path("mergeable").asBoolean(false);

        JsonNode checks = call("listChecks", () -> webClient.get()
                .uri("/repos/{owner}/{repo}/commits/{sha}/check-runs", repo.owner(), repo.repo(), headSha)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());

        List<CIResult.CheckRun> runs = new ArrayList<>();
        if (checks != null) {
            for (JsonNode run : checks.path("check_runs")) {
                runs.add(new CIResult.CheckRun(
                        run.path("name").asText(),
                        run.path("status").asText(),
                        run.path("conclusion").isNull() ? null : run.path("conclusion").asText(null)));
            }
        }
        CIResult result = CIResult.fromCheckRuns(runs, mergeable);
        log.debug("CI status for PR #{}: {} ({} checks)", prNumber, result.getStatus(), runs.size());
        return result;
    }

    @Override
    public Optional<Long> findLatestFailedRunId(RepositoryCoordinates repo, String branch) {
        JsonNode runs = call("findLatestFailedRun", () -> webClient.get()
                .uri(uri -> uri.path("/repos/{owner}/{repo}/actions/runs")
                        .queryParam("branch", branch)
                        .queryParam("status", "failure")
                        .queryParam("per_page", 1)
                        .build(repo.owner(), repo.repo()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());

        if (runs == null || runs.path("workflow_runs").isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(runs.path("workflow_runs").get(0).path("id").asLong());
    }

    @Override
    public String fetchRunLogs(RepositoryCoordinates repo, long runId) {
        JsonNode jobs = call("listRunJobs", () -> webClient.get()
                .uri("/repos/{owner}/{repo}/actions/runs/{runId}/jobs", repo.owner(), repo.repo(), runId)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());

        StringBuilder logs = new StringBuilder();
        if (jobs == null) {
            return "";
        }
        for (JsonNode job : jobs.path("jobs")) {
            if (!"failure".equals(job.path("conclusion").asText())) {
                continue;
            }
            long jobId = job.path("id").asLong();
            logs.append("=== Job: ").append(job.path("name").asText()).append(" ===\n");
            logs.append(fetchJobLog(repo, jobId)).append('\n');
            if (logs.length() > MAX_LOG_CHARS) {
                break;
            }
        }
        return logs.toString();
    }

    private String fetchJobLog(RepositoryCoordinates repo, long jobId) {
        // The endpoint answers 302 with a short-lived download URL; follow it without the API token
        URI location = call("jobLogLocation", () -> webClient.get()
                .uri("/repos/{owner}/{repo}/actions/jobs/{jobId}/logs", repo.owner(), repo.repo(), jobId)
                .exchangeToMono(response -> {
                    if (response.statusCode().is3xxRedirection()) {
                        return Mono.justOrEmpty(response.headers().asHttpHeaders().getLocation());
                    }
                    return response.releaseBody().then(Mono.<URI>empty());
                })
                .block());

        if (location == null) {
            log.warn("⚠️ No log download location for job {}", jobId);
            return "";
        }
        String text = call("downloadJobLog", () -> downloadClient.get()
                .uri(location)
                .retrieve()
                .bodyToMono(String.class)
                .block());
        return text == null ? "" : text;
    }

    @Override
    public String getPullRequestDiff(RepositoryCoordinates repo, int prNumber) {
        String diff = call("getPullRequestDiff", () -> webClient.get()
                .uri("/repos/{owner}/{repo}/pulls/{number}", repo.owner(), repo.repo(), prNumber)
                .header(HttpHeaders.ACCEPT, GITHUB_DIFF)
                .retrieve()
                .bodyToMono(String.class)
                .block());
        return diff == null ? "" : diff;
    }

    @Override
    public void publishReview(RepositoryCoordinates repo, int prNumber, String body) {
        call("publishReview", () -> webClient.post()
                .uri("/repos/{owner}/{repo}/pulls/{number}/reviews", repo.owner(), repo.repo(), prNumber)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("body", body, "event", "COMMENT"))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());
    }

    @Override
    public void merge(RepositoryCoordinates repo, int prNumber, MergeMethod method, String commitTitle) {
        log.info("Merging PR #{} in {} ({})", prNumber, repo, method.getApiValue());
        JsonNode response = call("mergePullRequest", () -> webClient.put()
                .uri("/repos/{owner}/{repo}/pulls/{number}/merge", repo.owner(), repo.repo(), prNumber)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("merge_method", method.getApiValue(), "commit_title", commitTitle))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());

        if (response != null && response.has("merged") && !response.path("merged").asBoolean()) {
            throw new PullRequestException("GitHub API Error: PR #" + prNumber + " was not merged: "
                    + response.path("message").asText());
        }
    }

    private JsonNode getPullRequest(RepositoryCoordinates repo, int prNumber) {
        JsonNode pr = call("getPullRequest", () -> webClient.get()
                .uri("/repos/{owner}/{repo}/pulls/{number}", repo.owner(), repo.repo(), prNumber)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());
        if (pr == null) {
            throw new PullRequestException("GitHub API Error: empty response for PR #" + prNumber);
        }
        return pr;
    }

    private <T> T call(String operation, Supplier<T> request) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GITHUB, operation, log);
        callCtx.logRequest(null);
        try {
            T result = request.get();
            callCtx.logResponse(null);
            return result;
        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + ExternalCallLogger.truncate(e.getResponseBodyAsString(), 300), e);
            throw new PullRequestException("GitHub API Error (" + operation + "): " + e.getStatusCode()
                    + " " + ExternalCallLogger.truncate(e.getResponseBodyAsString(), 300), e);
        } catch (PullRequestException e) {
            callCtx.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            callCtx.logError("Unexpected error", e);
            throw new PullRequestException("GitHub API Error (" + operation + "): " + e.getMessage(), e);
        }
    }
}
