package com.purchasingpower.fullcycle.service.impl;

import com.purchasingpower.fullcycle.config.GitHubProperties;
import com.purchasingpower.fullcycle.exception.PullRequestException;
import com.purchasingpower.fullcycle.model.MergeMethod;
import com.purchasingpower.fullcycle.model.Mergeability;
import com.purchasingpower.fullcycle.model.PullRequestRef;
import com.purchasingpower.fullcycle.model.RepositoryCoordinates;
import com.purchasingpower.fullcycle.workflow.state.CIResult;
import com.purchasingpower.fullcycle.workflow.state.CiStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the REST mapping against canned GitHub responses, without a network.
 */
@DisplayName("GitHub Pull Request Gateway Tests")
class GitHubPullRequestGatewayTest {

    private static final RepositoryCoordinates REPO = new RepositoryCoordinates("acme", "widgets");

    private final Map<String, ClientResponse> routes = new LinkedHashMap<>();
    private final List<ClientRequest> requests = new ArrayList<>();
    private GitHubPullRequestGateway gateway;

    @BeforeEach
    void setUp() {
        GitHubProperties props = new GitHubProperties();
        props.setToken("ghp_test");
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            String key = request.method().name() + " " + request.url().getPath();
            ClientResponse response = routes.get(key);
            return Mono.just(response != null ? response : ClientResponse.create(HttpStatus.NOT_FOUND)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"message\": \"Not Found\"}")
                    .build());
        });
        gateway = new GitHubPullRequestGateway(builder, props);
    }

    @Test
    @DisplayName("Should find an open pull request for the branch")
    void testFindOpenPullRequest() {
        // Given
        json("GET /repos/acme/widgets/pulls", "[{\"number\": 7, \"html_url\": \"https://github.com/acme/widgets/pull/7\"}]");

        // When
        Optional<PullRequestRef> pr = gateway.findOpenPullRequest(REPO, "feature/retry");

        // Then
        assertEquals(Optional.of(new PullRequestRef(7, "https://github.com/acme/widgets/pull/7")), pr);
        ClientRequest sent = requests.get(0);
        assertTrue(sent.url().getQuery().contains("state=open"));
        assertTrue(sent.url().getQuery().contains("head=acme:feature/retry"));
        assertEquals("Bearer ghp_test", sent.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("Should create a pull request and read its number")
    void testCreatePullRequest() {
        // Given
        json("POST /repos/acme/widgets/pulls", "{\"number\": 42, \"html_url\": \"https://github.com/acme/widgets/pull/42\"}");

        // When
        PullRequestRef pr = gateway.createPullRequest(REPO, "feat: add retry", "body", "feature/retry", "main");

        // Then
        assertEquals(42, pr.number());
    }

    @Test
    @DisplayName("Should map the mergeable flag, treating null as unknown")
    void testGetMergeability() {
        json("GET /repos/acme/widgets/pulls/42", "{\"mergeable\": null}");
        assertEquals(Mergeability.UNKNOWN, gateway.getMergeability(REPO, 42));

        json("GET /repos/acme/widgets/pulls/42", "{\"mergeable\": false}");
        assertEquals(Mergeability.CONFLICTING, gateway.getMergeability(REPO, 42));

        json("GET /repos/acme/widgets/pulls/42", "{\"mergeable\": true}");
        assertEquals(Mergeability.MERGEABLE, gateway.getMergeability(REPO, 42));
    }

    @Test
    @DisplayName("Should aggregate check runs of the head commit")
    void testGetCiStatus() {
        // Given
        json("GET /repos/acme/widgets/pulls/42", "{\"mergeable\": true, \"head\": {\"sha\": \"abc123\"}}");
        json("GET /repos/acme/widgets/commits/abc123/check-runs", """
                {"check_runs": [
                  {"name": "build", "status": "completed", "conclusion": "failure"},
                  {"name": "lint", "status": "completed", "conclusion": "success"}
                ]}
                """);

        // When
        CIResult result = gateway.getCiStatus(REPO, 42);

        // Then
        assertEquals(CiStatus.FAILED, result.getStatus());
        assertEquals("build", result.getCheckName());
    }

    @Test
    @DisplayName("Should download failed job logs without sending the token")
    void testFetchRunLogs() {
        // Given
        json("GET /repos/acme/widgets/actions/runs/99/jobs", """
                {"jobs": [
                  {"id": 1, "name": "build", "conclusion": "failure"},
                  {"id": 2, "name": "docs", "conclusion": "success"}
                ]}
                """);
        routes.put("GET /repos/acme/widgets/actions/jobs/1/logs", ClientResponse.create(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, "https://storage.example.com/logs/1.txt")
                .build());
        routes.put("GET /logs/1.txt", ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                .body("[ERROR] cannot find symbol")
                .build());

        // When
        String logs = gateway.fetchRunLogs(REPO, 99);

        // Then
        assertEquals("=== Job: build ===\n[ERROR] cannot find symbol\n", logs);
        ClientRequest download = requests.get(requests.size() - 1);
        assertEquals("storage.example.com", download.url().getHost());
        assertNull(download.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("Should find the latest failed workflow run")
    void testFindLatestFailedRunId() {
        json("GET /repos/acme/widgets/actions/runs", "{\"workflow_runs\": [{\"id\": 99}]}");
        assertEquals(Optional.of(99L), gateway.findLatestFailedRunId(REPO, "feature/retry"));

        json("GET /repos/acme/widgets/actions/runs", "{\"workflow_runs\": []}");
        assertTrue(gateway.findLatestFailedRunId(REPO, "feature/retry").isEmpty());
    }

    @Test
    @DisplayName("Should wrap API errors with the operation name")
    void testErrors() {
        PullRequestException thrown = assertThrows(PullRequestException.class,
                () -> gateway.getPullRequestDiff(REPO, 42));

        assertTrue(thrown.getMessage().startsWith("GitHub API Error (getPullRequestDiff): 404"));
    }

    @Test
    @DisplayName("Should fail when GitHub refuses to merge")
    void testMerge_NotMerged() {
        // Given
        json("PUT /repos/acme/widgets/pulls/42/merge", "{\"merged\": false, \"message\": \"Head branch was modified\"}");

        // When
        PullRequestException thrown = assertThrows(PullRequestException.class,
                () -> gateway.merge(REPO, 42, MergeMethod.SQUASH, "feat: x (#42)"));

        // Then
        assertTrue(thrown.getMessage().contains("Head branch was modified"));
    }

    private void json(String route, String body) {
        routes.put(route, ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
