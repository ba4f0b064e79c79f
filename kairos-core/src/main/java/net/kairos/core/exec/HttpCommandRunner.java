package net.kairos.core.exec;

import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/** Calls {@code job.command()} as a URL. Success is any 2xx; the response body is the output. */
public final class HttpCommandRunner implements CommandRunner {
    public static final String DEFAULT_METHOD = "GET";

    private final HttpClient client;

    public HttpCommandRunner(HttpClient client) {
        this.client = client;
    }

    @Override
    public ExecutionKind kind() {
        return ExecutionKind.HTTP;
    }

    @Override
    public String run(Job job, Deadline deadline) throws ExecutionFailureException {
        HttpRequest request = buildRequest(job, deadline);

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ExecutionTimeoutException(deadline.timeout(), null);
        } catch (IOException e) {
            throw new ExecutionFailureException("http request failed: " + e.getMessage(), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionTimeoutException(deadline.timeout(), null);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ExecutionFailureException("http status " + status, response.body());
        }
        return response.body();
    }

    private static HttpRequest buildRequest(Job job, Deadline deadline) throws ExecutionFailureException {
        String method = job.httpMethod() == null || job.httpMethod().isBlank()
                ? DEFAULT_METHOD : job.httpMethod().trim().toUpperCase();
        HttpRequest.BodyPublisher body = job.httpBody() == null || job.httpBody().isEmpty()
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(job.httpBody());
        Duration remaining = deadline.remaining();
        if (remaining.isZero()) {
            throw new ExecutionTimeoutException(deadline.timeout(), null);
        }
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(job.command().trim()))
                    .timeout(remaining)
                    .method(method, body);
            for (Map.Entry<String, String> h : job.httpHeaders().entrySet()) {
                b.header(h.getKey(), h.getValue());
            }
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new ExecutionFailureException("invalid http request: " + e.getMessage(), null, e);
        }
    }
}
