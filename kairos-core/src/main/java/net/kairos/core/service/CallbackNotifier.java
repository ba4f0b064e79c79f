package net.kairos.core.service;

import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.support.IsolatedTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget delivery of a job's callback after each firing. Failures are logged,
 * never retried and never propagated.
 */
public final class CallbackNotifier {
    private static final Logger log = LoggerFactory.getLogger(CallbackNotifier.class);

    public static final String DEFAULT_METHOD = "POST";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final Executor executor;
    private final Duration timeout;

    public CallbackNotifier(HttpClient client, Executor executor, Duration timeout) {
        this.client = client;
        this.executor = executor;
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public void notifyAsync(Job job, ExecutionLog execution) {
        if (!job.hasCallback()) return;
        try {
            executor.execute(IsolatedTask.of("callback " + job.name(), () -> deliver(job, execution)));
        } catch (RejectedExecutionException e) {
            log.warn("callback of job '{}' dropped, executor is shut down", job.name());
        }
    }

    /** @return whether the receiver answered 2xx */
    boolean deliver(Job job, ExecutionLog execution) {
        String method = job.callbackMethod() == null || job.callbackMethod().isBlank()
                ? DEFAULT_METHOD : job.callbackMethod().trim().toUpperCase();
        String body = CallbackTemplate.render(job.callbackBodyTemplate(), job, execution);

        HttpRequest request;
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(job.callbackUrl().trim()))
                    .timeout(timeout)
                    .method(method, body.isEmpty()
                            ? HttpRequest.BodyPublishers.noBody()
                            : HttpRequest.BodyPublishers.ofString(body));
            if (!body.isEmpty()) b.header("Content-Type", "application/json");
            for (Map.Entry<String, String> h : job.callbackHeaders().entrySet()) {
                b.setHeader(h.getKey(), h.getValue());
            }
            request = b.build();
        } catch (IllegalArgumentException e) {
            log.error("callback of job '{}' not sent, bad request: {}", job.name(), e.getMessage());
            return false;
        }

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("callback of job '{}' to {} answered {}", job.name(), job.callbackUrl(), status);
                return false;
            }
            log.debug("callback of job '{}' delivered ({})", job.name(), status);
            return true;
        } catch (IOException e) {
            log.error("callback of job '{}' to {} failed: {}", job.name(), job.callbackUrl(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("callback of job '{}' interrupted", job.name());
            return false;
        }
    }
}
