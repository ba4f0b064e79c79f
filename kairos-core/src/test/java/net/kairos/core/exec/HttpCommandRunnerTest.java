package net.kairos.core.exec;

import com.sun.net.httpserver.HttpServer;
import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;
import net.kairos.core.model.RecurrenceKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpCommandRunnerTest {

    HttpServer server;
    String base;
    final AtomicReference<String> seenMethod = new AtomicReference<>();
    final AtomicReference<String> seenBody = new AtomicReference<>();
    final AtomicReference<String> seenHeader = new AtomicReference<>();

    final HttpCommandRunner runner = new HttpCommandRunner(HttpClient.newHttpClient());

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", ex -> {
            seenMethod.set(ex.getRequestMethod());
            seenBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            seenHeader.set(ex.getRequestHeaders().getFirst("X-Trace"));
            reply(ex, 200, "pong");
        });
        server.createContext("/fail", ex -> reply(ex, 503, "down for maintenance"));
        server.createContext("/slow", ex -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            reply(ex, 200, "late");
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        if (server != null) server.stop(0);
    }

    private static void reply(com.sun.net.httpserver.HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private Job http(String path) {
        return Job.ofNew("http", RecurrenceKind.CRON, "* * * * *", ExecutionKind.HTTP, base + path);
    }

    @Test
    void get_is_the_default_method_and_body_is_the_output() throws Exception {
        String out = runner.run(http("/ok"), Deadline.after(Duration.ofSeconds(5)));

        assertThat(out).isEqualTo("pong");
        assertThat(seenMethod.get()).isEqualTo("GET");
    }

    @Test
    void method_headers_and_body_are_sent() throws Exception {
        Job job = http("/ok").withHttp("post", Map.of("X-Trace", "abc"), "{\"k\":1}");

        runner.run(job, Deadline.after(Duration.ofSeconds(5)));

        assertThat(seenMethod.get()).isEqualTo("POST");
        assertThat(seenHeader.get()).isEqualTo("abc");
        assertThat(seenBody.get()).isEqualTo("{\"k\":1}");
    }

    @Test
    void non_2xx_is_failure_carrying_response_body() {
        assertThatThrownBy(() -> runner.run(http("/fail"), Deadline.after(Duration.ofSeconds(5))))
                .isInstanceOf(ExecutionFailureException.class)
                .isNotInstanceOf(ExecutionTimeoutException.class)
                .hasMessageContaining("503")
                .satisfies(e -> assertThat(((ExecutionFailureException) e).output()).isEqualTo("down for maintenance"));
    }

    @Test
    void slow_response_is_a_timeout() {
        assertThatThrownBy(() -> runner.run(http("/slow"), Deadline.after(Duration.ofSeconds(1))))
                .isInstanceOf(ExecutionTimeoutException.class)
                .hasMessage("execution timed out (1 seconds)");
    }

    @Test
    void connection_refused_is_failure_without_body() {
        server.stop(0);
        server = null;
        assertThatThrownBy(() -> runner.run(http("/ok"), Deadline.after(Duration.ofSeconds(5))))
                .isInstanceOf(ExecutionFailureException.class)
                .satisfies(e -> assertThat(((ExecutionFailureException) e).output()).isNull());
    }
}
