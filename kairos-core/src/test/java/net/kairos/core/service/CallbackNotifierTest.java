package net.kairos.core.service;

import com.sun.net.httpserver.HttpServer;
import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.RecurrenceKind;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackNotifierTest {

    record Seen(String method, String contentType, String token, String body) {}

    HttpServer server;
    String base;
    final CopyOnWriteArrayList<Seen> seen = new CopyOnWriteArrayList<>();
    ExecutorService pool;
    CallbackNotifier notifier;

    final Instant start = Instant.parse("2030-01-01T00:00:00Z");
    final ExecutionLog log = ExecutionLog.started(1L, start).finish(start.plusSeconds(4), "42", null, 0);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", ex -> {
            seen.add(new Seen(ex.getRequestMethod(),
                    ex.getRequestHeaders().getFirst("Content-Type"),
                    ex.getRequestHeaders().getFirst("X-Token"),
                    new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8)));
            ex.sendResponseHeaders(204, -1);
            ex.close();
        });
        server.createContext("/broken", ex -> {
            ex.sendResponseHeaders(500, -1);
            ex.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
        pool = Executors.newSingleThreadExecutor();
        notifier = new CallbackNotifier(HttpClient.newHttpClient(), pool, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        server.stop(0);
    }

    private Job job(String url, String method, String template) {
        return Job.ofNew("cb", RecurrenceKind.CRON, "* * * * *", ExecutionKind.SHELL, "echo 42")
                .withId(1L)
                .withCallback(url, method, Map.of("X-Token", "t0k"), template);
    }

    @Test
    void posts_rendered_json_body_with_headers() {
        notifier.notifyAsync(job(base + "/hook", null, "{\"name\":\"${name}\",\"output\":\"${output}\"}"), log);

        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> !seen.isEmpty());
        Seen s = seen.get(0);
        assertThat(s.method()).isEqualTo("POST");
        assertThat(s.contentType()).isEqualTo("application/json");
        assertThat(s.token()).isEqualTo("t0k");
        assertThat(s.body()).isEqualTo("{\"name\":\"cb\",\"output\":\"42\"}");
    }

    @Test
    void empty_body_has_no_content_type() {
        assertThat(notifier.deliver(job(base + "/hook", "GET", null), log)).isTrue();

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).method()).isEqualTo("GET");
        assertThat(seen.get(0).contentType()).isNull();
        assertThat(seen.get(0).body()).isEmpty();
    }

    @Test
    void error_status_and_unreachable_receiver_are_swallowed() {
        assertThat(notifier.deliver(job(base + "/broken", "POST", "x"), log)).isFalse();
        assertThat(notifier.deliver(job("http://127.0.0.1:1/none", "POST", "x"), log)).isFalse();
    }

    @Test
    void job_without_callback_sends_nothing() throws Exception {
        Job plain = Job.ofNew("plain", RecurrenceKind.CRON, "* * * * *", ExecutionKind.SHELL, "true").withId(2L);

        notifier.notifyAsync(plain, log);
        Thread.sleep(200);

        assertThat(seen).isEmpty();
    }
}
