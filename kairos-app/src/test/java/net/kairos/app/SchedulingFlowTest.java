package net.kairos.app;

import com.sun.net.httpserver.HttpServer;
import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.RecurrenceKind;
import net.kairos.core.service.JobScheduler;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisabledOnOs(OS.WINDOWS)
class SchedulingFlowTest {

    @Autowired JobScheduler scheduler;
    @Autowired JdbcTemplate jdbc;

    HttpServer hooks;
    final List<String> callbacks = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        hooks = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        hooks.createContext("/target", ex -> {
            byte[] body = "target says hi".getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(200, body.length);
            ex.getResponseBody().write(body);
            ex.close();
        });
        hooks.createContext("/callback", ex -> {
            callbacks.add(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            ex.sendResponseHeaders(200, -1);
            ex.close();
        });
        hooks.start();
    }

    @AfterEach
    void tearDown() {
        hooks.stop(0);
    }

    private String url(String path) {
        return "http://127.0.0.1:" + hooks.getAddress().getPort() + path;
    }

    @Test
    void catalog_job_fires_on_its_cron_and_lands_in_the_database() throws Exception {
        Job heartbeat = scheduler.getJobByName("flow-heartbeat").orElseThrow();

        Awaitility.await().atMost(Duration.ofSeconds(15))
                .until(() -> jdbc.queryForObject(
                        "SELECT COUNT(*) FROM TB_EXECUTION_LOG WHERE JOB_ID = ?", Long.class, heartbeat.id()) >= 2);

        ExecutionLog latest = scheduler.getLogs(heartbeat.id()).get(0);
        assertThat(latest.succeeded()).isTrue();
        assertThat(latest.output()).contains("flow");
        assertThat(scheduler.getStats(heartbeat.id())).isPresent();
    }

    @Test
    void http_job_runs_now_and_sends_rendered_callback() throws Exception {
        Job job = scheduler.addJob(Job.ofNew("http-flow", RecurrenceKind.CRON, "0 0 1 1 *", ExecutionKind.HTTP, url("/target"))
                .withRetry(0, 0)
                .withCallback(url("/callback"), "POST", Map.of(),
                        "{\"name\":\"${name}\",\"status\":${status},\"output\":\"${output}\"}"));

        ExecutionLog log = scheduler.runNow(job.id()).get(10, TimeUnit.SECONDS);

        assertThat(log.succeeded()).isTrue();
        assertThat(log.output()).isEqualTo("target says hi");
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> !callbacks.isEmpty());
        assertThat(callbacks.get(0)).isEqualTo("{\"name\":\"http-flow\",\"status\":1,\"output\":\"target says hi\"}");

        scheduler.removeJob(job.id());
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM TB_EXECUTION_LOG WHERE JOB_ID = ?", Long.class, job.id()))
                .isZero();
    }
}
