package net.kairos.core.service;

import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobDefaults;
import net.kairos.core.model.RecurrenceKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobValidatorTest {

    final Instant now = Instant.parse("2030-01-01T00:00:00Z");
    final JobValidator validator = new JobValidator(new StepCron(Duration.ofMinutes(1)), () -> now, JobDefaults.STANDARD, ZoneId.of("UTC"));

    private static Job cron(String command) {
        return Job.ofNew("v", RecurrenceKind.CRON, "*/5 * * * *", ExecutionKind.SHELL, command);
    }

    @Test
    void out_of_range_settings_fall_back_to_defaults() {
        Job out = validator.validate(cron("true").withTimeout(0).withRetry(-1, -1));

        assertThat(out.timeoutSeconds()).isEqualTo(60);
        assertThat(out.retryTimes()).isEqualTo(3);
        assertThat(out.retryDelaySeconds()).isEqualTo(5);
    }

    @Test
    void zero_retries_and_zero_delay_are_kept() {
        Job out = validator.validate(cron("true").withRetry(0, 0));

        assertThat(out.retryTimes()).isZero();
        assertThat(out.retryDelaySeconds()).isZero();
    }

    @Test
    void http_method_defaults_to_get() {
        Job out = validator.validate(Job.ofNew("h", RecurrenceKind.CRON, "* * * * *", ExecutionKind.HTTP, "http://localhost/x"));

        assertThat(out.httpMethod()).isEqualTo("GET");
    }

    @Test
    void one_shot_sets_next_run_to_parsed_time() {
        Job out = validator.validate(Job.ofNew("o", RecurrenceKind.ONCE, "2030-01-01T09:30:00+09:00", ExecutionKind.SHELL, "true"));

        assertThat(out.nextRunAt()).isEqualTo(Instant.parse("2030-01-01T00:30:00Z"));
    }

    @Test
    void past_one_shot_is_rejected_only_when_enabled() {
        Job past = Job.ofNew("o", RecurrenceKind.ONCE, "2029-12-31T23:59:59Z", ExecutionKind.SHELL, "true");

        assertThatThrownBy(() -> validator.validate(past))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("past");
        assertThat(validator.validate(past.withEnabled(false)).enabled()).isFalse();
    }

    @Test
    void rejects_malformed_definitions() {
        assertThatThrownBy(() -> validator.validate(cron(" "))).isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> validator.validate(cron("true").withSchedule(RecurrenceKind.UNKNOWN, "x")))
                .isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> validator.validate(cron("true").withCommand(ExecutionKind.UNKNOWN, "true")))
                .isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> validator.validate(cron("true").withSchedule(RecurrenceKind.CRON, "bad cron")))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("cron");
        assertThatThrownBy(() -> validator.validate(cron("true").withSchedule(RecurrenceKind.ONCE, "tomorrow")))
                .isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> validator.validate(
                Job.ofNew("h", RecurrenceKind.CRON, "* * * * *", ExecutionKind.HTTP, "ftp://host/file")))
                .isInstanceOf(JobValidationException.class);
    }

    @Test
    void cron_that_parses_but_never_fires_is_rejected() {
        assertThatThrownBy(() -> validator.validate(cron("true").withSchedule(RecurrenceKind.CRON, "never 30 2")))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("never 30 2");
    }

    @Test
    void callback_method_and_placeholders_are_checked() {
        Job base = cron("true");

        assertThat(validator.validate(base.withCallback("http://hooks.local/cb", null, Map.of(), "${name}")).callbackMethod())
                .isEqualTo("POST");
        assertThatThrownBy(() -> validator.validate(base.withCallback("http://hooks.local/cb", "PUT", Map.of(), null)))
                .isInstanceOf(JobValidationException.class)
                .hasMessageContaining("GET or POST");
        assertThatThrownBy(() -> validator.validate(base.withCallback("http://hooks.local/cb", "POST", Map.of(), "${nope}")))
                .isInstanceOf(JobValidationException.class);
    }
}
