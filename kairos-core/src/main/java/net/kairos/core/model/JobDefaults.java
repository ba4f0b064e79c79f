package net.kairos.core.model;

/** Fallbacks applied to a job whose timeout/retry settings are out of range. */
public record JobDefaults(int timeoutSeconds, int retryTimes, int retryDelaySeconds) {

    public static final JobDefaults STANDARD = new JobDefaults(60, 3, 5);

    public JobDefaults {
        if (timeoutSeconds <= 0) throw new IllegalArgumentException("default timeout must be positive");
        if (retryTimes < 0 || retryDelaySeconds < 0) throw new IllegalArgumentException("default retry settings must be >= 0");
    }

    public Job applyTo(Job job) {
        int timeout = job.timeoutSeconds() <= 0 ? timeoutSeconds : job.timeoutSeconds();
        int retries = job.retryTimes() < 0 ? retryTimes : job.retryTimes();
        int delay = job.retryDelaySeconds() < 0 ? retryDelaySeconds : job.retryDelaySeconds();
        return job.withTimeout(timeout).withRetry(retries, delay);
    }
}
