package net.kairos.integration.spring.sched;

import net.kairos.core.service.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/** Arms the stored jobs once the context is up and disarms them on shutdown. */
public class KairosSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(KairosSchedulerLifecycle.class);

    private final JobScheduler scheduler;
    private volatile boolean running;

    public KairosSchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        try {
            scheduler.start();
        } catch (Exception e) {
            throw new IllegalStateException("kairos scheduler failed to start", e);
        }
        running = true;
    }

    @Override
    public void stop() {
        log.debug("stopping kairos scheduler");
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
