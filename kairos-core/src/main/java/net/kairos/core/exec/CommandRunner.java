package net.kairos.core.exec;

import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;

/** Runs one attempt of a job's command. Must give up once the deadline elapses. */
public interface CommandRunner {
    ExecutionKind kind();

    /** @return captured output on success */
    String run(Job job, Deadline deadline) throws ExecutionFailureException;
}
