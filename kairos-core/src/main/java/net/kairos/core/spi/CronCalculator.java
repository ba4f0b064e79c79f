package net.kairos.core.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** First execution strictly after {@code from}. */
    Instant next(Instant from, String cronExpr, ZoneId zone);

    /** @throws IllegalArgumentException when the expression does not parse */
    void validate(String cronExpr);
}
