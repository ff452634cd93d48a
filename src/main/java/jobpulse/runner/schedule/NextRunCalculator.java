package jobpulse.runner.schedule;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Derives the next eligible run of a job from its schedule.
 *
 * The naive result is {@code reference + interval}. When that is already at
 * or before the current time (the runner was down for a while) it is
 * re-based to {@code now + interval}, so missed periods are dropped rather
 * than replayed back to back.
 */
public class NextRunCalculator {

    private final Clock clock;

    public NextRunCalculator(Clock clock) {
        this.clock = clock;
    }

    public NextRunCalculator() {
        this(Clock.systemUTC());
    }

    /**
     * @param schedule  schedule descriptor
     * @param reference last completion; null means "now"
     * @return next run, or empty when the schedule is unparsable
     */
    public Optional<Instant> nextRun(String schedule, Instant reference) {
        Optional<Duration> interval = ScheduleParser.parse(schedule);
        if (interval.isEmpty()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Instant base = reference != null ? reference : now;
        try {
            Instant candidate = base.plus(interval.get());
            if (!candidate.isAfter(now)) {
                candidate = now.plus(interval.get());
            }
            return Optional.of(candidate);
        } catch (DateTimeException | ArithmeticException e) {
            // interval pushes past Instant.MAX
            return Optional.empty();
        }
    }
}
