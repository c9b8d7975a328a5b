package com.episcope.trends.testsupport;

import com.episcope.trends.service.ratelimit.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records requested sleeps and advances the clock instead of blocking.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public List<Duration> getSleeps() {
        return new ArrayList<>(sleeps);
    }

    public long count(Duration duration) {
        return getSleeps().stream().filter(duration::equals).count();
    }

    public Duration total() {
        return getSleeps().stream().reduce(Duration.ZERO, Duration::plus);
    }

    public void clear() {
        sleeps.clear();
    }
}
