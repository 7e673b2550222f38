package alertmigrator.engine;

import java.util.concurrent.atomic.AtomicLong;

final class RunIds {

    private static final AtomicLong COUNTER = new AtomicLong(1L);

    private RunIds() {}

    static long next() {
        return COUNTER.getAndIncrement();
    }
}
