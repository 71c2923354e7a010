package me.golemcore.narrator.testsupport;

import me.golemcore.narrator.port.outbound.SchedulerPort;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic {@link SchedulerPort}: tasks run only when the test advances
 * time, on the test thread.
 */
public class ManualScheduler implements SchedulerPort {

    private final MutableClock clock;
    private final List<ManualTask> tasks = new ArrayList<>();
    private long nextSequence;

    public ManualScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        return add(task, delay, null);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration period) {
        return add(task, period, period);
    }

    /**
     * Move the clock forward, running every task that falls due on the way in
     * due-time order.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<ManualTask> next = tasks.stream()
                    .filter(ManualTask::isPending)
                    .filter(task -> !task.dueAt.isAfter(target))
                    .min(Comparator.comparing((ManualTask task) -> task.dueAt)
                            .thenComparingLong(task -> task.sequence));
            if (next.isEmpty()) {
                break;
            }
            ManualTask task = next.get();
            clock.setInstant(task.dueAt);
            if (task.period != null) {
                task.dueAt = task.dueAt.plus(task.period);
            } else {
                task.done = true;
            }
            task.action.run();
        }
        clock.setInstant(target);
    }

    public int pendingCount() {
        return (int) tasks.stream().filter(ManualTask::isPending).count();
    }

    public int oneShotPendingCount() {
        return (int) tasks.stream().filter(task -> task.isPending() && task.period == null).count();
    }

    private ManualTask add(Runnable action, Duration delay, Duration period) {
        ManualTask task = new ManualTask(action, clock.instant().plus(delay), period, nextSequence++);
        tasks.add(task);
        return task;
    }

    private static final class ManualTask implements ScheduledTask {

        private final Runnable action;
        private final Duration period;
        private final long sequence;
        private Instant dueAt;
        private boolean cancelled;
        private boolean done;

        private ManualTask(Runnable action, Instant dueAt, Duration period, long sequence) {
            this.action = action;
            this.dueAt = dueAt;
            this.period = period;
            this.sequence = sequence;
        }

        private boolean isPending() {
            return !cancelled && !done;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isDone() {
            return cancelled || done;
        }
    }
}
