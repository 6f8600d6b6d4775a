package taxpoynt.core.service.maintenance;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Runs named background sweeps at their own intervals.
 *
 * <p>Components register a task once; an external tick calls {@link #tick}
 * and every task whose interval has elapsed runs, one after another. A
 * failing task is logged and does not stop the others.
 */
@ApplicationScoped
public class MaintenanceScheduler {

    private static final Logger LOG = Logger.getLogger(MaintenanceScheduler.class);

    private final Clock clock;
    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    private static final class ScheduledTask {
        final String name;
        final Duration interval;
        final Supplier<Uni<?>> action;
        volatile Instant nextRun;

        ScheduledTask(String name, Duration interval, Supplier<Uni<?>> action, Instant nextRun) {
            this.name = name;
            this.interval = interval;
            this.action = action;
            this.nextRun = nextRun;
        }
    }

    @Inject
    public MaintenanceScheduler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register a task, replacing any task with the same name. Its first run is
     * one interval from now.
     *
     * @throws IllegalArgumentException if the interval is not positive
     */
    public void register(String name, Duration interval, Supplier<Uni<?>> action) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval of task " + name + " must be positive");
        }
        if (shutdown) {
            LOG.warnf("Ignoring registration of %s: scheduler is shut down", name);
            return;
        }
        tasks.put(name, new ScheduledTask(name, interval, action, clock.instant().plus(interval)));
        LOG.debugf("Registered maintenance task %s every %s", name, interval);
    }

    /**
     * @return true if a task was registered under that name
     */
    public boolean cancel(String name) {
        final var removed = tasks.remove(name) != null;
        if (removed) {
            LOG.debugf("Cancelled maintenance task %s", name);
        }
        return removed;
    }

    /**
     * Cancel every task and refuse new registrations.
     */
    public void shutdown() {
        shutdown = true;
        tasks.clear();
        LOG.info("Maintenance scheduler shut down");
    }

    public Set<String> taskNames() {
        return new TreeSet<>(tasks.keySet());
    }

    /**
     * Run every task due at {@code now}.
     *
     * @return names of the tasks that ran, successfully or not
     */
    public Uni<List<String>> tick(Instant now) {
        if (shutdown) {
            return Uni.createFrom().item(List.of());
        }
        final var due = new ArrayList<ScheduledTask>();
        for (ScheduledTask task : tasks.values()) {
            if (!now.isBefore(task.nextRun)) {
                due.add(task);
            }
        }
        due.sort(Comparator.comparing((ScheduledTask t) -> t.nextRun).thenComparing(t -> t.name));

        return Multi.createFrom()
                .iterable(due)
                .onItem()
                .transformToUniAndConcatenate(task -> run(task, now))
                .collect()
                .asList();
    }

    /**
     * Run every task due at the current time.
     */
    public Uni<List<String>> tick() {
        return tick(clock.instant());
    }

    private Uni<String> run(ScheduledTask task, Instant now) {
        task.nextRun = now.plus(task.interval);
        return Uni.createFrom()
                .deferred(() -> task.action.get())
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf(e, "Maintenance task %s failed", task.name);
                    return null;
                })
                .replaceWith(task.name);
    }
}
