package taxpoynt.adapter.in.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.config.MaintenanceConfig;
import taxpoynt.core.service.maintenance.MaintenanceScheduler;

/**
 * Drives the {@link MaintenanceScheduler} from the Quarkus scheduler.
 */
@ApplicationScoped
public class MaintenanceTicker {

    private static final Logger LOG = Logger.getLogger(MaintenanceTicker.class);

    private final MaintenanceScheduler scheduler;
    private final MaintenanceConfig config;

    @Inject
    public MaintenanceTicker(MaintenanceScheduler scheduler, MaintenanceConfig config) {
        this.scheduler = scheduler;
        this.config = config;
    }

    @Scheduled(
            every = "${taxpoynt.maintenance.tick-interval:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> tick() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        return scheduler.tick()
                .invoke(ran -> {
                    if (!ran.isEmpty()) {
                        LOG.debugf("Maintenance tasks run: %s", ran);
                    }
                })
                .replaceWithVoid();
    }
}
