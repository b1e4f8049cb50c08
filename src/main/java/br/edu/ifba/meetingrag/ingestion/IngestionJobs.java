package br.edu.ifba.meetingrag.ingestion;

import java.util.List;
import java.util.UUID;

import br.edu.ifba.meetingrag.PipelineConfig;
import br.edu.ifba.meetingrag.queue.ProcessingTask;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Scheduled entry points: queue polling, transcript sync and housekeeping.
 * Each job skips a run while its previous run is still executing.
 */
@ApplicationScoped
public class IngestionJobs {

    private static final Logger LOG = Logger.getLogger(IngestionJobs.class);

    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    @Inject
    IngestionOrchestrator orchestrator;

    @Inject
    PipelineConfig config;

    @Scheduled(every = "{meetingrag.queue.poll-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void pollQueue() {
        final long startTime = System.currentTimeMillis();
        final List<ProcessingTask> processed = orchestrator.processPending(workerId);
        if (!processed.isEmpty()) {
            LOG.infof("Queue poll processed %d tasks in %d ms", Integer.valueOf(processed.size()),
                Long.valueOf(System.currentTimeMillis() - startTime));
        }
    }

    @Scheduled(every = "{meetingrag.sync.interval}", delayed = "30s",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void syncTranscripts() {
        if (!config.sync().enabled()) {
            LOG.debug("Scheduled sync disabled");
            return;
        }
        LOG.info("Starting scheduled transcript sync...");
        final SyncReport report = orchestrator.sync(SyncOptions.defaults());
        if (report.hasErrors()) {
            LOG.warnf("Scheduled sync finished with %d errors: %s", Integer.valueOf(report.errors().size()),
                report.errors());
        }
    }

    @Scheduled(every = "{meetingrag.housekeeping.interval}", delayed = "1m",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void housekeeping() {
        orchestrator.housekeeping();
    }
}
