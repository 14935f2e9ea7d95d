package com.pgstress.service;

import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.model.ProvisioningResult;
import com.pgstress.model.StressTestReport;
import com.pgstress.model.TableDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Runs the workload phases in order: provision, insert, update, query, report.
 *
 * <p>Insert, update and query phases all operate on exactly the tables the
 * provisioning phase created, which may be fewer than requested.
 */
@Service
public class StressWorkload {

    private static final Logger log = LoggerFactory.getLogger(StressWorkload.class);

    private final TableProvisioner provisioner;
    private final ParallelInsertCoordinator insertCoordinator;
    private final RowUpdater rowUpdater;
    private final QueryRunner queryRunner;
    private final DatabaseStatistics statistics;

    public StressWorkload(
            TableProvisioner provisioner,
            ParallelInsertCoordinator insertCoordinator,
            RowUpdater rowUpdater,
            QueryRunner queryRunner,
            DatabaseStatistics statistics) {
        this.provisioner = provisioner;
        this.insertCoordinator = insertCoordinator;
        this.rowUpdater = rowUpdater;
        this.queryRunner = queryRunner;
        this.statistics = statistics;
    }

    /**
     * Executes one stress run.
     *
     * @param configuration the run configuration
     * @return the final figures
     * @throws InterruptedException if interrupted while waiting for insert workers
     */
    public StressTestReport run(WorkloadConfiguration configuration) throws InterruptedException {
        long start = System.nanoTime();

        ProvisioningResult provisioning = provisioner.provision(configuration);
        List<TableDescriptor> tables = provisioning.tables();

        InsertProgress progress = insertCoordinator.insertAll(tables, configuration);

        int tablesUpdated = 0;
        int queriesSucceeded = 0;
        if (insertCoordinator.isCancelled()) {
            log.warn("Workload cancelled, skipping updates and queries");
        } else {
            tablesUpdated = rowUpdater.updateAll(tables, configuration.updateCount());
            queriesSucceeded = queryRunner.runSampleQueries(tables);
        }

        return new StressTestReport(
            provisioning.requested(),
            provisioning.created(),
            progress.targetRows(),
            progress.insertedRows(),
            progress.failedBatches(),
            progress.peakPoolPressure(),
            tablesUpdated,
            queriesSucceeded,
            statistics.stressTableCount(configuration.schema()),
            statistics.databaseSize(),
            Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * Stops insert workers before their next batch.
     */
    public void cancel() {
        insertCoordinator.cancel();
    }
}
