package com.pgstress.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class InsertProgressTest {

    @Test
    @DisplayName("Concurrent updates are never lost")
    void concurrentRecordsSum() throws Exception {
        InsertProgress progress = new InsertProgress(80_000);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> workers = new ArrayList<>();
            for (int w = 0; w < 8; w++) {
                workers.add(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        progress.record(10, true);
                    }
                    return null;
                });
            }
            executor.invokeAll(workers);
        } finally {
            executor.shutdownNow();
        }

        assertThat(progress.insertedRows()).isEqualTo(80_000);
        assertThat(progress.completedBatches()).isEqualTo(8_000);
        assertThat(progress.render()).contains("100%");
    }

    @Test
    void failedBatchesAddNothing() {
        InsertProgress progress = new InsertProgress(30);

        progress.record(10, true);
        long total = progress.record(0, false);

        assertThat(total).isEqualTo(10);
        assertThat(progress.failedBatches()).isEqualTo(1);
        assertThat(progress.completedBatches()).isEqualTo(2);
    }

    @Test
    void progressBarRendering() {
        assertThat(ProgressBar.render(5, 10))
            .isEqualTo("[" + "=".repeat(25) + " ".repeat(25) + "]  50% (5/10)");
        assertThat(ProgressBar.render(0, 0)).startsWith("[" + " ".repeat(ProgressBar.WIDTH) + "]");
        assertThat(ProgressBar.render(10, 10)).endsWith("100% (10/10)");
    }
}
