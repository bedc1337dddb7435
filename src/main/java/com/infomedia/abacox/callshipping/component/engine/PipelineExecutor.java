package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import com.infomedia.abacox.callshipping.component.feed.RawRecord;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs a page of feed records through the pipeline in parallel. Records are partitioned by linked id,
 * so one call is always handled by one thread in feed order.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class PipelineExecutor {

    private static final int MAX_THREADS = 4;

    private final ThreadPoolExecutor taskExecutor = new ThreadPoolExecutor(
            MAX_THREADS,
            MAX_THREADS,
            0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>()
    );

    private final CallPipelineService pipeline;

    /**
     * Processes the records and waits for all of them.
     *
     * @throws StateStoreException when the state store failed for any record
     */
    public void processAll(List<RawRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        List<List<RawRecord>> partitions = new ArrayList<>(MAX_THREADS);
        for (int i = 0; i < MAX_THREADS; i++) {
            partitions.add(new ArrayList<>());
        }
        for (RawRecord record : records) {
            partitions.get(Math.floorMod(partitionKey(record).hashCode(), MAX_THREADS)).add(record);
        }

        List<Future<?>> futures = new ArrayList<>(MAX_THREADS);
        for (List<RawRecord> partition : partitions) {
            if (!partition.isEmpty()) {
                futures.add(taskExecutor.submit(() -> partition.forEach(pipeline::process)));
            }
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while processing feed records", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof StateStoreException stateStoreException) {
                    throw stateStoreException;
                }
                log.error("Uncaught exception while processing feed records", e.getCause());
            }
        }
    }

    static String partitionKey(RawRecord record) {
        String linkedId = record.get("linkedid");
        if (linkedId != null && !linkedId.isBlank()) {
            return linkedId.trim();
        }
        String uniqueId = record.get("uniqueid");
        return uniqueId == null ? "" : uniqueId.trim();
    }

    @PreDestroy
    public void shutdownExecutor() {
        log.debug("Shutting down pipeline executor...");
        taskExecutor.shutdown();
        try {
            if (!taskExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                List<Runnable> droppedTasks = taskExecutor.shutdownNow();
                log.debug("Pipeline executor was forcefully shut down. {} tasks were dropped.", droppedTasks.size());
            }
        } catch (InterruptedException e) {
            taskExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
