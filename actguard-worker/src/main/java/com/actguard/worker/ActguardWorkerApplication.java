package com.actguard.worker;

import com.actguard.config.ActguardConfig;
import com.actguard.worker.activity.OutputSchemaActivitiesImpl;
import com.actguard.worker.service.ExecutionOutputService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Actguard Temporal worker entry point. Task queues are taken from env ACTGUARD_QUEUE; every queue
 * gets the output-schema activities.
 * <p>
 * WorkerFactory.start() returns immediately; the main thread is blocked so the JVM stays alive.
 * Shutdown hook and InterruptedException handle graceful shutdown (e.g. Ctrl+C).
 */
public final class ActguardWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(ActguardWorkerApplication.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private ActguardWorkerApplication() {
    }

    public static void main(String[] args) {
        ActguardConfig config = ActguardConfig.fromEnvironment();
        ExecutionOutputService outputService = ExecutionOutputService.create(config);

        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build()
        );
        WorkflowClient client = WorkflowClient.newInstance(
                service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build()
        );
        WorkerFactory factory = WorkerFactory.newInstance(client);

        WorkerOptions workerOptions = WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(config.getMaxConcurrentActivities())
                .build();

        OutputSchemaActivitiesImpl activities = new OutputSchemaActivitiesImpl(outputService);
        for (String taskQueue : config.getTaskQueues()) {
            Worker worker = factory.newWorker(taskQueue, workerOptions);
            worker.registerActivitiesImplementations(activities);
            log.info("Registered output schema activities for task queue: {}", taskQueue);
        }

        log.info("Starting worker | Temporal: {} | namespace: {} | validateOutputSchema: {} | maskSecrets: {} | schema: {}",
                config.getTemporalTarget(), config.getTemporalNamespace(),
                config.isValidateOutputSchema(), config.isMaskSecrets(), config.getSchemaSpecVersion());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down worker...");
            shutdown(factory, outputService.getMeterRegistry());
        }));

        factory.start();

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down worker...");
            shutdown(factory, outputService.getMeterRegistry());
        }
    }

    private static void shutdown(WorkerFactory factory, MeterRegistry meterRegistry) {
        factory.shutdown();
        try {
            factory.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            log.error("Error during worker shutdown: {}", e.getMessage());
        }
        for (Counter counter : meterRegistry.find(ExecutionOutputService.VALIDATIONS_METER).counters()) {
            log.info("Output validations [{}]: {}", counter.getId().getTag("outcome"), (long) counter.count());
        }
    }
}
