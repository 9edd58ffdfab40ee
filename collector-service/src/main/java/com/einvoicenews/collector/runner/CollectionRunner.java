package com.einvoicenews.collector.runner;

import com.einvoicenews.collector.dto.RunReport;
import com.einvoicenews.collector.service.CollectionRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Performs one collection run at startup. The run's outcome becomes the process exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "collector", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class CollectionRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CollectionRunService collectionRunService;

    private volatile int exitCode = 0;

    @Override
    public void run(String... args) {
        RunReport report = collectionRunService.runOnce();
        exitCode = report.exitCode();
        if (!report.isSuccess()) {
            log.error("Collection run failed: {}", report.failureMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
