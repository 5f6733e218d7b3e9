package com.catalogenricher.enrichment.pipeline;

import com.catalogenricher.enrichment.fetch.StopSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry: {@code --input=<table.csv|_partial.json> [--output=<file.csv>] [--force-update]}.
 * A shutdown signal during the run requests a graceful stop so the checkpoint is flushed before the JVM exits.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnrichmentCommandRunner implements ApplicationRunner {

    static final String INPUT = "input";
    static final String OUTPUT = "output";
    static final String FORCE_UPDATE = "force-update";

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final EnrichmentPipeline pipeline;

    @Override
    public void run(ApplicationArguments args) {
        PipelineRunOptions options = parse(args);
        if (options == null) {
            log.info("No --input given; nothing to enrich. Usage: --input=<table.csv> [--output=<file.csv>] [--force-update]");
            return;
        }
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            options.stopSignal().requestStop();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Pipeline did not stop within {}s", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "enricher-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            PipelineResult result = pipeline.run(options);
            switch (result.outcome()) {
                case COMPLETED -> log.info("Output: {}{}", result.outputPath(),
                        result.reportPath() == null ? "" : ", report: " + result.reportPath());
                case STOPPED -> log.warn("Stopped; resume with --input={}", options.input());
                case FAILED_OUTPUT -> log.error("Output not written ({}); checkpoint kept at {}",
                        result.error(), result.checkpointPath());
            }
        } finally {
            finished.countDown();
            removeHookQuietly(shutdownHook);
        }
    }

    static PipelineRunOptions parse(ApplicationArguments args) {
        String input = single(args, INPUT);
        if (input == null || input.isBlank()) {
            return null;
        }
        String output = single(args, OUTPUT);
        boolean forceUpdate = args.containsOption(FORCE_UPDATE) && !"false".equalsIgnoreCase(single(args, FORCE_UPDATE));
        return new PipelineRunOptions(Path.of(input.strip()),
                output == null || output.isBlank() ? null : Path.of(output.strip()), forceUpdate, new StopSignal());
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static void removeHookQuietly(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, hook stays registered");
        }
    }
}
