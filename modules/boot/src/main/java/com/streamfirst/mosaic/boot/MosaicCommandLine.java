package com.streamfirst.mosaic.boot;

import com.streamfirst.mosaic.application.JobSupervisor;
import com.streamfirst.mosaic.application.TargetRegistry;
import com.streamfirst.mosaic.domain.JobId;
import com.streamfirst.mosaic.domain.JobParameters;
import com.streamfirst.mosaic.domain.JobStatus;
import com.streamfirst.mosaic.domain.JobView;
import com.streamfirst.mosaic.domain.LibraryId;
import com.streamfirst.mosaic.domain.LibraryStatus;
import com.streamfirst.mosaic.domain.LibraryView;
import com.streamfirst.mosaic.domain.SessionId;
import com.streamfirst.mosaic.domain.Target;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * One-shot rendering from the command line:
 * {@code --library=tiles.zip --target=photo.jpg --out=mosaic.jpg [--cell-size=32] [--repeat-window=30]
 * [--color-strength=0.35] [--overlay-strength=0.0]}. Does nothing when {@code --library} is absent.
 */
@Slf4j
@RequiredArgsConstructor
public class MosaicCommandLine implements ApplicationRunner {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);
    private static final Duration TIMEOUT = Duration.ofHours(1);

    private final JobSupervisor supervisor;
    private final TargetRegistry targets;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!args.containsOption("library")) {
            return;
        }
        Path libraryFile = Path.of(required(args, "library"));
        Path targetFile = Path.of(required(args, "target"));
        Path outFile = Path.of(required(args, "out"));
        JobParameters defaults = JobParameters.DEFAULTS;
        JobParameters parameters = new JobParameters(
                intOption(args, "cell-size", defaults.cellSize()),
                intOption(args, "repeat-window", defaults.repeatWindowK()),
                doubleOption(args, "color-strength", defaults.colorStrength()),
                doubleOption(args, "overlay-strength", defaults.overlayStrength()));
        SessionId session = SessionId.LEGACY;

        Target target;
        try (InputStream in = Files.newInputStream(targetFile)) {
            target = targets.register(session, targetFile.getFileName().toString(), in);
        }
        LibraryId libraryId;
        try (InputStream in = Files.newInputStream(libraryFile)) {
            libraryId = supervisor.submitLibrary(session, libraryFile.getFileName().toString(), in);
        }

        LibraryView library = await(() -> supervisor.libraryView(session, libraryId),
                view -> view.status().isTerminal(), view -> view.progress() + "% " + view.message());
        if (library.status() != LibraryStatus.READY) {
            throw new IllegalStateException("Library failed: " + library.message());
        }

        JobId jobId = supervisor.submitJob(session, target.id(), libraryId, parameters);
        JobView job = await(() -> supervisor.jobView(session, jobId),
                view -> view.status().isTerminal(), view -> view.progress() + "% " + view.message());
        if (job.status() != JobStatus.DONE) {
            throw new IllegalStateException("Job failed: " + job.message());
        }
        Files.write(outFile, supervisor.result(session, jobId));
        log.info("Mosaic written to {}", outFile.toAbsolutePath());
    }

    private static <T> T await(Supplier<T> poll, Predicate<T> done,
                               Function<T, String> describe) throws InterruptedException {
        Instant deadline = Instant.now().plus(TIMEOUT);
        String last = null;
        while (true) {
            T view = poll.get();
            String description = describe.apply(view);
            if (!description.equals(last)) {
                log.info("{}", description);
                last = description;
            }
            if (done.test(view)) {
                return view;
            }
            if (Instant.now().isAfter(deadline)) {
                throw new IllegalStateException("Timed out after " + TIMEOUT);
            }
            Thread.sleep(POLL_INTERVAL.toMillis());
        }
    }

    private static String required(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Missing --" + name);
        }
        return values.get(0);
    }

    private static int intOption(ApplicationArguments args, String name, int fallback) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? fallback : Integer.parseInt(values.get(0));
    }

    private static double doubleOption(ApplicationArguments args, String name, double fallback) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? fallback : Double.parseDouble(values.get(0));
    }
}
