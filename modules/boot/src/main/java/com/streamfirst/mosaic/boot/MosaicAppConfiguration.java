package com.streamfirst.mosaic.boot;

import com.streamfirst.mosaic.adapters.InMemoryJobRepository;
import com.streamfirst.mosaic.adapters.InMemorySessionRepository;
import com.streamfirst.mosaic.adapters.InMemoryTargetRepository;
import com.streamfirst.mosaic.adapters.InMemoryTileLibraryRepository;
import com.streamfirst.mosaic.adapters.JsonLibrarySnapshotAdapter;
import com.streamfirst.mosaic.adapters.LocalFileStorageAdapter;
import com.streamfirst.mosaic.application.JobSupervisor;
import com.streamfirst.mosaic.application.LibraryIndexer;
import com.streamfirst.mosaic.application.MosaicCompositor;
import com.streamfirst.mosaic.application.MosaicSettings;
import com.streamfirst.mosaic.application.MosaicStateStore;
import com.streamfirst.mosaic.application.SessionSweeper;
import com.streamfirst.mosaic.application.TargetRegistry;
import com.streamfirst.mosaic.ports.FileStoragePort;
import com.streamfirst.mosaic.ports.JobRepository;
import com.streamfirst.mosaic.ports.LibrarySnapshotPort;
import com.streamfirst.mosaic.ports.SessionRepository;
import com.streamfirst.mosaic.ports.TargetRepository;
import com.streamfirst.mosaic.ports.TileLibraryRepository;
import java.nio.file.Path;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires ports, adapters and application services.
 */
@Slf4j
@Configuration
public class MosaicAppConfiguration {

    // --- Adapter Beans ---

    @Bean
    public FileStoragePort fileStorage(MosaicProperties properties) {
        Path root = Path.of(properties.getStorageRoot()).toAbsolutePath();
        log.info("Storing mosaic data under {}", root);
        return new LocalFileStorageAdapter(root);
    }

    @Bean
    public LibrarySnapshotPort librarySnapshots(FileStoragePort fileStorage) {
        return new JsonLibrarySnapshotAdapter(fileStorage);
    }

    @Bean
    public TileLibraryRepository tileLibraryRepository() {
        return new InMemoryTileLibraryRepository();
    }

    @Bean
    public JobRepository jobRepository() {
        return new InMemoryJobRepository();
    }

    @Bean
    public TargetRepository targetRepository() {
        return new InMemoryTargetRepository();
    }

    @Bean
    public SessionRepository sessionRepository() {
        return new InMemorySessionRepository();
    }

    // --- Application Service Beans ---

    @Bean
    public MosaicSettings mosaicSettings(MosaicProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MosaicStateStore mosaicStateStore(
            TileLibraryRepository tileLibraryRepository,
            JobRepository jobRepository,
            TargetRepository targetRepository,
            SessionRepository sessionRepository,
            LibrarySnapshotPort librarySnapshots,
            FileStoragePort fileStorage) {
        return new MosaicStateStore(tileLibraryRepository, jobRepository, targetRepository,
                sessionRepository, librarySnapshots, fileStorage);
    }

    @Bean
    public ThreadPoolTaskExecutor mosaicWorkers(MosaicProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("mosaic-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public LibraryIndexer libraryIndexer(MosaicStateStore mosaicStateStore, FileStoragePort fileStorage,
                                         LibrarySnapshotPort librarySnapshots, MosaicSettings mosaicSettings) {
        return new LibraryIndexer(mosaicStateStore, fileStorage, librarySnapshots, mosaicSettings);
    }

    @Bean
    public MosaicCompositor mosaicCompositor(FileStoragePort fileStorage, MosaicSettings mosaicSettings) {
        return new MosaicCompositor(fileStorage, mosaicSettings);
    }

    @Bean
    public JobSupervisor jobSupervisor(MosaicStateStore mosaicStateStore, LibraryIndexer libraryIndexer,
                                       MosaicCompositor mosaicCompositor, FileStoragePort fileStorage,
                                       ThreadPoolTaskExecutor mosaicWorkers, Clock clock,
                                       MosaicSettings mosaicSettings) {
        return new JobSupervisor(mosaicStateStore, libraryIndexer, mosaicCompositor, fileStorage,
                mosaicWorkers, clock, mosaicSettings);
    }

    @Bean
    public TargetRegistry targetRegistry(MosaicStateStore mosaicStateStore, FileStoragePort fileStorage,
                                         Clock clock, MosaicSettings mosaicSettings) {
        return new TargetRegistry(mosaicStateStore, fileStorage, clock, mosaicSettings);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public SessionSweeper sessionSweeper(MosaicStateStore mosaicStateStore, Clock clock,
                                         MosaicSettings mosaicSettings) {
        return new SessionSweeper(mosaicStateStore, clock, mosaicSettings);
    }

    // --- Execution Logic ---

    @Bean
    public MosaicCommandLine mosaicCommandLine(JobSupervisor jobSupervisor, TargetRegistry targetRegistry) {
        return new MosaicCommandLine(jobSupervisor, targetRegistry);
    }
}
