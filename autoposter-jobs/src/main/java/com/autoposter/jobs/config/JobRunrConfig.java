package com.autoposter.jobs.config;

import lombok.extern.slf4j.Slf4j;
import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.server.BackgroundJobServer;
import org.jobrunr.server.BackgroundJobServerConfiguration;
import org.jobrunr.server.JobActivator;
import org.jobrunr.storage.StorageProvider;
import org.jobrunr.storage.sql.common.SqlStorageProviderFactory;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * JobRunr storage and background server for the maintenance sweeps. Recurring jobs resolve
 * their service beans through the Spring context; uploads never go through JobRunr.
 */
@Slf4j
@Configuration
public class JobRunrConfig {

    @Bean
    public JobMapper maintenanceJobMapper() {
        return new JobMapper(new JacksonJsonMapper());
    }

    @Bean
    public StorageProvider maintenanceStorageProvider(DataSource dataSource, JobMapper maintenanceJobMapper) {
        StorageProvider storageProvider = SqlStorageProviderFactory.using(dataSource);
        storageProvider.setJobMapper(maintenanceJobMapper);
        return storageProvider;
    }

    @Bean
    public JobScheduler jobScheduler(StorageProvider maintenanceStorageProvider) {
        return new JobScheduler(maintenanceStorageProvider);
    }

    @Bean
    public JobActivator springJobActivator(ApplicationContext applicationContext) {
        return applicationContext::getBean;
    }

    @Bean(destroyMethod = "stop")
    public BackgroundJobServer maintenanceJobServer(StorageProvider maintenanceStorageProvider,
                                                    JobActivator springJobActivator,
                                                    @Value("${maintenance.worker-count:2}") int workerCount,
                                                    @Value("${maintenance.poll-interval-seconds:15}") int pollIntervalSeconds) {
        BackgroundJobServerConfiguration configuration = BackgroundJobServerConfiguration
                .usingStandardBackgroundJobServerConfiguration()
                .andWorkerCount(workerCount)
                .andPollIntervalInSeconds(pollIntervalSeconds);
        BackgroundJobServer server = new BackgroundJobServer(
                maintenanceStorageProvider, new JacksonJsonMapper(), springJobActivator, configuration);
        server.start();
        log.info("Maintenance job server started with {} workers, polling every {}s", workerCount, pollIntervalSeconds);
        return server;
    }
}
