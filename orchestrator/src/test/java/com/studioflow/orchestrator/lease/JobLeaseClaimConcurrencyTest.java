package com.studioflow.orchestrator.lease;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.repository.JobRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Leased-job claims from several workers against a real PostgreSQL.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import(JobLeaseService.class)
class JobLeaseClaimConcurrencyTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("studioflow")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired JobLeaseService            leases;
    @Autowired JobRepository              jobRepo;
    @Autowired PlatformTransactionManager txManager;

    @Test
    void concurrentWorkers_claimEachJobOnce() throws Exception {
        String kind = "tts-" + UUID.randomUUID().toString().substring(0, 8);
        int jobs = 12;
        for (int i = 0; i < jobs; i++) insertDueJob(kind);

        ExecutorService pool = Executors.newFixedThreadPool(3);
        Set<UUID> claimed = ConcurrentHashMap.newKeySet();
        List<Future<Integer>> counts = new ArrayList<>();
        for (int w = 0; w < 3; w++) {
            String workerId = "jobs-" + w;
            counts.add(pool.submit(() -> {
                int n = 0;
                List<UUID> batch;
                while (!(batch = leases.claimNextJobs(kind, 2, workerId)).isEmpty()) {
                    claimed.addAll(batch);
                    n += batch.size();
                }
                return n;
            }));
        }
        int total = 0;
        for (Future<Integer> f : counts) total += f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(total).isEqualTo(jobs);
        assertThat(claimed).hasSize(jobs);
        for (UUID id : claimed) {
            Job job = jobRepo.findById(id).orElseThrow();
            assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
            assertThat(job.getAttemptCount()).isEqualTo(1);
            assertThat(job.getLeaseExpiresAt()).isNotNull();
        }
    }

    @Test
    void expiredLease_requeuedWithBackoff() {
        String kind = "tts-" + UUID.randomUUID().toString().substring(0, 8);
        UUID id = insertDueJob(kind);
        leases.claimNextJobs(kind, 1, "jobs-0");
        new TransactionTemplate(txManager).executeWithoutResult(status -> {
            Job job = jobRepo.findById(id).orElseThrow();
            job.setLeaseExpiresAt(Instant.now().minusSeconds(5));
            jobRepo.save(job);
        });

        int touched = leases.expireLeases(100);

        Job job = jobRepo.findById(id).orElseThrow();
        assertThat(touched).isGreaterThanOrEqualTo(1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getErrorCode()).isEqualTo(JobLeaseService.LEASE_EXPIRED);
        assertThat(job.getNextRunAt()).isAfter(Instant.now());
    }

    private UUID insertDueJob(String kind) {
        UUID id = UUID.randomUUID();
        TransactionTemplate tx = new TransactionTemplate(txManager);
        tx.executeWithoutResult(status ->
                jobRepo.insertIfAbsent(id, kind, "AUTOPILOT", "", "{\"text\":\"hello\"}", "hash-" + id, 3));
        // The claim compares next_run_at with the JVM clock, not the database clock.
        tx.executeWithoutResult(status -> {
            Job job = jobRepo.findById(id).orElseThrow();
            job.setNextRunAt(Instant.now().minusSeconds(60));
            jobRepo.save(job);
        });
        return id;
    }
}
