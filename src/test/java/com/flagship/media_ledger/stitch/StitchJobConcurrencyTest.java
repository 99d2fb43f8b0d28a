package com.flagship.media_ledger.stitch;

import com.flagship.media_ledger.common.exception.AlreadyRunningException;
import com.flagship.media_ledger.stitch.runner.JobRunnerClient;
import com.flagship.media_ledger.stitch.runner.JobRunnerException;
import com.flagship.media_ledger.stitch.runner.StitchJobSpec;
import com.flagship.media_ledger.storage.ObjectStore;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * One active stitch job per target, under concurrency and after the worker dies.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class StitchJobConcurrencyTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("media_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("reconciliation.scheduler.enabled", () -> "false");
    }

    private static final List<String> INPUTS = List.of("clips/intro.mp4", "clips/main.mp4");

    @Autowired
    private JobOrchestrator orchestrator;

    @Autowired
    private ObjectStore objectStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobRunnerClient runnerClient;

    private String targetId;

    @BeforeEach
    void setUp() {
        targetId = "target-" + UUID.randomUUID();
        when(runnerClient.submit(any(StitchJobSpec.class)))
            .thenAnswer(inv -> "exec-" + inv.<StitchJobSpec>getArgument(0).getJobId());
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void ageJob(UUID jobId, StitchJobStatus status, Duration age) {
        jdbcTemplate.update("UPDATE stitch_jobs SET status = ?, updated_at = ? WHERE id = ?",
            status.name(), Timestamp.from(Instant.now().minus(age)), jobId);
    }

    @Test
    @DisplayName("Concurrent enqueues for one target produce exactly one job")
    void concurrentEnqueue() throws InterruptedException {
        printTestHeader("Concurrent Enqueue");
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Throwable> unexpected = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    orchestrator.enqueueStitch(targetId, "user-1", INPUTS);
                    accepted.incrementAndGet();
                } catch (AlreadyRunningException e) {
                    rejected.incrementAndGet();
                } catch (Throwable t) {
                    synchronized (unexpected) {
                        unexpected.add(t);
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Accepted", accepted.get());
        printOutput("Rejected", rejected.get());
        assertTrue(unexpected.isEmpty(), "unexpected failures: " + unexpected);
        assertEquals(1, accepted.get());
        assertEquals(threads - 1, rejected.get());
        assertEquals(1, orchestrator.listJobs(targetId).size());
    }

    @Test
    @DisplayName("A job whose worker died does not block its target")
    void staleJobIsReplaced() {
        printTestHeader("Stale Job Replaced");
        StitchJob first = orchestrator.enqueueStitch(targetId, "user-1", INPUTS);
        ageJob(first.getId(), StitchJobStatus.RUNNING, Duration.ofMinutes(20));
        when(runnerClient.getStatus(first.getExecutionRef())).thenThrow(new JobRunnerException("runner unreachable"));

        assertTrue(orchestrator.getActiveJob(targetId).isEmpty());
        StitchJob reconciled = orchestrator.getJob(first.getId());
        printOutput("Old job", reconciled.getStatus() + " " + reconciled.getMessage());
        assertEquals(StitchJobStatus.FAILED, reconciled.getStatus());
        assertTrue(reconciled.getMessage().startsWith("timed out"));

        StitchJob second = orchestrator.enqueueStitch(targetId, "user-1", INPUTS);
        assertNotEquals(first.getId(), second.getId());
        assertEquals(StitchJobStatus.QUEUED, second.getStatus());
    }

    @Test
    @DisplayName("Output in storage completes a job without asking the runner")
    void outputCompletesJob() {
        StitchJob job = orchestrator.enqueueStitch(targetId, "user-1", INPUTS);
        objectStore.put(job.getOutputPath(), new byte[] {1, 2, 3}, "video/mp4");

        StitchJob reconciled = orchestrator.getJob(job.getId());

        assertEquals(StitchJobStatus.COMPLETED, reconciled.getStatus());
        assertNotNull(reconciled.getCompletedAt());
        verify(runnerClient, never()).getStatus(anyString());
    }

    @Test
    @DisplayName("HTTP: second enqueue is 409 until the runner reports completion")
    void httpFlow() throws Exception {
        String body = "{\"input_paths\":[\"clips/intro.mp4\",\"clips/main.mp4\"]}";

        String created = mockMvc.perform(post("/api/stitch/targets/" + targetId + "/jobs")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("QUEUED"))
            .andReturn().getResponse().getContentAsString();
        String jobId = JsonPath.read(created, "$.id");

        mockMvc.perform(post("/api/stitch/targets/" + targetId + "/jobs")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.active_job_id").value(jobId));

        mockMvc.perform(post("/api/stitch/jobs/" + jobId + "/callback")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"SUCCEEDED\",\"message\":\"rendered\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.output_url").isNotEmpty());

        mockMvc.perform(get("/api/stitch/targets/" + targetId + "/active"))
            .andExpect(status().isNoContent());
    }

    @Test
    void tooFewInputsRejected() throws Exception {
        mockMvc.perform(post("/api/stitch/targets/" + targetId + "/jobs")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"input_paths\":[\"clips/only.mp4\"]}"))
            .andExpect(status().isBadRequest());
    }
}
