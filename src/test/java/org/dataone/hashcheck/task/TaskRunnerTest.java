package org.dataone.hashcheck.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.dataone.hashcheck.GenerationResult;
import org.dataone.hashcheck.VerificationResult;
import org.dataone.hashcheck.config.HashCheckConfig;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.digest.DigestEngine;
import org.dataone.hashcheck.digest.DigestRegistry;
import org.dataone.hashcheck.exceptions.HashCheckTaskException;
import org.dataone.hashcheck.exceptions.TaskCancelledException;
import org.dataone.hashcheck.exceptions.UnsupportedHashAlgorithmException;
import org.dataone.hashcheck.testdata.TestDataHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for TaskRunner
 */
public class TaskRunnerTest {
    private TaskRunner taskRunner;
    private DigestEngine engine;
    private HashCheckConfig config;

    /**
     * Temporary folder for tests to run in
     */
    @TempDir
    public Path tempFolder;

    @BeforeEach
    public void initializeRunner() {
        taskRunner = new TaskRunner();
        engine = new DigestEngine();
        config = HashCheckConfig.defaults().withWorkerThreads(4);
    }

    @AfterEach
    public void closeRunner() {
        taskRunner.close();
    }

    /**
     * Check that a task runs off the caller's thread and its result is returned by await
     */
    @Test
    public void submit_await() throws Exception {
        TestDataHarness.writeHelloWorld(tempFolder);

        TaskHandle<GenerationResult> handle =
            taskRunner.submit(new GenerationTask(List.of(tempFolder), config, engine), null);
        GenerationResult result = handle.await();
        assertTrue(handle.isDone());
        assertFalse(handle.isCancelled());
        assertEquals(2, result.manifest().entryCount());
        assertEquals(2, handle.latestProgress().processed());
    }

    /**
     * Check that the listener sees processed counts that never decrease and never exceed the
     * total, ending at the total
     */
    @Test
    public void submit_progressIsMonotonic() throws Exception {
        TestDataHarness.writeNumberedFiles(tempFolder, 40);
        List<TaskProgress> events = Collections.synchronizedList(new ArrayList<>());

        TaskHandle<GenerationResult> handle = taskRunner.submit(
            new GenerationTask(
                List.of(tempFolder), config.withVerifyAfterGeneration(true), engine),
            events::add);
        handle.await();

        int previous = 0;
        for (TaskProgress event : events) {
            assertTrue(event.processed() >= previous);
            assertTrue(event.processed() <= event.total());
            previous = event.processed();
        }
        TaskProgress last = events.get(events.size() - 1);
        assertEquals(80, last.processed());
        assertEquals(80, last.total());
        assertEquals(TaskPhase.VERIFYING, last.phase());
    }

    /**
     * Check that cancelling a running task resolves it with TaskCancelledException and the
     * files that were not started are skipped
     */
    @Test
    public void cancel_runningTask() throws Exception {
        TestDataHarness.writeNumberedFiles(tempFolder, 20);
        CountDownLatch firstFile = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ProgressListener listener = progress -> {
            if (progress.currentPath() != null && firstFile.getCount() > 0) {
                firstFile.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        };

        TaskHandle<GenerationResult> handle = taskRunner.submit(
            new GenerationTask(List.of(tempFolder), config.withWorkerThreads(1), engine),
            listener);
        assertTrue(firstFile.await(10, TimeUnit.SECONDS));
        handle.cancel();
        release.countDown();

        TaskCancelledException tce = assertThrows(TaskCancelledException.class, handle::await);
        assertTrue(handle.isCancelled());
        assertEquals(20, tce.getTotal());
        assertTrue(tce.getProcessed() < tce.getTotal());
    }

    /**
     * Check that a task-level failure is rethrown by await with its phase
     */
    @Test
    public void await_taskFailure() {
        TaskHandle<VerificationResult> handle = taskRunner.submit(
            VerificationTask.fromFile(tempFolder.resolve("missing.sfv"), null, config, engine),
            null);

        HashCheckTaskException htce = assertThrows(HashCheckTaskException.class, handle::await);
        assertEquals(TaskPhase.PARSING, htce.getPhase());
    }

    /**
     * Check that an unexpected exception in a task is wrapped in HashCheckTaskException
     */
    @Test
    public void await_unexpectedFailure() {
        HashCheckTask<String> broken = new HashCheckTask<>() {
            @Override
            public void validate() {
            }

            @Override
            public String run(CancellationToken token, ProgressTracker tracker) {
                tracker.beginPhase(TaskPhase.DIGESTING, 1);
                throw new IllegalStateException("broken task");
            }
        };

        TaskHandle<String> handle = taskRunner.submit(broken, null);
        HashCheckTaskException htce = assertThrows(HashCheckTaskException.class, handle::await);
        assertInstanceOf(IllegalStateException.class, htce.getCause());
        assertEquals(TaskPhase.DIGESTING, htce.getPhase());
    }

    /**
     * Check that an unsupported algorithm is rejected at submission, before anything runs
     */
    @Test
    public void submit_unsupportedAlgorithm() {
        DigestEngine crcOnly = new DigestEngine(DigestRegistry.of(ChecksumAlgorithm.CRC32));
        List<TaskProgress> events = new ArrayList<>();

        assertThrows(
            UnsupportedHashAlgorithmException.class, () -> taskRunner.submit(
                new GenerationTask(
                    List.of(tempFolder), config.withAlgorithm(ChecksumAlgorithm.SHA_256),
                    crcOnly), events::add));
        assertTrue(events.isEmpty());
    }

    /**
     * Check that a failing listener does not fail the task
     */
    @Test
    public void submit_failingListener() throws Exception {
        TestDataHarness.writeHelloWorld(tempFolder);

        TaskHandle<GenerationResult> handle = taskRunner.submit(
            new GenerationTask(List.of(tempFolder), config, engine), progress -> {
                throw new IllegalStateException("listener failure");
            });
        assertEquals(2, handle.await().manifest().entryCount());
    }
}
