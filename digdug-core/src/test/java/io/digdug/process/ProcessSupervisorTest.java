/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.digdug.process;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessSupervisorTest {

    ProcessSupervisor supervisor;

    @BeforeEach
    void beforeEach() {
        supervisor = new ProcessSupervisor(Duration.ofSeconds(2));
    }

    @AfterEach
    void afterEach() {
        supervisor.close();
    }

    private ProcessHandle sh(String script) {
        return supervisor.spawn("sh", List.of("-c", script), null);
    }

    @Test
    void testReadyOnPattern() throws Exception {
        ProcessHandle handle = sh("echo starting; sleep 0.2; echo 'tunnel is up'; sleep 60");
        supervisor.awaitReady(handle, ReadinessMatcher.pattern("tunnel is up"), Duration.ofSeconds(10));

        assertEquals(ProcessState.READY, handle.getState());
        assertTrue(handle.isAlive());
        supervisor.terminate(handle);
        assertEquals(ProcessState.EXITED, handle.getState());
    }

    @Test
    void testReadyLineWrittenBeforeAwait() throws Exception {
        ProcessHandle handle = sh("echo ready; sleep 60");
        ProcessHandleTest.waitForOutput(handle, "ready");

        supervisor.awaitReady(handle, ReadinessMatcher.pattern("ready"), Duration.ofSeconds(5));

        assertEquals(ProcessState.READY, handle.getState());
        supervisor.terminate(handle);
    }

    @Test
    void testTimeoutTerminatesProcess() {
        ProcessHandle handle = sh("sleep 60");
        long start = System.nanoTime();
        ReadyTimeoutException e = assertThrows(ReadyTimeoutException.class, () ->
                supervisor.awaitReady(handle, ReadinessMatcher.pattern("never"), Duration.ofMillis(100)));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(Duration.ofMillis(100), e.getTimeout());
        assertFalse(handle.isAlive());
        assertEquals(ProcessState.EXITED, handle.getState());
        assertTrue(elapsed < 5000, "took " + elapsed);
    }

    @Test
    void testExitBeforeReady() {
        ProcessHandle handle = sh("echo 'bad credentials' >&2; exit 3");
        ProcessExitException e = assertThrows(ProcessExitException.class, () ->
                supervisor.awaitReady(handle, ReadinessMatcher.pattern("ready"), Duration.ofSeconds(10)));

        assertEquals(3, e.getExitCode());
        assertTrue(e.getMessage().contains("bad credentials"), e.getMessage());
    }

    @Test
    void testFailurePatternTerminates() {
        ProcessHandle handle = sh("echo '*** Error: invalid key'; sleep 60");
        ReadinessMatcher matcher = ReadinessMatcher.pattern(
                Pattern.compile("connected"), Pattern.compile("\\*\\*\\* Error: (.*)$"));
        ProcessExitException e = assertThrows(ProcessExitException.class, () ->
                supervisor.awaitReady(handle, matcher, Duration.ofSeconds(10)));

        assertEquals("invalid key", e.getMessage());
        assertFalse(handle.isAlive());
    }

    @Test
    void testReadyFile(@TempDir Path dir) throws Exception {
        Path readyFile = dir.resolve("tunnel.ready");
        ProcessHandle handle = supervisor.spawn("sh", List.of("-c", "sleep 0.3; touch \"$READY\"; sleep 60"),
                null, Map.of("READY", readyFile.toString()), null);

        supervisor.awaitReady(handle, ReadinessMatcher.readyFile(readyFile), Duration.ofSeconds(10));

        assertEquals(ProcessState.READY, handle.getState());
        supervisor.terminate(handle);
    }

    @Test
    void testAnyOfFirstVerdictWins(@TempDir Path dir) throws Exception {
        ProcessHandle handle = sh("echo up; sleep 60");
        ReadinessMatcher matcher = ReadinessMatcher.anyOf(
                ReadinessMatcher.readyFile(dir.resolve("never")),
                ReadinessMatcher.pattern("up"));

        supervisor.awaitReady(handle, matcher, Duration.ofSeconds(10));

        assertEquals(ProcessState.READY, handle.getState());
        supervisor.terminate(handle);
    }

    @Test
    void testImmediate() throws Exception {
        ProcessHandle handle = sh("sleep 60");
        supervisor.awaitReady(handle, ReadinessMatcher.immediate(), Duration.ofSeconds(1));
        assertEquals(ProcessState.READY, handle.getState());
        supervisor.terminate(handle);
    }

    @Test
    void testInterruptLeavesProcessToCaller() throws Exception {
        ProcessHandle handle = sh("sleep 60");
        CompletableFuture<Throwable> result = new CompletableFuture<>();
        Thread waiter = new Thread(() -> {
            try {
                supervisor.awaitReady(handle, ReadinessMatcher.pattern("never"), Duration.ofSeconds(30));
                result.complete(null);
            } catch (Throwable t) {
                result.complete(t);
            }
        });
        waiter.start();
        Thread.sleep(200);
        waiter.interrupt();

        assertInstanceOf(InterruptedException.class, result.get(5, TimeUnit.SECONDS));
        assertTrue(handle.isAlive());
        supervisor.terminate(handle);
        assertFalse(handle.isAlive());
    }

    @Test
    void testSpawnMissingBinary() {
        assertThrows(SpawnException.class, () -> supervisor.spawn("/no/such/tunnel", List.of(), null));
    }

    @Test
    void testListenerSeesOutput() throws ExecutionException, InterruptedException {
        StringBuffer seen = new StringBuffer();
        ProcessHandle handle = supervisor.spawn("sh", List.of("-c", "echo a; echo b >&2"), null, Map.of(), event -> {
            if (event.isOutput()) {
                seen.append(event.isStdout() ? "out:" : "err:").append(event.data()).append(';');
            }
        });
        handle.getExitFuture().get();

        assertTrue(seen.toString().contains("out:a;"));
        assertTrue(seen.toString().contains("err:b;"));
    }

}
