package work.lcod.dispatch.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.dispatch.api.InputResult;
import work.lcod.dispatch.convert.ValueType;
import work.lcod.dispatch.support.DispatchTestSupport;
import work.lcod.dispatch.support.DispatchTestSupport.RecordingCallback;

class CommandQueueTest {
    private final CommandQueue queue = DispatchTestSupport.newQueue();

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    void echoBindsAllRemainingTokens() {
        queue.registerMetadata(echo());
        queue.start();

        var callback = new RecordingCallback();
        queue.submit("echo hello world", CommandContext.empty(), callback);

        var outcome = callback.await();
        assertEquals(InputResult.SUCCESS, outcome.result());
        assertEquals("hello world", outcome.payload());
    }

    @Test
    void inputMatchingNothingIsUnhandled() {
        queue.registerMetadata(echo());
        queue.start();

        var callback = new RecordingCallback();
        queue.submit("shout hello", CommandContext.empty(), callback);

        var outcome = callback.await();
        assertEquals(InputResult.UNHANDLED, outcome.result());
        assertNull(outcome.payload());
    }

    @Test
    void aliasesMatchCaseInsensitively() {
        queue.registerMetadata(echo());
        queue.start();

        var callback = new RecordingCallback();
        queue.submit("  ECHO Mixed Case", CommandContext.empty(), callback);

        assertEquals("Mixed Case", callback.await().payload());
    }

    @Test
    void firstRegisteredMatchWins() {
        queue.registerMetadata(CommandDefinition.command("first").alias("go").handler((c, args) -> "first").build());
        queue.registerMetadata(CommandDefinition.command("second").alias("go").handler((c, args) -> "second").build());
        queue.start();

        var callback = new RecordingCallback();
        queue.submit("go", CommandContext.empty(), callback);

        assertEquals("first", callback.await().payload());
    }

    @Test
    void failuresAreReportedToTheirOwnCallbackOnly() {
        queue.registerMetadata(echo());
        queue.registerMetadata(CommandDefinition.command("num")
            .parameter(ValueType.INTEGER)
            .handler((c, args) -> args.get(0))
            .build());
        queue.start();

        var bad = new RecordingCallback();
        var good = new RecordingCallback();
        queue.submit("num twelve", CommandContext.empty(), bad);
        queue.submit("echo still running", CommandContext.empty(), good);

        var failure = bad.await();
        assertEquals(InputResult.FAILURE, failure.result());
        var error = assertInstanceOf(CommandParsingException.class, failure.payload());
        assertEquals(ParserFailReason.PARSING_FAILED, error.reason());
        assertEquals(InputResult.SUCCESS, good.await().result());
        assertTrue(queue.isRunning());
    }

    @Test
    void handlerExceptionsBecomeFailures() {
        queue.registerMetadata(CommandDefinition.command("boom")
            .handler((c, args) -> {
                throw new IllegalStateException("kaboom");
            })
            .build());
        queue.start();

        var callback = new RecordingCallback();
        queue.submit("boom", CommandContext.empty(), callback);

        var outcome = callback.await();
        assertEquals(InputResult.FAILURE, outcome.result());
        assertInstanceOf(CommandHandlerException.class, outcome.payload());
        assertEquals(1, callback.calls());
    }

    @Test
    void nullInputIsReportedAsInvalidArguments() {
        queue.start();

        var callback = new RecordingCallback();
        queue.submit(null, CommandContext.empty(), callback);

        var outcome = callback.await();
        assertEquals(InputResult.FAILURE, outcome.result());
        assertEquals(ParserFailReason.INVALID_ARGUMENTS, ((CommandParsingException) outcome.payload()).reason());
    }

    @Test
    void throwingCallbackDoesNotStopTheWorker() {
        queue.registerMetadata(echo());
        queue.start();

        queue.submit("echo first", CommandContext.empty(), (result, payload) -> {
            throw new IllegalStateException("callback failure");
        });
        var callback = new RecordingCallback();
        queue.submit("echo second", CommandContext.empty(), callback);

        assertEquals("second", callback.await().payload());
    }

    @Test
    void independentCommandsRunConcurrently() throws Exception {
        var bothStarted = new CountDownLatch(2);
        queue.registerMetadata(CommandDefinition.command("meet")
            .handler((c, args) -> {
                bothStarted.countDown();
                return bothStarted.await(5, TimeUnit.SECONDS);
            })
            .build());
        queue.start();

        var first = new RecordingCallback();
        var second = new RecordingCallback();
        queue.submit("meet", CommandContext.empty(), first);
        queue.submit("meet", CommandContext.empty(), second);

        assertEquals(Boolean.TRUE, first.await().payload());
        assertEquals(Boolean.TRUE, second.await().payload());
    }

    @Test
    void registrationWhileProcessingIsSafe() throws Exception {
        queue.start();
        var callbacks = new ArrayList<RecordingCallback>();
        var registrar = new Thread(() -> {
            for (int i = 0; i < 200; i++) {
                queue.registerMetadata(CommandDefinition.command("cmd" + i).handler((c, args) -> "ok").build());
            }
        });
        registrar.start();
        for (int i = 0; i < 200; i++) {
            var callback = new RecordingCallback();
            callbacks.add(callback);
            queue.submit("unknown" + i, CommandContext.empty(), callback);
        }
        registrar.join();

        for (var callback : callbacks) {
            assertEquals(InputResult.UNHANDLED, callback.await().result());
        }
        assertEquals(200, queue.metadata().size());
    }

    @Test
    void startingTwiceFails() {
        queue.start();
        assertThrows(IllegalStateException.class, queue::start);
    }

    @Test
    void stoppedQueueRejectsInputAndCannotRestart() throws Exception {
        queue.start();
        queue.stop();
        queue.stop();

        assertThrows(IllegalStateException.class, () -> queue.submit("echo x", CommandContext.empty(), new RecordingCallback()));
        assertThrows(IllegalStateException.class, queue::start);
        waitForWorkerExit();
        assertFalse(queue.isRunning());
    }

    @Test
    void stoppingAbandonsQueuedInputWithoutCallbacks() throws Exception {
        queue.registerMetadata(echo());
        var callback = new RecordingCallback();
        queue.submit("echo never", CommandContext.empty(), callback);
        queue.stop();

        assertEquals(1, queue.pending());
        assertFalse(callback.completed());
    }

    @Test
    void stopDoesNotInterruptACallbackRunningOnTheWorker() throws Exception {
        var entered = new CountDownLatch(1);
        var finished = new CountDownLatch(1);
        var state = new AtomicReference<String>();
        queue.start();

        queue.submit("nothing", CommandContext.empty(), (result, payload) -> {
            entered.countDown();
            try {
                Thread.sleep(300);
                state.set("slept");
            } catch (InterruptedException ex) {
                state.set("interrupted");
            } finally {
                finished.countDown();
            }
        });
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        queue.stop();

        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals("slept", state.get());
        waitForWorkerExit();
        assertFalse(queue.isRunning());
    }

    @Test
    void runningCommandsFinishAfterStop() throws Exception {
        var release = new CountDownLatch(1);
        var entered = new CountDownLatch(1);
        queue.registerMetadata(CommandDefinition.command("wait")
            .handler((c, args) -> {
                entered.countDown();
                return release.await(5, TimeUnit.SECONDS) ? "released" : "timed out";
            })
            .build());
        queue.start();

        var callback = new RecordingCallback();
        queue.submit("wait", CommandContext.empty(), callback);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        queue.close();
        release.countDown();

        assertEquals("released", callback.await().payload());
    }

    @Test
    void closedQueueRejectsRegistration() {
        queue.close();
        assertThrows(IllegalStateException.class, () -> queue.registerMetadata(echo()));
    }

    @Test
    void nullCallbackIsRejected() {
        assertThrows(NullPointerException.class, () -> queue.submit("echo", CommandContext.empty(), null));
    }

    @Test
    void contextIsPassedThrough() {
        queue.registerMetadata(CommandDefinition.command("whoami")
            .handler((c, args) -> c.getAttribute("user"))
            .build());
        queue.start();

        var callback = new RecordingCallback();
        queue.submit("whoami", CommandContext.of(Map.of("user", "ada")), callback);

        assertEquals("ada", callback.await().payload());
    }

    private void waitForWorkerExit() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (queue.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    static CommandMetadata echo() {
        return CommandDefinition.command("echo")
            .remaining(ValueType.STRING)
            .returns(ValueType.STRING)
            .handler((c, args) -> args.get(0, ValueType.STRING))
            .build();
    }
}
