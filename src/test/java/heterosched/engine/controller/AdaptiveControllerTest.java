package heterosched.engine.controller;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.governor.ConcurrencyGovernor;
import heterosched.engine.model.ControllerTick;
import heterosched.engine.model.ControllerTick.Decision;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveControllerTest {

    private static final long SECOND = 1_000_000_000L;

    private AtomicLong clock;
    private SchedulerConfig config;
    private ExecutionRecorder recorder;
    private ConcurrencyGovernor governor;
    private AdaptiveController controller;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(0);
        // floor and increment 2, max ceiling 16
        config = SchedulerConfig.defaults()
                .withWorkerCount(2)
                .withControllerInterval(Duration.ofMillis(50));
        recorder = new ExecutionRecorder(clock::get);
        governor = new ConcurrencyGovernor(config.initialCeiling());
        controller = new AdaptiveController(recorder, governor, config, clock::get);
    }

    @AfterEach
    void tearDown() {
        controller.close();
    }

    @Test
    @DisplayName("Saturated governor with steady throughput is raised by one increment")
    void raisesWhenSaturated() throws Exception {
        admit(4);
        clock.addAndGet(SECOND);

        ControllerTick tick = controller.tick();

        assertEquals(Decision.RAISE, tick.decision());
        assertEquals(6, governor.ceiling());
        assertEquals(6, tick.ceiling());
    }

    @Test
    void holdsBetweenThresholds() throws Exception {
        admit(2);
        clock.addAndGet(SECOND);

        // 2 of 4: above 0.4 * 4, below 0.8 * 4
        ControllerTick tick = controller.tick();

        assertEquals(Decision.HOLD, tick.decision());
        assertEquals(4, governor.ceiling());
    }

    @Test
    void lowersWhenIdleButNotBelowFloor() {
        governor.setCeiling(8);

        for (int expected : new int[] { 6, 4, 2 }) {
            clock.addAndGet(SECOND);
            assertEquals(Decision.LOWER, controller.tick().decision());
            assertEquals(expected, governor.ceiling());
        }

        clock.addAndGet(SECOND);
        assertEquals(Decision.HOLD, controller.tick().decision());
        assertEquals(2, governor.ceiling());
    }

    @Test
    void neverRaisesPastMaximum() throws Exception {
        governor.setCeiling(15);
        admit(15);

        clock.addAndGet(SECOND);
        assertEquals(Decision.RAISE, controller.tick().decision());
        assertEquals(16, governor.ceiling());

        admit(1);
        clock.addAndGet(SECOND);
        assertEquals(Decision.HOLD, controller.tick().decision());
        assertEquals(16, governor.ceiling());
    }

    @Test
    @DisplayName("Falling throughput blocks a raise")
    void fallingThroughputBlocksRaise() throws Exception {
        admit(4);
        complete(10);
        clock.addAndGet(SECOND);
        assertEquals(Decision.RAISE, controller.tick().decision());
        assertEquals(6, governor.ceiling());

        admit(1);
        clock.addAndGet(SECOND);
        // 5 of 6 admitted but nothing completed since the last tick
        assertEquals(Decision.HOLD, controller.tick().decision());
        assertEquals(6, governor.ceiling());
    }

    @Test
    void historyKeepsEveryTick() {
        clock.addAndGet(SECOND);
        controller.tick();
        clock.addAndGet(SECOND);
        controller.tick();

        assertEquals(2, controller.history().size());
        assertEquals(1.0, controller.history().get(0).timeOffset(), 1e-9);
        assertEquals(2.0, controller.history().get(1).timeOffset(), 1e-9);
    }

    @Test
    void throughputIsMeasuredBetweenTicks() {
        complete(6);
        clock.addAndGet(2 * SECOND);

        assertEquals(3.0, controller.tick().throughput(), 1e-9);
    }

    @Test
    void markDoneStopsRunningController() throws Exception {
        controller.start();
        assertEquals(AdaptiveController.State.MONITORING, controller.state());

        controller.markDone();

        assertTrue(controller.awaitStopped(Duration.ofSeconds(2)));
        assertEquals(AdaptiveController.State.STOPPED, controller.state());
        assertTrue(controller.isDone());
    }

    @Test
    void neverStartedControllerStopsImmediately() {
        controller.markDone();
        assertEquals(AdaptiveController.State.STOPPED, controller.state());

        // Starting after stop is ignored
        controller.start();
        assertEquals(AdaptiveController.State.STOPPED, controller.state());
    }

    @Test
    void runningControllerTicksOnSchedule() throws Exception {
        AdaptiveController live = new AdaptiveController(recorder, governor, config);
        try {
            live.start();
            Thread.sleep(300);
        } finally {
            live.close();
        }

        assertFalse(live.history().isEmpty());
        assertEquals(AdaptiveController.State.STOPPED, live.state());
    }

    private void admit(int n) throws InterruptedException {
        for (int i = 0; i < n; i++) {
            governor.admit();
        }
    }

    private void complete(int n) {
        for (int i = 0; i < n; i++) {
            int taskId = 1000 + recorder.completedCount() + i;
            recorder.recordStart(taskId, 0, TaskType.IO);
            recorder.recordEnd(taskId, 0);
        }
    }
}
