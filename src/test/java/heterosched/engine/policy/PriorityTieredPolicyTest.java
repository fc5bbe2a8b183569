package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.model.ExecutionRecord;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PriorityTieredPolicyTest {

    @Test
    void defaultOrderPutsIoLast() {
        ExecutionRecorder recorder = new ExecutionRecorder();
        PriorityTieredPolicy policy = new PriorityTieredPolicy(
                SchedulerConfig.defaults().withWorkerCount(3), recorder);

        policy.run(PolicyFixtures.mixedBatch(4, 10), PolicyFixtures.sleeping());

        List<ExecutionRecord> records = recorder.records();
        List<TaskType> order = List.of(TaskType.COMPUTE, TaskType.MEMORY, TaskType.MIXED, TaskType.IO);
        for (int i = 0; i + 1 < order.size(); i++) {
            assertTrue(PolicyFixtures.maxEnd(records, order.get(i))
                    <= PolicyFixtures.minStart(records, order.get(i + 1)),
                    order.get(i) + " must finish before " + order.get(i + 1) + " starts");
        }
        assertEquals(0, policy.rank(TaskType.COMPUTE));
        assertEquals(3, policy.rank(TaskType.IO));
    }

    @Test
    void configuredOrderIsUsed() {
        SchedulerConfig config = SchedulerConfig.defaults()
                .withWorkerCount(2)
                .withPriorityOrder(SchedulerConfig.parsePriorityOrder("io,mixed"));
        PriorityTieredPolicy policy = new PriorityTieredPolicy(config, new ExecutionRecorder());

        List<TaskType> tierTypes = policy.tiers(PolicyFixtures.mixedBatch(2, 1)).stream()
                .map(tier -> tier.get(0).type())
                .collect(Collectors.toList());

        assertEquals(List.of(TaskType.IO, TaskType.MIXED, TaskType.COMPUTE, TaskType.MEMORY), tierTypes);
    }

    @Test
    void missingTiersAreSkipped() {
        PriorityTieredPolicy policy = new PriorityTieredPolicy(
                SchedulerConfig.defaults().withWorkerCount(2), new ExecutionRecorder());

        List<List<TaskDescriptor>> tiers = policy.tiers(PolicyFixtures.batchOf(TaskType.IO, 3, 0, 1));

        assertEquals(1, tiers.size());
        assertEquals(3, tiers.get(0).size());
    }
}
