package com.cronhooks.actor;

import akka.actor.typed.Behavior;
import akka.actor.typed.DispatcherSelector;
import akka.actor.typed.javadsl.*;
import com.cronhooks.message.ExecutionMessages.*;
import com.cronhooks.service.ExecutionResult;
import com.cronhooks.service.JobRunner;
import com.cronhooks.service.ReminderRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedList;
import java.util.Queue;

/**
 * JobDispatcherActor accepts job and reminder executions from every trigger source and runs each
 * one in its own {@link JobExecutionActor}. No ordering is kept between executions; at most
 * {@code maxConcurrent} run at once and the overflow waits in a bounded queue.
 */
public class JobDispatcherActor extends AbstractBehavior<Object> {
    private static final Logger logger = LoggerFactory.getLogger(JobDispatcherActor.class);

    private final JobRunner jobRunner;
    private final ReminderRunner reminderRunner;
    private final DispatcherSelector executionDispatcher;
    private final Queue<Execution> pending;
    private final int maxConcurrent;
    private final int maxQueued;
    private int active;
    private long completed;
    private long dropped;

    public static Behavior<Object> create(JobRunner jobRunner,
                                          ReminderRunner reminderRunner,
                                          DispatcherSelector executionDispatcher,
                                          int maxConcurrent,
                                          int maxQueued) {
        return Behaviors.setup(context ->
                new JobDispatcherActor(context, jobRunner, reminderRunner, executionDispatcher, maxConcurrent, maxQueued));
    }

    private JobDispatcherActor(ActorContext<Object> context,
                               JobRunner jobRunner,
                               ReminderRunner reminderRunner,
                               DispatcherSelector executionDispatcher,
                               int maxConcurrent,
                               int maxQueued) {
        super(context);
        this.jobRunner = jobRunner;
        this.reminderRunner = reminderRunner;
        this.executionDispatcher = executionDispatcher;
        this.pending = new LinkedList<>();
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.maxQueued = Math.max(0, maxQueued);

        logger.info("JobDispatcherActor created with maxConcurrent={}, maxQueued={}", this.maxConcurrent, this.maxQueued);
    }

    @Override
    public Receive<Object> createReceive() {
        return newReceiveBuilder()
                .onMessage(ExecuteJob.class, this::onExecution)
                .onMessage(ExecuteReminder.class, this::onExecution)
                .onMessage(ExecutionFinished.class, this::onExecutionFinished)
                .onMessage(GetDispatcherStatus.class, this::onGetDispatcherStatus)
                .onAnyMessage(msg -> {
                    logger.warn("Received unexpected message: {}", msg.getClass().getSimpleName());
                    return Behaviors.same();
                })
                .build();
    }

    private Behavior<Object> onExecution(Execution msg) {
        if (active < maxConcurrent) {
            start(msg);
            return Behaviors.same();
        }

        if (pending.size() >= maxQueued) {
            dropped++;
            logger.warn("⚠️ Execution queue is full ({} waiting), dropping {}", pending.size(), msg.describe());
            return Behaviors.same();
        }

        pending.offer(msg);
        logger.debug("Queued {}. Queue size: {}", msg.describe(), pending.size());
        return Behaviors.same();
    }

    private Behavior<Object> onExecutionFinished(ExecutionFinished msg) {
        active--;
        completed++;

        ExecutionResult result = msg.getResult();
        if (result == null) {
            logger.error("❌ {} ended abnormally", msg.getExecution().describe());
        } else if (result.isSuccess()) {
            logger.info("✅ {} completed", msg.getExecution().describe());
        } else {
            logger.warn("{} completed with errors: {}", msg.getExecution().describe(), result.getErrorMessage());
        }

        startNext();
        return Behaviors.same();
    }

    private Behavior<Object> onGetDispatcherStatus(GetDispatcherStatus msg) {
        msg.getReplyTo().tell(new DispatcherStatus(pending.size(), active, completed, dropped));
        return Behaviors.same();
    }

    private void startNext() {
        while (active < maxConcurrent && !pending.isEmpty()) {
            start(pending.poll());
        }
    }

    private void start(Execution execution) {
        active++;
        logger.debug("Starting {}. Active executions: {}", execution.describe(), active);
        getContext().spawnAnonymous(
                JobExecutionActor.create(execution, jobRunner, reminderRunner, getContext().getSelf()),
                executionDispatcher);
    }
}
