package com.cronhooks.actor;

import akka.actor.typed.ActorRef;
import akka.actor.typed.Behavior;
import akka.actor.typed.javadsl.*;
import com.cronhooks.message.ExecutionMessages.*;
import com.cronhooks.service.ExecutionResult;
import com.cronhooks.service.JobRunner;
import com.cronhooks.service.ReminderRunner;

/**
 * Runs a single execution on the blocking webhook dispatcher, reports back and stops.
 */
public class JobExecutionActor extends AbstractBehavior<Object> {
    private final Execution execution;
    private final JobRunner jobRunner;
    private final ReminderRunner reminderRunner;
    private final ActorRef<Object> dispatcher;

    public static Behavior<Object> create(Execution execution,
                                          JobRunner jobRunner,
                                          ReminderRunner reminderRunner,
                                          ActorRef<Object> dispatcher) {
        return Behaviors.setup(context -> {
            context.getSelf().tell(Run.INSTANCE);
            return new JobExecutionActor(context, execution, jobRunner, reminderRunner, dispatcher);
        });
    }

    private JobExecutionActor(ActorContext<Object> context,
                              Execution execution,
                              JobRunner jobRunner,
                              ReminderRunner reminderRunner,
                              ActorRef<Object> dispatcher) {
        super(context);
        this.execution = execution;
        this.jobRunner = jobRunner;
        this.reminderRunner = reminderRunner;
        this.dispatcher = dispatcher;
    }

    @Override
    public Receive<Object> createReceive() {
        return newReceiveBuilder()
                .onMessage(Run.class, this::onRun)
                .build();
    }

    private Behavior<Object> onRun(Run msg) {
        ExecutionResult result = null;
        try {
            if (execution instanceof ExecuteReminder) {
                ExecuteReminder reminder = (ExecuteReminder) execution;
                result = reminderRunner.fire(reminder.getJob(), reminder.getReminder());
            } else {
                result = jobRunner.run(execution.getJob());
            }
        } catch (RuntimeException e) {
            getContext().getLog().error("Unexpected failure during {}: {}", execution.describe(), e.getMessage(), e);
        }

        dispatcher.tell(new ExecutionFinished(execution, result));
        return Behaviors.stopped();
    }
}
