package com.cronhooks.message;

import akka.actor.typed.ActorRef;
import com.cronhooks.model.Job;
import com.cronhooks.model.Reminder;
import com.cronhooks.service.ExecutionResult;

public class ExecutionMessages {

    public enum Trigger { CRON, MANUAL, REMINDER }

    // Common parent of the two kinds of work the dispatcher accepts
    public abstract static class Execution {
        private final Job job;
        private final Trigger trigger;

        protected Execution(Job job, Trigger trigger) {
            this.job = job;
            this.trigger = trigger;
        }

        public Job getJob() { return job; }
        public Trigger getTrigger() { return trigger; }

        public abstract String describe();
    }

    // Messages for JobDispatcherActor
    public static class ExecuteJob extends Execution {

        public ExecuteJob(Job job, Trigger trigger) {
            super(job, trigger);
        }

        @Override
        public String describe() {
            return getTrigger() + " execution of job " + getJob().getId();
        }
    }

    public static class ExecuteReminder extends Execution {
        private final Reminder reminder;

        public ExecuteReminder(Job job, Reminder reminder) {
            super(job, Trigger.REMINDER);
            this.reminder = reminder;
        }

        public Reminder getReminder() { return reminder; }

        @Override
        public String describe() {
            return "reminder " + reminder.getId() + " of job " + getJob().getId();
        }
    }

    public static class ExecutionFinished {
        private final Execution execution;
        private final ExecutionResult result;

        public ExecutionFinished(Execution execution, ExecutionResult result) {
            this.execution = execution;
            this.result = result;
        }

        public Execution getExecution() { return execution; }

        /**
         * Null when the execution died with an unexpected exception.
         */
        public ExecutionResult getResult() { return result; }
    }

    public static class GetDispatcherStatus {
        private final ActorRef<DispatcherStatus> replyTo;

        public GetDispatcherStatus(ActorRef<DispatcherStatus> replyTo) {
            this.replyTo = replyTo;
        }

        public ActorRef<DispatcherStatus> getReplyTo() { return replyTo; }
    }

    public static class DispatcherStatus {
        private final int queued;
        private final int active;
        private final long completed;
        private final long dropped;

        public DispatcherStatus(int queued, int active, long completed, long dropped) {
            this.queued = queued;
            this.active = active;
            this.completed = completed;
            this.dropped = dropped;
        }

        public int getQueued() { return queued; }
        public int getActive() { return active; }
        public long getCompleted() { return completed; }
        public long getDropped() { return dropped; }
    }

    // Message for JobExecutionActor
    public static class Run {
        public static final Run INSTANCE = new Run();

        private Run() {}
    }
}
