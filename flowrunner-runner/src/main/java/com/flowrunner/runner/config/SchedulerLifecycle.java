package com.flowrunner.runner.config;

import com.flowrunner.engine.service.RunnerService;
import com.flowrunner.scheduler.SleepScheduler;
import com.flowrunner.scheduler.TriggerPollScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the schedulers once the context is ready and stops them on shutdown.
 */
public class SchedulerLifecycle implements SmartLifecycle {

    private final SleepScheduler sleepScheduler;
    private final TriggerPollScheduler triggerPollScheduler;
    private final RunnerService runnerService;
    private final boolean pollingEnabled;

    private volatile boolean running = false;

    public SchedulerLifecycle(
            SleepScheduler sleepScheduler,
            TriggerPollScheduler triggerPollScheduler,
            RunnerService runnerService,
            boolean pollingEnabled) {
        this.sleepScheduler = sleepScheduler;
        this.triggerPollScheduler = triggerPollScheduler;
        this.runnerService = runnerService;
        this.pollingEnabled = pollingEnabled;
    }

    @Override
    public void start() {
        sleepScheduler.start(runnerService::wakeUpWorkflowRun);
        if (pollingEnabled) {
            triggerPollScheduler.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        if (pollingEnabled) {
            triggerPollScheduler.stop();
        }
        sleepScheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
