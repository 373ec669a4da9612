package com.lwactors;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Executor that only runs tasks when the test says so.
 */
public class ManualExecutor implements Executor {

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean rejecting = false;
    private int submitted = 0;

    @Override
    public synchronized void execute(Runnable command) {
        if (rejecting) {
            throw new RejectedExecutionException("ManualExecutor is rejecting tasks");
        }
        submitted++;
        tasks.add(command);
    }

    /**
     * Runs queued tasks, including ones they schedule, until none are left.
     *
     * @return the number of tasks run
     */
    public int runAll() {
        int ran = 0;
        Runnable task;
        while ((task = next()) != null) {
            task.run();
            ran++;
        }
        return ran;
    }

    /**
     * Runs only the next queued task.
     *
     * @return true if a task was run
     */
    public boolean runNext() {
        Runnable task = next();
        if (task == null) {
            return false;
        }
        task.run();
        return true;
    }

    private synchronized Runnable next() {
        return tasks.poll();
    }

    public synchronized int submitted() {
        return submitted;
    }

    public synchronized void startRejecting() {
        rejecting = true;
    }
}
