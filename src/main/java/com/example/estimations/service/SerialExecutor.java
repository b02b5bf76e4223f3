package com.example.estimations.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared backing executor.
 * Many serial executors can share one pool without any of them holding a thread while idle.
 *
 * <p>If the backing executor refuses work (it is shut down), the refused task and everything
 * queued behind it are dropped. Tasks implementing {@link DroppableTask} are told so.
 */
public class SerialExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    /** A task that must complete its own bookkeeping when it will never run. */
    public interface DroppableTask extends Runnable {
        void dropped();
    }

    public static DroppableTask droppable(Runnable task, Runnable onDropped) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(onDropped, "onDropped");
        return new DroppableTask() {
            @Override public void run() { task.run(); }
            @Override public void dropped() { onDropped.run(); }
        };
    }

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor backing;
    private final String name;
    private Runnable active;

    public SerialExecutor(Executor backing, String name) {
        this.backing = Objects.requireNonNull(backing, "backing");
        this.name = (name == null) ? "serial" : name;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        List<Runnable> dropped;
        synchronized (this) {
            tasks.add(task);
            if (active != null) return;
            dropped = scheduleNext();
        }
        notifyDropped(dropped);
    }

    private void runThenScheduleNext(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            // tasks complete their own futures; anything reaching here is a bug in the task
            log.error("Task failed on {}", name, e);
        } finally {
            List<Runnable> dropped;
            synchronized (this) {
                dropped = scheduleNext();
            }
            notifyDropped(dropped);
        }
    }

    /** Caller holds the lock. Returns the tasks dropped because the backing executor refused. */
    private List<Runnable> scheduleNext() {
        Runnable next = tasks.poll();
        active = next;
        if (next == null) return List.of();
        try {
            backing.execute(() -> runThenScheduleNext(next));
            return List.of();
        } catch (RejectedExecutionException e) {
            List<Runnable> dropped = new ArrayList<>(tasks.size() + 1);
            dropped.add(next);
            dropped.addAll(tasks);
            tasks.clear();
            active = null;
            log.warn("{} dropped {} task(s): worker pool is shut down", name, dropped.size());
            return dropped;
        }
    }

    // outside the lock: callbacks may complete futures whose dependents run inline
    private void notifyDropped(List<Runnable> dropped) {
        for (Runnable t : dropped) {
            if (!(t instanceof DroppableTask d)) continue;
            try {
                d.dropped();
            } catch (RuntimeException e) {
                log.error("Drop callback failed on {}", name, e);
            }
        }
    }

    /** Tasks waiting behind the one currently running. */
    public synchronized int pending() {
        return tasks.size();
    }

    @Override
    public String toString() {
        return "SerialExecutor{" + name + '}';
    }
}
