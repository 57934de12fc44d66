package com.zero.core.queue;

/**
 * Thrown when a job is submitted while the queue already holds its maximum number
 * of waiting jobs.
 */
public class QueueFullException extends RuntimeException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Job queue is full (" + capacity + " job(s) waiting); retry later");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
