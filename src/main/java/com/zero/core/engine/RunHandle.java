package com.zero.core.engine;

/**
 * Interrupt target for one in-flight analyzer run.
 * <p>
 * Interrupts and {@link #finish()} are serialised on the handle, so once the run has
 * finished no late timeout or cancellation can interrupt the (pooled) thread.
 */
final class RunHandle {

    private final Thread thread;
    private boolean finished;
    private boolean timedOut;
    private boolean cancelled;

    RunHandle(Thread thread) {
        this.thread = thread;
    }

    synchronized void timeout() {
        if (!finished) {
            timedOut = true;
            thread.interrupt();
        }
    }

    synchronized void cancel() {
        if (!finished) {
            cancelled = true;
            thread.interrupt();
        }
    }

    synchronized boolean isTimedOut() {
        return timedOut;
    }

    /**
     * Marks the run finished and clears any interrupt it caused.
     *
     * @return true if the run hit its timeout before finishing
     */
    boolean finish() {
        boolean result;
        synchronized (this) {
            finished = true;
            result = timedOut;
        }
        if (Thread.currentThread() == thread) {
            Thread.interrupted();
        }
        return result;
    }

    synchronized boolean wasCancelled() {
        return cancelled;
    }
}
