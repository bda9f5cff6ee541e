package com.chicu.aimotuner.tuning.study;

/**
 * Кооперативная отмена: проверяется между задачами и между trial'ами.
 * Учитывает и флаг, и interrupt текущего потока.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }
}
