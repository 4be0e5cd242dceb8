package com.purchasingpower.repoagent.store;

import com.purchasingpower.repoagent.model.CloneProgress;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.EmptyProgressMonitor;

import java.util.function.Consumer;

/**
 * Bridges JGit transport progress to {@link CloneProgress} callbacks.
 *
 * <p>Transport tasks are mapped into {@code [0, TRANSFER_CEILING]}. Reported values never
 * decrease and stay at or below {@value #CAP} until {@link #complete()}.
 */
@Slf4j
class CloneProgressMonitor extends EmptyProgressMonitor {

    static final int TRANSFER_CEILING = 80;
    static final int CAP = 99;

    private final Consumer<CloneProgress> listener;

    private String phase = "Starting";
    private int totalWork;
    private int completedWork;
    private int lastReported = -1;
    private boolean completed;

    CloneProgressMonitor(Consumer<CloneProgress> listener) {
        this.listener = listener;
    }

    @Override
    public synchronized void beginTask(String title, int total) {
        phase = title;
        totalWork = total;
        completedWork = 0;
        log.debug("Clone phase: {} ({} units)", title, total);
    }

    @Override
    public synchronized void update(int completed) {
        completedWork += completed;
        if (totalWork > 0) {
            int within = (int) Math.min(100L, (100L * completedWork) / totalWork);
            report(phase, within * TRANSFER_CEILING / 100);
        }
    }

    synchronized void report(String phaseName, int percent) {
        if (completed) {
            return;
        }
        int bounded = Math.min(Math.max(percent, 0), CAP);
        if (bounded <= lastReported) {
            return;
        }
        lastReported = bounded;
        notifyListener(new CloneProgress(phaseName, bounded));
    }

    /**
     * Emits the single 100% notification.
     */
    synchronized void complete() {
        if (completed) {
            return;
        }
        completed = true;
        lastReported = 100;
        notifyListener(new CloneProgress("Complete", 100));
    }

    private void notifyListener(CloneProgress progress) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}%: {}", progress.percent(), e.getMessage());
        }
    }
}
