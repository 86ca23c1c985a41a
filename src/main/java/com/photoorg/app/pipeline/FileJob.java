package com.photoorg.app.pipeline;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.photoorg.app.index.FileStatus;
import com.photoorg.app.metadata.CaptureDate;
import com.photoorg.app.scan.CandidatePath;
import com.photoorg.app.scan.MediaType;

/**
 * Um arquivo em processamento. O resultado é fixado uma única vez por
 * {@link #settle(FileStatus)}, seja pelo worker ou pelo watchdog de timeout.
 */
public final class FileJob {

    private final CandidatePath candidate;
    private final PipelineStats stats;
    private final AtomicReference<Stage> stage = new AtomicReference<>(Stage.SCANNED);
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private volatile FileStatus outcome;
    private volatile String hash;
    private volatile CaptureDate captureDate;
    private volatile Long sizeBytes;
    private volatile String workerName;
    private volatile boolean timedOut;

    // guardados pelo monitor do job
    private Thread runner;
    private long startedNanos;
    private boolean interrupted;

    FileJob(CandidatePath candidate, PipelineStats stats) {
        this.candidate = candidate;
        this.stats = stats;
    }

    public CandidatePath candidate() {
        return candidate;
    }

    public Path path() {
        return candidate.path();
    }

    public MediaType mediaType() {
        return candidate.mediaHint();
    }

    public Stage stage() {
        return stage.get();
    }

    /**
     * @return false se a transição não é permitida (job já finalizado)
     */
    public boolean advance(Stage next) {
        while (true) {
            Stage cur = stage.get();
            if (!cur.canMoveTo(next)) return false;
            if (stage.compareAndSet(cur, next)) return true;
        }
    }

    /**
     * Fixa o resultado e atualiza os contadores. Só a primeira chamada vence.
     */
    public boolean settle(FileStatus status) {
        if (!settled.compareAndSet(false, true)) return false;
        outcome = status;
        advance(status == FileStatus.ERROR ? Stage.FAILED : Stage.RECORDED);
        stats.record(status, mediaType());
        return true;
    }

    public boolean isSettled() {
        return settled.get();
    }

    public FileStatus outcome() {
        return outcome;
    }

    public String hash() {
        return hash;
    }

    public void hash(String value) {
        this.hash = value;
    }

    public CaptureDate captureDate() {
        return captureDate;
    }

    public void captureDate(CaptureDate value) {
        this.captureDate = value;
    }

    public Long sizeBytes() {
        return sizeBytes;
    }

    public void sizeBytes(long value) {
        this.sizeBytes = value;
    }

    public String workerName() {
        return workerName;
    }

    // --- Controle de execução (WorkerPool) ----------------------------------

    void markTimedOut() {
        timedOut = true;
    }

    /** Finalizado pelo watchdog enquanto o worker ainda estava nele. */
    public boolean isTimedOut() {
        return timedOut;
    }

    synchronized void begin(Thread thread) {
        this.runner = thread;
        this.workerName = thread.getName();
        this.startedNanos = System.nanoTime();
    }

    synchronized void end() {
        this.runner = null;
    }

    synchronized long elapsedNanos(long now) {
        return runner == null ? 0 : now - startedNanos;
    }

    /**
     * Interrompe o worker apenas se ele ainda estiver neste job.
     */
    synchronized boolean interruptIfRunning() {
        if (runner == null || interrupted) return false;
        interrupted = true;
        runner.interrupt();
        return true;
    }

    @Override
    public String toString() {
        return candidate.path() + " [" + stage.get() + "]";
    }
}
