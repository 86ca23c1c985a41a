package com.photoorg.app.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.photoorg.app.index.FileStatus;
import com.photoorg.app.scan.CandidatePath;

/**
 * Pool fixo de workers alimentado por uma fila limitada.
 *
 * <p>Parada cooperativa: com o flag de parada ligado, arquivos ainda na fila
 * são descartados e os que já estão em um worker terminam normalmente.
 * {@link #drain()} espera até todo arquivo despachado ter resultado.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    public static final String MDC_FILE = "file";

    private static final long OFFER_TIMEOUT_MS = 200;
    private static final long PROGRESS_EVERY = 500;

    private final FileJob poison;

    private final int workerCount;
    private final BlockingQueue<FileJob> queue;
    private final FileHandler handler;
    private final PipelineStats stats;
    private final AtomicBoolean stop;
    private final Duration fileTimeout;

    private final List<Thread> workers = new ArrayList<>();
    private final Map<Thread, FileJob> running = new ConcurrentHashMap<>();
    private final Set<FileJob> inFlight = ConcurrentHashMap.newKeySet();
    private final LongAdder discarded = new LongAdder();

    private volatile boolean accepting = true;
    private volatile boolean started = false;
    private ScheduledExecutorService watchdog;

    /**
     * @param stop        flag de parada compartilhado (o scanner usa o mesmo)
     * @param fileTimeout {@link Duration#ZERO} desliga o timeout por arquivo
     */
    public WorkerPool(int workerCount, int queueCapacity, FileHandler handler, PipelineStats stats,
                      AtomicBoolean stop, Duration fileTimeout) {
        if (workerCount < 1) throw new IllegalArgumentException("workerCount < 1");
        this.workerCount = workerCount;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.handler = handler;
        this.stats = stats;
        this.stop = stop;
        this.fileTimeout = fileTimeout == null ? Duration.ZERO : fileTimeout;
        this.poison = new FileJob(null, stats);
    }

    public synchronized void start() {
        if (started) throw new IllegalStateException("WorkerPool já iniciado");
        started = true;

        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        for (int i = 1; i <= workerCount; i++) {
            Thread t = new Thread(() -> {
                if (parentMdc != null) MDC.setContextMap(parentMdc);
                try {
                    workerLoop();
                } finally {
                    MDC.clear();
                }
            }, "photoorg-worker-" + i);
            t.setDaemon(true);
            workers.add(t);
            t.start();
        }

        if (!fileTimeout.isZero()) {
            watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "photoorg-watchdog");
                t.setDaemon(true);
                return t;
            });
            long period = Math.max(10, Math.min(1000, fileTimeout.toMillis() / 4));
            watchdog.scheduleAtFixedRate(this::checkTimeouts, period, period, TimeUnit.MILLISECONDS);
        }
        logger.info("WorkerPool iniciado com {} workers (fila {})", workerCount, queue.remainingCapacity());
    }

    /**
     * Enfileira um arquivo. Bloqueia enquanto a fila estiver cheia; com parada
     * solicitada o arquivo é descartado.
     */
    public void submit(CandidatePath candidate) {
        if (!accepting) throw new IllegalStateException("WorkerPool não aceita novos arquivos");
        FileJob job = new FileJob(candidate, stats);
        while (!stop.get()) {
            try {
                if (queue.offer(job, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                discarded.increment();
                logger.warn("Envio interrompido; {} descartado", candidate.path());
                return;
            }
            if (started && workers.stream().noneMatch(Thread::isAlive)) {
                throw new IllegalStateException("Todos os workers terminaram; abortando");
            }
        }
        discarded.increment();
    }

    public void requestStop() {
        stop.set(true);
    }

    public boolean isStopRequested() {
        return stop.get();
    }

    /**
     * Fecha a entrada e espera cada arquivo despachado ter resultado.
     * Um worker preso em um arquivo já finalizado pelo watchdog é abandonado.
     */
    public void drain() throws InterruptedException {
        accepting = false;
        if (!started) return;
        for (int i = 0; i < workers.size(); i++) {
            queue.put(poison);
        }
        for (Thread t : workers) {
            while (t.isAlive()) {
                t.join(OFFER_TIMEOUT_MS);
                FileJob current = running.get(t);
                if (t.isAlive() && current != null && current.isTimedOut() && current.isSettled()) {
                    logger.warn("Worker {} abandonado preso em {}", t.getName(), current.path());
                    break;
                }
            }
        }
        if (watchdog != null) {
            watchdog.shutdownNow();
        }
        long dropped = discarded.sum();
        if (dropped > 0) {
            logger.info("{} arquivos na fila descartados pela parada", dropped);
        }
    }

    public long discarded() {
        return discarded.sum();
    }

    public PipelineStats stats() {
        return stats;
    }

    /**
     * Libera os workers restantes. Não mexe no flag de parada compartilhado.
     */
    @Override
    public void close() {
        accepting = false;
        if (watchdog != null) watchdog.shutdownNow();
        for (Thread t : workers) {
            if (t.isAlive()) queue.offer(poison);
        }
    }

    // --- Workers ------------------------------------------------------------

    private void workerLoop() {
        while (true) {
            // interrupção atrasada do watchdog não pode vazar para o próximo arquivo
            Thread.interrupted();
            FileJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                continue;
            }
            if (job == poison) return;
            if (stop.get()) {
                discarded.increment();
                continue;
            }
            process(job);
        }
    }

    private void process(FileJob job) {
        Thread self = Thread.currentThread();
        stats.seen.increment();
        inFlight.add(job);
        running.put(self, job);
        job.begin(self);
        MDC.put(MDC_FILE, job.path().toString());
        try {
            handler.handle(job);
            if (!job.isSettled()) {
                fail(job, new IllegalStateException("Arquivo terminou sem resultado"));
            }
        } catch (Exception e) {
            fail(job, e);
        } finally {
            job.end();
            inFlight.remove(job);
            running.remove(self);
            MDC.remove(MDC_FILE);
        }

        long n = stats.settled();
        if (n % PROGRESS_EVERY == 0) {
            logger.info("Progresso: {} arquivos ({} organizados, {} duplicados, {} revisão, {} erros)",
                    n, stats.organized.sum(), stats.duplicates.sum(), stats.review.sum(), stats.errors.sum());
        }
    }

    private void fail(FileJob job, Throwable cause) {
        Stage at = job.stage();
        if (!job.settle(FileStatus.ERROR)) {
            logger.debug("Falha após resultado já fixado em {}: {}", job.path(), cause.toString());
            return;
        }
        logger.warn("Falha em {} no estágio {}: {}", job.path(), at, cause.toString());
        logger.debug("Detalhes da falha em {}", job.path(), cause);
        handler.recordFailure(job, cause);
    }

    private void checkTimeouts() {
        long now = System.nanoTime();
        long limit = fileTimeout.toNanos();
        for (FileJob job : inFlight) {
            long elapsed = job.elapsedNanos(now);
            if (elapsed <= limit) continue;
            if (job.interruptIfRunning()) {
                logger.warn("Timeout de {} ms em {}, interrompendo", fileTimeout.toMillis(), job.path());
            }
            // não respondeu à interrupção: fecha como erro para não travar o drain
            if (elapsed > limit * 2 && !job.isSettled()) {
                job.markTimedOut();
                fail(job, new TimeoutException("Sem resposta após " + fileTimeout.toMillis() * 2 + " ms"));
            }
        }
    }
}
