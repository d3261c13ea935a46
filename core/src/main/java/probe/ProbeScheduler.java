package probe;

import model.ProbeDescriptor;
import model.ProbeResult;
import probe.checker.CheckerRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Logger;

/**
 * Параллельный запуск проверок на пуле фиксированного размера.
 *
 * <p>Дескрипторы читаются из последовательности в вызывающем потоке, при этом в работе
 * одновременно находится не более {@code 2 × concurrency} дескрипторов, так что ленивые
 * последовательности перебора не материализуются целиком. Результаты возвращаются
 * в порядке завершения.
 *
 * <p>Исключение, вылетевшее из чекера, превращается в синтетический неуспешный результат
 * и не прерывает остальные проверки: на каждый дескриптор приходится ровно один результат.
 */
public final class ProbeScheduler {
    private static final Logger logger = Logger.getLogger(ProbeScheduler.class.getName());

    private final CheckerRegistry checkers;
    private final int concurrency;

    /**
     * @param checkers чекеры по протоколам
     * @param concurrency число потоков пула, не меньше 1
     */
    public ProbeScheduler(CheckerRegistry checkers, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.checkers = Objects.requireNonNull(checkers, "checkers cannot be null");
        this.concurrency = concurrency;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Выполняет все проверки.
     *
     * @param descriptors последовательность дескрипторов, читается один раз
     * @param total общее число дескрипторов (для прогресса)
     * @param timeoutSeconds таймаут каждой проверки
     * @param listener слушатель прогресса
     * @return результаты в порядке завершения
     * @throws InterruptedException если вызывающий поток прерван
     */
    public List<ProbeResult> run(Iterable<ProbeDescriptor> descriptors, long total, int timeoutSeconds,
                                 ProbeProgressListener listener) throws InterruptedException {
        ProbeProgressListener progress = listener != null ? listener : ProbeProgressListener.noOp();
        Instant startTime = Instant.now();
        logger.info("Starting " + total + " probe(s) with " + concurrency + " worker(s)");
        progress.onRunStart(total);

        ExecutorService executor = Executors.newFixedThreadPool(concurrency);
        CompletionService<ProbeResult> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<ProbeResult>, Submission> inFlight = new HashMap<>();
        List<ProbeResult> results = new ArrayList<>();
        int window = concurrency * 2;
        long submitted = 0;
        long successful = 0;

        try {
            Iterator<ProbeDescriptor> iterator = descriptors.iterator();
            while (iterator.hasNext() || !inFlight.isEmpty()) {
                while (inFlight.size() < window && iterator.hasNext()) {
                    ProbeDescriptor descriptor = iterator.next();
                    Future<ProbeResult> future =
                        completionService.submit(() -> checkGuarded(descriptor, timeoutSeconds));
                    inFlight.put(future, new Submission(descriptor, submitted++));
                }

                Future<ProbeResult> done = completionService.take();
                Submission submission = inFlight.remove(done);
                ProbeResult result = resultOf(done, submission.descriptor());
                results.add(result);
                if (result.isSuccessful()) {
                    successful++;
                }

                progress.onProbeComplete(new ProbeEvent(
                    submission.descriptor(), submission.index(), result, results.size(), Math.max(total, submitted)));
            }
        } finally {
            shutdown(executor);
        }

        long durationSeconds = Duration.between(startTime, Instant.now()).toSeconds();
        logger.info("Finished " + results.size() + " probe(s) in " + durationSeconds + "s, "
            + successful + " successful");
        progress.onRunComplete(successful, durationSeconds);
        return results;
    }

    private ProbeResult checkGuarded(ProbeDescriptor descriptor, int timeoutSeconds) {
        try {
            return checkers.getChecker(descriptor.protocol()).check(descriptor, timeoutSeconds);
        } catch (Exception e) {
            logger.warning("Check of " + descriptor + " failed: " + e);
            return ProbeResult.failure(descriptor, "Check failed: " + describe(e));
        }
    }

    private ProbeResult resultOf(Future<ProbeResult> future, ProbeDescriptor descriptor) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // сюда попадают только Error из рабочего потока
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warning("Check of " + descriptor + " failed: " + cause);
            return ProbeResult.failure(descriptor, "Check failed: " + describe(cause));
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Submission(ProbeDescriptor descriptor, long index) {
    }
}
