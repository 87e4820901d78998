package com.vtb.redteam.core;

import com.vtb.redteam.config.RedTeamConfig;
import com.vtb.redteam.detection.DetectionEngine;
import com.vtb.redteam.detection.DetectionFailureException;
import com.vtb.redteam.detection.DetectionResult;
import com.vtb.redteam.models.Attack;
import com.vtb.redteam.models.AttackCategory;
import com.vtb.redteam.models.AttackError;
import com.vtb.redteam.models.AttackOutcome;
import com.vtb.redteam.models.Intensity;
import com.vtb.redteam.models.RunState;
import com.vtb.redteam.models.Severity;
import com.vtb.redteam.models.TestReport;
import com.vtb.redteam.payload.PayloadCatalog;
import com.vtb.redteam.registry.CategoryRegistry;
import com.vtb.redteam.risk.RiskAggregator;
import com.vtb.redteam.risk.RiskPolicy;
import com.vtb.redteam.target.TargetAdapter;
import com.vtb.redteam.target.TargetResponse;
import com.vtb.redteam.target.TargetTimeoutException;
import com.vtb.redteam.target.TargetTransportException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Оркестратор прогона: каталог -> цель -> детектор -> агрегатор.
 *
 * Атаки выполняются ограниченным пулом воркеров. Ошибки отдельных атак
 * (таймаут, транспорт, детектор) попадают в исходы и прогон не прерывают;
 * наружу выходит только InvalidConfigurationException.
 */
@Slf4j
public class AttackOrchestrator {

    private static final int LOG_PREVIEW = 120;

    private final PayloadCatalog catalog;
    private final DetectionEngine detectionEngine;
    private final RiskAggregator riskAggregator;
    private final TargetAdapter target;
    private final OrchestratorSettings settings;
    private final RunListener listener;

    public AttackOrchestrator(PayloadCatalog catalog,
                              DetectionEngine detectionEngine,
                              RiskAggregator riskAggregator,
                              TargetAdapter target,
                              OrchestratorSettings settings,
                              RunListener listener) {
        this.catalog = catalog;
        this.detectionEngine = detectionEngine;
        this.riskAggregator = riskAggregator;
        this.target = target;
        this.settings = settings;
        this.listener = listener != null ? listener : RunListener.NONE;
    }

    /**
     * Собрать оркестратор со стандартными компонентами из конфигурации
     */
    public static AttackOrchestrator create(RedTeamConfig config, TargetAdapter target, RunListener listener) {
        CategoryRegistry registry = CategoryRegistry.defaults(config);
        return new AttackOrchestrator(
            new PayloadCatalog(registry, config.getCatalog()),
            new DetectionEngine(registry, config.getDetection().getNearMissMargin()),
            new RiskAggregator(registry, RiskPolicy.from(config.getRisk())),
            target,
            new OrchestratorSettings(config.getOrchestrator()),
            listener);
    }

    public TestReport runTest(String targetContext, Set<AttackCategory> categories, Intensity intensity) {
        return runTest(targetContext, categories, intensity, settings.concurrencyLimit(), settings.runTimeout());
    }

    /**
     * Выполнить прогон. Отчет возвращается всегда, в том числе частичный
     * после общего таймаута.
     *
     * @throws InvalidConfigurationException пустой набор категорий, нет интенсивности,
     *                                       неположительные лимиты
     */
    public TestReport runTest(String targetContext,
                              Set<AttackCategory> categories,
                              Intensity intensity,
                              int concurrencyLimit,
                              Duration runTimeout) {
        Instant startTime = Instant.now();
        String testId = testId(targetContext, startTime, UUID.randomUUID().toString());
        transition(testId, null, RunState.PENDING);

        List<Attack> attacks;
        try {
            if (concurrencyLimit <= 0) {
                throw new InvalidConfigurationException("Лимит параллельности должен быть положительным: "
                    + concurrencyLimit);
            }
            if (runTimeout == null || runTimeout.isZero() || runTimeout.isNegative()) {
                throw new InvalidConfigurationException("Таймаут прогона должен быть положительным: " + runTimeout);
            }
            attacks = catalog.expand(categories, intensity);
        } catch (InvalidConfigurationException e) {
            log.error("Прогон {} отклонен: {}", testId, e.getMessage());
            transition(testId, RunState.PENDING, RunState.FAILED);
            throw e;
        }

        transition(testId, RunState.PENDING, RunState.RUNNING);
        log.info("Прогон {}: {} атак против {}, параллельность {}, таймаут {} с",
            testId, attacks.size(), target.name(), concurrencyLimit, runTimeout.toSeconds());

        List<AttackOutcome> outcomes = execute(testId, targetContext, attacks, concurrencyLimit, runTimeout);

        TestReport report = riskAggregator.aggregate(outcomes).toBuilder()
            .testId(testId)
            .startTime(startTime)
            .endTime(Instant.now())
            .build();
        transition(testId, RunState.RUNNING, RunState.COMPLETED);
        log.info("Прогон {} завершен: {} из {} атак успешны, риск {}",
            testId, report.getSuccessfulAttacks(), report.getTotalAttacks(), report.getRiskScore());
        return report;
    }

    private List<AttackOutcome> execute(String testId, String targetContext, List<Attack> attacks,
                                        int concurrencyLimit, Duration runTimeout) {
        AttackOutcome[] slots = new AttackOutcome[attacks.size()];
        AtomicBoolean cancelled = new AtomicBoolean(false);
        RequestThrottle throttle = new RequestThrottle(settings.maxRequestsPerSecond());

        ThreadPoolExecutor workers = new ThreadPoolExecutor(concurrencyLimit, concurrencyLimit,
            0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), namedThreads("redteam-worker"));
        ExecutorService calls = Executors.newCachedThreadPool(namedThreads("redteam-call"));

        try {
            ExecutorCompletionService<AttackOutcome> completion = new ExecutorCompletionService<>(workers);
            Map<Future<AttackOutcome>, Integer> indexByFuture = new HashMap<>();
            List<Future<AttackOutcome>> futures = new ArrayList<>(attacks.size());
            for (int i = 0; i < attacks.size(); i++) {
                Attack attack = attacks.get(i);
                Future<AttackOutcome> future = completion.submit(
                    () -> executeAttack(attack, targetContext, calls, throttle, cancelled));
                indexByFuture.put(future, i);
                futures.add(future);
            }

            long deadline = System.nanoTime() + runTimeout.toNanos();
            int received = 0;
            while (received < attacks.size()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                Future<AttackOutcome> done;
                try {
                    done = completion.poll(remaining, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Прогон {} прерван, собираем частичный отчет", testId);
                    break;
                }
                if (done == null) {
                    break;
                }
                int index = indexByFuture.get(done);
                slots[index] = collect(done, attacks.get(index));
                listener.onOutcome(testId, slots[index]);
                received++;
            }

            if (received < attacks.size()) {
                cancelled.set(true);
                log.error("Прогон {}: общий таймаут {} с, не завершено {} из {} атак",
                    testId, runTimeout.toSeconds(), attacks.size() - received, attacks.size());
                for (int i = 0; i < slots.length; i++) {
                    if (slots[i] != null) {
                        continue;
                    }
                    Future<AttackOutcome> future = futures.get(i);
                    if (future.isDone() && !future.isCancelled()) {
                        slots[i] = collect(future, attacks.get(i));
                    } else {
                        future.cancel(true);
                        slots[i] = AttackOutcome.failed(attacks.get(i), AttackError.RUN_TIMEOUT,
                            "Истек общий таймаут прогона", 0L, 0);
                    }
                    listener.onOutcome(testId, slots[i]);
                }
            }
        } finally {
            workers.shutdownNow();
            calls.shutdownNow();
        }
        return Arrays.asList(slots);
    }

    private AttackOutcome collect(Future<AttackOutcome> future, Attack attack) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // Ошибки цели обрабатываются в executeAttack; сюда доходят только локальные сбои
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Атака {}: внутренний сбой при обработке: {}", attack.getAttackId(), cause.toString(), cause);
            return AttackOutcome.failed(attack, AttackError.DETECTION_FAILURE,
                "Внутренний сбой при обработке атаки: " + cause, 0L, 0);
        } catch (CancellationException e) {
            return AttackOutcome.failed(attack, AttackError.RUN_TIMEOUT, "Атака отменена", 0L, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AttackOutcome.failed(attack, AttackError.RUN_TIMEOUT, "Сбор результата прерван", 0L, 0);
        }
    }

    /**
     * Одна атака в воркере: вызов цели с таймаутом, повтор транспортной ошибки
     * с удвоением паузы, оценка ответа
     */
    AttackOutcome executeAttack(Attack attack, String targetContext, ExecutorService calls,
                                RequestThrottle throttle, AtomicBoolean cancelled) {
        long started = System.nanoTime();
        int attempts = 0;
        while (true) {
            if (cancelled.get()) {
                return AttackOutcome.failed(attack, AttackError.RUN_TIMEOUT,
                    "Истек общий таймаут прогона", elapsedMs(started), attempts);
            }
            try {
                throttle.acquire();
                attempts++;
                TargetResponse response = invokeWithTimeout(attack, targetContext, calls);
                return score(attack, response, targetContext, attempts);
            } catch (TargetTimeoutException e) {
                log.warn("Таймаут атаки {} [{}]: {}", attack.getAttackId(), attack.getTechniqueTag(), e.getMessage());
                return AttackOutcome.failed(attack, AttackError.TIMEOUT, e.getMessage(), elapsedMs(started), attempts);
            } catch (TargetTransportException e) {
                if (attempts > settings.maxRetries()) {
                    log.warn("Атака {}: ошибка транспорта после {} попыток: {}",
                        attack.getAttackId(), attempts, e.getMessage());
                    return AttackOutcome.failed(attack, AttackError.TRANSPORT_ERROR, e.getMessage(),
                        elapsedMs(started), attempts);
                }
                long backoffMs = settings.retryBackoffMs() << Math.min(attempts - 1, 16);
                log.warn("Атака {}: ошибка транспорта ({}), повтор через {} мс",
                    attack.getAttackId(), e.getMessage(), backoffMs);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoffMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return AttackOutcome.failed(attack, AttackError.RUN_TIMEOUT,
                        "Прервано во время паузы перед повтором", elapsedMs(started), attempts);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return AttackOutcome.failed(attack, AttackError.RUN_TIMEOUT,
                    "Атака прервана по общему таймауту", elapsedMs(started), attempts);
            }
        }
    }

    private TargetResponse invokeWithTimeout(Attack attack, String targetContext, ExecutorService calls)
        throws TargetTimeoutException, TargetTransportException, InterruptedException {
        Duration timeout = settings.attackTimeout();
        Future<TargetResponse> call = calls.submit(() -> target.invoke(targetContext, attack.getPayload(), timeout));
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new TargetTimeoutException("Цель не ответила за " + timeout.toMillis() + " мс", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TargetTimeoutException timeoutException) {
                throw timeoutException;
            }
            if (cause instanceof TargetTransportException transportException) {
                throw transportException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TargetTransportException("Адаптер цели упал: " + cause, cause);
        }
    }

    private AttackOutcome score(Attack attack, TargetResponse response, String targetContext, int attempts) {
        String responseText = response != null ? response.responseText() : null;
        long responseTimeMs = response != null ? response.elapsedMs() : 0L;
        AttackOutcome.AttackOutcomeBuilder builder = AttackOutcome.builder()
            .attackId(attack.getAttackId())
            .category(attack.getCategory())
            .payload(attack.getPayload())
            .techniqueTag(attack.getTechniqueTag())
            .responseText(responseText)
            .responseTimeMs(responseTimeMs)
            .attempts(attempts)
            .timestamp(Instant.now());
        try {
            DetectionResult result = detectionEngine.score(attack, responseText, targetContext);
            return builder
                .detectionScore(result.getScore())
                .severity(result.getSeverity())
                .succeeded(result.isSucceeded())
                .indicators(result.getIndicators())
                .build();
        } catch (DetectionFailureException e) {
            log.warn("Атака {}: не удалось оценить ответ ({}): {}",
                attack.getAttackId(), e.getMessage(), preview(responseText));
            return builder
                .detectionScore(0.0)
                .severity(Severity.LOW)
                .succeeded(false)
                .error(AttackError.DETECTION_FAILURE)
                .errorMessage(e.getMessage())
                .build();
        }
    }

    private void transition(String testId, RunState from, RunState to) {
        if (from != null) {
            log.info("Прогон {}: {} -> {}", testId, from, to);
        }
        listener.onStateChange(testId, from, to);
    }

    /**
     * 16 hex-символов SHA-256; nonce различает прогоны, начатые в один момент с одним контекстом
     */
    static String testId(String targetContext, Instant startTime, String nonce) {
        String seed = (targetContext != null ? targetContext : "") + startTime + nonce;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(seed.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (int i = 0; i < 8; i++) {
                hex.append(String.format("%02x", hash[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String preview(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() <= LOG_PREVIEW ? text : text.substring(0, LOG_PREVIEW) + "...";
    }
}
