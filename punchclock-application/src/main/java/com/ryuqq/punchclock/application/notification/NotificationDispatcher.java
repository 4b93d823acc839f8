package com.ryuqq.punchclock.application.notification;

import com.ryuqq.punchclock.application.schedule.SchedulerEvent;
import com.ryuqq.punchclock.application.schedule.SchedulerEventListener;
import com.ryuqq.punchclock.core.model.ActionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 알림 메시지를 설정된 모든 채널에 동시에 전송.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>결과/이벤트로부터 메시지 생성</li>
 *   <li>채널별 {@link NotificationProvider#shouldNotify}로 대상 선별</li>
 *   <li>대상 채널에 병렬 전송 (채널 수만큼의 고정 스레드 풀)</li>
 *   <li>채널별 결과 수집</li>
 * </ol>
 *
 * <p>어떤 채널이 실패해도 호출자에게 예외를 던지지 않습니다.</p>
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class NotificationDispatcher implements SchedulerEventListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final Duration DEFAULT_RESULT_TIMEOUT = Duration.ofMinutes(2);

    private final List<NotificationProvider> providers;
    private final NotificationMessageFactory messageFactory;
    private final Duration resultTimeout;
    private final ExecutorService workers;

    public NotificationDispatcher(List<NotificationProvider> providers, NotificationMessageFactory messageFactory) {
        this(providers, messageFactory, DEFAULT_RESULT_TIMEOUT);
    }

    /**
     * 생성자.
     *
     * @param providers 채널 목록 (비어 있을 수 있음)
     * @param messageFactory 메시지 생성기
     * @param resultTimeout 채널 하나의 전송을 기다리는 최대 시간
     */
    public NotificationDispatcher(List<NotificationProvider> providers, NotificationMessageFactory messageFactory,
                                  Duration resultTimeout) {
        if (providers == null) {
            throw new IllegalArgumentException("providers cannot be null");
        }
        if (messageFactory == null) {
            throw new IllegalArgumentException("messageFactory cannot be null");
        }
        if (resultTimeout == null || resultTimeout.isNegative() || resultTimeout.isZero()) {
            throw new IllegalArgumentException("resultTimeout must be positive (current: " + resultTimeout + ")");
        }
        this.providers = List.copyOf(providers);
        this.messageFactory = messageFactory;
        this.resultTimeout = resultTimeout;
        this.workers = Executors.newFixedThreadPool(Math.max(1, this.providers.size()));

        if (this.providers.isEmpty()) {
            log.warn("No notification providers configured");
        } else {
            log.info("Notification providers: {}", providerNames());
        }
    }

    public List<ProviderResult> dispatch(ActionOutcome outcome) {
        return dispatch(messageFactory.fromOutcome(outcome));
    }

    public List<ProviderResult> dispatch(SchedulerEvent event) {
        return dispatch(messageFactory.fromSchedulerEvent(event));
    }

    /**
     * 메시지 전송.
     *
     * @param message 메시지
     * @return 대상 채널별 결과 (대상이 없으면 빈 목록)
     */
    public List<ProviderResult> dispatch(NotificationMessage message) {
        List<NotificationProvider> eligible = new ArrayList<>();
        for (NotificationProvider provider : providers) {
            if (isEligible(provider, message)) {
                eligible.add(provider);
            } else {
                log.debug("[{}] skipped '{}' by level settings ({})", provider.name(), message.title(), message.level());
            }
        }
        if (eligible.isEmpty()) {
            log.debug("No provider wants '{}' ({})", message.title(), message.level());
            return List.of();
        }

        log.info("Dispatching '{}' ({}) to {} provider(s)", message.title(), message.level(), eligible.size());

        Map<NotificationProvider, Future<ProviderResult>> futures = new LinkedHashMap<>();
        for (NotificationProvider provider : eligible) {
            futures.put(provider, submit(provider, message));
        }

        List<ProviderResult> results = new ArrayList<>();
        for (Map.Entry<NotificationProvider, Future<ProviderResult>> entry : futures.entrySet()) {
            results.add(await(entry.getKey(), entry.getValue()));
        }

        long delivered = results.stream().filter(ProviderResult::success).count();
        if (delivered == results.size()) {
            log.info("All notifications delivered ({}/{})", delivered, results.size());
        } else {
            log.warn("Notifications partially delivered ({}/{})", delivered, results.size());
        }
        return results;
    }

    private Future<ProviderResult> submit(NotificationProvider provider, NotificationMessage message) {
        try {
            return workers.submit(() -> provider.deliver(message));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] delivery rejected, dispatcher is closed: '{}'", provider.name(), message.title());
            return CompletableFuture.completedFuture(
                ProviderResult.failed(provider.name(), null, "dispatcher closed"));
        }
    }

    private boolean isEligible(NotificationProvider provider, NotificationMessage message) {
        try {
            return provider.shouldNotify(message);
        } catch (RuntimeException e) {
            log.error("[{}] shouldNotify failed, skipping: {}", provider.name(), e.toString());
            return false;
        }
    }

    private ProviderResult await(NotificationProvider provider, Future<ProviderResult> future) {
        try {
            ProviderResult result = future.get(resultTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ProviderResult.failed(provider.name(), null, "provider returned no result");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProviderResult.failed(provider.name(), null, "interrupted while waiting for delivery");
        } catch (ExecutionException e) {
            log.error("[{}] delivery task failed", provider.name(), e.getCause());
            return ProviderResult.failed(provider.name(), null, String.valueOf(e.getCause()));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[{}] delivery did not finish within {}ms", provider.name(), resultTimeout.toMillis());
            return ProviderResult.failed(provider.name(), null, "delivery timed out");
        }
    }

    /**
     * 모든 채널에 연결 확인 메시지 전송.
     */
    public List<ProviderResult> testProviders() {
        log.info("Testing notification providers...");
        List<ProviderResult> results = dispatch(messageFactory.connectivityTest());
        for (ProviderResult result : results) {
            if (result.success()) {
                log.info("[{}] test succeeded", result.providerName());
            } else {
                log.error("[{}] test failed: {}", result.providerName(), result.errorMessage());
            }
        }
        return results;
    }

    @Override
    public void onEvent(SchedulerEvent event) {
        dispatch(event);
    }

    @Override
    public void onOutcome(ActionOutcome outcome) {
        dispatch(outcome);
    }

    public List<String> providerNames() {
        List<String> names = new ArrayList<>();
        for (NotificationProvider provider : providers) {
            names.add(provider.name());
        }
        return names;
    }

    public boolean isEnabled() {
        return !providers.isEmpty();
    }

    /**
     * 전송 스레드 종료. 진행 중인 전송은 최대 30초 기다립니다.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
