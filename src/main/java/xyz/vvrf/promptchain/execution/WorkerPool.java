package xyz.vvrf.promptchain.execution;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;

/**
 * 有界的节点工作池。
 * 同一时刻最多运行 {@code concurrencyLimit} 个工作单元，其余排队等待。
 * 该上限对整个池生效：共享同一个池的多次并发运行合计也不会超过它。
 * 单元在调度器线程上先获取许可再执行，结束 (成功、出错或取消) 时释放；
 * 单元出错时错误被延迟，直到所有已启动的单元结束，已启动的单元不会被中断。
 *
 * @author Refactored
 */
@Slf4j
@Getter
public class WorkerPool implements Disposable {

    private final Scheduler scheduler;
    private final int concurrencyLimit;
    private final boolean ownsScheduler;
    @Getter(AccessLevel.NONE)
    private final Semaphore permits;

    public WorkerPool(Scheduler scheduler, int concurrencyLimit) {
        this(scheduler, concurrencyLimit, false);
    }

    private WorkerPool(Scheduler scheduler, int concurrencyLimit, boolean ownsScheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "调度器不能为空");
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("Concurrency limit must be positive, got " + concurrencyLimit);
        }
        this.concurrencyLimit = concurrencyLimit;
        this.ownsScheduler = ownsScheduler;
        this.permits = new Semaphore(concurrencyLimit, true);
        log.info("WorkerPool initialized. Scheduler: {}, Concurrency limit: {}", scheduler, concurrencyLimit);
    }

    /**
     * 创建一个自带 bounded-elastic 调度器的工作池，{@link #dispose()} 时一并释放。
     */
    public static WorkerPool boundedElastic(String namePrefix, int concurrencyLimit) {
        Scheduler scheduler = Schedulers.newBoundedElastic(
                Math.max(concurrencyLimit, Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE),
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                namePrefix,
                60,
                true);
        return new WorkerPool(scheduler, concurrencyLimit, true);
    }

    public static int defaultConcurrency() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() * 2);
    }

    /**
     * 运行所有工作单元并在全部结束后发出结果列表 (完成顺序)。
     * 任一单元出错时，等待其余已启动单元结束后再传播错误 (多个错误会被合并)。
     *
     * @param units 工作单元
     * @param <T>   结果类型
     * @return 全部结果
     */
    public <T> Mono<List<T>> runAll(List<Mono<T>> units) {
        if (units == null || units.isEmpty()) {
            return Mono.just(Collections.emptyList());
        }
        return Flux.fromIterable(units)
                .flatMapDelayError(unit -> gated(unit).subscribeOn(scheduler), concurrencyLimit, 1)
                .collectList();
    }

    /**
     * 当前空闲的许可数，等于池中还能立即启动的单元数。
     */
    public int availablePermits() {
        return permits.availablePermits();
    }

    private <T> Mono<T> gated(Mono<T> unit) {
        return Mono.using(
                () -> {
                    permits.acquire();
                    return permits;
                },
                acquired -> unit,
                acquired -> acquired.release());
    }

    @Override
    public void dispose() {
        if (ownsScheduler) {
            log.info("Disposing WorkerPool scheduler: {}", scheduler);
            scheduler.dispose();
        }
    }

    @Override
    public boolean isDisposed() {
        return ownsScheduler && scheduler.isDisposed();
    }
}
