package matriarch.core.service.resolution;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import matriarch.core.config.ParallelizationSettings;

/**
 * Non-blocking counting semaphore that caps in-flight directory calls.
 *
 * <p>The ceiling is shared by every concurrent resolution. Calls beyond it wait
 * in FIFO order and start as earlier calls terminate. No thread is ever parked.
 *
 * <p>Thread-safety: permits are taken with CAS on a counter; the waiting queue is
 * drained by one thread at a time.
 */
@ApplicationScoped
public class RequestBulkhead {

    private final int limit;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger drainers = new AtomicInteger();
    private final Queue<Runnable> waiting = new ConcurrentLinkedQueue<>();

    @Inject
    public RequestBulkhead(ParallelizationSettings settings) {
        this.limit = settings.maxDegreeOfParallelism();
    }

    /**
     * Run a call once a permit is available.
     *
     * <p>The supplier is invoked only after a permit has been taken. The permit is
     * returned when the call terminates. A subscriber that cancels while waiting
     * never starts its call.
     *
     * @param call supplier of the call
     * @param <T>  the result type
     * @return Uni with the call's outcome
     */
    public <T> Uni<T> submit(Supplier<Uni<T>> call) {
        return Uni.createFrom().emitter(emitter -> {
            final var terminated = new AtomicBoolean();
            emitter.onTermination(() -> terminated.set(true));
            waiting.add(() -> {
                if (terminated.get()) {
                    release();
                    return;
                }
                final Uni<T> uni;
                try {
                    uni = call.get();
                } catch (RuntimeException e) {
                    release();
                    emitter.fail(e);
                    return;
                }
                uni.subscribe()
                        .with(
                                item -> {
                                    release();
                                    emitter.complete(item);
                                },
                                failure -> {
                                    release();
                                    emitter.fail(failure);
                                });
            });
            drain();
        });
    }

    private void release() {
        inFlight.decrementAndGet();
        drain();
    }

    private void drain() {
        if (drainers.getAndIncrement() != 0) {
            return;
        }
        do {
            while (!waiting.isEmpty()) {
                final var current = inFlight.get();
                if (current >= limit) {
                    break;
                }
                if (!inFlight.compareAndSet(current, current + 1)) {
                    continue;
                }
                final var task = waiting.poll();
                if (task == null) {
                    inFlight.decrementAndGet();
                    break;
                }
                task.run();
            }
        } while (drainers.decrementAndGet() != 0);
    }

    public int limit() {
        return limit;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int waiting() {
        return waiting.size();
    }
}
