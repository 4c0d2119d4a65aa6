package io.scrapehive.scraper.discovery;

import io.scrapehive.scraper.target.DynamicTargetSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Starts and stops the background {@link DiscoveryWatcher}.
 * <p>
 * {@link #stop()} returns only after the watcher has exited, and is a no-op when discovery was never
 * started. The target set is cleared on stop.
 */
public class DiscoveryLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryLifecycle.class);

    private final boolean enabled;
    private final DiscoveryWatcher watcher;
    private final DynamicTargetSet targets;

    private CancellationSignal signal;
    private ExecutorService executor;
    private Future<?> completion;

    public DiscoveryLifecycle(boolean enabled, DiscoveryWatcher watcher, DynamicTargetSet targets) {
        this.enabled = enabled;
        this.watcher = watcher;
        this.targets = targets;
    }

    public synchronized void start() {
        if (!enabled || signal != null) {
            return;
        }
        signal = new CancellationSignal();
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pod-discovery");
            t.setDaemon(true);
            return t;
        });
        CancellationSignal current = signal;
        completion = executor.submit(() -> {
            watcher.watch(targets, current);
            return null;
        });
        log.info("Pod discovery started with {}", watcher.getClass().getSimpleName());
    }

    public synchronized void stop() {
        if (signal == null) {
            return;
        }
        signal.cancel();
        try {
            completion.get();
        } catch (ExecutionException e) {
            log.warn("Pod discovery ended with an error: {}", e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for pod discovery to stop");
        } finally {
            executor.shutdown();
            targets.clear();
            signal = null;
            executor = null;
            completion = null;
        }
        log.info("Pod discovery stopped");
    }

    public synchronized boolean isRunning() {
        return signal != null;
    }
}
