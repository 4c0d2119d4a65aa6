package io.scrapehive.scraper.discovery;

import com.typesafe.config.Config;
import io.scrapehive.scraper.target.DynamicTargetSet;

/**
 * Keeps a {@link DynamicTargetSet} up to date until cancelled.
 * <p>
 * Implementations need a public no-arg constructor; their settings arrive through
 * {@link #loadInner(Config)} with the {@code discovery} section of the configuration.
 */
public interface DiscoveryWatcher {

    String PROVIDER_CLASS_KEY = "provider-class";

    void loadInner(Config config);

    /**
     * Runs on a dedicated thread and must return soon after {@code signal} is cancelled.
     */
    void watch(DynamicTargetSet targets, CancellationSignal signal) throws Exception;

    static DiscoveryWatcher load(Config config) throws Exception {
        String clazz = config.hasPath(PROVIDER_CLASS_KEY)
                ? config.getString(PROVIDER_CLASS_KEY)
                : FileDiscoveryWatcher.class.getName();
        var constructor = Class.forName(clazz).getConstructor();
        var watcher = (DiscoveryWatcher) constructor.newInstance();
        watcher.loadInner(config);
        return watcher;
    }
}
