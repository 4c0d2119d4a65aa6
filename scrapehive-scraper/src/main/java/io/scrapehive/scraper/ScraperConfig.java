package io.scrapehive.scraper;

import com.typesafe.config.Config;
import io.scrapehive.common.tls.TlsClientConfig;
import io.scrapehive.scraper.transport.ClientConfig;

import java.time.Duration;
import java.util.List;

/**
 * Settings read from the {@code scrapehive} configuration section.
 */
public record ScraperConfig(
    List<String> urls,
    List<String> kubernetesServices,
    boolean monitorKubernetesPods,
    String bearerToken,
    Duration responseTimeout,
    TlsClientConfig tls,
    Config discovery,
    Duration scrapeInterval,
    String outputHttpPostUrl,
    int outputQueueCapacity,
    int outputMaxBatchRows,
    Duration outputFlushInterval
) {
    public static ScraperConfig fromConfig(Config config) {
        return new ScraperConfig(
            config.getStringList("urls"),
            config.getStringList("kubernetes_services"),
            config.getBoolean("monitor_kubernetes_pods"),
            config.getString("bearer_token"),
            config.getDuration("response_timeout"),
            TlsClientConfig.fromConfig(config.getConfig("tls")),
            config.getConfig("discovery"),
            config.getDuration("scrape_interval"),
            config.getString("output.http_post_url"),
            config.getInt("output.queue_capacity"),
            config.getInt("output.max_batch_rows"),
            config.getDuration("output.flush_interval")
        );
    }

    public ClientConfig clientConfig() {
        return new ClientConfig(tls, responseTimeout, bearerToken);
    }
}
