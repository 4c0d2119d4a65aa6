package io.scrapehive.scraper.discovery;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.scrapehive.scraper.target.DynamicTargetSet;
import io.scrapehive.scraper.target.ScrapeTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovers pods from a JSON file (an array of {@link PodEndpoint}) that an external agent keeps
 * current, re-reading it every {@code refresh_interval}.
 * <p>
 * Pods are scraped when annotated {@code prometheus.io/scrape: "true"}; the URL is built from the
 * pod IP and the {@code prometheus.io/scheme}, {@code prometheus.io/port} and
 * {@code prometheus.io/path} annotations.
 */
public class FileDiscoveryWatcher implements DiscoveryWatcher {

    private static final Logger log = LoggerFactory.getLogger(FileDiscoveryWatcher.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String PODS_FILE_KEY = "pods_file";
    public static final String REFRESH_INTERVAL_KEY = "refresh_interval";
    public static final String KUBE_CONFIG_KEY = "kube_config";

    static final String SCRAPE_ANNOTATION = "prometheus.io/scrape";
    static final String SCHEME_ANNOTATION = "prometheus.io/scheme";
    static final String PATH_ANNOTATION = "prometheus.io/path";
    static final String PORT_ANNOTATION = "prometheus.io/port";
    static final String DEFAULT_PORT = "9102";

    private Path podsFile;
    private Duration refreshInterval = Duration.ofSeconds(30);

    @Override
    public void loadInner(Config config) {
        String file = config.hasPath(PODS_FILE_KEY) ? config.getString(PODS_FILE_KEY) : "";
        this.podsFile = file.isBlank() ? null : Path.of(file);
        if (config.hasPath(REFRESH_INTERVAL_KEY)) {
            this.refreshInterval = config.getDuration(REFRESH_INTERVAL_KEY);
        }
        if (config.hasPath(KUBE_CONFIG_KEY) && !config.getString(KUBE_CONFIG_KEY).isBlank()) {
            log.debug("kube_config {} is not used by file discovery", config.getString(KUBE_CONFIG_KEY));
        }
    }

    @Override
    public void watch(DynamicTargetSet targets, CancellationSignal signal) throws InterruptedException {
        if (podsFile == null) {
            throw new IllegalStateException("discovery." + PODS_FILE_KEY + " is not configured");
        }
        do {
            try {
                Map<String, ScrapeTarget> current = readTargets();
                targets.replaceAll(current);
                log.debug("Discovered {} scrapeable pods in {}", current.size(), podsFile);
            } catch (IOException e) {
                log.warn("Could not read {}, keeping previous targets. Error: {}", podsFile, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Could not build targets from {}, keeping previous targets. Error: {}", podsFile, e.toString());
            }
        } while (!signal.await(refreshInterval));
    }

    Map<String, ScrapeTarget> readTargets() throws IOException {
        List<PodEndpoint> pods = objectMapper.readValue(Files.readAllBytes(podsFile), new TypeReference<>() {});
        Map<String, ScrapeTarget> result = new LinkedHashMap<>();
        if (pods == null) {
            throw new IOException("expected a JSON array of pods");
        }
        for (PodEndpoint pod : pods) {
            ScrapeTarget target = pod == null ? null : toTarget(pod);
            if (target != null) {
                result.put(pod.key(), target);
            }
        }
        return result;
    }

    static ScrapeTarget toTarget(PodEndpoint pod) {
        if (pod.name() == null || pod.name().isBlank()) {
            log.debug("Skipping pod without a name in namespace {}", pod.namespace());
            return null;
        }
        if (!"true".equalsIgnoreCase(pod.annotation(SCRAPE_ANNOTATION, "false"))) {
            return null;
        }
        if (pod.ip() == null || pod.ip().isBlank()) {
            return null;
        }
        String scheme = pod.annotation(SCHEME_ANNOTATION, "http");
        String port = pod.annotation(PORT_ANNOTATION, DEFAULT_PORT);
        String path = pod.annotation(PATH_ANNOTATION, "/metrics");
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        String host = pod.ip().contains(":") ? "[" + pod.ip() + "]" : pod.ip();

        URI url;
        try {
            url = URI.create(scheme + "://" + host + ":" + port + path);
        } catch (IllegalArgumentException e) {
            log.warn("Pod {} has an invalid scrape URL, skipping it. Error: {}", pod.key(), e.getMessage());
            return null;
        }

        Map<String, String> tags = new LinkedHashMap<>();
        pod.labels().forEach((key, value) -> {
            if (key != null && value != null) {
                tags.put(key, value);
            }
        });
        tags.put("pod_name", pod.name());
        if (pod.namespace() != null) {
            tags.put("namespace", pod.namespace());
        }
        return new ScrapeTarget(url, url, pod.ip(), tags);
    }
}
