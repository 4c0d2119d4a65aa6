package io.scrapehive.scraper.target;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.UnknownHostException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class TargetResolverTest {

    private final DynamicTargetSet dynamicTargets = new DynamicTargetSet();

    @Test
    void testStaticUrlsSkipUnparsable() throws Exception {
        var resolver = new TargetResolver(
                List.of("http://a:9100/metrics", "http://b:9100", "http://bad host/metrics", "http://c/x"),
                List.of(), dynamicTargets, host -> fail("no DNS expected"));

        List<ScrapeTarget> targets = resolver.resolve();

        assertEquals(3, targets.size());
        for (ScrapeTarget target : targets) {
            assertEquals(target.originalUrl(), target.url());
            assertNull(target.address());
            assertTrue(target.tags().isEmpty());
        }
    }

    @Test
    void testServiceExpandsToOneTargetPerAddress() throws Exception {
        HostResolver dns = mock(HostResolver.class);
        when(dns.lookupHost("my-service.my-namespace")).thenReturn(List.of("10.0.0.1", "10.0.0.2", "fd00::3"));
        var resolver = new TargetResolver(List.of(),
                List.of("https://my-service.my-namespace:9100/custom/metrics?format=text"), dynamicTargets, dns);

        List<ScrapeTarget> targets = resolver.resolve();

        assertEquals(3, targets.size());
        assertEquals(List.of("10.0.0.1", "10.0.0.2", "fd00::3"),
                targets.stream().map(ScrapeTarget::address).collect(Collectors.toList()));
        assertEquals(URI.create("https://10.0.0.1:9100/custom/metrics?format=text"), targets.get(0).url());
        assertEquals(URI.create("https://[fd00::3]:9100/custom/metrics?format=text"), targets.get(2).url());
        for (ScrapeTarget target : targets) {
            assertEquals(URI.create("https://my-service.my-namespace:9100/custom/metrics?format=text"), target.originalUrl());
            assertEquals("https", target.url().getScheme());
            assertEquals(9100, target.url().getPort());
            assertEquals("/custom/metrics", target.url().getPath());
        }
        verify(dns, times(1)).lookupHost("my-service.my-namespace");
    }

    @Test
    void testDnsFailureSkipsOnlyThatService() throws Exception {
        HostResolver dns = mock(HostResolver.class);
        when(dns.lookupHost("gone")).thenThrow(new UnknownHostException("gone"));
        when(dns.lookupHost("here")).thenReturn(List.of("10.1.1.1"));
        var resolver = new TargetResolver(List.of("http://static:9100/metrics"),
                List.of("http://gone:80/metrics", "http://here:80/metrics"), dynamicTargets, dns);

        List<ScrapeTarget> targets = resolver.resolve();

        assertEquals(2, targets.size());
        assertEquals("10.1.1.1", targets.get(1).address());
    }

    @Test
    void testMalformedServiceUrlFailsResolution() {
        var resolver = new TargetResolver(List.of(), List.of("http://bad host:80/"), dynamicTargets,
                host -> List.of());
        assertThrows(TargetResolutionException.class, resolver::resolve);
    }

    @Test
    void testServiceUrlWithoutHostFailsResolution() {
        var resolver = new TargetResolver(List.of(), List.of("my-service:9100"), dynamicTargets, host -> List.of());
        var ex = assertThrows(TargetResolutionException.class, resolver::resolve);
        assertTrue(ex.getMessage().contains("no host"));
    }

    @Test
    void testDynamicTargetsAreIncludedWithoutDeduplication() throws Exception {
        URI url = URI.create("http://10.0.0.9:9102/metrics");
        dynamicTargets.put("default/pod-a", new ScrapeTarget(url, url, "10.0.0.9", Map.of("pod_name", "pod-a")));
        var resolver = new TargetResolver(List.of(url.toString()), List.of(), dynamicTargets, host -> List.of());

        List<ScrapeTarget> targets = resolver.resolve();

        assertEquals(2, targets.size());
        assertEquals(url, targets.get(0).url());
        assertEquals(url, targets.get(1).url());
        assertEquals("pod-a", targets.get(1).tags().get("pod_name"));
    }

    @Test
    void testResolveIsRepeatable() throws Exception {
        HostResolver dns = mock(HostResolver.class);
        when(dns.lookupHost("svc")).thenReturn(List.of("10.0.0.1", "10.0.0.2"), List.of("10.0.0.2", "10.0.0.1"));
        var resolver = new TargetResolver(List.of("http://a/metrics", "http://b/metrics"),
                List.of("http://svc:8080/metrics"), dynamicTargets, dns);

        Comparator<ScrapeTarget> order = Comparator.comparing(t -> t.url().toString());
        List<ScrapeTarget> first = resolver.resolve().stream().sorted(order).collect(Collectors.toList());
        List<ScrapeTarget> second = resolver.resolve().stream().sorted(order).collect(Collectors.toList());

        assertEquals(first, second);
    }
}
