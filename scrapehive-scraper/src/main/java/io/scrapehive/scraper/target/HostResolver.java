package io.scrapehive.scraper.target;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

/**
 * DNS lookup used to expand service URLs into one target per address.
 */
@FunctionalInterface
public interface HostResolver {

    HostResolver SYSTEM = host -> {
        List<String> addresses = new ArrayList<>();
        for (InetAddress address : InetAddress.getAllByName(host)) {
            addresses.add(address.getHostAddress());
        }
        return addresses;
    };

    List<String> lookupHost(String host) throws UnknownHostException;
}
