package org.iceforge.influxexporter.udp;

import java.net.InetSocketAddress;

/**
 * Parses {@code host:port}, {@code :port} and {@code [ipv6]:port} bind addresses.
 */
public final class BindAddress {
    private BindAddress() {}

    public static InetSocketAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("bind address is blank");
        }
        String s = address.trim();
        int colon = s.lastIndexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("missing port in bind address: " + address);
        }

        String host = s.substring(0, colon);
        int port;
        try {
            port = Integer.parseInt(s.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in bind address: " + address, e);
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range in bind address: " + address);
        }

        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            return new InetSocketAddress(port);
        }

        InetSocketAddress resolved = new InetSocketAddress(host, port);
        if (resolved.isUnresolved()) {
            throw new IllegalArgumentException("cannot resolve bind address: " + address);
        }
        return resolved;
    }
}
