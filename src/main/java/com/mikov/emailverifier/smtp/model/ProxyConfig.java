package com.mikov.emailverifier.smtp.model;

import lombok.Builder;
import lombok.Data;

import java.net.InetSocketAddress;
import java.net.Proxy;

@Data
@Builder
public class ProxyConfig {
    private final String host;
    private final int port;

    public Proxy toProxy() {
        return new Proxy(Proxy.Type.SOCKS, new InetSocketAddress(host, port));
    }
}
