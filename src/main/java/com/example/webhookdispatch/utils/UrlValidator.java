package com.example.webhookdispatch.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 接收端 URL 校验。
 * 格式校验（http/https 绝对地址）始终生效；SSRF 校验防止把 Webhook 投递到内网受保护地址，可通过配置关闭。
 */
@Component
@Slf4j
public class UrlValidator {

    private final boolean ssrfEnabled;
    private final List<String> blockedIps;

    public UrlValidator(
            @Value("${app.security.ssrf.enabled:true}") boolean ssrfEnabled,
            @Value("${app.security.ssrf.blocked-ips:127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,169.254.169.254}") String blockedIpsConfig) {
        this.ssrfEnabled = ssrfEnabled;
        this.blockedIps = Arrays.stream(blockedIpsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * 校验 URL。
     *
     * @param url 目标 URL
     * @throws IllegalArgumentException 如果 URL 格式非法或命中 SSRF 规则
     */
    public void validate(String url) {
        URI uri = parseAbsolute(url);
        if (!ssrfEnabled) {
            return;
        }
        String host = uri.getHost();

        // 显式拦截通配/零地址
        if (host.equals("0.0.0.0") || host.equals("::") || host.equals("[::]")) {
            throw new IllegalArgumentException("Blocked wildcard address: " + host);
        }

        if (blockedIps.contains(host.toLowerCase())) {
            log.warn("[SSRF] Blocked host: {}", host);
            throw new IllegalArgumentException("Blocked host: " + host);
        }

        // 只要有一个解析结果命中黑名单，就拒绝整个域名（避免 DNS 轮询绕过）
        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Could not resolve host: " + host);
        }
        for (InetAddress addr : addresses) {
            if (isBlockedAddress(addr)) {
                log.warn("[SSRF] Found blocked IP: {} for host: {}", addr.getHostAddress(), host);
                throw new IllegalArgumentException("Blocked IP detected: " + addr.getHostAddress());
            }
        }
    }

    /**
     * 快速判断 URL 是否安全。
     *
     * @param url 目标 URL
     * @return true 表示安全
     */
    public boolean isSafeUrl(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private URI parseAbsolute(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim()).normalize();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + url);
        }
        // 协议白名单
        String scheme = uri.getScheme();
        if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Blocked protocol: " + scheme);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new IllegalArgumentException("Host cannot be empty");
        }
        return uri;
    }

    /**
     * 判断 IP 是否属于受限范围。
     *
     * @param addr IP 地址
     * @return true 表示受限，false 表示允许
     */
    private boolean isBlockedAddress(InetAddress addr) {
        if (addr.isLoopbackAddress() || addr.isSiteLocalAddress() || addr.isLinkLocalAddress()
                || addr.isMulticastAddress() || addr.isAnyLocalAddress()) {
            return true;
        }

        byte[] bytes = addr.getAddress();

        // IPv6 ULA（唯一本地地址）检查：fc00::/7
        if (bytes.length == 16 && (bytes[0] & 0xFE) == (byte) 0xFC) {
            return true;
        }

        String ip = addr.getHostAddress();
        for (String blocked : blockedIps) {
            if (blocked.contains("/")) {
                if (isInSubnet(addr, blocked))
                    return true;
            } else if (ip.equals(blocked)) {
                return true;
            }
        }

        return false;
    }

    /**
     * 判断 IP 是否落入指定 CIDR。
     *
     * @param ipAddr IP 地址
     * @param cidr   CIDR 表示
     * @return true 表示命中
     */
    private boolean isInSubnet(InetAddress ipAddr, String cidr) {
        try {
            String[] parts = cidr.split("/");
            int bits = Integer.parseInt(parts[1]);

            byte[] ipBytes = ipAddr.getAddress();
            byte[] subnetBytes = InetAddress.getByName(parts[0]).getAddress();
            if (ipBytes.length != subnetBytes.length) {
                return false;
            }

            int fullBytes = bits / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (ipBytes[i] != subnetBytes[i])
                    return false;
            }

            int remainingBits = bits % 8;
            if (remainingBits > 0) {
                int mask = (0xFF << (8 - remainingBits)) & 0xFF;
                return (ipBytes[fullBytes] & mask) == (subnetBytes[fullBytes] & mask);
            }

            return true;
        } catch (UnknownHostException | NumberFormatException | ArrayIndexOutOfBoundsException e) {
            log.warn("[SSRF] Ignoring malformed CIDR rule: {}", cidr);
            return false;
        }
    }
}
