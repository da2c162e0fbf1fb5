package com.netwarden.backend.geoip.service;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * IP literal 工具：
 * - 只接受 IPv4 dotted-quad / IPv6 literal，絕不做 DNS 查詢
 * - private / internal 判斷（這些 IP 不查、不存、不 cache）
 */
public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile(
            "^(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    private IpAddresses() {}

    /**
     * @return 正規化後的 literal（IPv6 轉小寫去 zone id）；不是合法 IP 回 null
     */
    public static String normalize(String raw) {
        InetAddress a = parse(raw);
        if (a == null) return null;
        if (a instanceof Inet4Address) return a.getHostAddress();
        String s = raw.trim();
        int pct = s.indexOf('%');
        if (pct > 0) s = s.substring(0, pct);
        return s.toLowerCase(Locale.ROOT);
    }

    public static InetAddress parse(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;

        int pct = s.indexOf('%');
        if (pct > 0) s = s.substring(0, pct);

        boolean v4 = IPV4.matcher(s).matches();
        boolean v6 = !v4 && s.indexOf(':') >= 0 && IPV6_CHARS.matcher(s).matches();
        if (!v4 && !v6) return null;

        try {
            // literal 不會觸發 DNS
            return InetAddress.getByName(s);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    public static boolean isPrivate(InetAddress a) {
        if (a == null) return false;
        if (a.isLoopbackAddress()
                || a.isSiteLocalAddress()
                || a.isLinkLocalAddress()
                || a.isAnyLocalAddress()
                || a.isMulticastAddress()) {
            return true;
        }
        byte[] b = a.getAddress();
        if (a instanceof Inet4Address) {
            int b0 = b[0] & 0xFF;
            int b1 = b[1] & 0xFF;
            // 100.64.0.0/10 carrier-grade NAT
            if (b0 == 100 && b1 >= 64 && b1 <= 127) return true;
            // 0.0.0.0/8
            return b0 == 0;
        }
        if (a instanceof Inet6Address) {
            // fc00::/7 unique local
            return (b[0] & 0xFE) == 0xFC;
        }
        return false;
    }

    public static boolean isPrivate(String raw) {
        return isPrivate(parse(raw));
    }
}
