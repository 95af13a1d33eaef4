package com.jimin.river.fetch;

import com.jimin.river.exception.FeedFetchException;
import com.jimin.river.exception.FeedValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 요청 목적지 검사 (SSRF 차단)
 *
 * - scheme은 http / https만 허용
 * - IP 리터럴: 사설/예약 대역이면 거부. 단 루프백 리터럴(127.0.0.1, ::1)은 허용
 * - 호스트 이름: 해석된 주소 중 하나라도 차단 대역이면 거부 (루프백 포함)
 *
 * 리다이렉트의 매 홉마다 HTTP 요청 전에 호출된다.
 */
@Component
@RequiredArgsConstructor
public class DestinationGuard {

    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final HostResolver hostResolver;

    /**
     * @throws FeedValidationException scheme/host가 잘못되었거나 차단 대역인 경우
     * @throws FeedFetchException      호스트 이름 해석 실패
     */
    public void check(URI uri) {
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new FeedValidationException("허용되지 않는 scheme입니다: " + uri.getScheme());
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new FeedValidationException("호스트가 없는 URL입니다: " + uri);
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        InetAddress literal = parseLiteral(host);
        if (literal != null) {
            if (!literal.isLoopbackAddress() && isBlocked(literal)) {
                throw new FeedValidationException("사설/예약 주소로의 요청은 허용되지 않습니다: " + host);
            }
            return;
        }

        InetAddress[] addresses;
        try {
            addresses = hostResolver.resolve(host);
        } catch (UnknownHostException e) {
            throw new FeedFetchException("호스트 이름을 해석할 수 없습니다: " + host, e);
        }
        if (addresses == null || addresses.length == 0) {
            throw new FeedFetchException("호스트 이름을 해석할 수 없습니다: " + host);
        }
        for (InetAddress address : addresses) {
            if (isBlocked(address)) {
                throw new FeedValidationException(
                        "사설/예약 주소로 해석되는 호스트입니다: " + host + " -> " + address.getHostAddress());
            }
        }
    }

    /**
     * 차단 대역: 루프백, 0.0.0.0/8, 링크 로컬, 10/8, 172.16/12, 192.168/16,
     * 100.64/10, 240/4, fc00::/7, 멀티캐스트
     */
    public static boolean isBlocked(InetAddress address) {
        if (address.isLoopbackAddress()
                || address.isAnyLocalAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isMulticastAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = bytes[0] & 0xFF;
            int second = bytes[1] & 0xFF;
            return first == 0
                    || (first == 100 && (second & 0xC0) == 64)
                    || first >= 240;
        }
        if (address instanceof Inet6Address) {
            return (bytes[0] & 0xFE) == 0xFC;
        }
        return false;
    }

    private static InetAddress parseLiteral(String host) {
        try {
            if (IPV4_LITERAL.matcher(host).matches()) {
                String[] parts = host.split("\\.");
                byte[] bytes = new byte[4];
                for (int i = 0; i < 4; i++) {
                    int octet = Integer.parseInt(parts[i]);
                    if (octet > 255) {
                        throw new FeedValidationException("잘못된 IP 주소입니다: " + host);
                    }
                    bytes[i] = (byte) octet;
                }
                return InetAddress.getByAddress(bytes);
            }
            if (host.indexOf(':') >= 0) {
                // IPv6 리터럴은 DNS 조회 없이 파싱된다
                return InetAddress.getByName(host);
            }
        } catch (UnknownHostException e) {
            throw new FeedValidationException("잘못된 IP 주소입니다: " + host, e);
        }
        return null;
    }
}
