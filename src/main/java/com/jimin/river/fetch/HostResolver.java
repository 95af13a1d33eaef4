package com.jimin.river.fetch;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * 호스트 이름 → IP 주소 해석 (테스트에서 대체 가능)
 */
@FunctionalInterface
public interface HostResolver {

    InetAddress[] resolve(String host) throws UnknownHostException;
}
