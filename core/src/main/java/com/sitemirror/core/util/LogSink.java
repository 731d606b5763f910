package com.sitemirror.core.util;

/**
 * 사람이 읽는 진행 로그 채널.
 * 전송 방식(SSE, 소켓, 폴링)은 구현체 바깥의 관심사다.
 */
@FunctionalInterface
public interface LogSink {
    void log(String line);

    LogSink NONE = line -> {};
}
