package com.sitemirror.core.util;

import java.time.Duration;

/** 요청 간 대기 추상화 (테스트에서는 기록용 구현으로 교체) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
