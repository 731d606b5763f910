package com.sitemirror.core.api;

import java.io.IOException;

/** 출력 루트 기준 상대 키(예: "pages/about.html") → 바이트 저장소 */
public interface PageStore {

    void put(String key, byte[] content) throws IOException;

    /** @throws java.io.FileNotFoundException 키가 없으면 */
    byte[] get(String key) throws IOException;

    boolean exists(String key);
}
