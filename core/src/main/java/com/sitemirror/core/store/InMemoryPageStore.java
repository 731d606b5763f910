package com.sitemirror.core.store;

import com.sitemirror.core.api.PageStore;

import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** 메모리 저장소 (테스트/드라이런용) */
public final class InMemoryPageStore implements PageStore {

    private final Map<String, byte[]> data = new ConcurrentHashMap<>();

    @Override
    public void put(String key, byte[] content) {
        data.put(key, content.clone());
    }

    @Override
    public byte[] get(String key) throws FileNotFoundException {
        byte[] b = data.get(key);
        if (b == null) throw new FileNotFoundException(key);
        return b.clone();
    }

    @Override
    public boolean exists(String key) { return data.containsKey(key); }

    public String getString(String key) throws FileNotFoundException {
        return new String(get(key), StandardCharsets.UTF_8);
    }

    public Set<String> keys() { return new TreeSet<>(data.keySet()); }
}
