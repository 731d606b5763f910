package com.sitemirror.core.store;

import com.sitemirror.core.api.PageStore;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/** 디렉터리 루트 아래에 키를 상대 경로로 저장. 임시 파일에 쓴 뒤 이동한다. */
public final class FileSystemPageStore implements PageStore {

    private final Path root;

    public FileSystemPageStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    @Override
    public void put(String key, byte[] content) throws IOException {
        Path target = resolve(key);
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        Files.write(tmp, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public byte[] get(String key) throws IOException {
        Path p = resolve(key);
        if (!Files.exists(p)) throw new FileNotFoundException(p.toString());
        return Files.readAllBytes(p);
    }

    @Override
    public boolean exists(String key) {
        try {
            return Files.isRegularFile(resolve(key));
        } catch (IOException e) {
            return false;
        }
    }

    /** 루트 밖으로 벗어나는 키("../x")는 거부 */
    private Path resolve(String key) throws IOException {
        if (key == null || key.isBlank()) throw new IOException("empty key");
        Path p = root.resolve(key).normalize();
        if (!p.startsWith(root)) throw new IOException("key escapes store root: " + key);
        return p;
    }
}
