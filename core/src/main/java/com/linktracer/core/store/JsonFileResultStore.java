package com.linktracer.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * JSON 스냅샷 파일로 영속화되는 저장소.
 * 열 때 파일을 읽어 메모리에 올리고, flush()/close() 때 전체를 다시 쓴다.
 * 크롤이 끝난 뒤 다른 프로세스가 같은 파일로 출처 조회를 할 수 있다.
 */
public final class JsonFileResultStore extends InMemoryResultStore {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final Object ioLock = new Object();

    private JsonFileResultStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /** 파일이 있으면 읽어서 연다. 읽기 실패는 StoreException */
    public static JsonFileResultStore open(Path file) {
        JsonFileResultStore store = new JsonFileResultStore(file);
        if (Files.exists(file)) {
            try {
                store.restore(MAPPER.readValue(file.toFile(), Snapshot.class));
            } catch (IOException e) {
                throw new StoreException("Cannot read store snapshot: " + file.toAbsolutePath(), e);
            }
        }
        return store;
    }

    public Path getFile() { return file; }

    @Override
    public void ping() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            if (parent != null && !Files.isWritable(parent)) {
                throw new StoreException("Store directory not writable: " + parent);
            }
        } catch (IOException e) {
            throw new StoreException("Store directory unavailable: " + file.toAbsolutePath(), e);
        }
    }

    @Override
    public void flush() {
        synchronized (ioLock) {
            try {
                Path abs = file.toAbsolutePath();
                if (abs.getParent() != null) Files.createDirectories(abs.getParent());
                Path tmp = abs.resolveSibling(abs.getFileName() + ".tmp");
                MAPPER.writeValue(tmp.toFile(), snapshot());
                try {
                    Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new StoreException("Cannot write store snapshot: " + file.toAbsolutePath(), e);
            }
        }
    }

    @Override
    public void close() {
        flush();
    }
}
