package com.webcrawler.core.cache;

import com.webcrawler.core.api.IPageCache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * 디렉터리 기반 캐시: 파일명 = SHA-256(key) hex + ".html".
 * 쓰기는 임시 파일 → 원자적 이동이라 동시 읽기가 반쯤 쓴 파일을 보지 않는다.
 */
public final class FileSystemPageCache implements IPageCache {

    private static final String SUFFIX = ".html";

    private final Path dir;

    public FileSystemPageCache(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir").toAbsolutePath().normalize();
    }

    public Path getDir() { return dir; }

    @Override
    public Optional<byte[]> get(String key) throws IOException {
        Path p = pathFor(key);
        try {
            return Optional.of(Files.readAllBytes(p));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, byte[] value) throws IOException {
        Objects.requireNonNull(value, "value");
        Files.createDirectories(dir);
        Path target = pathFor(key);
        Path tmp = Files.createTempFile(dir, "cache-", ".tmp");
        try {
            Files.write(tmp, value);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** key → 캐시 파일 경로 */
    public Path pathFor(String key) {
        return dir.resolve(hash(Objects.requireNonNull(key, "key")) + SUFFIX);
    }

    static String hash(String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
