package com.photoorg.app.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Digest do conteúdo lido em blocos de tamanho fixo; memória O(buffer).
 * Thread-safe: cada chamada usa seu próprio {@link MessageDigest} e buffer.
 */
public final class ContentHasher {

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;
    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private final String algorithm;
    private final int bufferSize;

    public ContentHasher() {
        this(DEFAULT_ALGORITHM, DEFAULT_BUFFER_SIZE);
    }

    public ContentHasher(String algorithm, int bufferSize) {
        if (bufferSize <= 0) throw new IllegalArgumentException("bufferSize deve ser positivo");
        this.algorithm = normalize(algorithm);
        this.bufferSize = bufferSize;
        newDigest(this.algorithm);
    }

    /**
     * @throws IOException se o arquivo não puder ser lido até o fim
     */
    public String hash(Path file) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[bufferSize];
            int n;
            while ((n = in.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IOException("Hash interrompido: " + file);
                }
                digest.update(buffer, 0, n);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public String algorithm() {
        return algorithm;
    }

    public int bufferSize() {
        return bufferSize;
    }

    /** Aceita também a grafia sem hífen (sha256). */
    static String normalize(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) return DEFAULT_ALGORITHM;
        String a = algorithm.trim().toUpperCase(Locale.ROOT);
        if (a.matches("SHA\\d+")) {
            return "SHA-" + a.substring(3);
        }
        return a;
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Algoritmo de hash indisponível: " + algorithm, e);
        }
    }
}
