package com.lux032.stemgenerator.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 文件内容哈希
 * 台账中的曲目标识和缓存键共用同一个定义: 整个文件的 SHA-256 十六进制串
 */
public final class FileHashUtils {

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * 输出目录名中使用的短哈希长度
     */
    public static final int SHORT_HASH_LENGTH = 8;

    private FileHashUtils() {
    }

    public static String sha256(Path file) throws IOException {
        MessageDigest md = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                md.update(buffer, 0, read);
            }
        }
        return toHex(md.digest());
    }

    public static String shortHash(String fullHash) {
        if (fullHash == null) {
            return "";
        }
        return fullHash.length() <= SHORT_HASH_LENGTH ? fullHash : fullHash.substring(0, SHORT_HASH_LENGTH);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not supported", e);
        }
    }

    private static String toHex(byte[] digest) {
        StringBuilder sb = new StringBuilder();
        for (byte b : digest) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
