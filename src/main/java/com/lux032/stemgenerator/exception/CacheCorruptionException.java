package com.lux032.stemgenerator.exception;

/**
 * 缓存条目元数据损坏或分轨缺失
 * 只在缓存内部流转,命中时被当作未命中处理
 */
public class CacheCorruptionException extends StemGeneratorException {

    public CacheCorruptionException(String message) {
        super(message);
    }

    public CacheCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
