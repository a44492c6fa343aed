package com.lux032.stemgenerator.backend;

import com.lux032.stemgenerator.model.SeparationResult;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 分轨分离后端
 *
 * <p>流水线对所有后端一视同仁。执行失败不抛异常,而是返回
 * {@code success=false} 并带上错误信息的结果。</p>
 */
public interface SeparationBackend {

    /**
     * 后端标识,同时写入任务台账和缓存键
     */
    String getName();

    /**
     * 当前是否可用 (命令存在、已配置密钥等)
     */
    boolean isAvailable();

    /**
     * 是否在本机运行
     * 自动路由时小文件优先交给本地后端
     */
    boolean isLocal();

    /**
     * 将输入文件分离为四条分轨,写入 outputDir
     */
    SeparationResult separate(Path input, Path outputDir);

    /**
     * 建议的并行度
     */
    int getRecommendedParallelism();

    /**
     * 是否匹配用户给出的后端名称
     * 支持完整名称以及下划线前的简称,如 {@code demucs} 匹配 {@code demucs_htdemucs}
     */
    default boolean matches(String preference) {
        if (preference == null) {
            return false;
        }
        String wanted = preference.trim().toLowerCase(Locale.ROOT);
        String name = getName().toLowerCase(Locale.ROOT);
        return name.equals(wanted) || name.startsWith(wanted + "_");
    }
}
