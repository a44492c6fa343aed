package com.lux032.stemgenerator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 批处理进度
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchProgress {
    private int total;
    private int completed;
    private int failed;
    private int skipped;

    public int getRemaining() {
        return Math.max(0, total - completed - failed - skipped);
    }

    public double getPercentComplete() {
        if (total == 0) {
            return 100.0;
        }
        return (completed + failed + skipped) * 100.0 / total;
    }

    /**
     * 复制一份快照交给回调,避免回调方修改内部计数
     */
    public BatchProgress snapshot() {
        return new BatchProgress(total, completed, failed, skipped);
    }
}
