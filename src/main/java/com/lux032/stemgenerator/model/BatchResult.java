package com.lux032.stemgenerator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 批处理汇总
 */
@Data
public class BatchResult {
    private BatchProgress progress = new BatchProgress();
    private List<SeparationResult> results = new ArrayList<>();
    private List<BatchError> errors = new ArrayList<>();
    private double processingTimeSeconds;
}
