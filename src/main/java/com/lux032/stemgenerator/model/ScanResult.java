package com.lux032.stemgenerator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 目录扫描结果
 */
@Data
public class ScanResult {
    private List<ScannedTrack> tracks = new ArrayList<>();
    private int totalFiles;
    private int audioFiles;
    private List<String> errors = new ArrayList<>();

    /**
     * 合并另一次扫描的结果
     */
    public void merge(ScanResult other) {
        tracks.addAll(other.getTracks());
        totalFiles += other.getTotalFiles();
        audioFiles += other.getAudioFiles();
        errors.addAll(other.getErrors());
    }
}
