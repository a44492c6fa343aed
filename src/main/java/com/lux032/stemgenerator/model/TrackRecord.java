package com.lux032.stemgenerator.model;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 曲目台账记录,以文件内容哈希作为唯一标识
 */
@Data
public class TrackRecord {
    private long id;
    private String filePath;
    private String fileHash;
    private String artist;
    private String title;
    private Double bpm;
    private String musicalKey;
    private String genre;
    private LocalDateTime createdAt;
}
