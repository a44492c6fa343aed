package com.lux032.stemgenerator.model;

import lombok.Data;

/**
 * 从音频标签中读出的曲目信息
 */
@Data
public class TrackMetadata {
    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    public static final String UNKNOWN_TITLE = "Unknown Title";

    private String artist = UNKNOWN_ARTIST;
    private String title = UNKNOWN_TITLE;
    private String genre;
    private Double bpm;
    private String musicalKey;
    private String crate; // 来自 GROUPING 标签
}
