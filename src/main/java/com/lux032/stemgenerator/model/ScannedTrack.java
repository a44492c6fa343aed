package com.lux032.stemgenerator.model;

import lombok.Data;

import java.nio.file.Path;

/**
 * 扫描得到的待处理曲目
 */
@Data
public class ScannedTrack {
    private Path path;
    private String artist = TrackMetadata.UNKNOWN_ARTIST;
    private String title = TrackMetadata.UNKNOWN_TITLE;
    private Double bpm;
    private String musicalKey;
    private String genre;
    private String crate;
    private Priority priority = Priority.LOW;

    public ScannedTrack() {
    }

    public ScannedTrack(Path path) {
        this.path = path;
    }

    public String getDisplayName() {
        return artist + " - " + title;
    }
}
