package com.lux032.stemgenerator.service;

import com.lux032.stemgenerator.model.TrackMetadata;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 使用 jaudiotagger 读取曲目标签
 * 读取失败时标题回退为文件名,艺术家为 Unknown Artist
 */
@Slf4j
public class TrackMetadataReader {

    static {
        // jaudiotagger 使用 JUL 输出大量调试信息
        Logger.getLogger("org.jaudiotagger").setLevel(Level.WARNING);
    }

    public TrackMetadata read(Path file) {
        TrackMetadata metadata = new TrackMetadata();
        metadata.setTitle(baseName(file));

        try {
            AudioFile audioFile = AudioFileIO.read(file.toFile());
            Tag tag = audioFile.getTag();
            if (tag == null) {
                return metadata;
            }

            String artist = first(tag, FieldKey.ARTIST);
            if (artist == null) {
                artist = first(tag, FieldKey.ALBUM_ARTIST);
            }
            if (artist != null) {
                metadata.setArtist(artist);
            }
            String title = first(tag, FieldKey.TITLE);
            if (title != null) {
                metadata.setTitle(title);
            }
            metadata.setGenre(first(tag, FieldKey.GENRE));
            metadata.setMusicalKey(first(tag, FieldKey.KEY));
            metadata.setCrate(first(tag, FieldKey.GROUPING));
            metadata.setBpm(parseBpm(first(tag, FieldKey.BPM)));
        } catch (Exception e) {
            // jaudiotagger 对不同格式抛出多种受检异常
            log.debug("读取标签失败,使用文件名: {} - {}", file.getFileName(), e.getMessage());
        }
        return metadata;
    }

    private static String first(Tag tag, FieldKey key) {
        try {
            String value = tag.getFirst(key);
            return value == null || value.trim().isEmpty() ? null : value.trim();
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            return null;
        }
    }

    static Double parseBpm(String value) {
        if (value == null) {
            return null;
        }
        try {
            double bpm = Double.parseDouble(value.replace(',', '.').trim());
            return bpm > 0 ? bpm : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
