package com.lux032.stemgenerator.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class StemConfigTest {

    @Test
    void defaultsAreUsable() {
        StemConfig config = StemConfig.fromProperties(new Properties());

        assertThat(config.getDbType()).isEqualTo("sqlite");
        assertThat(config.isMysql()).isFalse();
        assertThat(config.isCacheEnabled()).isTrue();
        assertThat(config.isQualityFallbackEnabled()).isTrue();
        assertThat(config.getLocalSizeThresholdMb()).isEqualTo(50);
        assertThat(config.getDemucsModel()).isEqualTo("htdemucs");
        assertThat(config.getSupportedFormats()).contains("mp3", "wav", "flac", "aiff");
        assertThat(config.isWebEnabled()).isFalse();
        assertThat(config.isValid()).isTrue();
    }

    @Test
    void derivedPathsFollowOutputDirectory() {
        Properties props = new Properties();
        props.setProperty("output.baseDirectory", "/data/stems");
        StemConfig config = StemConfig.fromProperties(props);

        assertThat(config.getEffectiveCacheDirectory()).isEqualTo(Paths.get("/data/stems", ".stem_cache").toString());
        assertThat(config.getEffectiveSqlitePath()).isEqualTo(Paths.get("/data/stems", "stem_generator.db").toString());

        props.setProperty("cache.directory", "/fast/cache");
        props.setProperty("db.sqlite.path", "/var/lib/ledger.db");
        config = StemConfig.fromProperties(props);
        assertThat(config.getEffectiveCacheDirectory()).isEqualTo("/fast/cache");
        assertThat(config.getEffectiveSqlitePath()).isEqualTo("/var/lib/ledger.db");
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("db.type", "mysql");
        props.setProperty("pipeline.localSizeThresholdMb", "20");
        props.setProperty("pipeline.qualityFallback", "false");
        props.setProperty("scanner.priorityCrates", " Peak Time , ,Closing ");
        props.setProperty("file.supportedFormats", "mp3, wav");
        props.setProperty("lalal.apiKey", "abc");
        props.setProperty("web.port", "9090");
        StemConfig config = StemConfig.fromProperties(props);

        assertThat(config.isMysql()).isTrue();
        assertThat(config.getLocalSizeThresholdBytes()).isEqualTo(20L * 1024 * 1024);
        assertThat(config.isQualityFallbackEnabled()).isFalse();
        assertThat(config.getPriorityCrates()).containsExactly("Peak Time", "Closing");
        assertThat(config.getSupportedFormats()).containsExactly("mp3", "wav");
        assertThat(config.hasLalalApiKey()).isTrue();
        assertThat(config.getWebPort()).isEqualTo(9090);
    }

    @Test
    void malformedNumbersKeepDefaults() {
        Properties props = new Properties();
        props.setProperty("web.port", "eighty");
        props.setProperty("demucs.timeoutSeconds", "");
        StemConfig config = StemConfig.fromProperties(props);

        assertThat(config.getWebPort()).isEqualTo(8080);
        assertThat(config.getDemucsTimeoutSeconds()).isEqualTo(1800);
    }

    @Test
    void invalidSettingsAreReported() {
        Properties props = new Properties();
        props.setProperty("db.type", "postgres");
        assertThat(StemConfig.fromProperties(props).isValid()).isFalse();

        props = new Properties();
        props.setProperty("lalal.pollIntervalSeconds", "30");
        props.setProperty("lalal.timeoutSeconds", "10");
        assertThat(StemConfig.fromProperties(props).isValid()).isFalse();

        props = new Properties();
        props.setProperty("pipeline.localSizeThresholdMb", "0");
        assertThat(StemConfig.fromProperties(props).isValid()).isFalse();
    }
}
