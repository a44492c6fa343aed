package com.lux032.stemgenerator.util;

/**
 * Banner 工具类 - 启动时在控制台显示
 */
public class BannerUtil {

    /**
     * 显示应用启动 Banner
     */
    public static void printBanner() {
        String banner =
            "\n" +
            " ════════════════════════════════════════════════════════════════════════════\n" +
            "  Stem Generator - Multi-Engine Audio Stem Separation\n" +
            "  Version: 1.0.0 | Demucs (local) & LALAL.AI (cloud)\n" +
            " ════════════════════════════════════════════════════════════════════════════\n";

        System.out.println(banner);
    }
}
