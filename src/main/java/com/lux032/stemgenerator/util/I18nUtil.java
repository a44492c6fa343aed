package com.lux032.stemgenerator.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Properties;

/**
 * 国际化工具类
 * 从 classpath 的 messages_<lang>.properties 加载提示文本
 */
@Slf4j
public class I18nUtil {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static Properties messages;
    private static String currentLanguage = DEFAULT_LANGUAGE;

    /**
     * 初始化国际化资源
     * @param language 语言代码，如 zh_CN 或 en_US
     */
    public static synchronized void init(String language) {
        if (language == null || language.trim().isEmpty()) {
            language = DEFAULT_LANGUAGE;
        }

        String resourceFile = "/messages_" + language + ".properties";
        InputStream is = I18nUtil.class.getResourceAsStream(resourceFile);
        if (is == null) {
            log.error("i18n resource file not found: {}, falling back to default English", resourceFile);
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
            } else {
                messages = new Properties();
            }
            return;
        }

        Properties loaded = new Properties();
        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            loaded.load(reader);
            log.debug("Loaded i18n resource file: {}", resourceFile);
        } catch (IOException e) {
            log.error("Failed to load i18n resource file: {}", resourceFile, e);
        }
        currentLanguage = language;
        messages = loaded;
    }

    /**
     * 获取国际化消息
     * @return 对应语言的消息文本，如果找不到则返回键本身
     */
    public static String getMessage(String key) {
        return messages().getProperty(key, key);
    }

    /**
     * 获取国际化消息（带默认值）
     */
    public static String getMessageWithDefault(String key, String defaultValue) {
        return messages().getProperty(key, defaultValue);
    }

    /**
     * 获取国际化消息（支持参数替换）
     * 支持 SLF4J 风格的 {} 占位符和 MessageFormat 风格的 {0} {1} 占位符
     */
    public static String getMessage(String key, Object... args) {
        String pattern = messages().getProperty(key, key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        return formatMessage(pattern, args);
    }

    static String formatMessage(String pattern, Object... args) {
        if (pattern == null || args == null || args.length == 0) {
            return pattern;
        }

        if (pattern.matches(".*\\{\\d+\\}.*")) {
            try {
                return MessageFormat.format(pattern, args);
            } catch (IllegalArgumentException e) {
                log.debug("MessageFormat failed for pattern '{}', falling back to SLF4J style", pattern);
            }
        }

        // SLF4J 风格
        StringBuilder result = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < pattern.length()) {
            if (i < pattern.length() - 1 && pattern.charAt(i) == '{' && pattern.charAt(i + 1) == '}') {
                if (argIndex < args.length) {
                    result.append(args[argIndex] != null ? args[argIndex].toString() : "null");
                    argIndex++;
                } else {
                    result.append("{}");
                }
                i += 2;
            } else {
                result.append(pattern.charAt(i));
                i++;
            }
        }
        return result.toString();
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }

    private static Properties messages() {
        if (messages == null) {
            init(currentLanguage);
        }
        return messages;
    }
}
