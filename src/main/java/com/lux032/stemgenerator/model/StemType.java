package com.lux032.stemgenerator.model;

/**
 * 分轨类型
 * 每次分离固定产出四条分轨,文件名为 {@code <name>.wav}
 */
public enum StemType {
    /**
     * 人声
     */
    VOCALS("vocals"),

    /**
     * 鼓
     */
    DRUMS("drums"),

    /**
     * 贝斯
     */
    BASS("bass"),

    /**
     * 其他伴奏
     */
    OTHER("other");

    private final String stemName;

    StemType(String stemName) {
        this.stemName = stemName;
    }

    public String getStemName() {
        return stemName;
    }

    public String getFileName() {
        return stemName + ".wav";
    }

    /**
     * 按名称查找分轨类型,忽略大小写
     * @return 匹配的类型,找不到返回 null
     */
    public static StemType fromName(String name) {
        if (name == null) {
            return null;
        }
        for (StemType type : values()) {
            if (type.stemName.equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        return null;
    }
}
