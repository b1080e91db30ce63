package com.resilia.neurogrid.common.domain.enums;

/**
 * 储能类型，默认响应排序由快到慢
 */
public enum StorageType {

    BATTERY(1, "电化学储能", "响应最快，效率高"),
    MECHANICAL(2, "机械储能", "抽水蓄能、压缩空气等"),
    THERMAL(3, "热储能", "中期储能，面向工业用热"),
    HYDROGEN(4, "氢储能", "长期储能，效率较低"),
    VEHICLE(5, "V2G移动储能", "电动汽车电池，最后动用");

    private final int defaultRank;
    private final String description;
    private final String detail;

    StorageType(int defaultRank, String description, String detail) {
        this.defaultRank = defaultRank;
        this.description = description;
        this.detail = detail;
    }

    public int getDefaultRank() {
        return defaultRank;
    }

    public String getDescription() {
        return description;
    }

    public String getDetail() {
        return detail;
    }

    public boolean isMobile() {
        return this == VEHICLE;
    }
}
