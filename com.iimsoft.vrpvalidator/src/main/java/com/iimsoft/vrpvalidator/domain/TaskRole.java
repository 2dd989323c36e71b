package com.iimsoft.vrpvalidator.domain;

public enum TaskRole {
    PICKUP("pickup", "pickups"),
    DELIVERY("delivery", "deliveries");

    private final String displayName;
    private final String fieldName;

    TaskRole(String displayName, String fieldName) {
        this.displayName = displayName;
        this.fieldName = fieldName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** 问题文档中对应的字段名，用于拼 field path。 */
    public String getFieldName() {
        return fieldName;
    }
}
