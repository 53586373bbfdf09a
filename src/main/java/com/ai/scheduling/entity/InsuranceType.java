package com.ai.scheduling.entity;

import org.apache.commons.lang3.StringUtils;

public enum InsuranceType {
    PRIVATE_PAY,
    HEALTH_PLAN;

    /**
     * Lenient parse used for caller-supplied values: blank or unknown input falls back to
     * {@link #PRIVATE_PAY}.
     */
    public static InsuranceType fromValue(String raw) {
        String value = StringUtils.upperCase(StringUtils.trimToNull(raw));
        if (value == null) {
            return PRIVATE_PAY;
        }
        for (InsuranceType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        return PRIVATE_PAY;
    }
}
