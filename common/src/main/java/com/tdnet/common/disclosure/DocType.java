package com.tdnet.common.disclosure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DocType {
    TANSHIN("tanshin"),
    PRESENTATION("presentation"),
    DIVIDEND("dividend"),
    OTHER("other");

    private final String wireName;

    DocType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DocType fromWireName(String value) {
        if (value == null) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DocType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
