package com.tdnet.common.issuer;

public record IssuerInfo(
    String code,
    String name,
    String sector,
    String size
) {
    public static final String UNKNOWN = "Unknown";

    public static IssuerInfo unknown(String code) {
        return new IssuerInfo(code, UNKNOWN, UNKNOWN, SizeClass.UNKNOWN);
    }
}
