package com.tdnet.common.issuer;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the issuer reference table, keyed by normalized code.
 */
public final class IssuerDirectory {

    private final Map<String, IssuerInfo> issuers;
    private final Map<String, String> markets;

    public IssuerDirectory(Map<String, IssuerInfo> issuers, Map<String, String> markets) {
        this.issuers = Map.copyOf(issuers);
        this.markets = Map.copyOf(markets);
    }

    public static IssuerDirectory empty() {
        return new IssuerDirectory(Map.of(), Map.of());
    }

    public Optional<IssuerInfo> find(String code) {
        return Optional.ofNullable(issuers.get(IssuerCodes.normalize(code)));
    }

    public IssuerInfo resolve(String code) {
        String normalized = IssuerCodes.normalize(code);
        return find(normalized).orElseGet(() -> IssuerInfo.unknown(normalized));
    }

    public Map<String, String> markets() {
        return markets;
    }

    public int size() {
        return issuers.size();
    }

    public boolean isEmpty() {
        return issuers.isEmpty() && markets.isEmpty();
    }
}
