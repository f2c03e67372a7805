package com.tdnet.ingestion.filter;

import com.tdnet.common.issuer.IssuerCodes;
import java.util.Map;
import java.util.Set;

/**
 * Drops issuers listed on excluded market segments. Issuers missing from the reference table pass.
 */
public class MarketFilter {

    private final Map<String, String> marketsByCode;
    private final Set<String> excludedMarkets;

    public MarketFilter(Map<String, String> marketsByCode, Set<String> excludedMarkets) {
        this.marketsByCode = Map.copyOf(marketsByCode);
        this.excludedMarkets = Set.copyOf(excludedMarkets);
    }

    public boolean isExcluded(String rawCode) {
        if (excludedMarkets.isEmpty() || marketsByCode.isEmpty()) {
            return false;
        }
        String market = marketsByCode.get(IssuerCodes.clean(rawCode));
        if (market == null) {
            market = marketsByCode.get(IssuerCodes.normalize(rawCode));
        }
        return market != null && excludedMarkets.contains(market);
    }
}
