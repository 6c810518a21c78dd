package com.coin.porter.common.currency;

import com.coin.porter.common.model.MatchRecord;
import com.coin.porter.common.model.ResolutionResult;
import com.coin.porter.common.model.VenueCoinListing;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

@Slf4j
public class CoinIdentifier {
    private final NetworkNameStandardizer standardizer;
    private final TraditionalMatcher traditionalMatcher;
    private final ContractClosureMatcher closureMatcher;
    private final ResultMerger merger;

    public CoinIdentifier(NetworkNameStandardizer standardizer) {
        this.standardizer = standardizer;
        this.traditionalMatcher = new TraditionalMatcher(new DenominationMatcher());
        this.closureMatcher = new ContractClosureMatcher(standardizer, traditionalMatcher);
        this.merger = new ResultMerger();
    }

    public ResolutionResult resolve(String querySymbol, Map<String, List<VenueCoinListing>> catalog) {
        if (StringUtils.isBlank(querySymbol)) {
            return ResolutionResult.empty(querySymbol, "empty query");
        }
        if (catalog == null || catalog.isEmpty()) {
            return ResolutionResult.empty(querySymbol, "empty catalog");
        }
        LOG.debug("Resolving {} across {} venues", querySymbol, catalog.size());

        ContractIdentityIndex index = ContractIdentityIndex.build(catalog, standardizer);
        LOG.debug("Indexed {} contract keys", index.size());

        List<MatchRecord> traditional = traditionalMatcher.match(querySymbol, catalog);
        LOG.debug("{}: {} traditional matches", querySymbol, traditional.size());

        List<MatchRecord> smart = closureMatcher.match(querySymbol, catalog, index, traditional);
        LOG.debug("{}: {} smart matches", querySymbol, smart.size());

        return merger.merge(querySymbol, traditional, smart);
    }
}
