package com.coin.porter.common.currency;

import com.coin.porter.common.model.MatchRecord;
import com.coin.porter.common.model.ResolutionResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class ResultMerger {

    public ResolutionResult merge(String querySymbol, List<MatchRecord> traditional, List<MatchRecord> smart) {
        List<MatchRecord> all = new ArrayList<>(traditional.size() + smart.size());
        all.addAll(traditional);
        all.addAll(smart);
        List<MatchRecord> verified = deduplicate(all);
        List<String> notes = List.of(
                "traditional matches: " + traditional.size(),
                "smart matches: " + smart.size(),
                "verified after merge: " + verified.size()
        );
        return new ResolutionResult(querySymbol, verified, List.of(), notes);
    }

    public List<MatchRecord> deduplicate(List<MatchRecord> records) {
        Set<MergeKey> seen = new HashSet<>();
        List<MatchRecord> unique = new ArrayList<>();
        for (MatchRecord record : records) {
            if (seen.add(MergeKey.of(record))) {
                unique.add(record);
            }
        }
        return unique;
    }

    private record MergeKey(String venue, String symbol, String network, String contract) {
        static MergeKey of(MatchRecord record) {
            String contract = record.contractAddress.isBlank() ? null : record.contractAddress.trim().toLowerCase();
            return new MergeKey(record.venue, record.symbol, record.network, contract);
        }
    }
}
