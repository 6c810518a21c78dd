package com.coin.porter.common.model;

import java.util.ArrayList;
import java.util.List;

public class ResolutionResult {
    public final String originalSymbol;
    public final List<MatchRecord> verifiedMatches;
    // always empty for now
    public final List<MatchRecord> possibleMatches;
    public final List<String> notes;

    public ResolutionResult(String originalSymbol, List<MatchRecord> verifiedMatches, List<MatchRecord> possibleMatches, List<String> notes) {
        this.originalSymbol = originalSymbol;
        this.verifiedMatches = verifiedMatches == null ? List.of() : List.copyOf(verifiedMatches);
        this.possibleMatches = possibleMatches == null ? List.of() : List.copyOf(possibleMatches);
        this.notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static ResolutionResult empty(String originalSymbol, String note) {
        return new ResolutionResult(originalSymbol, List.of(), List.of(), List.of(note));
    }

    public ResolutionResult withNotes(List<String> extraNotes) {
        if (extraNotes == null || extraNotes.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(notes);
        merged.addAll(extraNotes);
        return new ResolutionResult(originalSymbol, verifiedMatches, possibleMatches, merged);
    }
}
