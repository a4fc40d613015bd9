package com.craftplane.core.conflict;

import java.util.List;

public record ConflictAnalysis(boolean hasConflicts, List<PluginConflict> conflicts,
                               List<ConflictRecommendation> recommendations) {

    public ConflictAnalysis {
        conflicts = List.copyOf(conflicts);
        recommendations = List.copyOf(recommendations);
    }

    public static ConflictAnalysis none() {
        return new ConflictAnalysis(false, List.of(), List.of());
    }
}
