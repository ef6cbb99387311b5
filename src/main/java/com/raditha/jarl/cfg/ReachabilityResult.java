package com.raditha.jarl.cfg;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classification of every block of a graph plus the merged unreachable regions.
 *
 * @param reachable blocks reachable from the entry over live edges
 * @param reasons   reason for each block that is not reachable
 * @param regions   unreachable regions in source order
 */
public record ReachabilityResult(
        Set<Integer> reachable,
        Map<Integer, UnreachabilityReason> reasons,
        List<UnreachableRegion> regions) {

    public ReachabilityResult {
        reachable = Set.copyOf(reachable);
        reasons = Map.copyOf(reasons);
        regions = List.copyOf(regions);
    }

    public boolean isReachable(int block) {
        return reachable.contains(block);
    }

    public Optional<UnreachabilityReason> reason(int block) {
        return Optional.ofNullable(reasons.get(block));
    }
}
