package com.parish.security.branch;

import java.util.List;

/**
 * The branch filter a handler applies after scope resolution.
 * <ul>
 *   <li>{@code branchId} set: exactly that branch;</li>
 *   <li>{@code allowedBranchIds} non-empty: any of those branches;</li>
 *   <li>both empty: every branch of the tenant.</li>
 * </ul>
 *
 * @param branchId         single selected branch, may be null
 * @param allowedBranchIds candidate branches when no single branch was selected
 */
public record BranchScope(String branchId, List<String> allowedBranchIds) {

    public BranchScope {
        allowedBranchIds = allowedBranchIds == null ? List.of() : List.copyOf(allowedBranchIds);
        if (branchId != null && !allowedBranchIds.isEmpty()) {
            throw new IllegalArgumentException("branchId and allowedBranchIds are mutually exclusive");
        }
    }

    public static BranchScope allBranches() {
        return new BranchScope(null, List.of());
    }

    public static BranchScope single(String branchId) {
        return new BranchScope(branchId, List.of());
    }

    public static BranchScope anyOf(List<String> branchIds) {
        return new BranchScope(null, branchIds);
    }

    /**
     * True when no branch filter applies.
     */
    public boolean isUnfiltered() {
        return branchId == null && allowedBranchIds.isEmpty();
    }

    /**
     * The branch ids this scope names, empty when unfiltered.
     */
    public List<String> branchIds() {
        return branchId != null ? List.of(branchId) : allowedBranchIds;
    }
}
