package com.peerlend.matching.engine;

/**
 * Which pool queue a promotion walks.
 */
public enum MatchingStrategy {
    PROMOTE_SUPPLIERS,
    PROMOTE_BORROWERS
}
