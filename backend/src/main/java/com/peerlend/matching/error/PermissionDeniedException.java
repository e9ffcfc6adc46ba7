package com.peerlend.matching.error;

/**
 * Caller is neither the position owner nor one of its approved managers.
 */
public class PermissionDeniedException extends MatchingEngineException {

    public static final String PERMISSION_DENIED = "PERMISSION_DENIED";

    public PermissionDeniedException(String delegator, String manager) {
        super(PERMISSION_DENIED, manager + " is not allowed to manage positions of " + delegator);
    }
}
