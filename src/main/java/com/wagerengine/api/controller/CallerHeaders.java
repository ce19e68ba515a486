package com.wagerengine.api.controller;

import com.wagerengine.common.exception.UnauthorizedCallerException;

/**
 * Caller identity carried on every request.
 */
final class CallerHeaders {

    static final String CALLER = "X-Caller-Id";

    private CallerHeaders() {
    }

    /**
     * Players may only move funds of their own account.
     */
    static void requireSelf(String caller, String identity) {
        if (caller == null || !caller.equals(identity)) {
            throw new UnauthorizedCallerException(caller, "may only act on its own account " + identity);
        }
    }
}
