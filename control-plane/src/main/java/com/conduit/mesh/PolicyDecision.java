package com.conduit.mesh;

/**
 * What the first matching traffic rule asks for. All fields are optional.
 *
 * @param redirectService service to route to instead of the requested one
 * @param abortStatus     simulated HTTP status when the abort fault fired
 * @param delayMs         delay the caller should inject, 0 when none
 * @param mirrorService   service the caller should mirror the request to
 */
public record PolicyDecision(
        String redirectService,
        Integer abortStatus,
        long delayMs,
        String mirrorService
) {

    public static final PolicyDecision NONE = new PolicyDecision(null, null, 0, null);

    public boolean isAbort() {
        return abortStatus != null;
    }
}
