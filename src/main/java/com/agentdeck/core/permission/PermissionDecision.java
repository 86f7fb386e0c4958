package com.agentdeck.core.permission;

/**
 * Outcome of a permission check.
 *
 * @param behavior         allow, deny or ask
 * @param reason           human-readable explanation
 * @param source           the rule that decided
 * @param matchedPattern   the pattern that matched, if any
 * @param suggestedPattern for {@code ask}, the pattern to store if the human chooses to remember
 * @param remember         how long an allow should be reused; {@link RememberScope#ONCE} unless a human said otherwise
 */
public record PermissionDecision(
    PermissionBehavior behavior,
    String reason,
    DecisionSource source,
    PermissionPattern matchedPattern,
    String suggestedPattern,
    RememberScope remember
) {

    public static PermissionDecision allow(String reason, DecisionSource source, PermissionPattern matched) {
        return new PermissionDecision(PermissionBehavior.ALLOW, reason, source, matched, null, RememberScope.ONCE);
    }

    public static PermissionDecision deny(String reason, DecisionSource source, PermissionPattern matched) {
        return new PermissionDecision(PermissionBehavior.DENY, reason, source, matched, null, RememberScope.ONCE);
    }

    public static PermissionDecision ask(String reason, String suggestedPattern) {
        return new PermissionDecision(PermissionBehavior.ASK, reason, DecisionSource.ASK_FALLBACK, null,
                suggestedPattern, RememberScope.ONCE);
    }

    public boolean isAllowed() {
        return behavior == PermissionBehavior.ALLOW;
    }

    public boolean isDenied() {
        return behavior == PermissionBehavior.DENY;
    }

    public boolean needsUser() {
        return behavior == PermissionBehavior.ASK;
    }
}
