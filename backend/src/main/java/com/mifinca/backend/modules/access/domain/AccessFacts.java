package com.mifinca.backend.modules.access.domain;

/**
 * Boolean facts about a caller's relation to one resource. Which relation each flag stands for
 * depends on the {@link ResourcePolicy} the facts are evaluated against:
 * <ul>
 *     <li>{@code owner}: farm owner, animal owner, grupo creator, event recorder, transaction sender,
 *     or owner or grantee of a batch's farm</li>
 *     <li>{@code sharedAccess}: farm grant, access to an affected animal, transaction receiver, grantee,
 *     or batch recorder</li>
 *     <li>{@code delegator}: the user who assigned a farm grant</li>
 * </ul>
 */
public record AccessFacts(boolean superuser, boolean owner, boolean sharedAccess, boolean delegator) {

    public static AccessFacts of(Actor actor, boolean owner, boolean sharedAccess) {
        return new AccessFacts(actor.superuser(), owner, sharedAccess, false);
    }

    public static AccessFacts forGrant(Actor actor, boolean farmOwner, boolean grantee, boolean delegator) {
        return new AccessFacts(actor.superuser(), farmOwner, grantee, delegator);
    }

    public static AccessFacts actorOnly(Actor actor) {
        return new AccessFacts(actor.superuser(), false, false, false);
    }
}
