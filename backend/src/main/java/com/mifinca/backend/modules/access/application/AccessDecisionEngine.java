package com.mifinca.backend.modules.access.application;

import com.mifinca.backend.modules.access.domain.AccessFacts;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.AccessVerdict;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;

import org.springframework.stereotype.Component;

/**
 * Evaluates access facts against the policy table. Stateless; never touches the store.
 *
 * <pre>
 * resource             read                          write                    delete
 * FARM                 owner                         owner                    owner
 * LOT, PRODUCT         farm owner or shared          farm owner               farm owner
 * ANIMAL               owner or farm access          owner or farm access     owner
 * ANIMAL_LINEAGE       owner                         owner                    owner
 * GRUPO                creator                       creator                  creator
 * ANIMAL_EVENT         recorder or animal access     recorder                 recorder
 * BATCH                farm access, recorder or      farm access              farm access
 *                      animal access
 * TRANSACTION          sender or receiver            sender                   sender
 * FARM_ACCESS_GRANT    farm owner, grantor, grantee  farm owner, grantor      superuser
 * RBAC_ASSOCIATION     superuser                     superuser                superuser
 * USER_ADMINISTRATION  superuser                     superuser                superuser
 * CONFIGURATION_PARAMETER  any active user           superuser                superuser
 * </pre>
 *
 * Superusers are allowed everything.
 */
@Component
public class AccessDecisionEngine {

    public AccessVerdict decide(ResourcePolicy policy, AccessFacts facts, AccessOperation operation) {
        if (facts.superuser()) {
            return AccessVerdict.allow(policy, operation, "superuser");
        }
        return switch (policy) {
            case FARM, GRUPO, ANIMAL_LINEAGE -> ownerOnly(policy, facts, operation);
            case LOT, PRODUCT -> operation == AccessOperation.READ
                    ? ownerOrShared(policy, facts, operation)
                    : ownerOnly(policy, facts, operation);
            case ANIMAL -> operation == AccessOperation.DELETE
                    ? ownerOnly(policy, facts, operation)
                    : ownerOrShared(policy, facts, operation);
            case ANIMAL_EVENT, TRANSACTION, BATCH -> operation == AccessOperation.READ
                    ? ownerOrShared(policy, facts, operation)
                    : ownerOnly(policy, facts, operation);
            case FARM_ACCESS_GRANT -> decideGrant(facts, operation);
            case RBAC_ASSOCIATION, USER_ADMINISTRATION ->
                    AccessVerdict.deny(policy, operation, "superuser required");
            case CONFIGURATION_PARAMETER -> operation == AccessOperation.READ
                    ? AccessVerdict.allow(policy, operation, "active user")
                    : AccessVerdict.deny(policy, operation, "superuser required");
        };
    }

    public boolean isAllowed(ResourcePolicy policy, AccessFacts facts, AccessOperation operation) {
        return decide(policy, facts, operation).allowed();
    }

    private AccessVerdict decideGrant(AccessFacts facts, AccessOperation operation) {
        ResourcePolicy policy = ResourcePolicy.FARM_ACCESS_GRANT;
        return switch (operation) {
            case READ -> facts.owner() || facts.delegator() || facts.sharedAccess()
                    ? AccessVerdict.allow(policy, operation, "farm owner, grantor or grantee")
                    : AccessVerdict.deny(policy, operation, "not related to grant");
            case WRITE -> facts.owner() || facts.delegator()
                    ? AccessVerdict.allow(policy, operation, "farm owner or grantor")
                    : AccessVerdict.deny(policy, operation, "farm owner or grantor required");
            case DELETE -> AccessVerdict.deny(policy, operation, "superuser required");
        };
    }

    private AccessVerdict ownerOnly(ResourcePolicy policy, AccessFacts facts, AccessOperation operation) {
        return facts.owner()
                ? AccessVerdict.allow(policy, operation, "owner")
                : AccessVerdict.deny(policy, operation, "owner required");
    }

    private AccessVerdict ownerOrShared(ResourcePolicy policy, AccessFacts facts, AccessOperation operation) {
        if (facts.owner()) {
            return AccessVerdict.allow(policy, operation, "owner");
        }
        return facts.sharedAccess()
                ? AccessVerdict.allow(policy, operation, "shared access")
                : AccessVerdict.deny(policy, operation, "no owner or shared access");
    }
}
