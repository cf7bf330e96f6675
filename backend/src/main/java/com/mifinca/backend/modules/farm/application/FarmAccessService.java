package com.mifinca.backend.modules.farm.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.FarmAccessLevel;
import com.mifinca.backend.modules.farm.domain.UserFarmAccess;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessGrantRequest;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessResponse;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessUpdateRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Shared-access grants on farms. A (user, farm) pair holds at most one grant.
 */
@Service
@Transactional
public class FarmAccessService {

    private static final Logger log = LoggerFactory.getLogger(FarmAccessService.class);

    private final UserFarmAccessRepository userFarmAccessRepository;
    private final FarmRepository farmRepository;
    private final AppUserRepository appUserRepository;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;

    public FarmAccessService(
            UserFarmAccessRepository userFarmAccessRepository,
            FarmRepository farmRepository,
            AppUserRepository appUserRepository,
            CurrentActorService currentActorService,
            AccessGuard accessGuard
    ) {
        this.userFarmAccessRepository = userFarmAccessRepository;
        this.farmRepository = farmRepository;
        this.appUserRepository = appUserRepository;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
    }

    public FarmAccessResponse grantAccess(FarmAccessGrantRequest request) {
        Actor actor = currentActorService.requireActor();
        AppUser grantee = appUserRepository.findById(request.userId())
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        Farm farm = farmRepository.findById(request.farmId())
                .orElseThrow(() -> ProblemException.notFound("FARM_NOT_FOUND"));
        accessGuard.requireFarm(actor, farm, AccessOperation.WRITE);

        UserFarmAccessId id = new UserFarmAccessId(grantee.getId(), farm.getId());
        if (userFarmAccessRepository.existsById(id)) {
            throw ProblemException.alreadyExists("FARM_ACCESS_ALREADY_GRANTED");
        }

        FarmAccessLevel level = request.accessLevel() != null ? request.accessLevel() : FarmAccessLevel.VIEW;
        UserFarmAccess grant = new UserFarmAccess(grantee, farm, level, currentActorService.reference(actor));
        grant.setNotes(request.notes());

        UserFarmAccess saved;
        try {
            saved = userFarmAccessRepository.saveAndFlush(grant);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "FARM_ACCESS_ALREADY_GRANTED", null, ex);
        }
        log.info("Farm {} shared with user {} ({}) by {}", farm.getId(), grantee.getId(), level, actor.userId());
        return FarmAccessResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public FarmAccessResponse getGrant(UUID userId, UUID farmId) {
        Actor actor = currentActorService.requireActor();
        UserFarmAccess grant = loadGrant(userId, farmId);
        accessGuard.requireGrant(actor, grant, AccessOperation.READ);
        return FarmAccessResponse.from(grant);
    }

    /**
     * Superusers see every grant; others see grants they hold, assigned, or that touch a farm they own.
     */
    @Transactional(readOnly = true)
    public List<FarmAccessResponse> listGrants() {
        Actor actor = currentActorService.requireActor();
        List<UserFarmAccess> grants = actor.superuser()
                ? userFarmAccessRepository.findAll()
                : userFarmAccessRepository.findVisibleTo(actor.userId());
        return grants.stream().map(FarmAccessResponse::from).toList();
    }

    public FarmAccessResponse updateGrant(UUID userId, UUID farmId, FarmAccessUpdateRequest request) {
        Actor actor = currentActorService.requireActor();
        UserFarmAccess grant = loadGrant(userId, farmId);
        accessGuard.requireGrant(actor, grant, AccessOperation.WRITE);

        if (request.userId() != null && !request.userId().equals(userId)) {
            throw ProblemException.invalid("IMMUTABLE_FIELD", "userId cannot be changed");
        }
        if (request.farmId() != null && !request.farmId().equals(farmId)) {
            throw ProblemException.invalid("IMMUTABLE_FIELD", "farmId cannot be changed");
        }
        if (request.accessLevel() != null) {
            grant.setAccessLevel(request.accessLevel());
        }
        if (request.notes() != null) {
            grant.setNotes(request.notes());
        }
        return FarmAccessResponse.from(userFarmAccessRepository.save(grant));
    }

    public void revokeAccess(UUID userId, UUID farmId) {
        Actor actor = currentActorService.requireActor();
        UserFarmAccess grant = loadGrant(userId, farmId);
        accessGuard.requireGrant(actor, grant, AccessOperation.DELETE);

        userFarmAccessRepository.delete(grant);
        log.info("Farm {} access revoked for user {} by {}", farmId, userId, actor.userId());
    }

    private UserFarmAccess loadGrant(UUID userId, UUID farmId) {
        return userFarmAccessRepository.findById(new UserFarmAccessId(userId, farmId))
                .orElseThrow(() -> ProblemException.notFound("FARM_ACCESS_NOT_FOUND"));
    }
}
