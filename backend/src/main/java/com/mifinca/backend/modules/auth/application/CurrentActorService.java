package com.mifinca.backend.modules.auth.application;

import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.global.security.SecurityUtils;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns the authenticated principal into an {@link Actor} backed by the current state of the user row.
 */
@Service
@Transactional(readOnly = true)
public class CurrentActorService {

    private final AppUserRepository appUserRepository;

    public CurrentActorService(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    public Actor requireActor() {
        return resolve(SecurityUtils.getCurrentUserId());
    }

    public Actor resolve(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ProblemCategory.UNAUTHENTICATED, "UNAUTHENTICATED"));
        if (!user.isActive()) {
            throw new ProblemException(ProblemCategory.FORBIDDEN, "USER_INACTIVE");
        }
        return new Actor(user.getId(), true, user.isSuperuser());
    }

    /**
     * Reference to the actor's row for use as an owner or audit column.
     */
    public AppUser reference(Actor actor) {
        return appUserRepository.getReferenceById(actor.userId());
    }
}
