package com.mifinca.backend.modules.auth.application;

import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.mifinca.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.mifinca.backend.modules.auth.presentation.dto.UserListResponse;
import com.mifinca.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Superuser-only user management.
 */
@Service
@Transactional
public class UserAdminService {

    private static final Logger log = LoggerFactory.getLogger(UserAdminService.class);
    private static final int MAX_PAGE_SIZE = 100;

    private final AppUserRepository appUserRepository;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;

    public UserAdminService(
            AppUserRepository appUserRepository,
            CurrentActorService currentActorService,
            AccessGuard accessGuard
    ) {
        this.appUserRepository = appUserRepository;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
    }

    @Transactional(readOnly = true)
    public UserListResponse listUsers(Boolean active, int page, int size) {
        Actor actor = currentActorService.requireActor();
        accessGuard.requireSuperuser(actor, ResourcePolicy.USER_ADMINISTRATION, AccessOperation.READ);

        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        PageRequest pageable = PageRequest.of(Math.max(page, 0), safeSize);
        Page<AppUser> result = appUserRepository.findByActiveFilter(active, pageable);
        return new UserListResponse(
                result.getContent().stream().map(UserProfileResponse::from).toList(),
                result.getTotalElements()
        );
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getUser(UUID userId) {
        Actor actor = currentActorService.requireActor();
        AppUser user = loadUser(userId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.USER_ADMINISTRATION, AccessOperation.READ);
        return UserProfileResponse.from(user);
    }

    public UserProfileResponse updateUser(UUID userId, UpdateUserRequest request) {
        Actor actor = currentActorService.requireActor();
        AppUser user = loadUser(userId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.USER_ADMINISTRATION, AccessOperation.WRITE);

        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.phoneNumber() != null) {
            user.setPhoneNumber(request.phoneNumber().trim());
        }
        if (request.active() != null && request.active() != user.isActive()) {
            user.setActive(request.active());
            log.info("User {} active={} set by {}", userId, request.active(), actor.userId());
        }
        if (request.superuser() != null && request.superuser() != user.isSuperuser()) {
            user.setSuperuser(request.superuser());
            log.info("User {} superuser={} set by {}", userId, request.superuser(), actor.userId());
        }
        return UserProfileResponse.from(appUserRepository.save(user));
    }

    public void deleteUser(UUID userId) {
        Actor actor = currentActorService.requireActor();
        AppUser user = loadUser(userId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.USER_ADMINISTRATION, AccessOperation.DELETE);

        appUserRepository.delete(user);
        log.info("User {} deleted by {}", userId, actor.userId());
    }

    private AppUser loadUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
    }
}
