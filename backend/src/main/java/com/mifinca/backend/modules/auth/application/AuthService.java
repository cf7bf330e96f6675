package com.mifinca.backend.modules.auth.application;

import java.util.Locale;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.mifinca.backend.modules.auth.presentation.dto.LoginRequest;
import com.mifinca.backend.modules.auth.presentation.dto.LoginResponse;
import com.mifinca.backend.modules.auth.presentation.dto.RegisterRequest;
import com.mifinca.backend.modules.auth.presentation.dto.TokenResponse;
import com.mifinca.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public UserProfileResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.alreadyExists("EMAIL_ALREADY_REGISTERED");
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(trimToNull(request.firstName()));
        user.setLastName(trimToNull(request.lastName()));
        user.setPhoneNumber(trimToNull(request.phoneNumber()));
        user.setActive(true);
        user.setSuperuser(false);

        try {
            AppUser saved = appUserRepository.saveAndFlush(user);
            log.info("Registered user {}", saved.getId());
            return UserProfileResponse.from(saved);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "EMAIL_ALREADY_REGISTERED", null, ex);
        }
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ProblemException(ProblemCategory.UNAUTHENTICATED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(ProblemCategory.UNAUTHENTICATED, "INVALID_CREDENTIALS");
        }

        if (!user.isActive()) {
            throw new ProblemException(ProblemCategory.FORBIDDEN, "USER_INACTIVE");
        }

        TokenResponse tokens = jwtTokenService.issueAccessToken(user.getId(), user.getEmail());
        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ProblemCategory.UNAUTHENTICATED, "UNAUTHENTICATED"));
        return UserProfileResponse.from(user);
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
