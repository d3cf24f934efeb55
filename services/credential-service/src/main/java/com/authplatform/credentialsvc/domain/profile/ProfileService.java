package com.authplatform.credentialsvc.domain.profile;

import com.authplatform.credentialsvc.domain.model.User;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import com.authplatform.credentialsvc.shared.exception.AccountNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Read side of the authenticated user's account.
 */
@Service
public class ProfileService {

    private final UserRepository userRepository;

    public ProfileService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public ProfileData getProfile(UUID userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new AccountNotFoundException(userId));

        return new ProfileData(
                user.getId(),
                user.getEmail(),
                user.getDisplayName(),
                user.isEmailVerified(),
                user.getCreatedAt()
        );
    }

    public record ProfileData(
            UUID id,
            String email,
            String displayName,
            boolean emailVerified,
            Instant createdAt
    ) {}
}
