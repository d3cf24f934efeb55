package com.authplatform.credentialsvc.infra.persistence;

import com.authplatform.credentialsvc.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByDisplayName(String displayName);

    @Modifying
    @Query("UPDATE User u SET u.emailVerified = true, u.updatedAt = :now WHERE u.id = :id")
    int markEmailVerified(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE User u SET u.passwordHash = :passwordHash, u.updatedAt = :now WHERE u.id = :id")
    int updatePasswordHash(@Param("id") UUID id, @Param("passwordHash") String passwordHash,
                           @Param("now") Instant now);

    /**
     * Single-statement sweep; the verified flag is re-checked per row by the store.
     */
    @Modifying
    @Query("DELETE FROM User u WHERE u.emailVerified = false AND u.createdAt < :cutoff")
    int deleteUnverifiedCreatedBefore(@Param("cutoff") Instant cutoff);
}
