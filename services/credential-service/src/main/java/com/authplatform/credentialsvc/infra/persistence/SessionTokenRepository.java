package com.authplatform.credentialsvc.infra.persistence;

import com.authplatform.credentialsvc.domain.model.SessionToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SessionTokenRepository extends JpaRepository<SessionToken, UUID> {

    Optional<SessionToken> findByTokenHash(String tokenHash);

    Optional<SessionToken> findFirstByPreviousTokenHash(String previousTokenHash);

    long countByUserId(UUID userId);

    /**
     * Conditional delete used as the rotation linearization point: of concurrent callers holding
     * the same row, exactly one sees {@code 1}.
     */
    @Modifying
    @Query("DELETE FROM SessionToken t WHERE t.id = :id AND t.expiresAt > :now")
    int deleteLiveById(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM SessionToken t WHERE t.id = :id")
    int deleteRowById(@Param("id") UUID id);

    @Modifying
    @Query("DELETE FROM SessionToken t WHERE t.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("DELETE FROM SessionToken t WHERE t.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);
}
