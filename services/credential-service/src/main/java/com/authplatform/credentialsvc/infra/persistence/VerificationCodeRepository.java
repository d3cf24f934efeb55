package com.authplatform.credentialsvc.infra.persistence;

import com.authplatform.credentialsvc.domain.model.VerificationCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VerificationCodeRepository extends JpaRepository<VerificationCode, UUID> {

    Optional<VerificationCode> findFirstByEmailAndCodeHash(String email, String codeHash);

    @Query("SELECT COUNT(c) FROM VerificationCode c WHERE c.email = :email AND c.createdAt >= :since")
    long countIssuedSince(@Param("email") String email, @Param("since") Instant since);

    @Query("SELECT MIN(c.createdAt) FROM VerificationCode c WHERE c.email = :email AND c.createdAt >= :since")
    Optional<Instant> findOldestIssuedSince(@Param("email") String email, @Param("since") Instant since);

    @Modifying
    @Query("DELETE FROM VerificationCode c WHERE c.id = :id")
    int deleteRowById(@Param("id") UUID id);
}
