package com.rvoc.user;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.name = :name")
    Optional<User> findByNameForUpdate(@Param("name") String name);

    /**
     * Zeroes the counters of every user whose reset is due at {@code cutoff} and moves their reset
     * to {@code nextReset}. With {@code nextReset} after {@code cutoff}, running it again with the
     * same arguments matches no rows.
     */
    @Modifying
    @Query("""
            UPDATE User u
            SET u.loginAttemptCount = 0,
                u.failedLoginAttemptCount = 0,
                u.nextLoginAttemptCountReset = :nextReset
            WHERE u.nextLoginAttemptCountReset <= :cutoff
            """)
    int resetLoginCounters(@Param("cutoff") OffsetDateTime cutoff, @Param("nextReset") OffsetDateTime nextReset);
}
