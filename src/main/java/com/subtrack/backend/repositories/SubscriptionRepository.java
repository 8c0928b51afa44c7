package com.subtrack.backend.repositories;

import com.subtrack.backend.models.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    /**
     * Find subscription with its owner loaded, so name and email are available outside the session
     */
    @Query("SELECT s FROM Subscription s JOIN FETCH s.user WHERE s.id = :id")
    Optional<Subscription> findWithUserById(@Param("id") Long id);

    List<Subscription> findByUserIdOrderByRenewalDateAsc(Long userId);
}
