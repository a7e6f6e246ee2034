package com.tripdispatch.dispatch.tracking;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ShareTokenRepository extends JpaRepository<ShareToken, String> {

    List<ShareToken> findByTripIdAndRevokedFalse(UUID tripId);
}
