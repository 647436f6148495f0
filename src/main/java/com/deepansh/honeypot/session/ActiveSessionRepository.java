package com.deepansh.honeypot.session;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ActiveSessionRepository extends MongoRepository<ActiveSession, String> {

    List<ActiveSession> findByUpdatedAtBefore(Instant cutoff);

    List<ActiveSession> findAllByOrderByUpdatedAtDesc();
}
