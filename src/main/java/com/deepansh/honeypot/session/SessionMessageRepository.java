package com.deepansh.honeypot.session;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionMessageRepository extends MongoRepository<SessionMessage, String> {

    List<SessionMessage> findBySessionIdOrderBySeqAsc(String sessionId);

    void deleteBySessionId(String sessionId);
}
