package com.deepansh.honeypot.archive;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ArchivedSessionRepository extends MongoRepository<ArchivedSession, String> {
}
