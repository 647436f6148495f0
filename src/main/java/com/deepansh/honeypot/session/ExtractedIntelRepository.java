package com.deepansh.honeypot.session;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExtractedIntelRepository extends MongoRepository<ExtractedIntel, String> {
}
