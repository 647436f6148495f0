package com.deepansh.honeypot.intel;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScamIntelligenceRepository extends MongoRepository<ScamIntelligenceRecord, String> {

    List<ScamIntelligenceRecord> findByPushedToExternalFalseOrderByCreatedAtAsc();

    long countByPushedToExternalFalse();
}
