package com.deepansh.honeypot.archive;

import com.deepansh.honeypot.session.StoreLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Every finalized session ends up here. Writes are upserts keyed by
 * session id so a repeated finalization replaces rather than duplicates.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ArchiveStore {

    private final ArchivedSessionRepository archiveRepo;
    private final MongoTemplate mongoTemplate;
    private final StoreLock storeLock;

    public ArchivedSession upsert(ArchivedSession snapshot) {
        return storeLock.call("archive.upsert", snapshot.getSessionId(), () -> {
            ArchivedSession saved = archiveRepo.save(snapshot);
            log.info("Session archived [sessionId={}, messages={}, scam={}]",
                    saved.getSessionId(), saved.getTotalMessages(), saved.isScam());
            return saved;
        });
    }

    /**
     * Newest first by completion time. Arbitrary offsets are allowed,
     * which is why this goes through MongoTemplate skip/limit rather
     * than a page-aligned Pageable.
     */
    public List<ArchivedSession> list(int limit, int offset) {
        // Mongo reads limit 0 as "no limit"
        if (limit <= 0) {
            return List.of();
        }
        return storeLock.call("archive.list", null, () -> {
            Query query = new Query()
                    .with(Sort.by(Sort.Direction.DESC, "completedAt"))
                    .skip(Math.max(offset, 0))
                    .limit(limit);
            return mongoTemplate.find(query, ArchivedSession.class);
        });
    }

    public Optional<ArchivedSession> find(String sessionId) {
        return storeLock.call("archive.find", sessionId, () -> archiveRepo.findById(sessionId));
    }

    public long count() {
        return storeLock.call("archive.count", null, archiveRepo::count);
    }

    public long clearAll() {
        return storeLock.call("archive.clearAll", null, () -> {
            long count = archiveRepo.count();
            archiveRepo.deleteAll();
            log.info("Archive cleared [count={}]", count);
            return count;
        });
    }
}
