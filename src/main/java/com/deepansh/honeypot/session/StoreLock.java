package com.deepansh.honeypot.session;

import com.deepansh.honeypot.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.convert.ConversionException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mapping.MappingException;
import org.springframework.data.mapping.model.MappingInstantiationException;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The one exclusive lock shared by the active, archive and scam-intelligence
 * stores.
 *
 * Every public store operation runs inside {@link #call}. The lock is
 * reentrant, so the finalization engine can take it once around
 * read, write-to-archive and clear, and the store calls it makes
 * nest inside without deadlocking. That is what keeps a session id from
 * ever being both active and archived as seen by another thread.
 *
 * Driver failures (DataAccessException) and documents that no longer map
 * onto their class (mapping, instantiation or conversion errors) are
 * translated to {@link StorageException} here so callers only ever see
 * the domain type.
 */
@Component
@Slf4j
public class StoreLock {

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T call(String operation, String sessionId, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } catch (DataAccessException | MappingException | MappingInstantiationException | ConversionException e) {
            log.error("Storage failure in {} [sessionId={}]: {}", operation, sessionId, e.getMessage());
            throw new StorageException(operation, sessionId, e);
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, String sessionId, Runnable action) {
        call(operation, sessionId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
