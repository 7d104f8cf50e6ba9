package complaint.router.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-mailbox locks. Distinct mailboxes never contend; one mailbox is processed and its cursor
 * written by a single thread at a time.
 */
@Slf4j
@Service
public class MailboxLockService {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Attempts to acquire the lock for a mailbox without waiting.
     * @return true if the lock was acquired, false if another pass holds it
     */
    public boolean tryLock(String mailboxId) {
        boolean acquired = lockFor(mailboxId).tryLock();
        if (acquired) {
            log.debug("Acquired lock for mailbox: {}", mailboxId);
        } else {
            log.debug("Mailbox {} is already being processed, skipping", mailboxId);
        }
        return acquired;
    }

    /**
     * Waits up to {@code timeoutMs} for the lock.
     */
    public boolean tryLock(String mailboxId, long timeoutMs) throws InterruptedException {
        return lockFor(mailboxId).tryLock(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public void releaseLock(String mailboxId) {
        ReentrantLock lock = locks.get(mailboxId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Released lock for mailbox: {}", mailboxId);
        } else {
            log.warn("Attempted to release lock for mailbox {} but it is not held by this thread", mailboxId);
        }
    }

    private ReentrantLock lockFor(String mailboxId) {
        return locks.computeIfAbsent(mailboxId, id -> new ReentrantLock());
    }
}
