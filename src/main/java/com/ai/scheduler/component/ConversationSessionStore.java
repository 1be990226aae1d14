package com.ai.scheduler.component;

import com.ai.scheduler.conversation.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory sessions keyed by an opaque session key. Turns on the same key run one
 * at a time; different keys proceed in parallel. A turn mutates a copy of the state
 * that is committed only if the turn returns normally.
 */
@Component
public class ConversationSessionStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationSessionStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Runs {@code turn} with exclusive access to the session for {@code sessionKey},
     * creating the session on first use.
     */
    public <T> T withSession(String sessionKey, Function<ConversationState, T> turn) {
        Session session = sessions.computeIfAbsent(sessionKey, key -> {
            log.info("[{}] New session", key);
            return new Session();
        });
        session.lock.lock();
        try {
            ConversationState working = session.state.copy();
            T result = turn.apply(working);
            session.state = working;
            return result;
        } finally {
            session.lock.unlock();
        }
    }

    /** Copy of the current state, if the session exists. */
    public Optional<ConversationState> find(String sessionKey) {
        Session session = sessions.get(sessionKey);
        if (session == null) {
            return Optional.empty();
        }
        session.lock.lock();
        try {
            return Optional.of(session.state.copy());
        } finally {
            session.lock.unlock();
        }
    }

    public boolean evict(String sessionKey) {
        boolean removed = sessions.remove(sessionKey) != null;
        if (removed) {
            log.info("[{}] Session evicted", sessionKey);
        }
        return removed;
    }

    public int clear() {
        int count = sessions.size();
        sessions.clear();
        log.info("Cleared {} sessions", count);
        return count;
    }

    public int size() {
        return sessions.size();
    }

    private static final class Session {
        private final ReentrantLock lock = new ReentrantLock();
        private ConversationState state = new ConversationState();
    }
}
