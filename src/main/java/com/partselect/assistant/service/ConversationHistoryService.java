package com.partselect.assistant.service;

import com.partselect.assistant.model.ConversationTurn;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-session message buffer used only to build fallback prompts.
 */
@Service
public class ConversationHistoryService {

    private final ConcurrentHashMap<String, Deque<ConversationTurn>> buffers = new ConcurrentHashMap<>();
    private final int capacity;

    public ConversationHistoryService(@Value("${app.session.history-size:8}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public void append(String sessionId, ConversationTurn turn) {
        Deque<ConversationTurn> buffer = buffer(sessionId);
        synchronized (buffer) {
            buffer.addLast(turn);
            while (buffer.size() > capacity) {
                buffer.removeFirst();
            }
        }
    }

    /**
     * @return oldest first, at most the configured capacity
     */
    public List<ConversationTurn> recent(String sessionId) {
        Deque<ConversationTurn> buffer = buffer(sessionId);
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    public int capacity() {
        return capacity;
    }

    private Deque<ConversationTurn> buffer(String sessionId) {
        return buffers.computeIfAbsent(sessionId == null ? "" : sessionId, id -> new ArrayDeque<>());
    }
}
