package com.browserswarm.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Run-scoped set of claimed target labels, keyed by their normalized form.
 * Guarded by its own lock, independent of the worker pool's.
 */
@Slf4j
public class ClaimRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Integer> owners = new LinkedHashMap<>();

    /**
     * Inserts the label for the agent. Returns false when the label is blank or already claimed,
     * including by the same agent.
     */
    public boolean claim(int agentId, @Nullable String label) {
        String normalized = normalize(label);
        if (normalized.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            if (owners.containsKey(normalized)) {
                log.info("Agent {} denied claim for '{}': already claimed by agent {}.", agentId, label, owners.get(normalized));
                return false;
            }
            owners.put(normalized, agentId);
            log.info("Agent {} claimed '{}'.", agentId, label);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accepts the label for the agent if the agent already owns it or nobody does yet.
     */
    public boolean confirm(int agentId, @Nullable String label) {
        String normalized = normalize(label);
        if (normalized.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            Integer owner = owners.putIfAbsent(normalized, agentId);
            return owner == null || owner == agentId;
        } finally {
            lock.unlock();
        }
    }

    @Nullable
    public Integer ownerOf(@Nullable String label) {
        lock.lock();
        try {
            return owners.get(normalize(label));
        } finally {
            lock.unlock();
        }
    }

    public List<String> labels() {
        lock.lock();
        try {
            return List.copyOf(owners.keySet());
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            owners.clear();
        } finally {
            lock.unlock();
        }
    }

    public static String normalize(@Nullable String label) {
        if (!StringUtils.hasText(label)) {
            return "";
        }
        return label.trim().toLowerCase(Locale.ROOT);
    }
}
