package com.zero.core.cache;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which (target, analyzer) keys are being produced right now so the same
 * artifact is never computed by two runs at once.
 */
public class RunClaims {

    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    public boolean tryClaim(String target, String analyzerId) {
        return claimed.add(key(target, analyzerId));
    }

    /**
     * @throws ConflictingRunException if the key is already claimed
     */
    public void claim(String target, String analyzerId) {
        if (!tryClaim(target, analyzerId)) {
            throw new ConflictingRunException(target, List.of(analyzerId));
        }
    }

    public void release(String target, String analyzerId) {
        claimed.remove(key(target, analyzerId));
    }

    public boolean isClaimed(String target, String analyzerId) {
        return claimed.contains(key(target, analyzerId));
    }

    public int size() {
        return claimed.size();
    }

    private static String key(String target, String analyzerId) {
        return target + '\u0000' + analyzerId;
    }
}
