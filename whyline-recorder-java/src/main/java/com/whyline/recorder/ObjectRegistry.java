package com.whyline.recorder;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Side table from live object identity to a sequential display id.
 * Ids are handed out monotonically starting at 1 and never reused until {@link #clear()}.
 */
final class ObjectRegistry {

    private final Map<Object, Long> ids = new IdentityHashMap<>();
    private long lastId;

    synchronized long idOf(Object obj) {
        Long id = ids.get(obj);
        if (id == null) {
            id = ++lastId;
            ids.put(obj, id);
        }
        return id;
    }

    synchronized int size() {
        return ids.size();
    }

    synchronized void clear() {
        ids.clear();
        lastId = 0;
    }
}
