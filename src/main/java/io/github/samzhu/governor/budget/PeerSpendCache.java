package io.github.samzhu.governor.budget;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 以節點名稱為 key 的花費快取。
 *
 * <p>設計原則：
 * <ul>
 *   <li>只有 {@link #put} 會修改內容，每次同步成功就覆寫該節點的記錄</li>
 *   <li>過期資料不刪除，由讀取端依 {@code stalenessLimit} 排除</li>
 *   <li>{@code maxPeers > 0} 時保留最近回報的 N 個節點，淘汰最久未回報者</li>
 *   <li>獨立的讀寫鎖，不與預算設定的鎖同時持有</li>
 * </ul>
 */
class PeerSpendCache {

    private final Duration stalenessLimit;
    private final Map<String, PeerSpend> entries;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    PeerSpendCache(Duration stalenessLimit, int maxPeers) {
        this.stalenessLimit = stalenessLimit;
        // insertion order; put() re-inserts so the eldest entry is the least recently reported peer
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PeerSpend> eldest) {
                return maxPeers > 0 && size() > maxPeers;
            }
        };
    }

    void put(String peerName, PeerSpend spend) {
        lock.writeLock().lock();
        try {
            entries.remove(peerName);
            entries.put(peerName, spend);
        } finally {
            lock.writeLock().unlock();
        }
    }

    Optional<PeerSpend> get(String peerName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(peerName));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 回傳在 {@code now} 時仍未過期的節點資料。
     */
    List<PeerSpend> fresh(Instant now) {
        lock.readLock().lock();
        try {
            List<PeerSpend> result = new ArrayList<>(entries.size());
            for (PeerSpend spend : entries.values()) {
                if (!spend.isStale(now, stalenessLimit)) {
                    result.add(spend);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    Duration stalenessLimit() {
        return stalenessLimit;
    }
}
