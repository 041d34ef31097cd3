package com.ryuqq.reskit.core.cache;

import com.ryuqq.reskit.core.model.Asset;
import com.ryuqq.reskit.core.model.ResourceKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 참조 카운트 기반 공유 리소스 캐시.
 *
 * <p>ResourceCache는 {@link ResourceKey} → {@link CacheEntry} 매핑을 보유하며,
 * 참조 카운트 변경의 유일한 주체입니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>insert: 참조 카운트 1로 새 항목 생성. 이미 항목이 있으면 카운트를 증가시키고
 *       중복 로드된 리소스는 백엔드로 즉시 해제</li>
 *   <li>addRef: 살아 있는 항목의 카운트 증가. 없는 키는 무시</li>
 *   <li>release: 카운트 감소. 0에 도달하고 고정(pin)되지 않았으면 항목 제거,
 *       INVALID 전이, 백엔드 해제 (백엔드 해제는 항목당 정확히 한 번)</li>
 *   <li>없는 키나 카운트가 이미 0인 항목의 release는 무시 (이중 해제 안전)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 모든 테이블 변경은 이 객체의 모니터로 보호됩니다.
 * 로드 코디네이터도 진행 중 요청 테이블을 같은 모니터로 보호하므로,
 * 캐시 조회와 진행 중 요청 등록을 하나의 원자적 단계로 수행할 수 있습니다.
 * 백엔드 해제는 모니터를 놓은 뒤 호출됩니다.</p>
 *
 * @author ResKit Team
 * @since 1.0.0
 */
public class ResourceCache {

    private static final Logger log = LoggerFactory.getLogger(ResourceCache.class);

    private final BackendRegistry backends;
    private final Map<ResourceKey, CacheEntry> entries = new HashMap<>();

    /**
     * ResourceCache 생성.
     *
     * @param backends 해제 시 사용할 백엔드 레지스트리
     * @throws IllegalArgumentException backends가 null인 경우
     */
    public ResourceCache(BackendRegistry backends) {
        if (backends == null) {
            throw new IllegalArgumentException("backends cannot be null");
        }
        this.backends = backends;
    }

    /**
     * 항목 조회. 참조 카운트는 변경하지 않습니다.
     *
     * @param key 리소스 키
     * @return 캐시 항목 (없으면 null)
     */
    public synchronized CacheEntry get(ResourceKey key) {
        requireKey(key);
        return entries.get(key);
    }

    /**
     * 새 항목 삽입 (참조 카운트 1).
     *
     * <p>이미 항목이 있으면 기존 항목의 카운트를 증가시키고, 전달된 리소스는
     * 중복으로 간주해 백엔드로 해제합니다.</p>
     *
     * @param key 리소스 키
     * @param asset 로드된 리소스
     * @return 참조를 보유하게 된 항목
     */
    public CacheEntry insert(ResourceKey key, Asset asset) {
        CacheEntry entry = insertOrAddRefs(key, asset, 1);
        if (entry.getAsset() != asset) {
            releaseAsset(key, asset);
        }
        return entry;
    }

    /**
     * 새 항목 삽입 또는 기존 항목에 참조 추가.
     *
     * <p>반환된 항목의 리소스가 전달한 리소스와 다르면 중복 삽입이며,
     * 호출자는 모니터 밖에서 {@link #releaseAsset(ResourceKey, Asset)}로
     * 중복 리소스를 해제해야 합니다.</p>
     *
     * @param key 리소스 키
     * @param asset 로드된 리소스
     * @param refs 추가할 참조 수 (1 이상)
     * @return 참조를 보유하게 된 항목
     * @throws IllegalArgumentException key 또는 asset이 null이거나 refs가 1 미만인 경우
     */
    public synchronized CacheEntry insertOrAddRefs(ResourceKey key, Asset asset, int refs) {
        requireKey(key);
        if (asset == null) {
            throw new IllegalArgumentException("asset cannot be null");
        }
        if (refs < 1) {
            throw new IllegalArgumentException("refs must be positive (current: " + refs + ")");
        }

        CacheEntry existing = entries.get(key);
        if (existing != null) {
            existing.addRefs(refs);
            log.warn("Duplicate insert for {}, keeping cached asset (refCount={})",
                key.asCacheKey(), existing.getRefCount());
            return existing;
        }

        CacheEntry entry = new CacheEntry(key, asset, refs);
        entries.put(key, entry);
        log.debug("Cached {} (refCount={})", key.asCacheKey(), refs);
        return entry;
    }

    /**
     * 살아 있는 항목의 참조 카운트 증가.
     *
     * @param key 리소스 키
     * @return 항목이 있어 증가했으면 true, 없으면 false
     */
    public synchronized boolean addRef(ResourceKey key) {
        requireKey(key);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        entry.addRefs(1);
        return true;
    }

    /**
     * 참조 하나 해제.
     *
     * <p>카운트가 0에 도달하고 고정되지 않은 항목은 제거되어 INVALID가 되며,
     * 백엔드 해제가 호출됩니다. 없는 키나 카운트가 0인 항목은 무시합니다.</p>
     *
     * @param key 리소스 키
     */
    public void release(ResourceKey key) {
        CacheEntry destroyed;
        synchronized (this) {
            requireKey(key);
            CacheEntry entry = entries.get(key);
            if (entry == null || entry.getRefCount() == 0) {
                return;
            }
            entry.decrement();
            if (entry.getRefCount() > 0 || entry.isPinned()) {
                return;
            }
            destroyed = destroy(entry);
        }
        releaseAsset(key, destroyed.getAsset());
    }

    /**
     * 항목 고정. 고정된 항목은 카운트가 0이 되어도 제거되지 않습니다.
     *
     * <p>임베더용 API입니다. 엔진 내부 경로는 이 메서드를 호출하지 않으며,
     * 아카이브 번들 고정은 {@code DependencyGraph}가 번들 단위로 처리합니다.
     * 고정한 쪽이 {@link #unpin(ResourceKey)}로 해제해야 합니다.</p>
     *
     * @param key 리소스 키
     * @return 항목이 있어 고정했으면 true
     */
    public synchronized boolean pin(ResourceKey key) {
        requireKey(key);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        entry.setPinned(true);
        return true;
    }

    /**
     * 항목 고정 해제. 카운트가 이미 0이면 즉시 파괴됩니다.
     *
     * <p>{@link #pin(ResourceKey)}와 짝을 이루는 임베더용 API입니다.</p>
     *
     * @param key 리소스 키
     * @return 항목이 있어 고정 해제했으면 true
     */
    public boolean unpin(ResourceKey key) {
        CacheEntry destroyed = null;
        synchronized (this) {
            requireKey(key);
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            entry.setPinned(false);
            if (entry.getRefCount() == 0) {
                destroyed = destroy(entry);
            }
        }
        if (destroyed != null) {
            releaseAsset(key, destroyed.getAsset());
        }
        return true;
    }

    /**
     * 참조 카운트 조회.
     *
     * @param key 리소스 키
     * @return 참조 카운트 (항목이 없으면 0)
     */
    public synchronized int refCount(ResourceKey key) {
        requireKey(key);
        CacheEntry entry = entries.get(key);
        return entry == null ? 0 : entry.getRefCount();
    }

    public synchronized boolean contains(ResourceKey key) {
        requireKey(key);
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized List<ResourceKey> keys() {
        return List.copyOf(entries.keySet());
    }

    /**
     * 캐시에 없는 리소스를 백엔드로 해제.
     *
     * <p>백엔드 예외는 ERROR로 기록되고 전파되지 않습니다. 모니터를 보유한 상태로
     * 호출하면 안 됩니다.</p>
     *
     * @param key 리소스 키
     * @param asset 해제할 리소스
     */
    public void releaseAsset(ResourceKey key, Asset asset) {
        try {
            backends.get(key.getKind()).release(key, asset);
            log.debug("Released {}", key.asCacheKey());
        } catch (Exception e) {
            log.error("Backend release failed for {}", key.asCacheKey(), e);
        }
    }

    private CacheEntry destroy(CacheEntry entry) {
        entries.remove(entry.getKey());
        entry.invalidate();
        return entry;
    }

    private static void requireKey(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
