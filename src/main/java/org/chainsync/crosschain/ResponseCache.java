package org.chainsync.crosschain;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Class ResponseCache
 *
 * Cache node responses to reduce redundant RPCs to the node.
 * <p>
 * Entries expire at an absolute timestamp and are swept on a fixed interval.
 * The store is insertion ordered, which doubles as the eviction index: when the
 * cache is full, the oldest key is evicted before a new key is inserted.
 */
public class ResponseCache<V> {

	private static final Logger LOGGER = LogManager.getLogger(ResponseCache.class);

	public static final long DEFAULT_EXPIRY = 5 * 60 * 1000L;

	private static class CacheEntry<V> {
		final V value;
		final long expiry;

		CacheEntry(V value, long expiry) {
			this.value = value;
			this.expiry = expiry;
		}
	}

	/**
	 * Store
	 *
	 * Key -> (value, expiry), iteration order is insertion order.
	 */
	private final LinkedHashMap<String, CacheEntry<V>> store = new LinkedHashMap<>();

	private final long cacheTimeout;
	private final int maxCacheSize;
	private final ScheduledExecutorService sweeper;

	private volatile boolean stopped = false;

	/**
	 * @param cacheTimeout default lifetime of an entry, ms
	 * @param maxCacheSize maximum number of entries
	 * @param sweepInterval period between expiry sweeps, ms
	 */
	public ResponseCache(long cacheTimeout, int maxCacheSize, long sweepInterval) {
		if (maxCacheSize < 1)
			throw new IllegalArgumentException("cache size must be positive");

		this.cacheTimeout = cacheTimeout;
		this.maxCacheSize = maxCacheSize;

		this.sweeper = Executors.newSingleThreadScheduledExecutor(
				new ThreadFactoryBuilder().setNameFormat("Response Cache Sweeper-%d").setDaemon(true).build());
		this.sweeper.scheduleAtFixedRate(this::sweep, sweepInterval, sweepInterval, TimeUnit.MILLISECONDS);
	}

	/** Stores <tt>value</tt> with the default expiry. */
	public void set(String key, V value) {
		set(key, value, System.currentTimeMillis() + this.cacheTimeout);
	}

	/**
	 * Stores <tt>value</tt> until <tt>expiry</tt>.
	 *
	 * @param expiry absolute timestamp, ms since epoch
	 */
	public void set(String key, V value, long expiry) {
		synchronized (this.store) {
			// Re-setting a key moves it to the back of the eviction order
			if (this.store.remove(key) == null && this.store.size() >= this.maxCacheSize)
				removeOldest();

			this.store.put(key, new CacheEntry<>(value, expiry));
		}
	}

	/**
	 * Returns cached value, empty if absent or expired.
	 */
	public Optional<V> get(String key) {
		synchronized (this.store) {
			CacheEntry<V> entry = this.store.get(key);
			if (entry == null)
				return Optional.empty();

			if (System.currentTimeMillis() >= entry.expiry) {
				this.store.remove(key);
				return Optional.empty();
			}

			return Optional.ofNullable(entry.value);
		}
	}

	public int size() {
		synchronized (this.store) {
			return this.store.size();
		}
	}

	public void clear() {
		synchronized (this.store) {
			this.store.clear();
		}
	}

	/**
	 * Halts the sweep and releases the store. The cache must not be used afterwards.
	 */
	public void stop() {
		this.stopped = true;
		this.sweeper.shutdownNow();

		clear();
	}

	public boolean isStopped() {
		return this.stopped;
	}

	private void removeOldest() {
		Iterator<String> iterator = this.store.keySet().iterator();
		if (!iterator.hasNext())
			return;

		String oldest = iterator.next();
		iterator.remove();

		LOGGER.trace(() -> String.format("Evicted oldest cache entry %s", oldest));
	}

	void sweep() {
		long now = System.currentTimeMillis();
		int removed = 0;

		synchronized (this.store) {
			Iterator<Map.Entry<String, CacheEntry<V>>> iterator = this.store.entrySet().iterator();
			while (iterator.hasNext()) {
				if (now >= iterator.next().getValue().expiry) {
					iterator.remove();
					++removed;
				}
			}
		}

		if (removed > 0)
			LOGGER.debug("Swept {} expired cache entries", removed);
	}
}
