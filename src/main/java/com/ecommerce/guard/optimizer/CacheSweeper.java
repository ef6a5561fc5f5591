package com.ecommerce.guard.optimizer;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ReflectionUtils;

import java.beans.Introspector;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 缓存清理器 - 尽力而为，不保证覆盖进程内所有缓存
 * <p>
 * 清理顺序：
 * 1. 显式注册的 {@link Clearable}
 * 2. 容器中的 Clearable、Caffeine Cache、Spring CacheManager
 * 3. JVM / Spring 内部的反射与资源缓存
 * 4. 名称包含 "cache" 的 Map / Collection Bean（启发式兜底）
 */
@Slf4j
public class CacheSweeper {

    private final ApplicationContext applicationContext;
    private final long averageEntryBytes;
    private final Map<String, Clearable> registered = new ConcurrentHashMap<>();

    public CacheSweeper(ApplicationContext applicationContext, long averageEntryBytes) {
        this.applicationContext = applicationContext;
        this.averageEntryBytes = Math.max(1, averageEntryBytes);
    }

    /**
     * 注册不在容器中的缓存
     */
    public void register(String name, Clearable clearable) {
        registered.put(name, clearable);
    }

    public void unregister(String name) {
        registered.remove(name);
    }

    public CacheSweepResult sweep() {
        Sweep sweep = new Sweep();

        registered.forEach((name, clearable) ->
            sweep.clear(clearable, name, () -> {
                long bytes = clearable.estimatedBytes();
                clearable.clear();
                return bytes;
            }));

        if (applicationContext != null) {
            sweepContext(sweep);
        }

        sweep.clearStatic("introspector", Introspector::flushCaches);
        sweep.clearStatic("resourceBundle", ResourceBundle::clearCache);
        sweep.clearStatic("reflectionUtils", ReflectionUtils::clearCache);
        sweep.clearStatic("annotationUtils", AnnotationUtils::clearCache);

        log.info("Cache sweep finished: cleared={}, estimatedBytes={}, failures={}",
            sweep.names.size(), sweep.bytes, sweep.failures);
        return new CacheSweepResult(sweep.names.size(), sweep.bytes,
            Collections.unmodifiableList(sweep.names), sweep.failures);
    }

    @SuppressWarnings("rawtypes")
    private void sweepContext(Sweep sweep) {
        applicationContext.getBeansOfType(Clearable.class, false, false).forEach((name, clearable) ->
            sweep.clear(clearable, name, () -> {
                long bytes = clearable.estimatedBytes();
                clearable.clear();
                return bytes;
            }));

        applicationContext.getBeansOfType(Cache.class, false, false).forEach((name, cache) ->
            sweep.clear(cache, name, () -> {
                long bytes = cache.estimatedSize() * averageEntryBytes;
                cache.invalidateAll();
                cache.cleanUp();
                return bytes;
            }));

        applicationContext.getBeansOfType(CacheManager.class, false, false).forEach((name, manager) -> {
            for (String cacheName : manager.getCacheNames()) {
                org.springframework.cache.Cache cache = manager.getCache(cacheName);
                if (cache != null) {
                    sweep.clear(cache, name + ":" + cacheName, () -> {
                        long bytes = nativeEntries(cache.getNativeCache()) * averageEntryBytes;
                        cache.clear();
                        return bytes;
                    });
                }
            }
        });

        applicationContext.getBeansOfType(Map.class, false, false).forEach((name, map) -> {
            if (looksLikeCache(name)) {
                sweep.clear(map, name, () -> {
                    long bytes = map.size() * averageEntryBytes;
                    map.clear();
                    return bytes;
                });
            }
        });
        applicationContext.getBeansOfType(Collection.class, false, false).forEach((name, collection) -> {
            if (looksLikeCache(name)) {
                sweep.clear(collection, name, () -> {
                    long bytes = collection.size() * averageEntryBytes;
                    collection.clear();
                    return bytes;
                });
            }
        });
    }

    private static boolean looksLikeCache(String beanName) {
        return beanName.toLowerCase(Locale.ROOT).contains("cache");
    }

    private static long nativeEntries(Object nativeCache) {
        if (nativeCache instanceof Cache<?, ?> caffeine) {
            return caffeine.estimatedSize();
        }
        if (nativeCache instanceof Map<?, ?> map) {
            return map.size();
        }
        return 0L;
    }

    @FunctionalInterface
    private interface ClearAction {
        long clear();
    }

    /**
     * 单次清理的累计状态，同一对象只清理一次
     */
    private static final class Sweep {
        private final Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<String> names = new ArrayList<>();
        private long bytes;
        private int failures;

        void clear(Object target, String name, ClearAction action) {
            if (!seen.add(target)) {
                return;
            }
            try {
                bytes += Math.max(0, action.clear());
                names.add(name);
            } catch (RuntimeException e) {
                failures++;
                log.warn("Failed to clear cache {}: {}", name, e.getMessage());
            }
        }

        void clearStatic(String name, Runnable action) {
            try {
                action.run();
                names.add(name);
            } catch (RuntimeException e) {
                failures++;
                log.warn("Failed to clear {} cache: {}", name, e.getMessage());
            }
        }
    }
}
