package com.docproof.filter.registry;

import com.docproof.filter.Filter;
import com.docproof.filter.FilterNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of filters by id and alias. Create one per engine and pass it in; there is no global instance.
 * <p>
 * Lookups resolve a direct id first, then an alias. Registration is atomic: a rejected registration
 * leaves the registry unchanged. Reads are lock-free.
 */
public final class FilterRegistry {

    private static final Logger log = LoggerFactory.getLogger(FilterRegistry.class);
    private static final long LIFECYCLE_TIMEOUT_SECONDS = 60;

    private final Map<String, RegisteredFilter> filtersById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByAlias = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean initialized;

    public void register(Filter filter) {
        register(filter, FilterRegistrationOptions.defaults());
    }

    /**
     * Registers a filter under its id and the given aliases.
     *
     * @throws IllegalArgumentException if the id is blank or already registered, or an alias collides
     *                                  with a registered id or alias
     */
    public synchronized void register(Filter filter, FilterRegistrationOptions options) {
        Objects.requireNonNull(filter, "filter");
        FilterRegistrationOptions opts = options != null ? options : FilterRegistrationOptions.defaults();
        String id = filter.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Filter id must be non-blank");
        }
        if (filtersById.containsKey(id) || idsByAlias.containsKey(id)) {
            throw new IllegalArgumentException("Filter already registered: " + id);
        }
        for (String alias : opts.getAliases()) {
            if (alias.equals(id) || filtersById.containsKey(alias) || idsByAlias.containsKey(alias)) {
                throw new IllegalArgumentException("Alias already in use: " + alias + " (filter " + id + ")");
            }
        }
        filtersById.put(id, new RegisteredFilter(filter, opts, sequence.getAndIncrement()));
        for (String alias : opts.getAliases()) {
            idsByAlias.put(alias, id);
        }
        log.debug("Registered filter {} v{} aliases={}", id, filter.getVersion(), opts.getAliases());
    }

    /** Removes a filter and its aliases. Returns false if it was not registered. */
    public synchronized boolean unregister(String idOrAlias) {
        RegisteredFilter entry = get(idOrAlias);
        if (entry == null) return false;
        filtersById.remove(entry.getId());
        idsByAlias.values().removeIf(entry.getId()::equals);
        return true;
    }

    /**
     * Resolves a filter by id, then by alias.
     *
     * @return entry or null if neither matches
     */
    public RegisteredFilter get(String idOrAlias) {
        if (idOrAlias == null || idOrAlias.isBlank()) return null;
        RegisteredFilter direct = filtersById.get(idOrAlias);
        if (direct != null) return direct;
        String target = idsByAlias.get(idOrAlias);
        return target != null ? filtersById.get(target) : null;
    }

    /**
     * @throws FilterNotFoundException when the id or alias is not registered
     */
    public RegisteredFilter require(String idOrAlias) {
        RegisteredFilter entry = get(idOrAlias);
        if (entry == null) {
            throw new FilterNotFoundException(idOrAlias);
        }
        return entry;
    }

    public boolean has(String idOrAlias) {
        return get(idOrAlias) != null;
    }

    public int size() {
        return filtersById.size();
    }

    /** All entries sorted by priority, then registration order. */
    public List<RegisteredFilter> list() {
        return list(null, null);
    }

    /**
     * Entries sorted by priority (ascending), then registration order.
     *
     * @param tags    when non-empty, keep filters carrying at least one of these tags
     * @param enabled when non-null, keep filters whose enabled flag equals it
     */
    public List<RegisteredFilter> list(Set<String> tags, Boolean enabled) {
        List<RegisteredFilter> out = new ArrayList<>();
        for (RegisteredFilter f : filtersById.values()) {
            if (enabled != null && f.isEnabled() != enabled) continue;
            if (tags != null && !tags.isEmpty() && f.getFilter().getTags().stream().noneMatch(tags::contains)) continue;
            out.add(f);
        }
        out.sort(Comparator.comparingInt(RegisteredFilter::getPriority).thenComparingLong(RegisteredFilter::getSequence));
        return out;
    }

    /**
     * Resolved config for a step: the filter's registered defaults overlaid with the step config.
     *
     * @throws FilterNotFoundException when the id or alias is not registered
     */
    public Map<String, Object> configure(String idOrAlias, Map<String, Object> stepConfig) {
        RegisteredFilter entry = require(idOrAlias);
        Map<String, Object> merged = new LinkedHashMap<>(entry.getDefaultConfig());
        if (stepConfig != null) merged.putAll(stepConfig);
        return merged;
    }

    /** Runs every filter's {@code onInit} concurrently and waits for all of them. */
    public LifecycleResult initializeAll() {
        LifecycleResult result = runAll("init", filtersById.values(), Filter::onInit);
        initialized = true;
        return result;
    }

    /** Runs every filter's {@code onDestroy} concurrently and waits for all of them. */
    public LifecycleResult destroyAll() {
        LifecycleResult result = runAll("destroy", filtersById.values(), Filter::onDestroy);
        initialized = false;
        return result;
    }

    /** True after {@link #initializeAll()} and before {@link #destroyAll()}. */
    public boolean isInitialized() {
        return initialized;
    }

    /** Removes all registrations (mainly for tests). */
    public synchronized void clear() {
        filtersById.clear();
        idsByAlias.clear();
        initialized = false;
    }

    @FunctionalInterface
    private interface LifecycleHook {
        void run(Filter filter) throws Exception;
    }

    private static LifecycleResult runAll(String phase, Collection<RegisteredFilter> entries, LifecycleHook hook) {
        List<RegisteredFilter> snapshot = new ArrayList<>(entries);
        List<String> succeeded = new ArrayList<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        if (snapshot.isEmpty()) {
            return new LifecycleResult(succeeded, failures);
        }
        ExecutorService executor = Executors.newFixedThreadPool(snapshot.size());
        try {
            Map<String, Future<?>> futures = new LinkedHashMap<>();
            for (RegisteredFilter entry : snapshot) {
                futures.put(entry.getId(), executor.submit(() -> {
                    hook.run(entry.getFilter());
                    return null;
                }));
            }
            for (Map.Entry<String, Future<?>> f : futures.entrySet()) {
                try {
                    f.getValue().get(LIFECYCLE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                    succeeded.add(f.getKey());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    failures.put(f.getKey(), cause);
                    log.warn("Filter {} {} hook failed: {}", f.getKey(), phase, cause.toString(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failures.put(f.getKey(), e);
                    log.warn("Interrupted waiting for filter {} {} hook", f.getKey(), phase);
                } catch (TimeoutException e) {
                    f.getValue().cancel(true);
                    failures.put(f.getKey(), e);
                    log.warn("Filter {} {} hook did not finish within {}s", f.getKey(), phase, LIFECYCLE_TIMEOUT_SECONDS);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        log.info("Filter {} complete: {} succeeded, {} failed", phase, succeeded.size(), failures.size());
        return new LifecycleResult(succeeded, failures);
    }
}
