// file: naming/src/main/java/io/regstore/naming/NamespaceStore.java
package io.regstore.naming;

import io.regstore.naming.model.Namespace;
import io.regstore.storage.RecordStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Namespace persistence on a {@link RecordStore}.
 * <p>
 * Records live under type {@value #TYPE}, keyed by namespace name.
 */
public final class NamespaceStore {
    private static final Logger log = Logger.getLogger(NamespaceStore.class.getName());

    static final String TYPE = "namespace";

    static final String DEFAULT_NAMESPACE = "default";
    static final String POLARIS_NAMESPACE = "Polaris";
    static final String BUILTIN_OWNER = "polaris";

    private static final Map<String, String> BUILTIN_TOKENS = Map.of(
            DEFAULT_NAMESPACE, "e2e473081d3d4306b52264e49f7ce227",
            POLARIS_NAMESPACE, "2d1bfe5d12e04d54b8ee69e62494c7fd");
    private static final Map<String, String> BUILTIN_COMMENTS = Map.of(
            DEFAULT_NAMESPACE, "Default Environment",
            POLARIS_NAMESPACE, "Polaris-server");

    private final RecordStore store;
    private final Clock clock;

    public NamespaceStore(RecordStore store) {
        this(store, Clock.systemUTC());
    }

    public NamespaceStore(RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Create the built-in namespaces that do not exist yet. */
    public void initData() {
        for (String name : List.of(DEFAULT_NAMESPACE, POLARIS_NAMESPACE)) {
            if (getNamespace(name) != null) continue;
            Instant now = clock.instant();
            addNamespace(new Namespace(name, BUILTIN_COMMENTS.get(name), BUILTIN_TOKENS.get(name),
                    BUILTIN_OWNER, true, now, now));
            log.log(Level.INFO, "created built-in namespace " + name);
        }
    }

    /**
     * Save a namespace as valid.
     *
     * @throws IllegalArgumentException if name, owner or token is empty
     */
    public void addNamespace(Namespace namespace) {
        if (isEmpty(namespace.name()) || isEmpty(namespace.owner()) || isEmpty(namespace.token())) {
            throw new IllegalArgumentException("add namespace: name, owner and token are required");
        }
        store.saveValue(TYPE, namespace.name(), namespace.withValid(true));
    }

    /** Update owner and comment of an existing namespace. */
    public void updateNamespace(Namespace namespace) {
        if (isEmpty(namespace.name()) || isEmpty(namespace.owner())) {
            throw new IllegalArgumentException("update namespace: name and owner are required");
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("owner", namespace.owner());
        properties.put("comment", namespace.comment() == null ? "" : namespace.comment());
        properties.put("modifyTime", clock.instant());
        store.updateValue(TYPE, namespace.name(), Namespace.class, properties);
    }

    public void updateNamespaceToken(String name, String token) {
        if (isEmpty(name) || isEmpty(token)) {
            throw new IllegalArgumentException("update namespace token: name and token are required");
        }
        store.updateValue(TYPE, name, Namespace.class, Map.of(
                "token", token,
                "modifyTime", clock.instant()));
    }

    /** Namespaces whose owner contains {@code owner}. */
    public List<Namespace> listNamespaces(String owner) {
        if (isEmpty(owner)) {
            throw new IllegalArgumentException("list namespaces: owner is required");
        }
        return new ArrayList<>(store.loadValuesByFilter(TYPE, List.of("owner"), Namespace.class,
                values -> values.get("owner") instanceof String o && o.contains(owner)).values());
    }

    /** @return the namespace, or null if it does not exist */
    public Namespace getNamespace(String name) {
        return store.loadValues(TYPE, List.of(name), Namespace.class).get(name);
    }

    /**
     * Page through all namespaces, most recently modified first.
     *
     * @param offset index of the first namespace of the page
     * @param limit  maximum page size
     */
    public Page<Namespace> getNamespaces(int offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must be >= 0");
        }
        List<Namespace> all = new ArrayList<>(store.loadValuesAll(TYPE, Namespace.class).values());
        all.sort(Comparator.comparing(Namespace::modifyTime,
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed());
        if (offset >= all.size()) {
            return new Page<>(List.of(), all.size());
        }
        int end = (int) Math.min((long) offset + limit, all.size());
        return new Page<>(all.subList(offset, end), all.size());
    }

    /** Namespaces modified after {@code mtime}. */
    public List<Namespace> getMoreNamespaces(Instant mtime) {
        Objects.requireNonNull(mtime, "mtime");
        return new ArrayList<>(store.loadValuesByFilter(TYPE, List.of("modifyTime"), Namespace.class,
                values -> values.get("modifyTime") instanceof Instant t && t.isAfter(mtime)).values());
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
