// file: naming/src/main/java/io/regstore/naming/InstanceStore.java
package io.regstore.naming;

import com.google.protobuf.BoolValue;
import com.google.protobuf.StringValue;
import io.regstore.core.FieldSchema;
import io.regstore.core.RecordSchema;
import io.regstore.naming.api.Instance;
import io.regstore.naming.model.ServiceInstance;
import io.regstore.storage.Bucket;
import io.regstore.storage.RecordCodec;
import io.regstore.storage.RecordStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Service instance persistence on a {@link RecordStore}.
 * <p>
 * Records live under type {@value #TYPE}, keyed by instance id. Batch operations run in
 * a single write transaction, so a batch is applied completely or not at all.
 */
public final class InstanceStore {
    private static final Logger log = Logger.getLogger(InstanceStore.class.getName());

    static final String TYPE = "instance";

    private static final RecordSchema<ServiceInstance> SCHEMA = RecordSchema.of(ServiceInstance.class);
    private static final FieldSchema PROTO = SCHEMA.field("proto");
    private static final FieldSchema MODIFY_TIME = SCHEMA.field("modifyTime");

    private final RecordStore store;
    private final Clock clock;

    public InstanceStore(RecordStore store) {
        this(store, Clock.systemUTC());
    }

    public InstanceStore(RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Save an instance as valid. */
    public void addInstance(ServiceInstance instance) {
        batchAddInstances(List.of(instance));
    }

    /** Save several instances in one transaction. */
    public void batchAddInstances(Collection<ServiceInstance> instances) {
        for (ServiceInstance i : instances) {
            requireId(i);
        }
        if (instances.isEmpty()) return;
        Instant now = clock.instant();
        store.execute(true, tx -> {
            Bucket type = tx.createBucketIfNotExists(TYPE);
            for (ServiceInstance i : instances) {
                replace(type, i.withValid(true, now));
            }
            return null;
        });
    }

    /** Replace a stored instance, refreshing its modify time. */
    public void updateInstance(ServiceInstance instance) {
        requireId(instance);
        store.saveValue(TYPE, instance.id(), instance.withValid(instance.valid(), clock.instant()));
    }

    public void deleteInstance(String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("delete instance: id is required");
        }
        store.deleteValues(TYPE, List.of(id));
    }

    public void batchDeleteInstances(Collection<String> ids) {
        store.deleteValues(TYPE, ids);
    }

    /** @return the instance, or null if it does not exist */
    public ServiceInstance getInstance(String id) {
        return store.loadValues(TYPE, List.of(id), ServiceInstance.class).get(id);
    }

    /** @return for every id, whether an instance is stored under it */
    public Map<String, Boolean> checkInstancesExisted(Collection<String> ids) {
        Map<String, Boolean> out = new LinkedHashMap<>();
        store.execute(false, tx -> {
            Bucket type = tx.bucket(TYPE);
            for (String id : ids) {
                out.put(id, type != null && type.bucket(id) != null);
            }
            return null;
        });
        return out;
    }

    /** Number of valid instances. */
    public int getInstancesCount() {
        int[] count = {0};
        store.iterateFields(TYPE, "valid", ServiceInstance.class, v -> {
            if (Boolean.TRUE.equals(v)) count[0]++;
        });
        return count[0];
    }

    /** Instances of a service listening on {@code host}. */
    public List<ServiceInstance> getInstancesMainByService(String serviceId, String host) {
        return new ArrayList<>(store.loadValuesByFilter(TYPE, List.of("serviceId", "proto"), ServiceInstance.class,
                values -> serviceId.equals(values.get("serviceId"))
                        && values.get("proto") instanceof Instance p
                        && host.equals(p.getHost().getValue())).values());
    }

    /**
     * Instances modified after {@code mtime}.
     *
     * @param firstUpdate only valid instances are returned on the first update
     * @param serviceIds  restrict to these services; empty means all services
     */
    public Map<String, ServiceInstance> getMoreInstances(Instant mtime, boolean firstUpdate, Collection<String> serviceIds) {
        Set<String> services = Set.copyOf(serviceIds);
        return store.loadValuesByFilter(TYPE, List.of("modifyTime", "serviceId", "valid"), ServiceInstance.class,
                values -> {
                    if (firstUpdate && !Boolean.TRUE.equals(values.get("valid"))) return false;
                    if (!services.isEmpty() && !services.contains(values.get("serviceId"))) return false;
                    return values.get("modifyTime") instanceof Instant t && t.isAfter(mtime);
                });
    }

    /** Set the health flag and revision of one instance. */
    public void setInstanceHealthStatus(String id, boolean healthy, String revision) {
        mutateProtos(List.of(id), p -> p.toBuilder()
                .setHealthy(BoolValue.of(healthy))
                .setRevision(StringValue.of(revision))
                .build());
    }

    /** Set the isolate flag and revision of several instances in one transaction. */
    public void batchSetInstanceIsolate(Collection<String> ids, boolean isolate, String revision) {
        mutateProtos(ids, p -> p.toBuilder()
                .setIsolate(BoolValue.of(isolate))
                .setRevision(StringValue.of(revision))
                .build());
    }

    // ----------------- helpers -----------------

    private void mutateProtos(Collection<String> ids, UnaryOperator<Instance> change) {
        if (ids.isEmpty()) return;
        Instant now = clock.instant();
        int updated = store.execute(true, tx -> {
            Bucket type = tx.bucket(TYPE);
            if (type == null) return 0;
            int n = 0;
            for (String id : ids) {
                Bucket record = type.bucket(id);
                if (record == null) continue;
                Object current = RecordCodec.readField(record, SCHEMA, PROTO.name());
                Instance proto = current instanceof Instance i ? i : Instance.getDefaultInstance();
                RecordCodec.writeProperty(record, PROTO, change.apply(proto));
                RecordCodec.writeProperty(record, MODIFY_TIME, now);
                n++;
            }
            return n;
        });
        if (updated < ids.size()) {
            log.log(Level.FINE, String.format("updated %d of %d instances, the rest do not exist", updated, ids.size()));
        }
    }

    private static void replace(Bucket type, ServiceInstance instance) {
        String id = instance.id();
        if (type.bucket(id) != null) {
            type.deleteBucket(id);
        }
        RecordCodec.serialize(type.createBucket(id), SCHEMA, instance);
    }

    private static void requireId(ServiceInstance instance) {
        if (instance.proto() == null || instance.id().isEmpty()) {
            throw new IllegalArgumentException("instance id is required");
        }
    }
}
