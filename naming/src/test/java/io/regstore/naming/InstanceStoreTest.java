package io.regstore.naming;

import com.google.protobuf.BoolValue;
import com.google.protobuf.StringValue;
import com.google.protobuf.UInt32Value;
import io.regstore.naming.api.Instance;
import io.regstore.naming.api.Location;
import io.regstore.naming.model.ServiceInstance;
import io.regstore.storage.BucketRecordStore;
import io.regstore.storage.StoreConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InstanceStoreTest {

    private static final Instant T0 = Instant.parse("2021-01-02T15:04:05Z");

    @TempDir Path dir;
    private BucketRecordStore records;
    private MutableClock clock;
    private InstanceStore store;

    @BeforeEach
    void open() {
        records = BucketRecordStore.open(StoreConfig.at(dir));
        clock = new MutableClock(T0);
        store = new InstanceStore(records, clock);
    }

    @AfterEach
    void close() {
        records.close();
    }

    private static ServiceInstance instance(String id, String serviceId, String host) {
        Instance proto = Instance.newBuilder()
                .setId(StringValue.of(id))
                .setService(StringValue.of("svc-" + serviceId))
                .setNamespace(StringValue.of("default"))
                .setHost(StringValue.of(host))
                .setPort(UInt32Value.of(8080))
                .setHealthy(BoolValue.of(true))
                .setLocation(Location.newBuilder().setRegion(StringValue.of("south")))
                .putMetadata("env", "test")
                .build();
        return new ServiceInstance(proto, serviceId, "", false, null);
    }

    @Test
    void add_and_get() {
        store.addInstance(instance("ins1", "svcid1", "1.1.1.1"));

        ServiceInstance back = store.getInstance("ins1");
        assertTrue(back.valid());
        assertEquals(T0, back.modifyTime());
        assertEquals("svcid1", back.serviceId());
        assertEquals("1.1.1.1", back.host());
        assertEquals("test", back.proto().getMetadataMap().get("env"));
        assertEquals("south", back.proto().getLocation().getRegion().getValue());
        assertNull(store.getInstance("nope"));
    }

    @Test
    void batch_add_is_atomic_and_rejects_missing_ids() {
        ServiceInstance noId = new ServiceInstance(Instance.getDefaultInstance(), "svcid1", "", true, null);
        assertThrows(IllegalArgumentException.class,
                () -> store.batchAddInstances(List.of(instance("ins1", "svcid1", "h"), noId)));
        assertNull(store.getInstance("ins1"));

        store.batchAddInstances(List.of(instance("ins1", "svcid1", "h"), instance("ins2", "svcid1", "h")));
        assertEquals(Map.of("ins1", true, "ins2", true, "ins3", false),
                store.checkInstancesExisted(List.of("ins1", "ins2", "ins3")));
    }

    @Test
    void update_replaces_and_refreshes_modify_time() {
        store.addInstance(instance("ins1", "svcid1", "1.1.1.1"));
        clock.advance(Duration.ofMinutes(1));
        ServiceInstance changed = instance("ins1", "svcid2", "2.2.2.2").withValid(true, null);
        store.updateInstance(changed);

        ServiceInstance back = store.getInstance("ins1");
        assertEquals("svcid2", back.serviceId());
        assertEquals("2.2.2.2", back.host());
        assertEquals(T0.plus(Duration.ofMinutes(1)), back.modifyTime());
    }

    @Test
    void delete_single_and_batch() {
        store.batchAddInstances(List.of(instance("ins1", "s", "h"), instance("ins2", "s", "h"), instance("ins3", "s", "h")));
        store.deleteInstance("ins1");
        assertNull(store.getInstance("ins1"));
        store.batchDeleteInstances(List.of("ins2", "ins3", "never"));
        assertEquals(0, records.countValues(InstanceStore.TYPE));
    }

    @Test
    void count_only_valid_instances() {
        store.batchAddInstances(List.of(instance("ins1", "s", "h"), instance("ins2", "s", "h")));
        store.updateInstance(store.getInstance("ins2").withValid(false, null));
        assertEquals(1, store.getInstancesCount());
    }

    @Test
    void main_instances_by_service_and_host() {
        store.batchAddInstances(List.of(
                instance("ins1", "svcid1", "1.1.1.1"),
                instance("ins2", "svcid1", "2.2.2.2"),
                instance("ins3", "svcid2", "1.1.1.1")));

        List<String> ids = store.getInstancesMainByService("svcid1", "1.1.1.1").stream()
                .map(ServiceInstance::id).toList();
        assertEquals(List.of("ins1"), ids);
    }

    @Test
    void more_instances_after_mtime() {
        store.batchAddInstances(List.of(instance("old", "svcid1", "h")));
        clock.advance(Duration.ofMinutes(1));
        Instant mark = clock.instant();
        clock.advance(Duration.ofMinutes(1));
        store.batchAddInstances(List.of(
                instance("a", "svcid1", "h"),
                instance("b", "svcid2", "h"),
                instance("c", "svcid2", "h")));
        store.updateInstance(store.getInstance("c").withValid(false, null));

        assertEquals(Set.of("a", "b", "c"), store.getMoreInstances(mark, false, List.of()).keySet());
        assertEquals(Set.of("b", "c"), store.getMoreInstances(mark, false, List.of("svcid2")).keySet());
        assertEquals(Set.of("b"), store.getMoreInstances(mark, true, List.of("svcid2")).keySet());
    }

    @Test
    void health_status_updates_message_field_only() {
        store.addInstance(instance("ins7", "s", "h"));
        clock.advance(Duration.ofSeconds(30));
        store.setInstanceHealthStatus("ins7", false, "rev-no-healthy");

        ServiceInstance back = store.getInstance("ins7");
        assertFalse(back.proto().getHealthy().getValue());
        assertEquals("rev-no-healthy", back.proto().getRevision().getValue());
        assertEquals("h", back.host());
        assertEquals(T0.plusSeconds(30), back.modifyTime());
        assertTrue(back.valid());

        store.setInstanceHealthStatus("missing", true, "r");
        assertNull(store.getInstance("missing"));
    }

    @Test
    void batch_isolate_sets_every_listed_instance() {
        store.batchAddInstances(List.of(instance("ins1", "s", "h"), instance("ins2", "s", "h"), instance("ins3", "s", "h")));
        store.batchSetInstanceIsolate(List.of("ins1", "ins3"), true, "rev-isolate");

        Map<String, Boolean> isolated = records.loadValuesAll(InstanceStore.TYPE, ServiceInstance.class).values().stream()
                .collect(Collectors.toMap(ServiceInstance::id, i -> i.proto().getIsolate().getValue()));
        assertEquals(Map.of("ins1", true, "ins2", false, "ins3", true), isolated);
        assertEquals("rev-isolate", store.getInstance("ins3").proto().getRevision().getValue());
    }
}
