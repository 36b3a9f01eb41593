// file: naming/src/main/java/io/regstore/naming/model/ServiceInstance.java
package io.regstore.naming.model;

import io.regstore.naming.api.Instance;

import java.time.Instant;

/**
 * A service instance; stored under type {@code instance}, keyed by the id of its message.
 *
 * @param proto             the wire form of the instance
 * @param serviceId         id of the owning {@link Service}
 * @param servicePlatformId platform the service belongs to, may be empty
 */
public record ServiceInstance(
        Instance proto,
        String serviceId,
        String servicePlatformId,
        boolean valid,
        Instant modifyTime
) {
    public String id() {
        return proto.getId().getValue();
    }

    public String host() {
        return proto.getHost().getValue();
    }

    public ServiceInstance withValid(boolean v, Instant mtime) {
        return new ServiceInstance(proto, serviceId, servicePlatformId, v, mtime);
    }
}
