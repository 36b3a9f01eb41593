// file: naming/src/main/java/io/regstore/naming/model/Service.java
package io.regstore.naming.model;

import java.time.Instant;
import java.util.Map;

/** A registered service; stored under type {@code service}, keyed by id. */
public record Service(
        String id,
        String name,
        String namespace,
        String comment,
        String token,
        String owner,
        String revision,
        Map<String, String> meta,
        boolean valid,
        Instant createTime,
        Instant modifyTime
) {
}
