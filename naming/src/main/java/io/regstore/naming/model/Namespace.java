// file: naming/src/main/java/io/regstore/naming/model/Namespace.java
package io.regstore.naming.model;

import java.time.Instant;

/** A namespace groups services; stored under type {@code namespace}, keyed by name. */
public record Namespace(
        String name,
        String comment,
        String token,
        String owner,
        boolean valid,
        Instant createTime,
        Instant modifyTime
) {
    public Namespace withValid(boolean v) {
        return new Namespace(name, comment, token, owner, v, createTime, modifyTime);
    }
}
