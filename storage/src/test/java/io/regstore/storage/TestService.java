package io.regstore.storage;

import com.google.protobuf.StringValue;
import io.regstore.core.Unsigned;

import java.time.Instant;
import java.util.Map;

record TestService(
        String id,
        String name,
        Map<String, String> tags,
        int weight,
        @Unsigned int port,
        boolean healthy,
        Instant modifyTime,
        StringValue label
) {
    static TestService of(String id, String name, Map<String, String> tags) {
        return new TestService(id, name, tags, 0, 0, false, null, null);
    }
}
