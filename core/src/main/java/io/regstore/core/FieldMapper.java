package io.regstore.core;

/**
 * Maps a record field name to the key used for it inside a record bucket, and back.
 * <p>
 * The mapping is the identity on the field name. Field names are unique within one
 * record shape, so the mapping is injective without further work. Every read and write
 * path goes through this class so the two directions cannot drift apart.
 */
public final class FieldMapper {

    private FieldMapper() {
        // utility
    }

    public static String toBucketKey(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        return fieldName;
    }

    public static String fromBucketKey(String bucketKey) {
        if (bucketKey == null || bucketKey.isBlank()) {
            throw new IllegalArgumentException("bucket key must not be blank");
        }
        return bucketKey;
    }
}
