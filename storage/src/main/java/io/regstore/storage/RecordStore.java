// file: storage/src/main/java/io/regstore/storage/RecordStore.java
package io.regstore.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Typed record store over nested buckets, used by the registry adapters.
 * <p>
 * Semantics:
 *  - Records are grouped by a caller-chosen type string and addressed by key.
 *  - Every write operation runs in one engine transaction; nothing partial is visible.
 *  - Results come back in engine key order (byte-wise over the key).
 *  - Decoding operations take the record class the values were written with.
 */
public interface RecordStore extends AutoCloseable {

    /** Replace the record stored under {@code key} with {@code record}. */
    void saveValue(String type, String key, Object record);

    /** Remove records; absent keys are ignored. */
    void deleteValues(String type, Collection<String> keys);

    /**
     * Overwrite the given properties of one record, encoding each value by its runtime type.
     * Values of unsupported types are skipped. Missing records are left alone.
     */
    void updateValue(String type, String key, Map<String, ?> properties);

    /**
     * Overwrite the given properties of one record, encoding each value with the declared
     * kind of the field of {@code shape}.
     *
     * @throws io.regstore.core.SchemaException if a property is not a field of the shape,
     *                                          or its value does not fit the field
     */
    void updateValue(String type, String key, Class<?> shape, Map<String, ?> properties);

    /** Load records by key; absent keys are omitted from the result. */
    <T> Map<String, T> loadValues(String type, Collection<String> keys, Class<T> shape);

    /**
     * Load the records for which {@code filter} accepts the values of {@code fields}.
     * Fields without a value are left out of the map handed to the filter.
     */
    <T> Map<String, T> loadValuesByFilter(String type, List<String> fields, Class<T> shape,
                                          Predicate<Map<String, Object>> filter);

    /** Load every record of a type. */
    <T> Map<String, T> loadValuesAll(String type, Class<T> shape);

    /** Hand the value of one field of every record to {@code process}, null when absent. */
    void iterateFields(String type, String field, Class<?> shape, Consumer<Object> process);

    /** Number of records of a type. */
    int countValues(String type);

    /** Run a raw read or write transaction; a write transaction commits when {@code process} returns. */
    <R> R execute(boolean writable, TxFunction<R> process);

    /** Begin a raw write transaction the caller must commit or roll back. */
    BucketTx transaction();

    @Override
    void close();
}
