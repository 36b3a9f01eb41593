package io.regstore.storage;

/**
 * Body of a managed transaction. Throwing from {@link #apply} rolls the transaction back.
 */
@FunctionalInterface
public interface TxFunction<R> {
    R apply(BucketTx tx);
}
