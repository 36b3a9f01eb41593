// file: naming/src/main/java/io/regstore/naming/Page.java
package io.regstore.naming;

import java.util.List;

/** One page of a listing, with the size of the whole listing. */
public record Page<T>(List<T> items, int total) {
    public Page {
        items = List.copyOf(items);
    }
}
