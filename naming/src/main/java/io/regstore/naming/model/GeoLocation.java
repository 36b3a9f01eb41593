// file: naming/src/main/java/io/regstore/naming/model/GeoLocation.java
package io.regstore.naming.model;

import io.regstore.core.Unsigned;
import io.regstore.naming.api.Location;

/** Location of an address, with the numeric ids of its region, zone and campus. */
public record GeoLocation(
        Location proto,
        @Unsigned int regionId,
        @Unsigned int zoneId,
        @Unsigned int campusId,
        boolean valid
) {
    public long regionIdUnsigned() {
        return Integer.toUnsignedLong(regionId);
    }
}
