package de.bwaldvogel.oplog.bson;

import java.io.Serializable;

/**
 * Marker for the BSON value types that have no natural Java counterpart.
 */
public interface Bson extends Serializable {
}
