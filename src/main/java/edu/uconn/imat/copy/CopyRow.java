package edu.uconn.imat.copy;

import java.util.List;

/**
 * A row destined for a {@link RawTable}, its values in the table's column order.
 */
public interface CopyRow {

    List<Object> copyValues();
}
