package com.example.devicestore.core.device;

import com.example.devicestore.core.UnsupportedCommandException;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent device inventory.
 *
 * <p>Implementations are safe for concurrent use; every call borrows a pooled connection for its
 * own duration and may block on the network round trip.
 */
public interface DeviceStore extends AutoCloseable {

  /**
   * Creates the device row, or merges {@code facts} into the existing row with the same serial
   * number. Only the columns owned by {@code source} are written; the other fact set is left
   * untouched.
   *
   * @param source origin of the facts
   * @param facts device facts; the serial number is required
   * @return surrogate identifier of the created or merged row
   * @throws IllegalArgumentException if required facts are missing
   * @throws SQLException if the write fails
   */
  UUID createOrMerge(FactSource source, Device facts) throws SQLException;

  /**
   * Tag based variant of {@link #createOrMerge(FactSource, Device)}.
   *
   * @param sourceTag {@code fetch} or {@code authenticate}
   * @param facts device facts
   * @return surrogate identifier of the created or merged row
   * @throws UnsupportedCommandException for any other tag, before anything is written
   * @throws SQLException if the write fails
   */
  default UUID createOrMerge(final String sourceTag, final Device facts) throws SQLException {
    return createOrMerge(FactSource.fromTag(sourceTag), facts);
  }

  /**
   * Looks up a device by surrogate identifier, reading every column.
   *
   * @param uuid surrogate identifier
   * @return the device, or empty when no row matches
   * @throws SQLException if the read fails
   */
  Optional<Device> findByUuid(UUID uuid) throws SQLException;

  /**
   * Looks up a device by UDID, reading only the projected columns.
   *
   * @param udid device-generated identifier, must not be blank
   * @param projection columns to read; empty reads every column
   * @return the device, or empty when no row matches
   * @throws IllegalArgumentException if {@code udid} is blank or {@code projection} holds a null
   * @throws SQLException if the read fails
   */
  Optional<Device> findByUdid(String udid, Collection<DeviceColumn> projection)
      throws SQLException;

  default Optional<Device> findByUdid(final String udid, final DeviceColumn... projection)
      throws SQLException {
    if (projection == null) throw new IllegalArgumentException("projection cannot be null");
    return findByUdid(udid, Arrays.asList(projection));
  }

  /**
   * Lists devices matching every {@link com.example.devicestore.core.filter.DeviceFilter
   * DeviceFilter} among {@code params}. Other arguments are ignored; with no filter every device
   * is returned.
   *
   * @param params filters, possibly mixed with other values
   * @return matching devices ordered by serial number
   * @throws SQLException if the read fails
   */
  List<DeviceSummary> list(Object... params) throws SQLException;

  /** Releases the connection pool. */
  @Override
  void close();
}
