package com.example.devicestore.core.device;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.devicestore.core.filter.PredicateComposer;
import com.example.devicestore.core.jdbc.DbClient;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * PostgreSQL {@link DeviceStore}.
 *
 * <p>Each merge is a single {@code INSERT ... ON CONFLICT (serial_number) DO UPDATE} statement, so
 * two sources merging facts for the same device at the same time can never lose either fact set:
 * PostgreSQL resolves the conflict atomically at the row level. No locking or read-before-write
 * happens here.
 */
public final class PostgresDeviceStore implements DeviceStore {

  private static final System.Logger LOGGER =
      System.getLogger(PostgresDeviceStore.class.getName());

  static final String UPSERT_PROVISIONING_FACTS =
      """
      INSERT INTO devices (
        serial_number,
        model,
        description,
        color,
        asset_tag,
        dep_profile_status,
        dep_profile_uuid,
        dep_profile_assign_time,
        dep_profile_push_time,
        dep_profile_assigned_date,
        dep_profile_assigned_by,
        dep_device
      )
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      ON CONFLICT (serial_number)
      DO UPDATE SET
        model = EXCLUDED.model,
        description = EXCLUDED.description,
        color = EXCLUDED.color,
        asset_tag = EXCLUDED.asset_tag,
        dep_profile_status = EXCLUDED.dep_profile_status,
        dep_profile_uuid = EXCLUDED.dep_profile_uuid,
        dep_profile_assign_time = EXCLUDED.dep_profile_assign_time,
        dep_profile_push_time = EXCLUDED.dep_profile_push_time,
        dep_profile_assigned_date = EXCLUDED.dep_profile_assigned_date,
        dep_profile_assigned_by = EXCLUDED.dep_profile_assigned_by,
        dep_device = EXCLUDED.dep_device
      RETURNING device_uuid""";

  static final String UPSERT_ENROLLMENT_FACTS =
      """
      INSERT INTO devices (
        udid,
        apple_mdm_topic,
        os_version,
        build_version,
        product_name,
        serial_number,
        imei,
        meid
      )
      VALUES (?, ?, ?, ?, ?, ?, ?, ?)
      ON CONFLICT (serial_number)
      DO UPDATE SET
        udid = EXCLUDED.udid,
        apple_mdm_topic = EXCLUDED.apple_mdm_topic,
        os_version = EXCLUDED.os_version,
        build_version = EXCLUDED.build_version,
        product_name = EXCLUDED.product_name,
        serial_number = EXCLUDED.serial_number,
        imei = EXCLUDED.imei,
        meid = EXCLUDED.meid
      RETURNING device_uuid""";

  static final String SELECT_SUMMARIES =
      "SELECT device_uuid, udid, serial_number, dep_profile_status, model, workflow_uuid"
          + " FROM devices";

  private final DbClient client;

  public PostgresDeviceStore(final DbClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public UUID createOrMerge(final FactSource source, final Device facts) throws SQLException {
    Objects.requireNonNull(source, "source");
    if (facts == null) throw new IllegalArgumentException("device facts are required");
    if (isBlank(facts.serialNumber()))
      throw new IllegalArgumentException("serial number is required to merge device facts");
    if (source == FactSource.AUTHENTICATE && isBlank(facts.udid()))
      throw new IllegalArgumentException("udid is required to merge enrollment facts");

    final var sql =
        source == FactSource.FETCH ? UPSERT_PROVISIONING_FACTS : UPSERT_ENROLLMENT_FACTS;

    final var uuid =
        client.execute(
            conn -> {
              try (final var ps = client.prepare(conn, sql, List.of())) {
                if (source == FactSource.FETCH) bindProvisioningFacts(ps, facts);
                else bindEnrollmentFacts(ps, facts);
                try (final var rs = ps.executeQuery()) {
                  if (!rs.next())
                    throw new SQLException("upsert returned no device_uuid for " + source.tag());
                  return rs.getObject(1, UUID.class);
                }
              }
            });
    LOGGER.log(
        DEBUG,
        "Merged {0} facts for serial {1} into device {2}",
        source.tag(),
        facts.serialNumber(),
        uuid);
    return uuid;
  }

  @Override
  public Optional<Device> findByUuid(final UUID uuid) throws SQLException {
    Objects.requireNonNull(uuid, "uuid");
    final var columns = EnumSet.allOf(DeviceColumn.class);
    final var sql = "SELECT " + columnList(columns) + " FROM devices WHERE device_uuid = ?";
    return findOne("findByUuid", sql, uuid, columns);
  }

  @Override
  public Optional<Device> findByUdid(final String udid, final Collection<DeviceColumn> projection)
      throws SQLException {
    if (isBlank(udid)) throw new IllegalArgumentException("udid is required");
    if (projection != null && projection.stream().anyMatch(Objects::isNull))
      throw new IllegalArgumentException("projection cannot contain null columns");
    final var columns =
        projection == null || projection.isEmpty()
            ? EnumSet.allOf(DeviceColumn.class)
            : EnumSet.copyOf(projection);

    // udid has no unique constraint, so the tie-break has to be explicit
    final var sql =
        "SELECT "
            + columnList(columns)
            + " FROM devices WHERE udid = ? ORDER BY device_uuid LIMIT 1";
    return findOne("findByUdid", sql, udid, columns);
  }

  @Override
  public List<DeviceSummary> list(final Object... params) throws SQLException {
    final var query = PredicateComposer.compose(SELECT_SUMMARIES, params);
    final var sql = query.sql() + " ORDER BY serial_number";
    try {
      return client.execute(
          conn -> {
            try (final var ps = client.prepare(conn, sql, query.params());
                final var rs = ps.executeQuery()) {
              final var devices = new ArrayList<DeviceSummary>();
              while (rs.next()) devices.add(toSummary(rs));
              return devices;
            }
          });
    } catch (final SQLException e) {
      throw withContext("list devices", e);
    }
  }

  @Override
  public void close() {
    try {
      client.close();
      LOGGER.log(INFO, "Device store closed");
    } catch (final Exception e) {
      LOGGER.log(WARNING, "Failed to close device store connection pool", e);
    }
  }

  private Optional<Device> findOne(
      final String operation,
      final String sql,
      final Object key,
      final Collection<DeviceColumn> columns)
      throws SQLException {
    try {
      return client.execute(
          conn -> {
            try (final var ps = client.prepare(conn, sql, List.of(key));
                final var rs = ps.executeQuery()) {
              if (!rs.next()) return Optional.empty();
              final var builder = Device.builder();
              for (final var column : columns) column.read(rs, builder);
              return Optional.of(builder.build());
            }
          });
    } catch (final SQLException e) {
      throw withContext(operation, e);
    }
  }

  private static void bindProvisioningFacts(final PreparedStatement ps, final Device d)
      throws SQLException {
    ps.setString(1, d.serialNumber());
    ps.setString(2, d.model());
    ps.setString(3, d.description());
    ps.setString(4, d.color());
    ps.setString(5, d.assetTag());
    ps.setString(6, d.depProfileStatus());
    ps.setString(7, d.depProfileUuid());
    setDate(ps, 8, d.depProfileAssignTime());
    setDate(ps, 9, d.depProfilePushTime());
    setDate(ps, 10, d.depProfileAssignedDate());
    ps.setString(11, d.depProfileAssignedBy());
    ps.setBoolean(12, true);
  }

  private static void bindEnrollmentFacts(final PreparedStatement ps, final Device d)
      throws SQLException {
    ps.setString(1, d.udid());
    ps.setString(2, d.mdmTopic());
    ps.setString(3, d.osVersion());
    ps.setString(4, d.buildVersion());
    ps.setString(5, d.productName());
    ps.setString(6, d.serialNumber());
    ps.setString(7, d.imei());
    ps.setString(8, d.meid());
  }

  private static void setDate(final PreparedStatement ps, final int index, final LocalDate date)
      throws SQLException {
    if (date == null) ps.setNull(index, Types.DATE);
    else ps.setDate(index, Date.valueOf(date));
  }

  private static DeviceSummary toSummary(final ResultSet rs) throws SQLException {
    return new DeviceSummary(
        rs.getObject("device_uuid", UUID.class),
        rs.getString("udid"),
        rs.getString("serial_number"),
        rs.getString("dep_profile_status"),
        rs.getString("model"),
        rs.getString("workflow_uuid"));
  }

  private static String columnList(final Collection<DeviceColumn> columns) {
    return columns.stream().map(DeviceColumn::columnName).collect(Collectors.joining(", "));
  }

  private static SQLException withContext(final String operation, final SQLException e) {
    return new SQLException(
        "device datastore %s failed: %s".formatted(operation, e.getMessage()),
        e.getSQLState(),
        e.getErrorCode(),
        e);
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
