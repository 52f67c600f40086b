package com.example.devicestore.core.device;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * Readable columns of the {@code devices} table.
 *
 * <p>Projections are built from these constants only, so a caller-supplied column name can never
 * reach the statement text unchecked.
 */
public enum DeviceColumn {
  DEVICE_UUID("device_uuid", (rs, b) -> b.uuid(rs.getObject("device_uuid", UUID.class))),
  UDID("udid", (rs, b) -> b.udid(rs.getString("udid"))),
  SERIAL_NUMBER("serial_number", (rs, b) -> b.serialNumber(rs.getString("serial_number"))),
  OS_VERSION("os_version", (rs, b) -> b.osVersion(rs.getString("os_version"))),
  MODEL("model", (rs, b) -> b.model(rs.getString("model"))),
  COLOR("color", (rs, b) -> b.color(rs.getString("color"))),
  ASSET_TAG("asset_tag", (rs, b) -> b.assetTag(rs.getString("asset_tag"))),
  DEP_PROFILE_STATUS(
      "dep_profile_status", (rs, b) -> b.depProfileStatus(rs.getString("dep_profile_status"))),
  DEP_PROFILE_UUID(
      "dep_profile_uuid", (rs, b) -> b.depProfileUuid(rs.getString("dep_profile_uuid"))),
  DEP_PROFILE_ASSIGN_TIME(
      "dep_profile_assign_time",
      (rs, b) -> b.depProfileAssignTime(rs.getObject("dep_profile_assign_time", LocalDate.class))),
  DEP_PROFILE_PUSH_TIME(
      "dep_profile_push_time",
      (rs, b) -> b.depProfilePushTime(rs.getObject("dep_profile_push_time", LocalDate.class))),
  DEP_PROFILE_ASSIGNED_DATE(
      "dep_profile_assigned_date",
      (rs, b) ->
          b.depProfileAssignedDate(rs.getObject("dep_profile_assigned_date", LocalDate.class))),
  DEP_PROFILE_ASSIGNED_BY(
      "dep_profile_assigned_by",
      (rs, b) -> b.depProfileAssignedBy(rs.getString("dep_profile_assigned_by"))),
  DESCRIPTION("description", (rs, b) -> b.description(rs.getString("description"))),
  BUILD_VERSION("build_version", (rs, b) -> b.buildVersion(rs.getString("build_version"))),
  PRODUCT_NAME("product_name", (rs, b) -> b.productName(rs.getString("product_name"))),
  IMEI("imei", (rs, b) -> b.imei(rs.getString("imei"))),
  MEID("meid", (rs, b) -> b.meid(rs.getString("meid"))),
  APPLE_MDM_TOKEN("apple_mdm_token", (rs, b) -> b.mdmToken(rs.getString("apple_mdm_token"))),
  APPLE_MDM_TOPIC("apple_mdm_topic", (rs, b) -> b.mdmTopic(rs.getString("apple_mdm_topic"))),
  APPLE_PUSH_MAGIC("apple_push_magic", (rs, b) -> b.pushMagic(rs.getString("apple_push_magic"))),
  MDM_ENROLLED(
      "mdm_enrolled", (rs, b) -> b.mdmEnrolled(rs.getObject("mdm_enrolled", Boolean.class))),
  WORKFLOW_UUID("workflow_uuid", (rs, b) -> b.workflowUuid(rs.getString("workflow_uuid"))),
  DEP_DEVICE("dep_device", (rs, b) -> b.depDevice(rs.getObject("dep_device", Boolean.class))),
  AWAITING_CONFIGURATION(
      "awaiting_configuration",
      (rs, b) -> b.awaitingConfiguration(rs.getObject("awaiting_configuration", Boolean.class)));

  private final String columnName;
  private final ColumnReader reader;

  DeviceColumn(final String columnName, final ColumnReader reader) {
    this.columnName = columnName;
    this.reader = reader;
  }

  public String columnName() {
    return columnName;
  }

  /**
   * Copies this column from the current row into {@code builder}.
   *
   * @param rs result set positioned on a row that selected this column
   * @param builder target builder
   * @throws SQLException if the column cannot be read
   */
  public void read(final ResultSet rs, final Device.Builder builder) throws SQLException {
    reader.read(rs, builder);
  }

  /**
   * Resolves a column by its SQL name, case-insensitively.
   *
   * @param name column name such as {@code serial_number}
   * @return matching column
   * @throws IllegalArgumentException if no such column exists
   */
  public static DeviceColumn fromName(final String name) {
    if (name != null) {
      final var normalized = name.trim().toLowerCase(Locale.ROOT);
      for (final var column : values()) if (column.columnName.equals(normalized)) return column;
    }
    throw new IllegalArgumentException("unknown device column: " + name);
  }

  @FunctionalInterface
  private interface ColumnReader {
    void read(ResultSet rs, Device.Builder builder) throws SQLException;
  }
}
