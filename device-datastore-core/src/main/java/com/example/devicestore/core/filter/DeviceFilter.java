package com.example.devicestore.core.filter;

import java.util.Objects;
import java.util.UUID;

/**
 * Narrows the device list. Every variant renders a single comparison whose value is bound as a
 * statement parameter.
 *
 * <pre>{@code
 * store.list(new DeviceFilter.ByProfileStatus("assigned"), new DeviceFilter.ProvisionedOnly(true));
 * }</pre>
 */
public sealed interface DeviceFilter {

  /**
   * Renders this filter as one {@code WHERE} condition.
   *
   * @return condition and its bound values
   */
  SqlFragment toSql();

  /** Matches exactly one surrogate identifier. */
  record ByUuid(UUID uuid) implements DeviceFilter {
    public ByUuid {
      Objects.requireNonNull(uuid, "uuid");
    }

    @Override
    public SqlFragment toSql() {
      return SqlFragment.of("device_uuid = ?", uuid);
    }
  }

  /** Matches a hardware serial number. */
  record BySerialNumber(String serialNumber) implements DeviceFilter {
    public BySerialNumber {
      Objects.requireNonNull(serialNumber, "serialNumber");
    }

    @Override
    public SqlFragment toSql() {
      return SqlFragment.of("serial_number = ?", serialNumber);
    }
  }

  /** Matches a device-generated UDID. */
  record ByUdid(String udid) implements DeviceFilter {
    public ByUdid {
      Objects.requireNonNull(udid, "udid");
    }

    @Override
    public SqlFragment toSql() {
      return SqlFragment.of("udid = ?", udid);
    }
  }

  /** Matches a provisioning profile status such as {@code assigned} or {@code pushed}. */
  record ByProfileStatus(String status) implements DeviceFilter {
    public ByProfileStatus {
      Objects.requireNonNull(status, "status");
    }

    @Override
    public SqlFragment toSql() {
      return SqlFragment.of("dep_profile_status = ?", status);
    }
  }

  /** Matches devices attached to a workflow; an empty id selects devices without one. */
  record ByWorkflow(String workflowUuid) implements DeviceFilter {
    public ByWorkflow {
      Objects.requireNonNull(workflowUuid, "workflowUuid");
    }

    @Override
    public SqlFragment toSql() {
      return SqlFragment.of("workflow_uuid = ?", workflowUuid);
    }
  }

  /** Matches rows that were, or were not, sourced from the provisioning feed. */
  record ProvisionedOnly(boolean provisioned) implements DeviceFilter {
    @Override
    public SqlFragment toSql() {
      return provisioned
          ? SqlFragment.of("dep_device = ?", true)
          : SqlFragment.of("dep_device IS NOT TRUE");
    }
  }
}
