package com.example.devicestore.core.device;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Canonical device row.
 *
 * <p>Columns fall into two fact sets written independently: provisioning facts (model, color,
 * profile assignment...) merged under {@link FactSource#FETCH}, and enrollment facts (UDID, OS
 * version, IMEI...) merged under {@link FactSource#AUTHENTICATE}. The serial number belongs to
 * both. Columns not selected by a projection read back as {@code null}.
 *
 * @param uuid store-generated surrogate identifier
 * @param udid device-generated identifier, empty until enrollment
 * @param serialNumber hardware serial number
 * @param osVersion OS version reported at enrollment
 * @param buildVersion OS build reported at enrollment
 * @param productName product name reported at enrollment
 * @param imei IMEI reported at enrollment
 * @param meid MEID reported at enrollment
 * @param mdmTopic push topic of the MDM enrollment
 * @param model device model from the provisioning feed
 * @param description device description from the provisioning feed
 * @param color device color from the provisioning feed
 * @param assetTag asset tag from the provisioning feed
 * @param depProfileStatus provisioning profile status
 * @param depProfileUuid provisioning profile identifier
 * @param depProfileAssignTime date the profile was assigned
 * @param depProfilePushTime date the profile was pushed
 * @param depProfileAssignedDate date the device was assigned
 * @param depProfileAssignedBy actor that assigned the profile
 * @param depDevice whether the row was sourced from the provisioning feed
 * @param workflowUuid workflow owning the device, empty when none
 * @param mdmToken MDM push token
 * @param pushMagic MDM push magic
 * @param mdmEnrolled whether MDM enrollment completed
 * @param awaitingConfiguration whether the device waits for configuration
 */
public record Device(
    UUID uuid,
    String udid,
    String serialNumber,
    String osVersion,
    String buildVersion,
    String productName,
    String imei,
    String meid,
    String mdmTopic,
    String model,
    String description,
    String color,
    String assetTag,
    String depProfileStatus,
    String depProfileUuid,
    LocalDate depProfileAssignTime,
    LocalDate depProfilePushTime,
    LocalDate depProfileAssignedDate,
    String depProfileAssignedBy,
    Boolean depDevice,
    String workflowUuid,
    String mdmToken,
    String pushMagic,
    Boolean mdmEnrolled,
    Boolean awaitingConfiguration) {

  public static Builder builder() {
    return new Builder();
  }

  /** Fluent builder for {@link Device}. Unset values stay {@code null}. */
  public static class Builder {
    private UUID uuid;
    private String udid;
    private String serialNumber;
    private String osVersion;
    private String buildVersion;
    private String productName;
    private String imei;
    private String meid;
    private String mdmTopic;
    private String model;
    private String description;
    private String color;
    private String assetTag;
    private String depProfileStatus;
    private String depProfileUuid;
    private LocalDate depProfileAssignTime;
    private LocalDate depProfilePushTime;
    private LocalDate depProfileAssignedDate;
    private String depProfileAssignedBy;
    private Boolean depDevice;
    private String workflowUuid;
    private String mdmToken;
    private String pushMagic;
    private Boolean mdmEnrolled;
    private Boolean awaitingConfiguration;

    private Builder() {}

    /**
     * Sets the store-generated surrogate identifier. Ignored by merges.
     *
     * @param uuid store-generated surrogate identifier
     * @return this builder
     */
    public Builder uuid(final UUID uuid) {
      this.uuid = uuid;
      return this;
    }

    /**
     * Sets the device-generated identifier; required for {@link FactSource#AUTHENTICATE}.
     *
     * @param udid device-generated identifier, empty until enrollment
     * @return this builder
     */
    public Builder udid(final String udid) {
      this.udid = udid;
      return this;
    }

    /**
     * Sets the hardware serial number (required for every merge).
     *
     * @param serialNumber hardware serial number
     * @return this builder
     */
    public Builder serialNumber(final String serialNumber) {
      this.serialNumber = serialNumber;
      return this;
    }

    /**
     * Sets the OS version reported at enrollment.
     *
     * @param osVersion OS version reported at enrollment
     * @return this builder
     */
    public Builder osVersion(final String osVersion) {
      this.osVersion = osVersion;
      return this;
    }

    /**
     * Sets the OS build reported at enrollment.
     *
     * @param buildVersion OS build reported at enrollment
     * @return this builder
     */
    public Builder buildVersion(final String buildVersion) {
      this.buildVersion = buildVersion;
      return this;
    }

    /**
     * Sets the product name reported at enrollment.
     *
     * @param productName product name reported at enrollment
     * @return this builder
     */
    public Builder productName(final String productName) {
      this.productName = productName;
      return this;
    }

    /**
     * Sets the IMEI reported at enrollment.
     *
     * @param imei IMEI reported at enrollment
     * @return this builder
     */
    public Builder imei(final String imei) {
      this.imei = imei;
      return this;
    }

    /**
     * Sets the MEID reported at enrollment.
     *
     * @param meid MEID reported at enrollment
     * @return this builder
     */
    public Builder meid(final String meid) {
      this.meid = meid;
      return this;
    }

    /**
     * Sets the push topic of the MDM enrollment.
     *
     * @param mdmTopic push topic of the MDM enrollment
     * @return this builder
     */
    public Builder mdmTopic(final String mdmTopic) {
      this.mdmTopic = mdmTopic;
      return this;
    }

    /**
     * Sets the device model from the provisioning feed.
     *
     * @param model device model from the provisioning feed
     * @return this builder
     */
    public Builder model(final String model) {
      this.model = model;
      return this;
    }

    /**
     * Sets the device description from the provisioning feed.
     *
     * @param description device description from the provisioning feed
     * @return this builder
     */
    public Builder description(final String description) {
      this.description = description;
      return this;
    }

    /**
     * Sets the device color from the provisioning feed.
     *
     * @param color device color from the provisioning feed
     * @return this builder
     */
    public Builder color(final String color) {
      this.color = color;
      return this;
    }

    /**
     * Sets the asset tag from the provisioning feed.
     *
     * @param assetTag asset tag from the provisioning feed
     * @return this builder
     */
    public Builder assetTag(final String assetTag) {
      this.assetTag = assetTag;
      return this;
    }

    /**
     * Sets the provisioning profile status.
     *
     * @param depProfileStatus provisioning profile status
     * @return this builder
     */
    public Builder depProfileStatus(final String depProfileStatus) {
      this.depProfileStatus = depProfileStatus;
      return this;
    }

    /**
     * Sets the provisioning profile identifier.
     *
     * @param depProfileUuid provisioning profile identifier
     * @return this builder
     */
    public Builder depProfileUuid(final String depProfileUuid) {
      this.depProfileUuid = depProfileUuid;
      return this;
    }

    /**
     * Sets the date the profile was assigned.
     *
     * @param depProfileAssignTime date the profile was assigned
     * @return this builder
     */
    public Builder depProfileAssignTime(final LocalDate depProfileAssignTime) {
      this.depProfileAssignTime = depProfileAssignTime;
      return this;
    }

    /**
     * Sets the date the profile was pushed.
     *
     * @param depProfilePushTime date the profile was pushed
     * @return this builder
     */
    public Builder depProfilePushTime(final LocalDate depProfilePushTime) {
      this.depProfilePushTime = depProfilePushTime;
      return this;
    }

    /**
     * Sets the date the device was assigned.
     *
     * @param depProfileAssignedDate date the device was assigned
     * @return this builder
     */
    public Builder depProfileAssignedDate(final LocalDate depProfileAssignedDate) {
      this.depProfileAssignedDate = depProfileAssignedDate;
      return this;
    }

    /**
     * Sets the actor that assigned the profile.
     *
     * @param depProfileAssignedBy actor that assigned the profile
     * @return this builder
     */
    public Builder depProfileAssignedBy(final String depProfileAssignedBy) {
      this.depProfileAssignedBy = depProfileAssignedBy;
      return this;
    }

    /**
     * Marks whether the row was sourced from the provisioning feed.
     *
     * @param depDevice whether the row was sourced from the provisioning feed
     * @return this builder
     */
    public Builder depDevice(final Boolean depDevice) {
      this.depDevice = depDevice;
      return this;
    }

    /**
     * Sets the workflow owning the device, empty when none.
     *
     * @param workflowUuid workflow owning the device, empty when none
     * @return this builder
     */
    public Builder workflowUuid(final String workflowUuid) {
      this.workflowUuid = workflowUuid;
      return this;
    }

    /**
     * Sets the MDM push token.
     *
     * @param mdmToken MDM push token
     * @return this builder
     */
    public Builder mdmToken(final String mdmToken) {
      this.mdmToken = mdmToken;
      return this;
    }

    /**
     * Sets the MDM push magic.
     *
     * @param pushMagic MDM push magic
     * @return this builder
     */
    public Builder pushMagic(final String pushMagic) {
      this.pushMagic = pushMagic;
      return this;
    }

    /**
     * Marks whether MDM enrollment completed.
     *
     * @param mdmEnrolled whether MDM enrollment completed
     * @return this builder
     */
    public Builder mdmEnrolled(final Boolean mdmEnrolled) {
      this.mdmEnrolled = mdmEnrolled;
      return this;
    }

    /**
     * Marks whether the device waits for configuration.
     *
     * @param awaitingConfiguration whether the device waits for configuration
     * @return this builder
     */
    public Builder awaitingConfiguration(final Boolean awaitingConfiguration) {
      this.awaitingConfiguration = awaitingConfiguration;
      return this;
    }

    public Device build() {
      return new Device(
          uuid,
          udid,
          serialNumber,
          osVersion,
          buildVersion,
          productName,
          imei,
          meid,
          mdmTopic,
          model,
          description,
          color,
          assetTag,
          depProfileStatus,
          depProfileUuid,
          depProfileAssignTime,
          depProfilePushTime,
          depProfileAssignedDate,
          depProfileAssignedBy,
          depDevice,
          workflowUuid,
          mdmToken,
          pushMagic,
          mdmEnrolled,
          awaitingConfiguration);
    }
  }
}
