package com.example.devicestore.core.device;

import java.util.UUID;

/**
 * Row of the device list.
 *
 * @param uuid surrogate identifier
 * @param udid device-generated identifier, empty until enrollment
 * @param serialNumber hardware serial number
 * @param depProfileStatus provisioning profile status
 * @param model device model
 * @param workflowUuid workflow owning the device, empty when none
 */
public record DeviceSummary(
    UUID uuid,
    String udid,
    String serialNumber,
    String depProfileStatus,
    String model,
    String workflowUuid) {}
