package com.fueltrack.archival.service;

import com.fueltrack.archival.model.RetentionPolicy;
import com.fueltrack.archival.model.SystemConfig;
import com.fueltrack.archival.repository.SystemConfigRepository;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Reads the retention policy from the application's {@code system_settings} configuration document.
 */
@Service
public class SystemConfigRetentionPolicyProvider implements RetentionPolicyProvider {

    private final SystemConfigRepository systemConfigRepository;

    public SystemConfigRetentionPolicyProvider(SystemConfigRepository systemConfigRepository) {
        this.systemConfigRepository = systemConfigRepository;
    }

    @Override
    public RetentionPolicy currentPolicy() {
        return systemConfigRepository.findFirstByConfigType(SystemConfig.SYSTEM_SETTINGS)
                .filter(config -> !config.isDeleted())
                .map(SystemConfig::getSystemSettings)
                .map(SystemConfig.SystemSettings::getData)
                .map(this::toPolicy)
                .orElseGet(RetentionPolicy::empty);
    }

    private RetentionPolicy toPolicy(SystemConfig.DataSettings data) {
        RetentionPolicy.RetentionPolicyBuilder builder = RetentionPolicy.builder()
                .archivalEnabled(data.getArchivalEnabled())
                .archivalMonths(data.getArchivalMonths())
                .auditLogMonths(data.getAuditLogRetention());
        Map<String, SystemConfig.CollectionArchivalSetting> perCollection = data.getCollectionArchivalSettings();
        if (perCollection != null) {
            perCollection.forEach((name, setting) -> {
                if (setting != null) {
                    // A per-type entry without an explicit flag is treated as enabled
                    boolean enabled = !Boolean.FALSE.equals(setting.getEnabled());
                    builder.type(name, new RetentionPolicy.TypeRetention(enabled, setting.getRetentionMonths()));
                }
            });
        }
        return builder.build();
    }
}
