package com.fueltrack.archival.service;

import com.fueltrack.archival.model.RetentionPolicy;
import com.fueltrack.archival.model.SystemConfig;
import com.fueltrack.archival.repository.SystemConfigRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SystemConfigRetentionPolicyProviderTest {

    @Mock
    private SystemConfigRepository systemConfigRepository;

    @InjectMocks
    private SystemConfigRetentionPolicyProvider provider;

    private static SystemConfig config(SystemConfig.DataSettings data) {
        SystemConfig.SystemSettings settings = new SystemConfig.SystemSettings();
        settings.setData(data);
        SystemConfig config = new SystemConfig();
        config.setConfigType(SystemConfig.SYSTEM_SETTINGS);
        config.setSystemSettings(settings);
        return config;
    }

    private static SystemConfig.CollectionArchivalSetting setting(Boolean enabled, Integer months) {
        SystemConfig.CollectionArchivalSetting setting = new SystemConfig.CollectionArchivalSetting();
        setting.setEnabled(enabled);
        setting.setRetentionMonths(months);
        return setting;
    }

    @Test
    public void testCurrentPolicy_MapsDataSettings() {
        SystemConfig.DataSettings data = new SystemConfig.DataSettings();
        data.setArchivalEnabled(true);
        data.setArchivalMonths(5);
        data.setAuditLogRetention(18);
        Map<String, SystemConfig.CollectionArchivalSetting> perCollection = new LinkedHashMap<>();
        perCollection.put("DeliveryOrder", setting(false, null));
        perCollection.put("FuelRecord", setting(null, 9));
        data.setCollectionArchivalSettings(perCollection);
        when(systemConfigRepository.findFirstByConfigType(SystemConfig.SYSTEM_SETTINGS))
                .thenReturn(Optional.of(config(data)));

        RetentionPolicy policy = provider.currentPolicy();

        assertEquals(Boolean.TRUE, policy.getArchivalEnabled());
        assertEquals(5, policy.getArchivalMonths());
        assertEquals(18, policy.getAuditLogMonths());
        assertFalse(policy.forType("DeliveryOrder").get().isEnabled());
        assertTrue(policy.forType("FuelRecord").get().isEnabled());
        assertEquals(9, policy.forType("FuelRecord").get().getRetentionMonths());
        assertTrue(policy.forType("LPOEntry").isEmpty());
    }

    @Test
    public void testCurrentPolicy_MissingDocumentIsEmpty() {
        when(systemConfigRepository.findFirstByConfigType(SystemConfig.SYSTEM_SETTINGS))
                .thenReturn(Optional.empty());

        RetentionPolicy policy = provider.currentPolicy();

        assertNull(policy.getArchivalEnabled());
        assertTrue(policy.getPerType().isEmpty());
    }

    @Test
    public void testCurrentPolicy_DeletedDocumentIgnored() {
        SystemConfig.DataSettings data = new SystemConfig.DataSettings();
        data.setArchivalEnabled(false);
        SystemConfig deleted = config(data);
        deleted.setDeleted(true);
        when(systemConfigRepository.findFirstByConfigType(SystemConfig.SYSTEM_SETTINGS))
                .thenReturn(Optional.of(deleted));

        assertNull(provider.currentPolicy().getArchivalEnabled());
    }
}
