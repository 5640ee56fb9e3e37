package com.fueltrack.archival.service;

import com.fueltrack.archival.model.RetentionDecision;
import com.fueltrack.archival.model.RetentionPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class RetentionResolverTest {

    @Mock
    private RetentionPolicyProvider policyProvider;

    @InjectMocks
    private RetentionResolver retentionResolver;

    @Test
    public void testResolve_PerTypeDisabled() {
        when(policyProvider.currentPolicy()).thenReturn(RetentionPolicy.builder()
                .archivalEnabled(true)
                .archivalMonths(3)
                .type("DeliveryOrder", new RetentionPolicy.TypeRetention(false, 24))
                .build());

        RetentionDecision decision = retentionResolver.resolve("DeliveryOrder", 6);

        assertFalse(decision.isEnabled());
    }

    @Test
    public void testResolve_PerTypeMonthsWin() {
        when(policyProvider.currentPolicy()).thenReturn(RetentionPolicy.builder()
                .archivalMonths(3)
                .type("FuelRecord", new RetentionPolicy.TypeRetention(true, 18))
                .build());

        assertEquals(RetentionDecision.keepMonths(18), retentionResolver.resolve("FuelRecord", 6));
    }

    @Test
    public void testResolve_PerTypeWithoutMonthsUsesDefaultNotGlobal() {
        when(policyProvider.currentPolicy()).thenReturn(RetentionPolicy.builder()
                .archivalMonths(3)
                .type("FuelRecord", new RetentionPolicy.TypeRetention(true, null))
                .build());

        assertEquals(RetentionDecision.keepMonths(6), retentionResolver.resolve("FuelRecord", 6));
    }

    @Test
    public void testResolve_GlobalDisabled() {
        when(policyProvider.currentPolicy()).thenReturn(RetentionPolicy.builder()
                .archivalEnabled(false)
                .archivalMonths(3)
                .build());

        assertFalse(retentionResolver.resolve("LPOEntry", 6).isEnabled());
    }

    @Test
    public void testResolve_GlobalMonths() {
        when(policyProvider.currentPolicy()).thenReturn(RetentionPolicy.builder()
                .archivalEnabled(true)
                .archivalMonths(4)
                .build());

        assertEquals(RetentionDecision.keepMonths(4), retentionResolver.resolve("LPOEntry", 6));
    }

    @Test
    public void testResolve_NothingConfigured() {
        when(policyProvider.currentPolicy()).thenReturn(RetentionPolicy.empty());

        assertEquals(RetentionDecision.keepMonths(12), retentionResolver.resolve("AuditLog", 12));
    }

    @Test
    public void testResolve_NonPositiveMonthsTreatedAsUnset() {
        when(policyProvider.currentPolicy()).thenReturn(RetentionPolicy.builder()
                .archivalMonths(0)
                .type("LPOSummary", new RetentionPolicy.TypeRetention(true, -2))
                .build());

        assertEquals(RetentionDecision.keepMonths(6), retentionResolver.resolve("LPOSummary", 6));
        assertEquals(RetentionDecision.keepMonths(6), retentionResolver.resolve("FuelRecord", 6));
    }

    @Test
    public void testResolve_ProviderFailureFallsBackToDefaultEnabled() {
        when(policyProvider.currentPolicy()).thenThrow(new DataAccessResourceFailureException("mongo down"));

        RetentionDecision decision = retentionResolver.resolve("FuelRecord", 6);

        assertTrue(decision.isEnabled());
        assertEquals(6, decision.getMonths());
    }
}
