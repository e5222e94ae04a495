package com.reclaimradar.claims.query;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimStatus;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.ClaimableItemRepository;
import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventRepository;
import com.reclaimradar.domain.LedgerEventStatus;
import com.reclaimradar.domain.ReimbursedItem;
import com.reclaimradar.domain.ReimbursedItemRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClaimStatsServiceTest {

    @Mock
    private ReimbursedItemRepository reimbursedItemRepository;
    @Mock
    private ClaimableItemRepository claimableItemRepository;
    @Mock
    private LedgerEventRepository ledgerEventRepository;

    @InjectMocks
    private ClaimStatsService service;

    @Test
    @DisplayName("stats group recovered money by currency, claims by category and status, ledger by bucket")
    void aggregates() {
        when(reimbursedItemRepository.findAll()).thenReturn(List.of(
                reimbursed("USD", 2, "30.00"), reimbursed("USD", 1, "10.50"), reimbursed("CAD", 1, "8.00")));
        when(claimableItemRepository.findAll()).thenReturn(List.of(
                claim(ClaimCategory.LOST_WAREHOUSE, ClaimStatus.PENDING, 3, "45.00"),
                claim(ClaimCategory.LOST_WAREHOUSE, ClaimStatus.CLAIMED, 1, null),
                claim(ClaimCategory.DAMAGED_WAREHOUSE, ClaimStatus.PENDING, 2, "20.00")));
        when(ledgerEventRepository.findByStatus(LedgerEventStatus.CLAIMABLE)).thenReturn(List.of(ledger(4), ledger(-2)));
        when(ledgerEventRepository.findByStatus(LedgerEventStatus.WAITING)).thenReturn(List.of(ledger(1)));
        when(ledgerEventRepository.countByStatus(any())).thenReturn(0L);
        when(ledgerEventRepository.countByStatus(LedgerEventStatus.CLAIMABLE)).thenReturn(2L);

        ClaimStats stats = service.getStats();

        assertThat(stats.recovered()).hasSize(2);
        assertThat(stats.recovered().get(0).currency()).isEqualTo("USD");
        assertThat(stats.recovered().get(0).itemCount()).isEqualTo(2);
        assertThat(stats.recovered().get(0).totalQuantity()).isEqualTo(3);
        assertThat(stats.recovered().get(0).totalValue()).isEqualByComparingTo("40.50");

        ClaimStats.CategoryTotals lost = stats.byCategory().stream()
                .filter(t -> t.category().equals("LOST_WAREHOUSE")).findFirst().orElseThrow();
        assertThat(lost.itemCount()).isEqualTo(2);
        assertThat(lost.totalQuantity()).isEqualTo(4);
        assertThat(lost.totalValue()).isEqualByComparingTo("45.00");

        assertThat(stats.byStatus()).containsEntry("PENDING", 2L).containsEntry("CLAIMED", 1L).containsEntry("DENIED", 0L);
        assertThat(stats.ledger().totalClaimableUnits()).isEqualTo(6);
        assertThat(stats.ledger().totalWaitingUnits()).isEqualTo(1);
        assertThat(stats.ledger().countsByStatus()).containsEntry("CLAIMABLE", 2L).containsEntry("RESOLVED", 0L);
    }

    private static ReimbursedItem reimbursed(String currency, int qty, String amount) {
        ReimbursedItem r = new ReimbursedItem();
        r.setCurrencyUnit(currency);
        r.setQuantityReimbursedTotal(qty);
        r.setAmountTotal(new BigDecimal(amount));
        return r;
    }

    private static ClaimableItem claim(ClaimCategory category, ClaimStatus status, int qty, String value) {
        ClaimableItem c = new ClaimableItem();
        c.setCategory(category);
        c.setStatus(status);
        c.setQuantity(qty);
        c.setCurrency("USD");
        c.setEstimatedValue(value != null ? new BigDecimal(value) : null);
        return c;
    }

    private static LedgerEvent ledger(int unreconciled) {
        LedgerEvent e = new LedgerEvent();
        e.setUnreconciledQuantity(unreconciled);
        return e;
    }
}
