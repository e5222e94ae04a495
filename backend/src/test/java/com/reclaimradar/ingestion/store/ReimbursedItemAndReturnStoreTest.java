package com.reclaimradar.ingestion.store;

import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.CustomerReturnRepository;
import com.reclaimradar.domain.ReimbursedItem;
import com.reclaimradar.domain.ReimbursedItemRepository;
import com.reclaimradar.ingestion.adapter.ReportTableParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReimbursedItemAndReturnStoreTest {

    private static final String REIMBURSEMENTS = "approval-date\treimbursement-id\tamazon-order-id\tfnsku\tasin\tsku\t"
            + "quantity-reimbursed-total\tamount-total\n";
    private static final String RETURNS = "return-date\torder-id\tsku\tasin\tfnsku\tquantity\tstatus\n";

    @Mock
    private ReimbursedItemRepository reimbursedItemRepository;
    @Mock
    private CustomerReturnRepository customerReturnRepository;

    @InjectMocks
    private ReimbursedItemStore reimbursedItemStore;
    @InjectMocks
    private CustomerReturnStore customerReturnStore;

    @Test
    @DisplayName("new reimbursement id is created")
    void newReimbursement_isCreated() {
        when(reimbursedItemRepository.findByReimbursementId("RB-1")).thenReturn(Optional.empty());

        IngestResult result = reimbursedItemStore.ingest(ReportTableParser.parse(
                REIMBURSEMENTS + "2024-03-01T00:00:00Z\tRB-1\t111-1\tX1\tB1\tS1\t2\t31.98\n"));

        assertThat(result).isEqualTo(new IngestResult(1, 1, 0, 0));
        ArgumentCaptor<ReimbursedItem> saved = ArgumentCaptor.forClass(ReimbursedItem.class);
        verify(reimbursedItemRepository).save(saved.capture());
        assertThat(saved.getValue().getAmazonOrderId()).isEqualTo("111-1");
        assertThat(saved.getValue().getAmountTotal()).isEqualByComparingTo("31.98");
        assertThat(saved.getValue().getCurrencyUnit()).isEqualTo("USD");
    }

    @Test
    @DisplayName("known reimbursement id refreshes approval date and amounts")
    void knownReimbursement_isUpdated() {
        ReimbursedItem existing = new ReimbursedItem();
        existing.setReimbursementId("RB-1");
        existing.setProductName("Original name");
        when(reimbursedItemRepository.findByReimbursementId("RB-1")).thenReturn(Optional.of(existing));

        IngestResult result = reimbursedItemStore.ingest(ReportTableParser.parse(
                REIMBURSEMENTS + "2024-03-04T00:00:00Z\tRB-1\t111-1\tX1\tB1\tS1\t3\t47.97\n"));

        assertThat(result).isEqualTo(new IngestResult(1, 0, 1, 0));
        assertThat(existing.getApprovalDate()).isEqualTo(Instant.parse("2024-03-04T00:00:00Z"));
        assertThat(existing.getQuantityReimbursedTotal()).isEqualTo(3);
        assertThat(existing.getProductName()).isEqualTo("Original name");
    }

    @Test
    @DisplayName("re-sync of an identical reimbursement writes nothing and counts no update")
    void unchangedReimbursement_isNotRewritten() {
        ReimbursedItem existing = new ReimbursedItem();
        existing.setReimbursementId("RB-1");
        existing.setApprovalDate(Instant.parse("2024-03-04T00:00:00Z"));
        existing.setQuantityReimbursedTotal(3);
        existing.setAmountPerUnit(new BigDecimal("0"));
        existing.setAmountTotal(new BigDecimal("47.970"));
        when(reimbursedItemRepository.findByReimbursementId("RB-1")).thenReturn(Optional.of(existing));

        IngestResult result = reimbursedItemStore.ingest(ReportTableParser.parse(
                REIMBURSEMENTS + "2024-03-04T00:00:00Z\tRB-1\t111-1\tX1\tB1\tS1\t3\t47.97\n"));

        assertThat(result).isEqualTo(new IngestResult(1, 0, 0, 0));
        verify(reimbursedItemRepository, never()).save(any());
    }

    @Test
    void reimbursementMissingRequiredField_isSkipped() {
        IngestResult result = reimbursedItemStore.ingest(ReportTableParser.parse(
                REIMBURSEMENTS + "2024-03-04T00:00:00Z\t\t111-1\tX1\tB1\tS1\t3\t47.97\n"));

        assertThat(result).isEqualTo(new IngestResult(1, 0, 0, 1));
        verify(reimbursedItemRepository, never()).save(any());
    }

    @Test
    @DisplayName("known customer return is left untouched")
    void knownReturn_isNotRewritten() {
        when(customerReturnRepository.existsByOrderIdAndFnskuAndReturnDate(eq("111-1"), eq("X1"), any())).thenReturn(true);
        when(customerReturnRepository.existsByOrderIdAndFnskuAndReturnDate(eq("111-2"), eq("X1"), any())).thenReturn(false);

        IngestResult result = customerReturnStore.ingest(ReportTableParser.parse(RETURNS
                + "2024-02-01T10:00:00Z\t111-1\tS1\tB1\tX1\t1\tUnit returned to inventory\n"
                + "2024-02-02T10:00:00Z\t111-2\tS1\tB1\tX1\t\t\n"));

        assertThat(result).isEqualTo(new IngestResult(2, 1, 0, 0));
        ArgumentCaptor<CustomerReturn> saved = ArgumentCaptor.forClass(CustomerReturn.class);
        verify(customerReturnRepository).save(saved.capture());
        assertThat(saved.getValue().getOrderId()).isEqualTo("111-2");
        assertThat(saved.getValue().getQuantity()).isEqualTo(1);
    }
}
