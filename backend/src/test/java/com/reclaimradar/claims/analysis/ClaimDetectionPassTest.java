package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimStatus;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.ReimbursedItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.reclaimradar.claims.analysis.ClaimFixtures.adjustment;
import static com.reclaimradar.claims.analysis.ClaimFixtures.claim;
import static com.reclaimradar.claims.analysis.ClaimFixtures.customerReturn;
import static com.reclaimradar.claims.analysis.ClaimFixtures.ledgerReturn;
import static com.reclaimradar.claims.analysis.ClaimFixtures.reimbursement;
import static org.assertj.core.api.Assertions.assertThat;

class ClaimDetectionPassTest {

    private static final Instant NOW = Instant.parse("2024-03-20T12:00:00Z");
    private static final Instant TEN_DAYS_AGO = Instant.parse("2024-03-10T09:30:00Z");

    private static ClaimAnalysisSnapshot snapshot(List<LedgerEvent> adjustments,
                                                  List<LedgerEvent> ledgerReturns,
                                                  List<ReimbursedItem> reimbursed,
                                                  List<CustomerReturn> returns,
                                                  List<ClaimableItem> existing,
                                                  Map<String, BigDecimal> prices) {
        return new ClaimAnalysisSnapshot(adjustments, ledgerReturns, reimbursed, returns, existing, prices);
    }

    private static ClaimAnalysisSnapshot withAdjustments(LedgerEvent... events) {
        return snapshot(List.of(events), List.of(), List.of(), List.of(), List.of(), Map.of());
    }

    @Nested
    class LostWarehouse {

        private final LostWarehousePass pass = new LostWarehousePass();

        @Test
        @DisplayName("lost adjustment with unreconciled units becomes a LOST_WAREHOUSE claim")
        void createsClaim() {
            List<ClaimableItem> found = pass.detect(withAdjustments(adjustment("X1", "M", -5, 5, TEN_DAYS_AGO)), NOW);

            assertThat(found).singleElement().satisfies(c -> {
                assertThat(c.getCategory()).isEqualTo(ClaimCategory.LOST_WAREHOUSE);
                assertThat(c.getStatus()).isEqualTo(ClaimStatus.PENDING);
                assertThat(c.getQuantity()).isEqualTo(5);
                assertThat(c.getReason()).isEqualTo("Lost in warehouse. Reason: M");
                assertThat(c.getCurrency()).isEqualTo("USD");
                assertThat(c.getEstimatedValue()).isNull();
                assertThat(c.getFulfillmentCenter()).isEqualTo("PHX7");
            });
        }

        @Test
        @DisplayName("qualifies regardless of ledger status")
        void ignoresLedgerStatus() {
            LedgerEvent recent = adjustment("X1", "5", -2, 2, NOW.minusSeconds(2 * 86_400));

            assertThat(pass.detect(withAdjustments(recent), NOW)).hasSize(1);
        }

        @Test
        void requiresUnreconciledUnitsAndLossReason() {
            assertThat(pass.detect(withAdjustments(
                    adjustment("X1", "M", -5, 0, TEN_DAYS_AGO),
                    adjustment("X2", "D", -5, 5, TEN_DAYS_AGO),
                    adjustment("X3", "F", -5, 5, TEN_DAYS_AGO)), NOW)).isEmpty();
        }

        @Test
        @DisplayName("any reimbursement for the same fnsku and asin suppresses the claim")
        void suppressedByReimbursement() {
            ClaimAnalysisSnapshot s = snapshot(List.of(adjustment("X1", "M", -5, 5, TEN_DAYS_AGO)), List.of(),
                    List.of(reimbursement("X1", "B-X1", null, Instant.parse("2023-01-01T00:00:00Z"))),
                    List.of(), List.of(), Map.of());

            assertThat(pass.detect(s, NOW)).isEmpty();
        }

        @Test
        @DisplayName("existing claim dated on the event's day or later deduplicates")
        void dedupAgainstExistingClaim() {
            ClaimAnalysisSnapshot sameDay = snapshot(List.of(adjustment("X1", "M", -5, 5, TEN_DAYS_AGO)), List.of(),
                    List.of(), List.of(),
                    List.of(claim("X1", ClaimCategory.LOST_WAREHOUSE, Instant.parse("2024-03-10T00:00:00Z"))), Map.of());
            ClaimAnalysisSnapshot dayBefore = snapshot(List.of(adjustment("X1", "M", -5, 5, TEN_DAYS_AGO)), List.of(),
                    List.of(), List.of(),
                    List.of(claim("X1", ClaimCategory.LOST_WAREHOUSE, Instant.parse("2024-03-09T23:59:59Z"))), Map.of());

            assertThat(pass.detect(sameDay, NOW)).isEmpty();
            assertThat(pass.detect(dayBefore, NOW)).hasSize(1);
        }

        @Test
        @DisplayName("two events for one fnsku on the same day yield one claim")
        void dedupWithinRun() {
            List<ClaimableItem> found = pass.detect(withAdjustments(
                    adjustment("X1", "M", -1, 1, TEN_DAYS_AGO),
                    adjustment("X1", "M", -2, 2, TEN_DAYS_AGO.plusSeconds(60))), NOW);

            assertThat(found).hasSize(1);
        }

        @Test
        @DisplayName("running twice over the saved result creates nothing new")
        void secondRunIsEmpty() {
            LedgerEvent event = adjustment("X1", "M", -5, 5, TEN_DAYS_AGO);
            List<ClaimableItem> first = pass.detect(withAdjustments(event), NOW);

            ClaimAnalysisSnapshot after = snapshot(List.of(event), List.of(), List.of(), List.of(), first, Map.of());

            assertThat(pass.detect(after, NOW)).isEmpty();
        }

        @Test
        @DisplayName("estimated value uses the latest unit price")
        void valuation() {
            ClaimAnalysisSnapshot s = snapshot(List.of(adjustment("X1", "M", -3, 3, TEN_DAYS_AGO)), List.of(),
                    List.of(), List.of(), List.of(), Map.of("X1", new BigDecimal("19.99")));

            assertThat(pass.detect(s, NOW).get(0).getEstimatedValue()).isEqualByComparingTo("59.97");
        }
    }

    @Nested
    class DamagedWarehouse {

        private final DamagedWarehousePass pass = new DamagedWarehousePass();

        @Test
        void createsClaimWithAbsoluteQuantity() {
            List<ClaimableItem> found = pass.detect(withAdjustments(adjustment("X1", "D", -4, 0, TEN_DAYS_AGO)), NOW);

            assertThat(found).singleElement().satisfies(c -> {
                assertThat(c.getCategory()).isEqualTo(ClaimCategory.DAMAGED_WAREHOUSE);
                assertThat(c.getQuantity()).isEqualTo(4);
                assertThat(c.getReason()).isEqualTo("Damaged in warehouse. Reason: D");
            });
        }

        @Test
        @DisplayName("only a reimbursement approved on or after the event suppresses")
        void suppressedByLaterReimbursementOnly() {
            LedgerEvent event = adjustment("X1", "W", -1, 0, TEN_DAYS_AGO);
            ClaimAnalysisSnapshot earlier = snapshot(List.of(event), List.of(),
                    List.of(reimbursement("X1", "B-X1", null, TEN_DAYS_AGO.minusSeconds(1))), List.of(), List.of(), Map.of());
            ClaimAnalysisSnapshot later = snapshot(List.of(event), List.of(),
                    List.of(reimbursement("X1", "B-X1", null, TEN_DAYS_AGO.plusSeconds(86_400))), List.of(), List.of(), Map.of());

            assertThat(pass.detect(earlier, NOW)).hasSize(1);
            assertThat(pass.detect(later, NOW)).isEmpty();
        }
    }

    @Nested
    class CustomerReturns {

        private final LostCustomerReturnPass lostPass = new LostCustomerReturnPass();
        private final DamagedCustomerReturnPass damagedPass = new DamagedCustomerReturnPass();
        private final Instant returnDate = Instant.parse("2024-02-01T10:00:00Z");

        @Test
        @DisplayName("return marked returned-to-inventory without a ledger receipt is claimable")
        void lostReturn_createsClaim() {
            CustomerReturn r = customerReturn("111-1", "X1", CustomerReturn.STATUS_RETURNED_TO_INVENTORY, "SELLABLE", returnDate);

            List<ClaimableItem> found = lostPass.detect(
                    snapshot(List.of(), List.of(), List.of(), List.of(r), List.of(), Map.of()), NOW);

            assertThat(found).singleElement().satisfies(c -> {
                assertThat(c.getCategory()).isEqualTo(ClaimCategory.CUSTOMER_RETURN_NOT_RECEIVED);
                assertThat(c.getReferenceId()).isEqualTo("111-1");
                assertThat(c.getReason()).isEqualTo(LostCustomerReturnPass.REASON);
                assertThat(c.getProductName()).isEqualTo("Unknown Product");
            });
        }

        @Test
        void lostReturn_ledgerReceiptAfterReturnSuppresses() {
            CustomerReturn r = customerReturn("111-1", "X1", CustomerReturn.STATUS_RETURNED_TO_INVENTORY, "SELLABLE", returnDate);

            assertThat(lostPass.detect(snapshot(List.of(), List.of(ledgerReturn("X1", returnDate.plusSeconds(3600))),
                    List.of(), List.of(r), List.of(), Map.of()), NOW)).isEmpty();
            assertThat(lostPass.detect(snapshot(List.of(), List.of(ledgerReturn("X1", returnDate.minusSeconds(3600))),
                    List.of(), List.of(r), List.of(), Map.of()), NOW)).hasSize(1);
        }

        @Test
        @DisplayName("reimbursement naming the same fnsku and order suppresses both return passes")
        void reimbursementForOrderSuppresses() {
            CustomerReturn lost = customerReturn("111-1", "X1", CustomerReturn.STATUS_RETURNED_TO_INVENTORY, "SELLABLE", returnDate);
            CustomerReturn damaged = customerReturn("111-2", "X2", null, CustomerReturn.DISPOSITION_CUSTOMER_DAMAGED, returnDate);
            ClaimAnalysisSnapshot s = snapshot(List.of(), List.of(),
                    List.of(reimbursement("X1", "B-X1", "111-1", NOW), reimbursement("X2", "B-X2", "111-2", NOW)),
                    List.of(lost, damaged), List.of(), Map.of());

            assertThat(lostPass.detect(s, NOW)).isEmpty();
            assertThat(damagedPass.detect(s, NOW)).isEmpty();
        }

        @Test
        @DisplayName("damaged returns yield at most one claim per fnsku")
        void damagedReturn_oncePerFnsku() {
            List<CustomerReturn> returns = new ArrayList<>();
            returns.add(customerReturn("111-1", "X1", null, CustomerReturn.DISPOSITION_CUSTOMER_DAMAGED, returnDate));
            returns.add(customerReturn("111-2", "X1", null, CustomerReturn.DISPOSITION_CUSTOMER_DAMAGED, returnDate.plusSeconds(86_400)));
            returns.add(customerReturn("111-3", "X2", null, "SELLABLE", returnDate));

            List<ClaimableItem> found = damagedPass.detect(
                    snapshot(List.of(), List.of(), List.of(), returns, List.of(), Map.of()), NOW);

            assertThat(found).singleElement().satisfies(c -> {
                assertThat(c.getCategory()).isEqualTo(ClaimCategory.CUSTOMER_RETURN_DAMAGED);
                assertThat(c.getReason()).isEqualTo("Customer returned item damaged: CUSTOMER_DAMAGED");
            });
            assertThat(damagedPass.detect(snapshot(List.of(), List.of(), List.of(), returns, found, Map.of()), NOW)).isEmpty();
        }
    }

    @Test
    void refundWithoutReturn_isAlwaysEmpty() {
        assertThat(new RefundWithoutReturnPass().detect(ClaimAnalysisSnapshot.empty(), NOW)).isEmpty();
    }
}
