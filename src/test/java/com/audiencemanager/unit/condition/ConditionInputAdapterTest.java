package com.audiencemanager.unit.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.audiencemanager.condition.ConditionInputAdapter;
import com.audiencemanager.domain.model.Condition;
import com.audiencemanager.exception.BusinessException;
import com.audiencemanager.exception.ErrorCode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConditionInputAdapterTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 31);

    private ConditionInputAdapter conditionInputAdapter;

    @BeforeEach
    void setUp() {
        conditionInputAdapter = new ConditionInputAdapter();
    }

    @Nested
    @DisplayName("List format")
    class ListFormat {

        @Test
        @DisplayName("maps entries to conditions")
        void mapsEntries() {
            List<Condition> conditions = conditionInputAdapter.normalize(List.of(
                    Map.of("field", "amount", "operator", ">", "value", 1000),
                    Map.of("field", "amount", "operator", "BETWEEN", "value", 10, "value2", 20)));

            assertThat(conditions).containsExactly(
                    Condition.of("amount", ">", 1000), Condition.between("amount", 10, 20));
        }

        @Test
        @DisplayName("rewrites start_date, end_date and min_transactions aliases")
        void aliases() {
            List<Condition> conditions = conditionInputAdapter.normalize(List.of(
                    Map.of("field", "start_date", "operator", "=", "value", "2024-01-01"),
                    Map.of("field", "end_date", "operator", "=", "value", "2024-01-31"),
                    Map.of("field", "min_transactions", "operator", "=", "value", 3)));

            assertThat(conditions).containsExactly(
                    Condition.of("transaction_date", ">=", "2024-01-01"),
                    Condition.of("transaction_date", "<=", "2024-01-31"),
                    Condition.of("transaction_count", ">=", 3));
        }

        @Test
        @DisplayName("non-object entries become empty conditions for the compiler to report")
        void nonObjectEntry() {
            List<Condition> conditions = conditionInputAdapter.normalize(List.of("amount > 5"));

            assertThat(conditions).containsExactly(new Condition());
        }

        @Test
        @DisplayName("JSON string is parsed first")
        void jsonString() {
            List<Condition> conditions = conditionInputAdapter.normalize(
                    "[{\"field\": \"city_tier\", \"operator\": \"IN\", \"value\": [1, 2]}]");

            assertThat(conditions).containsExactly(Condition.of("city_tier", "IN", List.of(1, 2)));
        }
    }

    @Nested
    @DisplayName("Legacy dictionary format")
    class LegacyFormat {

        @Test
        @DisplayName("translates every recognised key")
        void translatesKeys() {
            Map<String, Object> legacy = new LinkedHashMap<>();
            legacy.put("start_date", "2024-01-01");
            legacy.put("city_tier", 1);
            legacy.put("transaction_type", "upi");
            legacy.put("amount", 500);
            legacy.put("amount_operator", ">");
            legacy.put("total_spend_gt", 5000);
            legacy.put("transaction_count_lt", 10);

            List<Condition> conditions = conditionInputAdapter.normalize(legacy, TODAY);

            assertThat(conditions).containsExactly(
                    Condition.of("transaction_date", ">=", "2024-01-01"),
                    Condition.of("city_tier", "=", 1),
                    Condition.of("transaction_type", "=", "UPI"),
                    Condition.of("amount", ">", 500),
                    Condition.of("total_spend", ">", 5000),
                    Condition.of("transaction_count", "<", 10));
        }

        @Test
        @DisplayName("timeframe_days is resolved against today")
        void timeframeDays() {
            List<Condition> conditions = conditionInputAdapter.normalize(Map.of("timeframe_days", 30), TODAY);

            assertThat(conditions).containsExactly(Condition.of("transaction_date", ">=", "2024-03-01"));
        }

        @Test
        @DisplayName("falsy values and transaction_type 'all' add nothing")
        void falsyValuesIgnored() {
            Map<String, Object> legacy = new LinkedHashMap<>();
            legacy.put("city_tier", 0);
            legacy.put("start_date", "");
            legacy.put("transaction_type", "all");
            legacy.put("min_transactions", 0);

            assertThat(conditionInputAdapter.normalize(legacy, TODAY)).isEmpty();
        }

        @Test
        @DisplayName("amount without operator defaults to equality; city_tier_in becomes IN")
        void amountDefaultsAndTierList() {
            Map<String, Object> legacy = new LinkedHashMap<>();
            legacy.put("amount", 99);
            legacy.put("city_tier_in", List.of(1, 3));

            assertThat(conditionInputAdapter.normalize(legacy, TODAY)).containsExactly(
                    Condition.of("city_tier", "IN", List.of(1, 3)), Condition.of("amount", "=", 99));
        }

        @Test
        @DisplayName("typed transaction_amount entry becomes an amount condition")
        void typedAmount() {
            List<Condition> conditions = conditionInputAdapter.normalize(
                    Map.of("type", "transaction_amount", "operator", ">=", "value", 250), TODAY);

            assertThat(conditions).containsExactly(Condition.of("amount", ">=", 250));
        }
    }

    @Test
    @DisplayName("null input yields no conditions")
    void nullInput() {
        assertThat(conditionInputAdapter.normalize(null)).isEmpty();
        assertThat(conditionInputAdapter.normalize("  ")).isEmpty();
    }

    @Test
    @DisplayName("scalar input and malformed JSON are validation errors")
    void invalidInput() {
        assertThatThrownBy(() -> conditionInputAdapter.normalize(42))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);

        assertThatThrownBy(() -> conditionInputAdapter.normalize("[{\"field\": "))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
    }
}
