package com.audiencemanager.unit.condition;

import static org.assertj.core.api.Assertions.assertThat;

import com.audiencemanager.domain.model.Condition;
import com.audiencemanager.domain.model.ConditionSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConditionSetTest {

    @Test
    @DisplayName("condition order does not matter")
    void orderIndependent() {
        ConditionSet a = ConditionSet.of(List.of(Condition.of("amount", ">", 1000), Condition.of("city_tier", "=", 1)));
        ConditionSet b = ConditionSet.of(List.of(Condition.of("city_tier", "=", 1), Condition.of("amount", ">", 1000)));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    @DisplayName("1000, 1000.0 and \"1000\" are the same value")
    void numericNormalization() {
        ConditionSet integer = ConditionSet.of(List.of(Condition.of("amount", ">", 1000)));
        ConditionSet decimal = ConditionSet.of(List.of(Condition.of("amount", ">", 1000.0)));
        ConditionSet text = ConditionSet.of(List.of(Condition.of("amount", ">", "1000")));

        assertThat(integer).isEqualTo(decimal).isEqualTo(text);
    }

    @Test
    @DisplayName("IN lists compare irrespective of element order")
    void listValuesSorted() {
        ConditionSet a = ConditionSet.of(List.of(Condition.of("city_tier", "IN", List.of(1, 2))));
        ConditionSet b = ConditionSet.of(List.of(Condition.of("city_tier", "in", List.of(2, 1))));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("field case and operator aliases are normalized")
    void fieldAndOperatorNormalized() {
        ConditionSet a = ConditionSet.of(List.of(Condition.of("City_Tier", "<>", 3)));
        ConditionSet b = ConditionSet.of(List.of(Condition.of("city_tier", "!=", 3)));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("duplicates collapse and null entries are ignored")
    void duplicatesAndNulls() {
        List<Condition> conditions = new ArrayList<>();
        conditions.add(Condition.of("amount", ">", 10));
        conditions.add(null);
        conditions.add(Condition.of("amount", ">", 10));

        assertThat(ConditionSet.of(conditions).size()).isEqualTo(1);
    }

    @Test
    @DisplayName("subset test and difference")
    void subsetAndMinus() {
        ConditionSet small = ConditionSet.of(List.of(Condition.of("amount", ">", 1000)));
        ConditionSet large =
                ConditionSet.of(List.of(Condition.of("amount", ">", 1000), Condition.of("city_tier", "=", 1)));

        assertThat(small.isSubsetOf(large)).isTrue();
        assertThat(large.isSubsetOf(small)).isFalse();
        assertThat(large.minus(small))
                .isEqualTo(ConditionSet.of(List.of(Condition.of("city_tier", "=", 1))));
        assertThat(ConditionSet.of(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("canonical tuple lists attributes by name")
    void canonicalTuple() {
        assertThat(ConditionSet.canonicalTuple(Condition.between("amount", 10, 20.50)))
                .isEqualTo("(field=amount, operator=BETWEEN, value=10, value2=20.5)");
    }

    @Test
    @DisplayName("huge exponents keep a short scientific key")
    void hugeExponentKey() {
        String tuple = ConditionSet.canonicalTuple(Condition.of("amount", ">", "1e400000000"));

        assertThat(tuple).isEqualTo("(field=amount, operator=>, value=1E+400000000)");
        assertThat(ConditionSet.of(List.of(Condition.of("amount", ">", "10e399999999"))))
                .isEqualTo(ConditionSet.of(List.of(Condition.of("amount", ">", "1e400000000"))));
    }
}
