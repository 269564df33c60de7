package replacer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReplacementPlan")
class ReplacementPlanTest {

    @Test
    @DisplayName("should build a valid plan")
    void shouldBuildValidPlan() {
        ReplacementPlan plan = ReplacementPlan.of("Account.Old__c", "Account.New__c", true, 50);

        assertThat(plan.oldField().fieldName()).isEqualTo("Old__c");
        assertThat(plan.newField().fieldName()).isEqualTo("New__c");
        assertThat(plan.dryRun()).isTrue();
        assertThat(plan.batchSize()).isEqualTo(50);
    }

    @Test
    @DisplayName("should reject identical fields")
    void shouldRejectIdenticalFields() {
        assertThatThrownBy(() -> ReplacementPlan.of("Account.Old__c", "Account.Old__c", false, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("identical");
    }

    @Test
    @DisplayName("should reject a non-positive batch size")
    void shouldRejectNonPositiveBatchSize() {
        assertThatThrownBy(() -> ReplacementPlan.of("Account.Old__c", "Account.New__c", false, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");
    }
}
