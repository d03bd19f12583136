package org.pathlab.paths.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BmsspSearchBudgetTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(BmsspSearchBudget.PROP_MAX_FRONTIER_PULLS);
    }

    @Test
    @DisplayName("Defaults are unbounded without configuration")
    void testDefaultsUnbounded() {
        System.clearProperty(BmsspSearchBudget.PROP_MAX_FRONTIER_PULLS);
        assertEquals(BmsspSearchBudget.UNBOUNDED, BmsspSearchBudget.defaults().maxFrontierPulls());
    }

    @Test
    @DisplayName("System property sets the bound")
    void testSystemProperty() {
        System.setProperty(BmsspSearchBudget.PROP_MAX_FRONTIER_PULLS, " 25 ");
        assertEquals(25, BmsspSearchBudget.defaults().maxFrontierPulls());
    }

    @Test
    @DisplayName("Invalid or non-positive values mean unbounded")
    void testInvalidValues() {
        System.setProperty(BmsspSearchBudget.PROP_MAX_FRONTIER_PULLS, "many");
        assertEquals(BmsspSearchBudget.UNBOUNDED, BmsspSearchBudget.defaults().maxFrontierPulls());
        assertEquals(BmsspSearchBudget.UNBOUNDED, BmsspSearchBudget.of(0).maxFrontierPulls());
        assertEquals(BmsspSearchBudget.UNBOUNDED, BmsspSearchBudget.of(-4).maxFrontierPulls());
    }

    @Test
    @DisplayName("Exceeding the bound fails fast with a reason code")
    void testCheck() {
        BmsspSearchBudget budget = BmsspSearchBudget.of(2);
        budget.checkFrontierPulls(2);

        BmsspSearchBudget.BudgetExceededException ex = assertThrows(
                BmsspSearchBudget.BudgetExceededException.class,
                () -> budget.checkFrontierPulls(3));
        assertEquals(BmsspSearchBudget.REASON_FRONTIER_PULLS_EXCEEDED, ex.reasonCode());
    }
}
