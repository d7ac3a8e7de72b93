package ch.ethz.systems.wimaxbench.xpt.wimax.scheduler;

import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.SimpleOfdmWimaxPhy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolBudgetTest {

    @Test
    void consumeReturnsNewBudget() {
        SymbolBudget budget = SymbolBudget.of(10);
        SymbolBudget rest = budget.consume(4);

        assertEquals(10, budget.getSymbols());
        assertEquals(6, rest.getSymbols());
        assertEquals(SymbolBudget.of(6), rest);
        assertEquals(0, rest.consume(6).getSymbols());
    }

    @Test
    void bytesFollowThePhy() {
        assertEquals(5 * 48, SymbolBudget.of(5).getBytes(new SimpleOfdmWimaxPhy(), ModulationType.QAM16_12));
    }

    @Test
    void invalidBudgets() {
        assertThrows(IllegalArgumentException.class, () -> SymbolBudget.of(-1));
        assertThrows(IllegalStateException.class, () -> SymbolBudget.of(3).consume(4));
        assertThrows(IllegalStateException.class, () -> SymbolBudget.of(3).consume(-1));
    }

}
