package ch.ethz.systems.wimaxbench.xpt.wimax.scheduler;

import ch.ethz.systems.wimaxbench.xpt.wimax.phy.IWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;

/**
 * Remaining symbols of an uplink opportunity. Immutable: consuming
 * symbols yields a new budget. A budget is never negative.
 */
public final class SymbolBudget {

    private final int symbols;

    private SymbolBudget(int symbols) {
        if (symbols < 0) {
            throw new IllegalArgumentException("Symbol budget cannot be negative: " + symbols);
        }
        this.symbols = symbols;
    }

    public static SymbolBudget of(int symbols) {
        return new SymbolBudget(symbols);
    }

    public int getSymbols() {
        return symbols;
    }

    /**
     * Byte capacity of the remaining symbols.
     *
     * @param phy               PHY performing the conversion
     * @param modulationType    Modulation of the opportunity
     *
     * @return  Available bytes
     */
    public int getBytes(IWimaxPhy phy, ModulationType modulationType) {
        return phy.getNrBytes(symbols, modulationType);
    }

    /**
     * Consume symbols from the budget.
     *
     * @param consumed  Symbols used by a transmitted packet
     *
     * @return  Remaining budget
     */
    public SymbolBudget consume(int consumed) {
        if (consumed < 0 || consumed > symbols) {
            throw new IllegalStateException("Cannot consume " + consumed + " symbols from a budget of " + symbols);
        }
        return new SymbolBudget(symbols - consumed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolBudget)) {
            return false;
        }
        return symbols == ((SymbolBudget) o).symbols;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(symbols);
    }

    @Override
    public String toString() {
        return "SymbolBudget[" + symbols + "]";
    }

}
