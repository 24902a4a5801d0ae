package com.finplan.core.statements;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatementDeriverTest {

    private static final OpeningBalances OPENING = new OpeningBalances(1000, 0, 0, 0, 0, 0, 0, 1000);
    private static final StatementInputs INPUTS =
            new StatementInputs(365_000, 100_000, 50_000, 32_500, 10_000, 20_000, 0, 5_000, 0);
    private static final StatementConfig CONFIG = new StatementConfig(30, 45, 0.1);

    @Test
    @DisplayName("derives P&L, working capital, cash flow and balance sheet without interest")
    void derivesYear() {
        var s = StatementDeriver.derive(2025, INPUTS, OPENING, 187_500, CONFIG, 0, 0);

        assertEquals(2025, s.year());
        assertEquals(182_500.0, s.profitAndLoss().cogs());
        assertEquals(182_500.0, s.profitAndLoss().ebitda());
        assertEquals(172_500.0, s.profitAndLoss().ebit());
        assertEquals(167_500.0, s.profitAndLoss().netResult());

        assertEquals(30_000.0, s.workingCapital().accountsReceivable());
        assertEquals(22_500.0, s.workingCapital().accountsPayable());
        assertEquals(36_500.0, s.workingCapital().deferredRevenue(), 1e-9);

        assertEquals(206_500.0, s.cashFlow().operating(), 1e-9);
        assertEquals(-20_000.0, s.cashFlow().investing());
        assertEquals(186_500.0, s.cashFlow().netCashFlow(), 1e-9);
        assertEquals(187_500.0, s.cashFlow().endingCash(), 1e-9);

        var bs = s.balanceSheet();
        assertEquals(20_000.0, bs.tangibleAssets());
        assertEquals(10_000.0, bs.accumulatedDepreciation());
        assertEquals(227_500.0, bs.totalAssets(), 1e-9);
        assertEquals(59_000.0, bs.totalLiabilities(), 1e-9);
        assertEquals(168_500.0, bs.totalEquity());
        assertEquals(0.0, bs.residual(), 1e-6);
    }

    @Test
    @DisplayName("beginning cash plus net cash flow equals ending cash")
    void cashIdentity() {
        var s = StatementDeriver.derive(2025, INPUTS, OPENING, 50_000, CONFIG, 0.05, 0.12);
        assertEquals(s.cashFlow().beginningCash() + s.cashFlow().netCashFlow(), s.cashFlow().endingCash());
    }

    @Test
    @DisplayName("the balance sheet carries the assumed cash and shows its gap to the derived ending cash")
    void assumedCashOnBalanceSheet() {
        var s = StatementDeriver.derive(2025, INPUTS, OPENING, 50_000, CONFIG, 0, 0);

        assertEquals(50_000.0, s.balanceSheet().cash());
        assertEquals(187_500.0, s.cashFlow().endingCash(), 1e-9);
        assertEquals(50_000.0 - 187_500.0, s.balanceSheet().residual(), 1e-6);
    }

    @Test
    @DisplayName("interest is computed on the assumed ending cash")
    void interestFromSeed() {
        var s = StatementDeriver.derive(2025, INPUTS, OPENING, 3000, CONFIG, 0.05, 0.12);
        assertEquals(100.0, s.profitAndLoss().interestIncome(), 1e-9);
        assertEquals(167_600.0, s.profitAndLoss().netResult(), 1e-6);
    }

    @Test
    @DisplayName("fixed assets and provisions roll forward from the opening position")
    void rollForward() {
        var opening = new OpeningBalances(1000, 0, 0, 0, 400, 5000, 1000, 4600);
        var inputs = new StatementInputs(0, 0, 0, 0, 500, 1000, 0, 0, 600);
        var s = StatementDeriver.derive(2026, inputs, opening, 200, CONFIG, 0, 0);

        assertEquals(200.0, s.cashFlow().endingCash(), 1e-9);

        assertEquals(6000.0, s.balanceSheet().tangibleAssets());
        assertEquals(1500.0, s.balanceSheet().accumulatedDepreciation());
        assertEquals(200.0, s.cashFlow().changeInProvisions());
        assertEquals(0.0, s.balanceSheet().residual(), 1e-9);
    }

    @Test
    @DisplayName("closing position of a snapshot becomes the next opening position")
    void closingOf() {
        var s = StatementDeriver.derive(2025, INPUTS, OPENING, 187_500, CONFIG, 0, 0);
        var next = OpeningBalances.closingOf(s);

        assertEquals(s.cashFlow().endingCash(), next.cash());
        assertEquals(s.balanceSheet().retainedEarnings(), next.retainedEarnings());
        assertEquals(0.0, next.residual(), 1e-6);
    }
}
