package com.finplan.core.statements;

import java.io.Serializable;

/**
 * Balance-sheet state a year starts from: the opening position of the first forecast year, or the
 * closing position of the previous accepted year.
 */
public record OpeningBalances(
    double cash,
    double accountsReceivable,
    double accountsPayable,
    double deferredIncome,
    double provisions,
    double tangibleAssets,
    double accumulatedDepreciation,
    double retainedEarnings
) implements Serializable {

    public static final OpeningBalances ZERO = new OpeningBalances(0, 0, 0, 0, 0, 0, 0, 0);

    /** Closing position of an accepted year, with cash taken from the cash flow statement. */
    public static OpeningBalances closingOf(StatementSnapshot snapshot) {
        var bs = snapshot.balanceSheet();
        return new OpeningBalances(snapshot.cashFlow().endingCash(), bs.accountsReceivable(), bs.accountsPayable(),
                bs.deferredIncome(), bs.provisions(), bs.tangibleAssets(),
                bs.accumulatedDepreciation(), bs.retainedEarnings());
    }

    /** Assets minus liabilities and equity of this position. */
    public double residual() {
        double assets = cash + accountsReceivable + tangibleAssets - accumulatedDepreciation;
        double liabilitiesAndEquity = accountsPayable + deferredIncome + provisions + retainedEarnings;
        return assets - liabilitiesAndEquity;
    }
}
