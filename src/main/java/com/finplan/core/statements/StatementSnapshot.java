package com.finplan.core.statements;

import java.io.Serializable;

/**
 * The three derived statements of one year.
 *
 * @param year           fiscal year
 * @param profitAndLoss  P&amp;L lines
 * @param workingCapital working-capital lines
 * @param balanceSheet   closing balance sheet
 * @param cashFlow       cash flow statement
 */
public record StatementSnapshot(
    int year,
    ProfitAndLoss profitAndLoss,
    WorkingCapital workingCapital,
    BalanceSheet balanceSheet,
    CashFlow cashFlow
) implements Serializable {

    public record ProfitAndLoss(
        double revenue,
        double staffCosts,
        double rent,
        double otherOpex,
        double cogs,
        double ebitda,
        double depreciation,
        double ebit,
        double interestIncome,
        double interestExpense,
        double taxes,
        double netResult
    ) implements Serializable {

        public double ebitdaMarginPct() {
            return StatementMath.ebitdaMarginPct(ebitda, revenue);
        }

        public double netMarginPct() {
            return StatementMath.netMarginPct(netResult, revenue);
        }
    }

    public record WorkingCapital(
        double accountsReceivable,
        double accountsPayable,
        double deferredRevenue,
        double netWorkingCapital
    ) implements Serializable {}

    public record BalanceSheet(
        double cash,
        double accountsReceivable,
        double totalCurrentAssets,
        double tangibleAssets,
        double accumulatedDepreciation,
        double netFixedAssets,
        double totalAssets,
        double accountsPayable,
        double deferredIncome,
        double totalCurrentLiabilities,
        double provisions,
        double totalLiabilities,
        double retainedEarnings,
        double totalEquity
    ) implements Serializable {

        /** Total assets minus (total liabilities + total equity). */
        public double residual() {
            return totalAssets - (totalLiabilities + totalEquity);
        }

        public double currentRatio() {
            return StatementMath.currentRatio(totalCurrentAssets, totalCurrentLiabilities);
        }
    }

    public record CashFlow(
        double changeInReceivables,
        double changeInPayables,
        double changeInDeferredIncome,
        double changeInProvisions,
        double depreciation,
        double operating,
        double capex,
        double investing,
        double financing,
        double netCashFlow,
        double beginningCash,
        double endingCash
    ) implements Serializable {}

    public double daysInWorkingCapital() {
        return StatementMath.daysInWorkingCapital(workingCapital.netWorkingCapital(), profitAndLoss.revenue());
    }
}
