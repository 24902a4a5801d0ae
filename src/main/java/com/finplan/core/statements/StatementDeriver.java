package com.finplan.core.statements;

import static com.finplan.core.statements.StatementMath.*;

/**
 * Builds one year's statements from its inputs, the opening position and an assumed ending cash.
 * Called once per convergence iteration.
 * <p>
 * The assumed cash drives interest and is the cash carried on the balance sheet, while the cash flow
 * statement derives its own ending cash. The balance sheet therefore only balances once the assumed
 * cash equals the derived ending cash.
 */
public final class StatementDeriver {

    private StatementDeriver() {}

    /**
     * @param year          fiscal year
     * @param inputs        operating inputs for the year
     * @param opening       closing position of the previous year
     * @param cashSeed      assumed ending cash: drives interest and is reported as balance-sheet cash
     * @param config        working-capital assumptions
     * @param depositRate   annual rate earned on positive average cash
     * @param overdraftRate annual rate paid on negative average cash
     */
    public static StatementSnapshot derive(int year, StatementInputs inputs, OpeningBalances opening,
                                           double cashSeed, StatementConfig config,
                                           double depositRate, double overdraftRate) {
        double cogs = cogs(inputs.staffCosts(), inputs.rent(), inputs.otherOpex());
        double ebitda = ebitda(inputs.revenue(), cogs);
        double ebit = ebit(ebitda, inputs.depreciation());
        InterestOnCash interest = interestOnCash(opening.cash(), cashSeed, depositRate, overdraftRate);
        double netResult = netResult(ebit, interest.income(), interest.expense(), inputs.taxes());
        var pnl = new StatementSnapshot.ProfitAndLoss(inputs.revenue(), inputs.staffCosts(), inputs.rent(),
                inputs.otherOpex(), cogs, ebitda, inputs.depreciation(), ebit,
                interest.income(), interest.expense(), inputs.taxes(), netResult);

        double ar = accountsReceivable(inputs.revenue(), config.dsoDays());
        double ap = accountsPayable(cogs, config.dpoDays());
        double deferred = deferredRevenue(inputs.revenue(), config.deferredRevenuePct());
        var wc = new StatementSnapshot.WorkingCapital(ar, ap, deferred, workingCapital(ar, ap, deferred));

        double deltaAr = ar - opening.accountsReceivable();
        double deltaAp = ap - opening.accountsPayable();
        double deltaDeferred = deferred - opening.deferredIncome();
        double deltaProvisions = inputs.provisions() - opening.provisions();
        double operating = operatingCashFlow(netResult, inputs.depreciation(), deltaAr, deltaAp,
                deltaDeferred, deltaProvisions);
        double investing = investingCashFlow(inputs.capex());
        double net = netCashFlow(operating, investing, inputs.financing());
        double cashEnd = endingCash(opening.cash(), net);
        var cf = new StatementSnapshot.CashFlow(deltaAr, deltaAp, deltaDeferred, deltaProvisions,
                inputs.depreciation(), operating, inputs.capex(), investing, inputs.financing(),
                net, opening.cash(), cashEnd);

        double tangible = opening.tangibleAssets() + inputs.capex();
        double accumulated = opening.accumulatedDepreciation() + inputs.depreciation();
        double tca = totalCurrentAssets(cashSeed, ar);
        double nfa = netFixedAssets(tangible, accumulated);
        double tcl = totalCurrentLiabilities(ap, deferred);
        double retained = retainedEarnings(opening.retainedEarnings(), netResult);
        var bs = new StatementSnapshot.BalanceSheet(cashSeed, ar, tca, tangible, accumulated, nfa,
                totalAssets(tca, nfa), ap, deferred, tcl, inputs.provisions(),
                totalLiabilities(tcl, inputs.provisions()), retained, retained);

        return new StatementSnapshot(year, pnl, wc, bs, cf);
    }
}
