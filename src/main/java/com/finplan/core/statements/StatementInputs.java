package com.finplan.core.statements;

/**
 * Per-year operating inputs read from the driver table.
 *
 * @param revenue     total revenue
 * @param staffCosts  staff costs
 * @param rent        rent
 * @param otherOpex   other operating expenses
 * @param depreciation depreciation charged in the year
 * @param capex       capital expenditure
 * @param financing   financing cash flow, positive for inflows
 * @param taxes       taxes charged in the year
 * @param provisions  closing provisions level
 */
public record StatementInputs(
    double revenue,
    double staffCosts,
    double rent,
    double otherOpex,
    double depreciation,
    double capex,
    double financing,
    double taxes,
    double provisions
) {}
