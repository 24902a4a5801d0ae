package com.finplan.core.statements;

/**
 * @param balanced whether the residual is within tolerance
 * @param residual total assets minus (total liabilities + total equity), signed
 */
public record BalanceCheck(boolean balanced, double residual) {}
