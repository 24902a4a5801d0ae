package com.finplan.core.rent;

public enum RentModelType {
    FIXED_ESCALATION,
    REVENUE_SHARE,
    PARTNER
}
