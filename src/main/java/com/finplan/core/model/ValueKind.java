package com.finplan.core.model;

public enum ValueKind {
    NUMERIC
}
