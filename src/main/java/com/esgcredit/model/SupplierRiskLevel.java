package com.esgcredit.model;

public enum SupplierRiskLevel {
    HIGH,
    MEDIUM,
    LOW
}
