package es.hargos.tenantguard.entity;

public enum DiscountType {
    PERCENT,
    FIXED
}
