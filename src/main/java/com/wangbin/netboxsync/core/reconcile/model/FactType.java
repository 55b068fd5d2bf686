package com.wangbin.netboxsync.core.reconcile.model;

public enum FactType {
    VLAN,
    PREFIX
}
