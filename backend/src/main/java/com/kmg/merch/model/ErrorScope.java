package com.kmg.merch.model;

public enum ErrorScope {
    ITEM,
    GLOBAL,
    NOTE
}
