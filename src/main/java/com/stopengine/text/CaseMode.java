package com.stopengine.text;

public enum CaseMode {
    LOWER,
    UPPER,
    NONE
}
