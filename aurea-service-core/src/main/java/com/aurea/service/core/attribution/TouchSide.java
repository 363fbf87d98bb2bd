package com.aurea.service.core.attribution;

public enum TouchSide {
    FIRST,
    LAST
}
