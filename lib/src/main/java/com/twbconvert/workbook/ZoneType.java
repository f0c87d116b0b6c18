package com.twbconvert.workbook;

public enum ZoneType {
    LAYOUT,
    WORKSHEET,
    FILTER,
    TEXT,
    TITLE,
    OTHER
}
