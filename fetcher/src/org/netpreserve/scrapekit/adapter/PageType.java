package org.netpreserve.scrapekit.adapter;

public enum PageType {
    LIST,
    DETAIL,
    GENERIC
}
