package com.ewsaccount.domain;

/**
 * Folder traversal depth: immediate children only, or the whole subtree
 */
public enum Depth {
    SHALLOW,
    DEEP
}
