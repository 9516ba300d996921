package org.pragmatica.phpfmt.ast;

/**
 * Array literal syntax. {@link #UNSPECIFIED} arrays (built by code rather than parsed)
 * use the printer's configured default.
 */
public enum ArrayKind {
    UNSPECIFIED,
    SHORT,
    LONG
}
