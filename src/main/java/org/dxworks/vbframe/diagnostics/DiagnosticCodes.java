package org.dxworks.vbframe.diagnostics;

/**
 * Stable diagnostic codes. Codes are part of the JSON contract and must never be renumbered.
 */
public final class DiagnosticCodes {

    private DiagnosticCodes() {
        // constants
    }

    // syntax stage
    public static final String SYNTAX_ERROR = "VB1001";
    public static final String UNKNOWN_TOKEN = "VB1002";
    public static final String UNRECOGNIZED_CONSTRUCT = "VB1003";
    public static final String PARSER_FAILURE = "VB1004";

    // fatal file errors
    public static final String FATAL_DECODE = "VB1901";
    public static final String FATAL_IO = "VB1902";
    public static final String FATAL_INTERNAL = "VB1903";

    // semantic stage
    public static final String UNRESOLVED_TYPE = "VB2001";
    public static final String UNKNOWN_CONTROL_TYPE = "VB2002";
    public static final String DUPLICATE_CONTROL_NAME = "VB2003";
    public static final String UNMATCHED_EVENT_BINDING = "VB2004";
    public static final String UNKNOWN_EVENT = "VB2005";
    public static final String RESOURCE_REFERENCE = "VB2006";

    // project level
    public static final String DUPLICATE_MODULE_NAME = "VB3001";
    public static final String CANCELLED = "VB3002";
}
