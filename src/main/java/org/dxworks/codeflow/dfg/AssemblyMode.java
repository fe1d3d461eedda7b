package org.dxworks.codeflow.dfg;

public enum AssemblyMode {
    /** One path per variable per route. */
    SEPARATED,
    /** All occurrences of a route in one path. */
    JOINT
}
