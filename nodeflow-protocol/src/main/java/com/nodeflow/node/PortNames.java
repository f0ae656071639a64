package com.nodeflow.node;

/**
 * Port names shared by the built-in node types and the router.
 */
public final class PortNames {

    /** Default input port. */
    public static final String DATA = "data";
    /** Input port of sub-workflow trigger nodes. */
    public static final String INPUT = "input";
    /** Default output port. */
    public static final String OUTPUT = "output";
    /** Output port taken by every error envelope. */
    public static final String ERROR = "error";
    public static final String TRUE = "true";
    public static final String FALSE = "false";

    private PortNames() {
    }
}
