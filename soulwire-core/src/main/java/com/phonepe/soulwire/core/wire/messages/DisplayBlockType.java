package com.phonepe.soulwire.core.wire.messages;

import lombok.experimental.UtilityClass;

/**
 * Names of the display block kinds this library understands. Others are kept as {@link UnknownDisplayBlock}.
 */
@UtilityClass
public class DisplayBlockType {
    public static final String BRIEF = "brief";
    public static final String DIFF = "diff";
    public static final String TODO = "todo";
    public static final String SHELL = "shell";
}
