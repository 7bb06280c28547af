package de.codesourcery.m68k;

/**
 * Assembler defaults and debug switches.
 */
public class Constants
{
    // Parser class constants
    public static final boolean PARSER_DEBUG = false;

    // Assembler class constants
    public static final boolean ASSEMBLER_DEBUG = false;

    /**
     * Address the first instruction is assembled to unless told otherwise.
     */
    public static final int DEFAULT_ORIGIN = 0;

    /**
     * Initial size of the assembler's output buffer, grows as needed.
     */
    public static final int ASSEMBLER_INITIAL_BUFFER_SIZE = 1024;

    // Main class constants
    public static final String DEFAULT_OUTPUT_SUFFIX = ".bin";
    public static final String SOURCE_ENCODING = "UTF-8";
}
