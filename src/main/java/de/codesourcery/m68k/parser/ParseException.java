package de.codesourcery.m68k.parser;

/**
 * A mistake in the assembly source.
 *
 * Parse exceptions never leave the parser or assembler, they are turned
 * into {@link CompilationError}s at line (or statement) granularity.
 */
public class ParseException extends RuntimeException {

	public final Location location;

	public ParseException(String message)
	{
		this( message , (Location) null );
	}

	public ParseException(String message,Token token)
	{
		this( message , token == null ? null : token.location );
	}

	public ParseException(String message,Location location)
	{
		super(message);
		this.location = location;
	}

	public boolean hasLocation() {
		return location != null && location.isValid();
	}
}
