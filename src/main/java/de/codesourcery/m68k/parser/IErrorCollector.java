package de.codesourcery.m68k.parser;

import java.util.List;

/**
 * Sink for user-level mistakes found while lexing, parsing or assembling.
 */
public interface IErrorCollector
{
	public void add(CompilationError error);

	public default void add(Location location,String message) {
		add( new CompilationError( location == null ? Location.INVALID : location , message ) );
	}

	public default void add(ParseException e) {
		add( e.location , e.getMessage() );
	}

	public boolean hasErrors();

	public List<CompilationError> getErrors();
}
