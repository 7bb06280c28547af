package de.codesourcery.m68k.parser;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.Validate;

public class ErrorCollector implements IErrorCollector
{
	private final List<CompilationError> errors = new ArrayList<>();

	@Override
	public void add(CompilationError error)
	{
		Validate.notNull( error , "error must not be NULL");
		errors.add( error );
	}

	@Override
	public boolean hasErrors() {
		return ! errors.isEmpty();
	}

	@Override
	public List<CompilationError> getErrors() {
		return new ArrayList<>( errors );
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder();
		for ( CompilationError e : errors ) {
			if ( buffer.length() > 0 ) {
				buffer.append("\n");
			}
			buffer.append( e );
		}
		return buffer.toString();
	}
}
