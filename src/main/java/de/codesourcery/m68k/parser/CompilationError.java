package de.codesourcery.m68k.parser;

import org.apache.commons.lang.Validate;

public final class CompilationError
{
	public final Location location;
	public final String message;

	public CompilationError(Location location, String message)
	{
		Validate.notNull( location , "location must not be NULL");
		Validate.notNull( message , "message must not be NULL");
		this.location = location;
		this.message = message;
	}

	@Override
	public String toString() {
		return location.isValid() ? location+": "+message : message;
	}

	@Override
	public int hashCode() {
		return 31 * ( 31 + location.hashCode() ) + message.hashCode();
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof CompilationError )
		{
			final CompilationError other = (CompilationError) obj;
			return location.equals( other.location ) && message.equals( other.message );
		}
		return false;
	}
}
