package de.codesourcery.m68k.parser.ast;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.parser.Location;

/**
 * A top-level element of a {@link Program}.
 *
 * The set of statement kinds is closed, code that needs to tell them apart
 * switches over {@link #getType()}.
 */
public abstract class Statement
{
	public static enum Type {
		LABEL,
		COMMENT,
		INSTRUCTION;
	}

	public final Location location;

	protected Statement(Location location)
	{
		Validate.notNull( location , "location must not be NULL");
		this.location = location;
	}

	public abstract Type getType();

	public final boolean hasType(Type t) {
		return t.equals( getType() );
	}

	/**
	 * Renders this statement the way a listing prints it.
	 *
	 * @return
	 */
	public String toAlignedString() {
		return toString();
	}
}
