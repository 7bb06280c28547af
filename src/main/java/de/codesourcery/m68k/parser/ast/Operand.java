package de.codesourcery.m68k.parser.ast;

import java.util.Arrays;
import java.util.Objects;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/**
 * An instruction operand.
 *
 * The set of operand shapes is closed, code that needs to tell them apart
 * switches over {@link #getType()}.
 * <code>toString()</code> renders the canonical source form which parses back into an equal operand.
 */
public abstract class Operand
{
	public final Location location;

	protected Operand(Location location)
	{
		Validate.notNull( location , "location must not be NULL");
		this.location = location;
	}

	public abstract OperandType getType();

	public final boolean hasType(OperandType t) {
		return t.equals( getType() );
	}

	/**
	 * Returns the values that take part in equality checks, in addition to
	 * the location and the concrete class.
	 *
	 * @return
	 */
	protected Object[] fields() {
		return new Object[0];
	}

	@Override
	public final int hashCode() {
		return Objects.hash( getClass() , location , Arrays.hashCode( fields() ) );
	}

	@Override
	public final boolean equals(Object obj)
	{
		if ( obj == null || obj.getClass() != getClass() ) {
			return false;
		}
		final Operand other = (Operand) obj;
		return location.equals( other.location ) && Arrays.equals( fields() , other.fields() );
	}
}
