package de.codesourcery.m68k.parser.ast;

import java.util.Objects;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.parser.Location;

/**
 * A jump target.
 *
 * Names starting with a dot denote local labels that belong to the
 * closest preceding global label.
 */
public final class LabelNode extends Statement
{
	public final String name;

	public LabelNode(Location location,String name)
	{
		super(location);
		Validate.notEmpty( name , "name must not be NULL or empty");
		this.name = name;
	}

	@Override
	public Type getType() {
		return Type.LABEL;
	}

	public boolean isLocal() {
		return name.startsWith(".");
	}

	public boolean isGlobal() {
		return ! isLocal();
	}

	@Override
	public String toString() {
		return name;
	}

	@Override
	public String toAlignedString() {
		return name+":";
	}

	@Override
	public int hashCode() {
		return Objects.hash( getType() , location , name );
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof LabelNode )
		{
			final LabelNode other = (LabelNode) obj;
			return location.equals( other.location ) && name.equals( other.name );
		}
		return false;
	}
}
