package de.codesourcery.m68k.parser;

/**
 * A position in the source file.
 *
 * Line and column numbers are 1-based. Nodes that were synthesized
 * and have no source position use {@link #INVALID}.
 */
public final class Location
{
	public static final Location INVALID = new Location(-1,-1);

	public final int line;
	public final int column;

	public Location(int line, int column)
	{
		this.line = line;
		this.column = column;
	}

	public boolean isValid() {
		return line >= 0 && column >= 0;
	}

	@Override
	public String toString() {
		return line+":"+column;
	}

	@Override
	public int hashCode() {
		final int result = 31 * 1 + column;
		return 31 * result + line;
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof Location )
		{
			final Location other = (Location) obj;
			return line == other.line && column == other.column;
		}
		return false;
	}
}
