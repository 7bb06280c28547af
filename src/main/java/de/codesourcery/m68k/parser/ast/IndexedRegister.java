package de.codesourcery.m68k.parser.ast;

/**
 * One of the eight address or data registers.
 */
public abstract class IndexedRegister extends Register
{
	public final int index;

	protected IndexedRegister(int index)
	{
		if ( index < 0 || index > 7 ) {
			throw new IllegalArgumentException("Register index must be in range 0..7 but was "+index);
		}
		this.index = index;
	}

	protected abstract char prefix();

	@Override
	public String toString() {
		return Character.toString( prefix() )+index;
	}

	@Override
	public int hashCode() {
		return 31 * getType().hashCode() + index;
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj != null && obj.getClass() == getClass() ) {
			return index == ((IndexedRegister) obj).index;
		}
		return false;
	}
}
