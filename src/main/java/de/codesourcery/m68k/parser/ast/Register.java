package de.codesourcery.m68k.parser.ast;

/**
 * A CPU register referenced by an operand.
 *
 * The set of register kinds is closed, use {@link #getType()} to tell them apart.
 */
public abstract class Register
{
	public static enum Type {
		PC,
		ADDRESS,
		DATA;
	}

	public abstract Type getType();

	public final boolean hasType(Type t) {
		return t.equals( getType() );
	}

	public boolean isProgramCounter() {
		return hasType(Type.PC);
	}

	public boolean isAddressRegister() {
		return hasType(Type.ADDRESS);
	}

	public boolean isDataRegister() {
		return hasType(Type.DATA);
	}

	/**
	 * Looks up a register by name.
	 *
	 * <code>SP</code> is an alias for <code>A7</code>.
	 *
	 * @param name
	 * @return register or <code>null</code> if the name does not denote a register
	 */
	public static Register getRegister(String name)
	{
		if ( name == null ) {
			return null;
		}
		if ( "PC".equals( name ) ) {
			return ProgramCounter.INSTANCE;
		}
		if ( "SP".equals( name ) ) {
			return new AddressRegister(7);
		}
		if ( name.length() == 2 && ( name.charAt(0) == 'A' || name.charAt(0) == 'D' ) )
		{
			final int index = name.charAt(1) - '0';
			if ( index >= 0 && index <= 7 ) {
				return name.charAt(0) == 'A' ? new AddressRegister(index) : new DataRegister(index);
			}
		}
		return null;
	}
}
