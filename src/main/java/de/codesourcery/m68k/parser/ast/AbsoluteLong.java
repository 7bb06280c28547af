package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/** <code>(xxx).L</code> */
public final class AbsoluteLong extends Operand
{
	public final long value;

	public AbsoluteLong(Location location,long value)
	{
		super(location);
		this.value = value;
	}

	@Override
	public OperandType getType() {
		return OperandType.ABSOLUTE_LONG;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { value };
	}

	@Override
	public String toString() {
		return "("+value+").L";
	}
}
