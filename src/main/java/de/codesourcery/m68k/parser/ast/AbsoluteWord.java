package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/** <code>(xxx).W</code> */
public final class AbsoluteWord extends Operand
{
	public final long value;

	public AbsoluteWord(Location location,long value)
	{
		super(location);
		this.value = value;
	}

	@Override
	public OperandType getType() {
		return OperandType.ABSOLUTE_WORD;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { value };
	}

	@Override
	public String toString() {
		return "("+value+").W";
	}
}
