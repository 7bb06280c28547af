package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/** <code>#xxx</code> */
public final class Immediate extends Operand
{
	public final long value;

	public Immediate(Location location,long value)
	{
		super(location);
		this.value = value;
	}

	@Override
	public OperandType getType() {
		return OperandType.IMMEDIATE;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { value };
	}

	@Override
	public String toString() {
		return "#"+value;
	}
}
