package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/**
 * <code>(d16,PC)</code>
 */
public final class PCRelativeDisplacement extends Operand
{
	public final long displacement;

	public PCRelativeDisplacement(Location location,long displacement)
	{
		super(location);
		this.displacement = displacement;
	}

	@Override
	public OperandType getType() {
		return OperandType.PC_RELATIVE_DISPLACEMENT;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { displacement };
	}

	@Override
	public String toString() {
		return "("+displacement+",PC)";
	}
}
