package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

public final class StatusRegister extends Operand
{
	public StatusRegister(Location location) {
		super(location);
	}

	@Override
	public OperandType getType() {
		return OperandType.STATUS_REGISTER;
	}

	@Override
	public String toString() {
		return "SR";
	}
}
