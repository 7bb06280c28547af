package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

public final class UserStackPointer extends Operand
{
	public UserStackPointer(Location location) {
		super(location);
	}

	@Override
	public OperandType getType() {
		return OperandType.USER_STACK_POINTER;
	}

	@Override
	public String toString() {
		return "USP";
	}
}
