package de.codesourcery.m68k.parser.ast;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

public final class ConditionCodeRegister extends Operand
{
	public ConditionCodeRegister(Location location) {
		super(location);
	}

	@Override
	public OperandType getType() {
		return OperandType.CONDITION_CODE_REGISTER;
	}

	@Override
	public String toString() {
		return "CCR";
	}
}
