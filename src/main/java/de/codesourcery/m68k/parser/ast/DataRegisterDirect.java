package de.codesourcery.m68k.parser.ast;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

public final class DataRegisterDirect extends Operand
{
	public final DataRegister register;

	public DataRegisterDirect(Location location,DataRegister register)
	{
		super(location);
		Validate.notNull( register , "register must not be NULL");
		this.register = register;
	}

	@Override
	public OperandType getType() {
		return OperandType.DATA_REGISTER_DIRECT;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { register };
	}

	@Override
	public String toString() {
		return register.toString();
	}
}
