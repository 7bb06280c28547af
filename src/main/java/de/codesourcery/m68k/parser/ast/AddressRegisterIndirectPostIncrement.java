package de.codesourcery.m68k.parser.ast;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/** <code>(An)+</code> */
public final class AddressRegisterIndirectPostIncrement extends Operand
{
	public final AddressRegister register;

	public AddressRegisterIndirectPostIncrement(Location location,AddressRegister register)
	{
		super(location);
		Validate.notNull( register , "register must not be NULL");
		this.register = register;
	}

	@Override
	public OperandType getType() {
		return OperandType.ADDRESS_REGISTER_INDIRECT_POST_INCREMENT;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { register };
	}

	@Override
	public String toString() {
		return "("+register+")+";
	}
}
