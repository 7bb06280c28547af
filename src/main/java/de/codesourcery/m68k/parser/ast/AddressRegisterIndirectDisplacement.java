package de.codesourcery.m68k.parser.ast;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.parser.Location;

/**
 * <code>(d16,An)</code>
 */
public final class AddressRegisterIndirectDisplacement extends Operand
{
	public final AddressRegister register;
	public final long displacement;

	public AddressRegisterIndirectDisplacement(Location location,AddressRegister register,long displacement)
	{
		super(location);
		Validate.notNull( register , "register must not be NULL");
		this.register = register;
		this.displacement = displacement;
	}

	@Override
	public OperandType getType() {
		return OperandType.ADDRESS_REGISTER_INDIRECT_DISPLACEMENT;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { register , displacement };
	}

	@Override
	public String toString() {
		return "("+displacement+","+register+")";
	}
}
