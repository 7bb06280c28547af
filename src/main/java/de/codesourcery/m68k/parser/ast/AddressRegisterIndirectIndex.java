package de.codesourcery.m68k.parser.ast;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.assembler.Size;
import de.codesourcery.m68k.parser.Location;

/**
 * <code>(d8,An,Xn.s)</code>
 */
public final class AddressRegisterIndirectIndex extends Operand
{
	public final AddressRegister register;
	public final long displacement;
	public final IndexedRegister index;
	public final Size indexSize;

	public AddressRegisterIndirectIndex(Location location,AddressRegister register,long displacement,IndexedRegister index,Size indexSize)
	{
		super(location);
		Validate.notNull( register , "register must not be NULL");
		Validate.notNull( index , "index must not be NULL");
		Validate.notNull( indexSize , "indexSize must not be NULL");
		this.register = register;
		this.displacement = displacement;
		this.index = index;
		this.indexSize = indexSize;
	}

	@Override
	public OperandType getType() {
		return OperandType.ADDRESS_REGISTER_INDIRECT_INDEX;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { register , displacement , index , indexSize };
	}

	@Override
	public String toString() {
		return "("+displacement+","+register+","+index+"."+indexSize.shortName+")";
	}
}
