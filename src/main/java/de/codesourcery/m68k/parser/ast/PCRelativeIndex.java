package de.codesourcery.m68k.parser.ast;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.assembler.OperandType;
import de.codesourcery.m68k.assembler.Size;
import de.codesourcery.m68k.parser.Location;

/**
 * <code>(d8,PC,Xn.s)</code>
 */
public final class PCRelativeIndex extends Operand
{
	public final long displacement;
	public final IndexedRegister index;
	public final Size indexSize;

	public PCRelativeIndex(Location location,long displacement,IndexedRegister index,Size indexSize)
	{
		super(location);
		Validate.notNull( index , "index must not be NULL");
		Validate.notNull( indexSize , "indexSize must not be NULL");
		this.displacement = displacement;
		this.index = index;
		this.indexSize = indexSize;
	}

	@Override
	public OperandType getType() {
		return OperandType.PC_RELATIVE_INDEX;
	}

	@Override
	protected Object[] fields() {
		return new Object[] { displacement , index , indexSize };
	}

	@Override
	public String toString() {
		return "("+displacement+",PC,"+index+"."+indexSize.shortName+")";
	}
}
