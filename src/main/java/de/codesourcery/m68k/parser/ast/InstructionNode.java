package de.codesourcery.m68k.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.assembler.Opcode;
import de.codesourcery.m68k.assembler.Size;
import de.codesourcery.m68k.parser.Location;

/**
 * A machine instruction together with its size suffix and operands.
 */
public final class InstructionNode extends Statement
{
	public final Opcode opcode;
	private final Size size;
	public final List<Operand> operands;

	/**
	 *
	 * @param location
	 * @param opcode
	 * @param size size suffix from the source or <code>null</code> if the source had none
	 * @param operands
	 */
	public InstructionNode(Location location,Opcode opcode,Size size,List<Operand> operands)
	{
		super(location);
		Validate.notNull( opcode , "opcode must not be NULL");
		Validate.notNull( operands , "operands must not be NULL");
		this.opcode = opcode;
		this.size = size;
		this.operands = Collections.unmodifiableList( new ArrayList<>( operands ) );
	}

	@Override
	public Type getType() {
		return Type.INSTRUCTION;
	}

	/**
	 * Returns the size given in the source.
	 *
	 * @return size or <code>null</code> if the source had no size suffix
	 * @see #getEffectiveSize()
	 */
	public Size getSize() {
		return size;
	}

	public boolean hasExplicitSize() {
		return size != null;
	}

	/**
	 * Returns the size this instruction operates on.
	 *
	 * @return
	 * @see Opcode#resolveSize(Size, List)
	 */
	public Size getEffectiveSize() {
		return opcode.resolveSize( size , operands );
	}

	public Operand operand(int index) {
		return operands.get(index);
	}

	public int getOperandCount() {
		return operands.size();
	}

	private String mnemonic() {
		return size == null ? opcode.code : opcode.code+"."+size.shortName;
	}

	@Override
	public String toString()
	{
		if ( operands.isEmpty() ) {
			return mnemonic();
		}
		return mnemonic()+" "+StringUtils.join( operands , "," );
	}

	@Override
	public String toAlignedString()
	{
		if ( operands.isEmpty() ) {
			return mnemonic();
		}
		return StringUtils.rightPad( mnemonic() , 8 )+" "+StringUtils.join( operands , "," );
	}

	@Override
	public int hashCode() {
		return Objects.hash( getType() , location , opcode , size , operands );
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof InstructionNode )
		{
			final InstructionNode other = (InstructionNode) obj;
			return location.equals( other.location ) &&
					opcode == other.opcode &&
					size == other.size &&
					operands.equals( other.operands );
		}
		return false;
	}
}
