package de.codesourcery.m68k.assembler;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Addressing-mode shape of a parsed operand.
 *
 * Configurations of an {@link Opcode} list the operand types they accept per position.
 */
public enum OperandType
{
	/** D3 */
	DATA_REGISTER_DIRECT("Dn","data register direct"),
	/** A3 */
	ADDRESS_REGISTER_DIRECT("An","address register direct"),
	/** (A3) */
	ADDRESS_REGISTER_INDIRECT("(An)","address register indirect"),
	/** (A3)+ */
	ADDRESS_REGISTER_INDIRECT_POST_INCREMENT("(An)+","address register indirect with postincrement"),
	/** -(A3) */
	ADDRESS_REGISTER_INDIRECT_PRE_DECREMENT("-(An)","address register indirect with predecrement"),
	/** (12,A3) */
	ADDRESS_REGISTER_INDIRECT_DISPLACEMENT("(d16,An)","address register indirect with displacement"),
	/** (12,A3,D2.W) */
	ADDRESS_REGISTER_INDIRECT_INDEX("(d8,An,Xn.s)","address register indirect with index"),
	/** ($1234).W */
	ABSOLUTE_WORD("(xxx).W","absolute short"),
	/** ($12345678).L */
	ABSOLUTE_LONG("(xxx).L","absolute long"),
	/** (12,PC) */
	PC_RELATIVE_DISPLACEMENT("(d16,PC)","program counter indirect with displacement"),
	/** (12,PC,D2.W) */
	PC_RELATIVE_INDEX("(d8,PC,Xn.s)","program counter indirect with index"),
	/** #12 */
	IMMEDIATE("#xxx","immediate data"),
	CONDITION_CODE_REGISTER("CCR","condition code register"),
	STATUS_REGISTER("SR","status register"),
	USER_STACK_POINTER("USP","user stack pointer"),
	// placeholder, never produced by the parser
	ADDRESS("<address>","address");

	/**
	 * Effective address modes that may be written to, excluding address registers.
	 */
	public static final Set<OperandType> DATA_ALTERABLE = Collections.unmodifiableSet( EnumSet.of(
			DATA_REGISTER_DIRECT,
			ADDRESS_REGISTER_INDIRECT,
			ADDRESS_REGISTER_INDIRECT_POST_INCREMENT,
			ADDRESS_REGISTER_INDIRECT_PRE_DECREMENT,
			ADDRESS_REGISTER_INDIRECT_DISPLACEMENT,
			ADDRESS_REGISTER_INDIRECT_INDEX,
			ABSOLUTE_WORD,
			ABSOLUTE_LONG ) );

	/**
	 * Effective address modes that denote a memory location without an implied size.
	 */
	public static final Set<OperandType> CONTROL = Collections.unmodifiableSet( EnumSet.of(
			ADDRESS_REGISTER_INDIRECT,
			ADDRESS_REGISTER_INDIRECT_DISPLACEMENT,
			ADDRESS_REGISTER_INDIRECT_INDEX,
			ABSOLUTE_WORD,
			ABSOLUTE_LONG,
			PC_RELATIVE_DISPLACEMENT,
			PC_RELATIVE_INDEX ) );

	public final String shortName;
	public final String readableName;

	private OperandType(String shortName,String readableName)
	{
		this.shortName = shortName;
		this.readableName = readableName;
	}

	@Override
	public String toString() {
		return readableName+" ("+shortName+")";
	}
}
