package de.codesourcery.m68k.assembler.exceptions;

import de.codesourcery.m68k.parser.ParseException;
import de.codesourcery.m68k.parser.ast.Operand;

/**
 * A displacement, address or immediate value does not fit into its extension field.
 */
public class ValueOutOfRangeException extends ParseException {

	public final long value;

	public ValueOutOfRangeException(Operand operand,String what,long value,long min,long max)
	{
		super("The "+what+" "+value+" of operand "+operand+" is out of range, it must be between "+min+" and "+max+"." , operand.location );
		this.value = value;
	}
}
