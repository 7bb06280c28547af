package de.codesourcery.m68k.assembler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.parser.ast.Operand;
import de.codesourcery.m68k.utils.Misc;

/**
 * A size / operand combination an {@link Opcode} accepts.
 */
public final class Configuration
{
	private final Set<Size> sizes;
	private final List<Set<OperandType>> operandTypes;

	@SafeVarargs
	public Configuration(Set<Size> sizes,Set<OperandType>... operandTypes)
	{
		Validate.notEmpty( sizes , "sizes must not be NULL or empty");
		Validate.noNullElements( operandTypes , "operandTypes must not contain NULL elements");
		this.sizes = Collections.unmodifiableSet( EnumSet.copyOf( sizes ) );
		final List<Set<OperandType>> types = new ArrayList<>();
		for ( Set<OperandType> set : operandTypes )
		{
			Validate.notEmpty( set , "operand type set must not be empty");
			types.add( Collections.unmodifiableSet( EnumSet.copyOf( set ) ) );
		}
		this.operandTypes = Collections.unmodifiableList( types );
	}

	public Set<Size> getSizes() {
		return sizes;
	}

	public List<Set<OperandType>> getOperandTypes() {
		return operandTypes;
	}

	public int getOperandCount() {
		return operandTypes.size();
	}

	public boolean supports(Size size) {
		return sizes.contains( size );
	}

	/**
	 * Checks whether operands have the right count and, position by position,
	 * one of the accepted types.
	 *
	 * @param operands
	 * @return
	 */
	public boolean matches(List<Operand> operands)
	{
		if ( operands.size() != operandTypes.size() ) {
			return false;
		}
		for ( int i = 0 ; i < operands.size() ; i++ )
		{
			if ( ! operandTypes.get(i).contains( operands.get(i).getType() ) ) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString()
	{
		final List<String> sizeNames = new ArrayList<>();
		for ( Size s : sizes ) {
			sizeNames.add( s.readableName );
		}
		final StringBuilder buffer = new StringBuilder( Misc.toReadableList( sizeNames ) ).append(": ");
		if ( operandTypes.isEmpty() ) {
			buffer.append("no operands");
		}
		for ( int i = 0 ; i < operandTypes.size() ; i++ )
		{
			if ( i > 0 ) {
				buffer.append(" , ");
			}
			final List<String> names = new ArrayList<>();
			for ( OperandType t : operandTypes.get(i) ) {
				names.add( t.shortName );
			}
			buffer.append( Misc.join( names , " | " ) );
		}
		return buffer.toString();
	}
}
