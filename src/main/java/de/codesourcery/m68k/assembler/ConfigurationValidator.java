package de.codesourcery.m68k.assembler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.Validate;

import de.codesourcery.m68k.parser.ParseException;
import de.codesourcery.m68k.parser.ast.Operand;
import de.codesourcery.m68k.utils.Misc;

/**
 * Checks a requested size and operand list against the configurations of an {@link Opcode}.
 */
public final class ConfigurationValidator
{
	private ConfigurationValidator() {
	}

	/**
	 * Makes sure exactly one configuration of an opcode accepts the given size and operands.
	 *
	 * @param opcode
	 * @param size
	 * @param operands
	 * @return the matching configuration
	 * @throws ParseException if no configuration matches (the exception carries no location)
	 * @throws IllegalStateException if more than one configuration matches, the opcode table is broken then
	 */
	public static Configuration validate(Opcode opcode,Size size,List<Operand> operands) throws ParseException
	{
		Validate.notNull( opcode , "opcode must not be NULL");
		Validate.notNull( size , "size must not be NULL");
		Validate.notNull( operands , "operands must not be NULL");

		final List<Configuration> sizeMatching = new ArrayList<>();
		for ( Configuration config : opcode.getConfigurations() ) {
			if ( config.supports( size ) ) {
				sizeMatching.add( config );
			}
		}

		if ( sizeMatching.isEmpty() )
		{
			final Set<Size> supported = EnumSet.noneOf( Size.class );
			for ( Configuration config : opcode.getConfigurations() ) {
				supported.addAll( config.getSizes() );
			}
			final List<String> names = new ArrayList<>();
			for ( Size s : supported ) {
				names.add( s.readableName );
			}
			throw new ParseException("The operation "+opcode.code+" only supports the sizes "+Misc.toReadableList( names )+
					", but you tried to use it with the size "+size.readableName+". That doesn't work." );
		}

		final List<Configuration> matching = new ArrayList<>();
		for ( Configuration config : sizeMatching ) {
			if ( config.matches( operands ) ) {
				matching.add( config );
			}
		}

		if ( matching.isEmpty() )
		{
			final List<String> types = new ArrayList<>();
			for ( Operand op : operands ) {
				types.add( op.getType().toString() );
			}
			final StringBuilder buffer = new StringBuilder();
			if ( types.isEmpty() ) {
				buffer.append("You provided no operands");
			} else {
				buffer.append("You provided operands of the types ").append( Misc.toReadableList( types ) );
			}
			buffer.append(". But the "+opcode.code+" operation on size "+size.readableName+
					" doesn't accept operands of these types. Here are all the combinations that are accepted:");
			for ( Configuration config : sizeMatching ) {
				buffer.append("\n- ").append( config );
			}
			throw new ParseException( buffer.toString() );
		}

		if ( matching.size() > 1 ) {
			throw new IllegalStateException("Internal error, operation "+opcode.code+" has "+matching.size()+" configurations matching "+size+" "+operands);
		}
		return matching.get(0);
	}
}
