package de.codesourcery.m68k.assembler;

import de.codesourcery.m68k.assembler.exceptions.ValueOutOfRangeException;
import de.codesourcery.m68k.parser.ast.AbsoluteLong;
import de.codesourcery.m68k.parser.ast.AbsoluteWord;
import de.codesourcery.m68k.parser.ast.AddressRegisterDirect;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirect;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectDisplacement;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectIndex;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectPostIncrement;
import de.codesourcery.m68k.parser.ast.AddressRegisterIndirectPreDecrement;
import de.codesourcery.m68k.parser.ast.DataRegisterDirect;
import de.codesourcery.m68k.parser.ast.Immediate;
import de.codesourcery.m68k.parser.ast.IndexedRegister;
import de.codesourcery.m68k.parser.ast.Operand;
import de.codesourcery.m68k.parser.ast.PCRelativeDisplacement;
import de.codesourcery.m68k.parser.ast.PCRelativeIndex;
import de.codesourcery.m68k.utils.BitOutputStream;

/**
 * Encodes operands as 6-bit effective address fields plus extension words.
 *
 * <pre>
 * Mode          mode reg
 * Dn            000  n
 * An            001  n
 * (An)          010  n
 * (An)+         011  n
 * -(An)         100  n
 * (d16,An)      101  n
 * (d8,An,Xn.s)  110  n
 * (xxx).W       111  000
 * (xxx).L       111  001
 * (d16,PC)      111  010
 * (d8,PC,Xn.s)  111  011
 * #xxx          111  100
 * </pre>
 */
public final class EffectiveAddress
{
	private EffectiveAddress() {
	}

	public static int mode(OperandType type)
	{
		switch( type )
		{
			case DATA_REGISTER_DIRECT:                     return 0b000;
			case ADDRESS_REGISTER_DIRECT:                  return 0b001;
			case ADDRESS_REGISTER_INDIRECT:                return 0b010;
			case ADDRESS_REGISTER_INDIRECT_POST_INCREMENT: return 0b011;
			case ADDRESS_REGISTER_INDIRECT_PRE_DECREMENT:  return 0b100;
			case ADDRESS_REGISTER_INDIRECT_DISPLACEMENT:   return 0b101;
			case ADDRESS_REGISTER_INDIRECT_INDEX:          return 0b110;
			case ABSOLUTE_WORD:
			case ABSOLUTE_LONG:
			case PC_RELATIVE_DISPLACEMENT:
			case PC_RELATIVE_INDEX:
			case IMMEDIATE:
				return 0b111;
			case CONDITION_CODE_REGISTER:
			case STATUS_REGISTER:
			case USER_STACK_POINTER:
			case ADDRESS:
				throw new IllegalArgumentException("Internal error, "+type+" has no effective address encoding");
			default:
				throw new RuntimeException("Unhandled operand type: "+type);
		}
	}

	public static int register(Operand operand)
	{
		switch( operand.getType() )
		{
			case DATA_REGISTER_DIRECT:                     return ((DataRegisterDirect) operand).register.index;
			case ADDRESS_REGISTER_DIRECT:                  return ((AddressRegisterDirect) operand).register.index;
			case ADDRESS_REGISTER_INDIRECT:                return ((AddressRegisterIndirect) operand).register.index;
			case ADDRESS_REGISTER_INDIRECT_POST_INCREMENT: return ((AddressRegisterIndirectPostIncrement) operand).register.index;
			case ADDRESS_REGISTER_INDIRECT_PRE_DECREMENT:  return ((AddressRegisterIndirectPreDecrement) operand).register.index;
			case ADDRESS_REGISTER_INDIRECT_DISPLACEMENT:   return ((AddressRegisterIndirectDisplacement) operand).register.index;
			case ADDRESS_REGISTER_INDIRECT_INDEX:          return ((AddressRegisterIndirectIndex) operand).register.index;
			case ABSOLUTE_WORD:            return 0b000;
			case ABSOLUTE_LONG:            return 0b001;
			case PC_RELATIVE_DISPLACEMENT: return 0b010;
			case PC_RELATIVE_INDEX:        return 0b011;
			case IMMEDIATE:                return 0b100;
			case CONDITION_CODE_REGISTER:
			case STATUS_REGISTER:
			case USER_STACK_POINTER:
			case ADDRESS:
				throw new IllegalArgumentException("Internal error, "+operand.getType()+" has no effective address encoding");
			default:
				throw new RuntimeException("Unhandled operand type: "+operand.getType());
		}
	}

	/**
	 * Writes the 3-bit mode field followed by the 3-bit register field.
	 *
	 * @param operand
	 * @param out
	 */
	public static void write(Operand operand,BitOutputStream out)
	{
		out.writeBits( mode( operand.getType() ) , 3 );
		out.writeBits( register( operand ) , 3 );
	}

	/**
	 * Writes the extension words an operand needs, if any.
	 *
	 * @param operand
	 * @param size operation size, determines the length of immediate data
	 * @param context
	 * @throws ValueOutOfRangeException
	 */
	public static void writeExtensionWords(Operand operand,Size size,ICompilationContext context) throws ValueOutOfRangeException
	{
		switch( operand.getType() )
		{
			case ADDRESS_REGISTER_INDIRECT_DISPLACEMENT:
				context.writeWord( checkDisplacement16( operand , ((AddressRegisterIndirectDisplacement) operand).displacement ) );
				return;
			case PC_RELATIVE_DISPLACEMENT:
				context.writeWord( checkDisplacement16( operand , ((PCRelativeDisplacement) operand).displacement ) );
				return;
			case ADDRESS_REGISTER_INDIRECT_INDEX:
			{
				final AddressRegisterIndirectIndex op = (AddressRegisterIndirectIndex) operand;
				context.writeWord( briefExtensionWord( operand , op.index , op.indexSize , op.displacement ) );
				return;
			}
			case PC_RELATIVE_INDEX:
			{
				final PCRelativeIndex op = (PCRelativeIndex) operand;
				context.writeWord( briefExtensionWord( operand , op.index , op.indexSize , op.displacement ) );
				return;
			}
			case ABSOLUTE_WORD:
			{
				final long value = ((AbsoluteWord) operand).value;
				if ( value < Short.MIN_VALUE || value > 0xffff ) {
					throw new ValueOutOfRangeException( operand , "address" , value , Short.MIN_VALUE , 0xffff );
				}
				context.writeWord( (int) value );
				return;
			}
			case ABSOLUTE_LONG:
				context.writeLong( (int) ((AbsoluteLong) operand).value );
				return;
			case IMMEDIATE:
				writeImmediate( (Immediate) operand , size , context );
				return;
			case DATA_REGISTER_DIRECT:
			case ADDRESS_REGISTER_DIRECT:
			case ADDRESS_REGISTER_INDIRECT:
			case ADDRESS_REGISTER_INDIRECT_POST_INCREMENT:
			case ADDRESS_REGISTER_INDIRECT_PRE_DECREMENT:
			case CONDITION_CODE_REGISTER:
			case STATUS_REGISTER:
			case USER_STACK_POINTER:
			case ADDRESS:
				return;
			default:
				throw new RuntimeException("Unhandled operand type: "+operand.getType());
		}
	}

	/**
	 * Writes immediate data: bytes occupy the low half of a word, longs take two words.
	 *
	 * @param operand
	 * @param size
	 * @param context
	 * @throws ValueOutOfRangeException
	 */
	public static void writeImmediate(Immediate operand,Size size,ICompilationContext context) throws ValueOutOfRangeException
	{
		final long value = operand.value;
		switch( size )
		{
			case BYTE:
				if ( value < Byte.MIN_VALUE || value > 0xff ) {
					throw new ValueOutOfRangeException( operand , "immediate value" , value , Byte.MIN_VALUE , 0xff );
				}
				context.writeWord( (int) value & 0xff );
				return;
			case WORD:
				if ( value < Short.MIN_VALUE || value > 0xffff ) {
					throw new ValueOutOfRangeException( operand , "immediate value" , value , Short.MIN_VALUE , 0xffff );
				}
				context.writeWord( (int) value );
				return;
			case LONG:
				if ( value < Integer.MIN_VALUE || value > 0xffffffffL ) {
					throw new ValueOutOfRangeException( operand , "immediate value" , value , Integer.MIN_VALUE , 0xffffffffL );
				}
				context.writeLong( (int) value );
				return;
			default:
				throw new RuntimeException("Unhandled size: "+size);
		}
	}

	private static int checkDisplacement16(Operand operand,long displacement)
	{
		if ( displacement < Short.MIN_VALUE || displacement > Short.MAX_VALUE ) {
			throw new ValueOutOfRangeException( operand , "displacement" , displacement , Short.MIN_VALUE , Short.MAX_VALUE );
		}
		return (int) displacement;
	}

	/*
	 * D/A | reg (3) | W/L | 000 | displacement (8)
	 */
	private static int briefExtensionWord(Operand operand,IndexedRegister index,Size indexSize,long displacement)
	{
		if ( displacement < Byte.MIN_VALUE || displacement > Byte.MAX_VALUE ) {
			throw new ValueOutOfRangeException( operand , "displacement" , displacement , Byte.MIN_VALUE , Byte.MAX_VALUE );
		}
		final BitOutputStream out = new BitOutputStream();
		out.writeBit( index.isAddressRegister() ? 1 : 0 );
		out.writeBits( index.index , 3 );
		out.writeBits( SizeEncoding.SINGLE_BIT.encode( indexSize ) , 1 );
		out.writeBits( 0b000 , 3 );
		out.writeBits( (int) displacement & 0xff , 8 );
		return out.toWord();
	}
}
